package com.questrail.cue.observability;

import java.util.List;
import java.util.Objects;

/**
 * Fans every event out to a fixed list of sinks, in order.
 */
public final class CompositeObservabilitySink implements CueObservabilitySink {
    private final List<CueObservabilitySink> sinks;

    public CompositeObservabilitySink(List<CueObservabilitySink> sinks) {
        this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
    }

    public static CueObservabilitySink of(CueObservabilitySink... sinks) {
        return sinks.length == 1 ? sinks[0] : new CompositeObservabilitySink(List.of(sinks));
    }

    @Override
    public void onParseFailure(ParseFailureEvent event) {
        sinks.forEach(s -> s.onParseFailure(event));
    }

    @Override
    public void onEvaluationError(EvaluationErrorEvent event) {
        sinks.forEach(s -> s.onEvaluationError(event));
    }

    @Override
    public void onActionFailure(ActionFailureEvent event) {
        sinks.forEach(s -> s.onActionFailure(event));
    }

    @Override
    public void onActionExecuted(ActionExecutedEvent event) {
        sinks.forEach(s -> s.onActionExecuted(event));
    }

    @Override
    public void onSequenceCompleted(SequenceCompletedEvent event) {
        sinks.forEach(s -> s.onSequenceCompleted(event));
    }
}
