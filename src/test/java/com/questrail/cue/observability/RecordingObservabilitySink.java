package com.questrail.cue.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements CueObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onParseFailure(ParseFailureEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onEvaluationError(EvaluationErrorEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onActionFailure(ActionFailureEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onActionExecuted(ActionExecutedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onSequenceCompleted(SequenceCompletedEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
