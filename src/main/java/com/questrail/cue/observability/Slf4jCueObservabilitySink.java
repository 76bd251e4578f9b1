package com.questrail.cue.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CueObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCueObservabilitySink implements CueObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCueObservabilitySink.class);

    @Override
    public void onParseFailure(ParseFailureEvent event) {
        log.warn("Invalid {} '{}': {}", event.kind(), event.source(), event.message());
    }

    @Override
    public void onEvaluationError(EvaluationErrorEvent event) {
        log.warn("Error evaluating condition '{}'", event.condition(), event.cause());
    }

    @Override
    public void onActionFailure(ActionFailureEvent event) {
        log.warn("Action {} failed: {}", event.type().keyword(), event.message(), event.cause());
    }

    @Override
    public void onActionExecuted(ActionExecutedEvent event) {
        if (log.isTraceEnabled()) {
            log.trace("Action {} {} in {}ms",
                event.type().keyword(),
                event.success() ? "succeeded" : "failed",
                event.elapsed().toMillis());
        }
    }

    @Override
    public void onSequenceCompleted(SequenceCompletedEvent event) {
        log.debug("{}", event.result().summary());
    }
}
