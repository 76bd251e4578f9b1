package com.questrail.cue.observability;

/**
 * Receives diagnostics from the parsers and the sequence executor.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive on any thread and must not throw.</p>
 */
public interface CueObservabilitySink {
    /**
     * Called when expression text is rejected at the public boundary.
     * @param event the rejected text and reason
     */
    void onParseFailure(ParseFailureEvent event);

    /**
     * Called when a condition throws during evaluation.
     * @param event the condition and its cause
     */
    void onEvaluationError(EvaluationErrorEvent event);

    /**
     * Called when a single action throws.
     * @param event the failed action
     */
    void onActionFailure(ActionFailureEvent event);

    /**
     * Called after every action attempt.
     * @param event type, elapsed time and outcome
     */
    void onActionExecuted(ActionExecutedEvent event);

    /**
     * Called once per top-level run.
     * @param event the final result
     */
    void onSequenceCompleted(SequenceCompletedEvent event);
}
