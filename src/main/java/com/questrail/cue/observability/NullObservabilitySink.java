package com.questrail.cue.observability;

/**
 * No-op implementation of CueObservabilitySink.
 */
public final class NullObservabilitySink implements CueObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onParseFailure(ParseFailureEvent event) {}

    @Override
    public void onEvaluationError(EvaluationErrorEvent event) {}

    @Override
    public void onActionFailure(ActionFailureEvent event) {}

    @Override
    public void onActionExecuted(ActionExecutedEvent event) {}

    @Override
    public void onSequenceCompleted(SequenceCompletedEvent event) {}
}
