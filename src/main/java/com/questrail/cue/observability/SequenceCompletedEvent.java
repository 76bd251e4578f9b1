package com.questrail.cue.observability;

import com.questrail.cue.api.ExecutionResult;

import java.time.Instant;

/**
 * A top-level run that has produced its result.
 */
public record SequenceCompletedEvent(
    Instant timestamp,
    ExecutionResult result
) {
}
