package com.questrail.cue.observability;

import com.questrail.cue.action.ActionType;

import java.time.Instant;

/**
 * An action that threw while executing. The sequence carried on.
 */
public record ActionFailureEvent(
    Instant timestamp,
    ActionType type,
    String message,
    Throwable cause
) {
}
