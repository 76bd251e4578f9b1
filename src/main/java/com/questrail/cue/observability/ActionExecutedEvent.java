package com.questrail.cue.observability;

import com.questrail.cue.action.ActionType;

import java.time.Duration;
import java.time.Instant;

/**
 * One action attempt, successful or not. Delays report the time suspended.
 */
public record ActionExecutedEvent(
    Instant timestamp,
    ActionType type,
    Duration elapsed,
    boolean success
) {
}
