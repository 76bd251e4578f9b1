package com.questrail.cue.observability;

import java.time.Instant;

/**
 * A condition whose evaluation threw, typically inside a permission lookup
 * or placeholder resolver. The condition is treated as not satisfied.
 */
public record EvaluationErrorEvent(
    Instant timestamp,
    String condition,
    Throwable cause
) {
}
