package com.questrail.cue.observability;

import java.time.Instant;

/**
 * A condition or action expression that could not be parsed.
 *
 * @param kind   {@code "condition"} or {@code "action"}
 * @param source the offending text as supplied
 */
public record ParseFailureEvent(
    Instant timestamp,
    String kind,
    String source,
    String message
) {
}
