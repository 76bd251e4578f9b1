package com.questrail.cue.internal.parse;

/**
 * Indicates that a condition or action expression could not be translated
 * into a valid semantic node.
 *
 * This typically reflects:
 * <ul>
 *   <li>Malformed bracket or brace nesting</li>
 *   <li>A missing mandatory keyword ({@code then}) or value</li>
 *   <li>An empty {@code any}/{@code all} body</li>
 *   <li>An unknown action type or comparator</li>
 *   <li>Nesting deeper than the configured maximum</li>
 * </ul>
 *
 * The exception never crosses the public runtime boundary; it is turned into
 * an absent result plus a diagnostic there.
 */
public final class CueParseException extends RuntimeException
{
    public CueParseException(String message) {
        super(message);
    }

    public CueParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
