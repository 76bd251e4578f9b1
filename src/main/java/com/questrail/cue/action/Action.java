package com.questrail.cue.action;

/**
 * Canonical semantic representation of one parsed action line.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code Action} is a closed set of immutable records. The executor
 * dispatches exhaustively over it; there is no string-typed lookup of
 * behavior once a line has been parsed.
 * </p>
 *
 * <h2>Ownership</h2>
 * <p>
 * Nodes are never mutated after construction. A {@link Conditional} owns its
 * branch lists; no node is shared between two parents by the parser.
 * </p>
 */
public sealed interface Action
        permits Tell, Sound, Title, ActionBar, RunAsActor, RunAsHost, Delay, Conditional {

    /**
     * Returns the keyword family this action was parsed from.
     */
    ActionType type();
}
