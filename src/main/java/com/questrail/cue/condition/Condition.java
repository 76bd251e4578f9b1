package com.questrail.cue.condition;

/**
 * Canonical semantic representation of a parsed condition expression.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code Condition} is the closed tree produced by the condition parser. It is
 * the ONLY form the evaluator reasons about; the keyword spellings
 * ({@code perm}/{@code permission}, {@code papi}/{@code placeholder}) and
 * whitespace irregularities of the source text are resolved before a node
 * is constructed.
 * </p>
 *
 * <h2>Immutability</h2>
 * <p>
 * Nodes are immutable, side-effect free value trees. A single tree may be
 * cached under its normalized source text and evaluated concurrently for any
 * number of actors.
 * </p>
 *
 * <h2>Evaluation</h2>
 * <p>
 * Evaluation is deliberately not a method on the node: it needs external
 * capabilities (permission lookup, placeholder resolution) that belong to
 * the host. See {@code ConditionEvaluator}.
 * </p>
 */
public sealed interface Condition
        permits Permission, PlaceholderComparison, Any, All, Not {

    /**
     * Returns a canonical, re-parseable rendering of this condition.
     *
     * @return expression text that parses back to an equal node
     */
    String describe();
}
