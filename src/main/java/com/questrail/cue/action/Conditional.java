package com.questrail.cue.action;

import com.questrail.cue.condition.Condition;

import java.util.Objects;
import java.util.Optional;

/**
 * If-then-else over two owned action lists.
 *
 * <p>
 * The condition is evaluated once per execution. The chosen branch runs as
 * a nested sequence inside the same execution unit, so delays, cancellation
 * and actor-availability checks apply to it as well. Failures inside a branch
 * never escape this node.
 * </p>
 */
public record Conditional(
        Condition condition,
        ActionList thenBranch,
        Optional<ActionList> elseBranch
) implements Action
{
    public Conditional {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(thenBranch, "thenBranch");
        Objects.requireNonNull(elseBranch, "elseBranch");
    }

    public static Conditional ifThen(Condition condition, ActionList thenBranch) {
        return new Conditional(condition, thenBranch, Optional.empty());
    }

    public static Conditional ifThenElse(Condition condition, ActionList thenBranch, ActionList elseBranch) {
        return new Conditional(condition, thenBranch, Optional.of(elseBranch));
    }

    public String describe() {
        String base = "if " + condition.describe() + " then " + String.join(",", thenBranch.keywords());
        return elseBranch
                .map(e -> base + " else " + String.join(",", e.keywords()))
                .orElse(base);
    }

    @Override
    public ActionType type() {
        return ActionType.CONDITIONAL;
    }
}
