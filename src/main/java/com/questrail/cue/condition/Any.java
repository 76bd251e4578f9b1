package com.questrail.cue.condition;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Disjunction: satisfied when at least one child is satisfied.
 *
 * <p>
 * A node always has at least one child. {@code any []} is a parse failure,
 * never an always-false condition.
 * </p>
 */
public record Any(List<Condition> children) implements Condition
{
    public Any {
        Objects.requireNonNull(children, "children");
        if (children.isEmpty()) {
            throw new IllegalArgumentException("any requires at least one child");
        }
        children = List.copyOf(children);
    }

    public static Any of(Condition... children) {
        return new Any(List.of(children));
    }

    @Override
    public String describe() {
        return children.stream()
                .map(Condition::describe)
                .collect(Collectors.joining("; ", "any [", "]"));
    }
}
