package com.questrail.cue.condition;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Conjunction: satisfied when every child is satisfied.
 *
 * <p>
 * A node always has at least one child. {@code all []} is a parse failure,
 * never an always-true condition.
 * </p>
 */
public record All(List<Condition> children) implements Condition
{
    public All {
        Objects.requireNonNull(children, "children");
        if (children.isEmpty()) {
            throw new IllegalArgumentException("all requires at least one child");
        }
        children = List.copyOf(children);
    }

    public static All of(Condition... children) {
        return new All(List.of(children));
    }

    @Override
    public String describe() {
        return children.stream()
                .map(Condition::describe)
                .collect(Collectors.joining("; ", "all [", "]"));
    }
}
