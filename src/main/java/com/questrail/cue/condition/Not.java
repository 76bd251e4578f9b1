package com.questrail.cue.condition;

import java.util.Objects;

/**
 * Negation of a single child condition.
 */
public record Not(Condition child) implements Condition
{
    public Not {
        Objects.requireNonNull(child, "child");
    }

    @Override
    public String describe() {
        return "not " + child.describe();
    }
}
