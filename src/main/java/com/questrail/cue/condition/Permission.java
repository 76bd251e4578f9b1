package com.questrail.cue.condition;

import java.util.Objects;

/**
 * Permission check.
 *
 * <p>
 * Satisfied when the actor holds {@code value}, or, when {@code negated},
 * when the actor does not hold it. Produced by {@code permission <v>},
 * {@code perm <v>} and by the implicit-permission fallback for bare tokens.
 * A leading {@code !} in the source sets {@code negated} and is stripped.
 * </p>
 */
public record Permission(String value, boolean negated) implements Condition
{
    public Permission {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("permission value must not be blank");
        }
    }

    public static Permission of(String value) {
        return new Permission(value, false);
    }

    @Override
    public String describe() {
        return "permission " + (negated ? "!" : "") + value;
    }
}
