package com.questrail.cue.condition;

import java.util.Objects;
import java.util.Optional;

/**
 * Comparison of a resolved placeholder value.
 *
 * <p>
 * With an operator, the resolved value of {@code key} is compared against
 * {@code rhs}. Without one, the condition is satisfied when the key resolves
 * to a non-empty value that differs from the key itself (an unresolved
 * placeholder is echoed back by most resolvers).
 * </p>
 *
 * <p>
 * {@code operator} and {@code rhs} are either both present or both absent.
 * </p>
 */
public record PlaceholderComparison(
        String key,
        Optional<ComparisonOperator> operator,
        Optional<String> rhs
) implements Condition
{
    public PlaceholderComparison {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(rhs, "rhs");
        if (key.isBlank()) {
            throw new IllegalArgumentException("placeholder key must not be blank");
        }
        if (operator.isPresent() != rhs.isPresent()) {
            throw new IllegalArgumentException("operator and rhs must be given together");
        }
    }

    public static PlaceholderComparison truthy(String key) {
        return new PlaceholderComparison(key, Optional.empty(), Optional.empty());
    }

    public static PlaceholderComparison compare(String key, ComparisonOperator operator, String rhs) {
        return new PlaceholderComparison(key, Optional.of(operator), Optional.of(rhs));
    }

    @Override
    public String describe() {
        return operator
                .map(op -> "placeholder " + key + " " + op.symbol() + " " + rhs.orElseThrow())
                .orElse("placeholder " + key);
    }
}
