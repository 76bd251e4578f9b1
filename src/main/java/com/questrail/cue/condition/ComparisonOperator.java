package com.questrail.cue.condition;

import java.util.Optional;

/**
 * Comparison operators available to placeholder conditions.
 *
 * <p>
 * Comparison is numeric when both operands parse as decimal numbers and
 * lexicographic otherwise.
 * </p>
 */
public enum ComparisonOperator
{
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    /**
     * Compares {@code left} against {@code right} with this operator.
     */
    public boolean compare(String left, String right) {
        Double l = toNumber(left);
        Double r = toNumber(right);
        int cmp = (l != null && r != null)
                ? Double.compare(l, r)
                : left.compareTo(right);

        return switch (this) {
            case GREATER_THAN -> cmp > 0;
            case GREATER_THAN_OR_EQUAL -> cmp >= 0;
            case LESS_THAN -> cmp < 0;
            case LESS_THAN_OR_EQUAL -> cmp <= 0;
            case EQUAL -> cmp == 0;
            case NOT_EQUAL -> cmp != 0;
        };
    }

    private static Double toNumber(String s) {
        try {
            return Double.valueOf(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
