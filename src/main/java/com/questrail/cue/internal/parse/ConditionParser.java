package com.questrail.cue.internal.parse;

import com.questrail.cue.condition.All;
import com.questrail.cue.condition.Any;
import com.questrail.cue.condition.ComparisonOperator;
import com.questrail.cue.condition.Condition;
import com.questrail.cue.condition.Not;
import com.questrail.cue.condition.Permission;
import com.questrail.cue.condition.PlaceholderComparison;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * ConditionParser
 * =============================================================================
 * Recursive-descent parser from condition text to a {@link Condition} tree.
 *
 * <h2>Dispatch</h2>
 * Keywords are matched case-insensitively on the leading word:
 * <ul>
 *   <li>{@code permission} / {@code perm} : permission node, {@code !} negates</li>
 *   <li>{@code placeholder} / {@code papi} : placeholder comparison</li>
 *   <li>{@code any [..]} / {@code all [..]} : combinators, {@code ;} separated</li>
 *   <li>{@code not} : negation of the remainder</li>
 * </ul>
 * One pair of parentheses enclosing a whole expression is grouping only.
 * Text carrying a {@code %key%} span is a placeholder comparison. Text without a
 * keyword is an implicit permission; at top level it must not contain brackets.
 *
 * <h2>Failure</h2>
 * Every failure is a {@link CueParseException}; no partial tree is returned.
 * Inside a combinator a failing child is skipped and logged, but the
 * combinator itself fails when no child survives.
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class ConditionParser
{
    private static final Logger log = LoggerFactory.getLogger(ConditionParser.class);

    private static final String OPERATOR_CHARS = "<>=!";

    private final int maxDepth;

    public ConditionParser(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1");
        }
        this.maxDepth = maxDepth;
    }

    public Condition parse(String expression) {
        Objects.requireNonNull(expression, "expression");
        return parse(expression, 0);
    }

    Condition parse(String expression, int depth) {
        String text = Normalizer.normalize(expression);
        if (text.isEmpty()) {
            throw new CueParseException("Empty condition");
        }
        return parseExpression(text, false, depth);
    }

    private Condition parseExpression(String text, boolean nested, int depth) {
        if (depth > maxDepth) {
            throw new CueParseException("Condition nesting exceeds " + maxDepth + " levels");
        }
        text = ExpressionScanner.stripEnclosing(text, '(', ')');
        if (text.isEmpty()) {
            throw new CueParseException("Empty parenthesized condition");
        }

        String lower = text.toLowerCase(Locale.ROOT);
        String word = leadingWord(lower);

        switch (word) {
            case "permission":
            case "perm":
                return permission(remainder(text, word));
            case "placeholder":
            case "papi":
                return placeholder(remainder(text, word));
            case "not":
                String rest = remainder(text, word);
                if (rest.isEmpty()) {
                    throw new CueParseException("Missing condition after 'not'");
                }
                return new Not(parseExpression(rest, true, depth + 1));
            default:
                break;
        }

        if (isCombinator(lower, "any")) {
            return new Any(children("any", text, depth));
        }
        if (isCombinator(lower, "all")) {
            return new All(children("all", text, depth));
        }

        if (hasPlaceholderSpan(text)) {
            return placeholder(text);
        }
        if (!nested && (text.indexOf('[') >= 0 || text.indexOf(']') >= 0)) {
            throw new CueParseException("Unrecognized condition: " + text);
        }
        return permission(text);
    }

    // ---------------------------------------------------------------------
    // Leaves
    // ---------------------------------------------------------------------

    private static Permission permission(String value) {
        String v = value.trim();
        boolean negated = v.startsWith("!");
        if (negated) {
            v = v.substring(1).trim();
        }
        if (v.isEmpty()) {
            throw new CueParseException("Missing permission value");
        }
        return new Permission(v, negated);
    }

    /**
     * Splits at the first run of operator characters, scanning left to right.
     * A run that is not a known operator is an error unless it is made of
     * {@code '!'} only, in which case it belongs to the key or value.
     */
    private static PlaceholderComparison placeholder(String value) {
        String v = value.trim();
        if (v.isEmpty()) {
            throw new CueParseException("Missing placeholder value");
        }

        int i = 0;
        while (i < v.length()) {
            if (OPERATOR_CHARS.indexOf(v.charAt(i)) < 0) {
                i++;
                continue;
            }
            int end = i;
            while (end < v.length() && OPERATOR_CHARS.indexOf(v.charAt(end)) >= 0) {
                end++;
            }
            String run = v.substring(i, end);
            Optional<ComparisonOperator> op = ComparisonOperator.fromSymbol(run);
            if (op.isPresent()) {
                String key = v.substring(0, i).trim();
                String rhs = v.substring(end).trim();
                if (key.isEmpty()) {
                    throw new CueParseException("Missing placeholder before '" + run + "'");
                }
                if (rhs.isEmpty()) {
                    throw new CueParseException("Missing comparison value after '" + run + "'");
                }
                return PlaceholderComparison.compare(key, op.get(), rhs);
            }
            if (run.chars().anyMatch(c -> c != '!')) {
                throw new CueParseException("Unknown comparator '" + run + "'");
            }
            i = end;
        }
        return PlaceholderComparison.truthy(v);
    }

    // ---------------------------------------------------------------------
    // Combinators
    // ---------------------------------------------------------------------

    private List<Condition> children(String kind, String text, int depth) {
        int open = text.indexOf('[');
        if (open < 0) {
            throw new CueParseException("Missing '[' after '" + kind + "'");
        }
        if (!text.substring(kind.length(), open).isBlank()) {
            throw new CueParseException("Unexpected text between '" + kind + "' and '['");
        }
        int close = ExpressionScanner.matchingClose(text, open, '[', ']');
        if (close < 0) {
            throw new CueParseException("Unclosed '[' in '" + kind + "'");
        }
        if (close != text.length() - 1) {
            throw new CueParseException("Unexpected text after ']' in '" + kind + "'");
        }

        String body = text.substring(open + 1, close).trim();
        if (body.isEmpty()) {
            throw new CueParseException("Empty '" + kind + "' condition");
        }

        List<Condition> children = new ArrayList<>();
        for (String piece : ExpressionScanner.splitTopLevel(body, ';', '[', ']')) {
            try {
                children.add(parseExpression(piece, true, depth + 1));
            } catch (CueParseException e) {
                log.warn("Skipping sub-condition '{}' of '{}': {}", piece, kind, e.getMessage());
            }
        }
        if (children.isEmpty()) {
            throw new CueParseException("No valid sub-conditions in '" + kind + "'");
        }
        return children;
    }

    // ---------------------------------------------------------------------
    // Scanning
    // ---------------------------------------------------------------------

    private static String leadingWord(String text) {
        int sp = text.indexOf(' ');
        return sp < 0 ? text : text.substring(0, sp);
    }

    private static String remainder(String text, String word) {
        return text.substring(word.length()).trim();
    }

    private static boolean isCombinator(String lower, String kind) {
        if (!lower.startsWith(kind)) {
            return false;
        }
        if (lower.length() == kind.length()) {
            return true;
        }
        char next = lower.charAt(kind.length());
        return next == ' ' || next == '[';
    }

    private static boolean hasPlaceholderSpan(String text) {
        int first = text.indexOf('%');
        return first >= 0 && text.indexOf('%', first + 2) > first;
    }
}
