package com.questrail.cue.internal.parse;

import com.questrail.cue.action.Action;
import com.questrail.cue.action.ActionList;
import com.questrail.cue.action.Conditional;
import com.questrail.cue.condition.Condition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses {@code if {condition} then {actions} [else {actions}]}.
 *
 * <p>
 * {@code then} and {@code else} only split the text at brace depth 0, and only
 * when preceded by whitespace and followed by whitespace, {@code '{'} or the end
 * of the text. Each segment loses one enclosing brace pair. Branch actions are
 * separated by top-level {@code ;} and parsed by {@link ActionParser}; a branch
 * action that fails is skipped, but a branch left with no action fails the
 * whole conditional.
 * </p>
 */
final class ConditionalActionParser
{
    private static final Logger log = LoggerFactory.getLogger(ConditionalActionParser.class);

    private final ActionParser actionParser;
    private final ConditionParser conditionParser;
    private final int maxDepth;

    ConditionalActionParser(ActionParser actionParser, ConditionParser conditionParser, int maxDepth) {
        this.actionParser = actionParser;
        this.conditionParser = conditionParser;
        this.maxDepth = maxDepth;
    }

    static boolean startsWithIf(String text) {
        return text.regionMatches(true, 0, "if ", 0, 3)
                || text.regionMatches(true, 0, "if{", 0, 3);
    }

    Conditional parse(String expression, int depth) {
        if (depth > maxDepth) {
            throw new CueParseException("Conditional nesting exceeds " + maxDepth + " levels");
        }

        String text = Normalizer.normalize(expression);
        if (!text.regionMatches(true, 0, "if ", 0, 3)) {
            throw new CueParseException("Conditional action must start with 'if'");
        }
        if (!ExpressionScanner.isBalanced(text, '{', '}')) {
            throw new CueParseException("Unbalanced braces in conditional action");
        }

        int thenAt = findKeyword(text, "then", 3);
        if (thenAt < 0) {
            throw new CueParseException("Missing 'then' in conditional action");
        }
        int elseAt = findKeyword(text, "else", thenAt + 4);

        String conditionText = ExpressionScanner.stripEnclosing(text.substring(3, thenAt), '{', '}');
        if (conditionText.isEmpty()) {
            throw new CueParseException("Missing condition in conditional action");
        }
        Condition condition = conditionParser.parse(conditionText, depth + 1);

        String thenText = elseAt < 0 ? text.substring(thenAt + 4) : text.substring(thenAt + 4, elseAt);
        ActionList thenBranch = parseBranch("then", thenText, depth);

        Optional<ActionList> elseBranch = elseAt < 0
                ? Optional.empty()
                : Optional.of(parseBranch("else", text.substring(elseAt + 4), depth));

        return new Conditional(condition, thenBranch, elseBranch);
    }

    private ActionList parseBranch(String label, String segment, int depth) {
        String body = ExpressionScanner.stripEnclosing(segment, '{', '}');
        if (body.isEmpty()) {
            throw new CueParseException("Empty '" + label + "' branch");
        }

        List<Action> actions = new ArrayList<>();
        for (String piece : ExpressionScanner.splitTopLevel(body, ';', '{', '}')) {
            try {
                actions.add(actionParser.parse(piece, depth + 1));
            } catch (CueParseException e) {
                log.warn("Skipping '{}' action '{}': {}", label, piece, e.getMessage());
            }
        }
        if (actions.isEmpty()) {
            throw new CueParseException("No valid actions in '" + label + "' branch");
        }
        return new ActionList(actions);
    }

    /**
     * Index of {@code keyword} at brace depth 0 at or after {@code from}, or -1.
     * Backtick-quoted text is skipped.
     */
    static int findKeyword(String text, String keyword, int from) {
        int depth = 0;
        boolean quoted = false;
        int n = keyword.length();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '`') {
                quoted = !quoted;
                continue;
            }
            if (quoted) {
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
            if (i < from || depth != 0 || !text.regionMatches(true, i, keyword, 0, n)) {
                continue;
            }
            boolean spaceBefore = i > 0 && Character.isWhitespace(text.charAt(i - 1));
            boolean boundaryAfter = i + n == text.length()
                    || Character.isWhitespace(text.charAt(i + n))
                    || text.charAt(i + n) == '{';
            if (spaceBefore && boundaryAfter) {
                return i;
            }
        }
        return -1;
    }
}
