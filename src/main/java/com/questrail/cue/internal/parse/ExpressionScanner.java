package com.questrail.cue.internal.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth-aware scanning helpers shared by the condition and action parsers.
 *
 * <p>
 * Conditions nest with {@code [ ]}, action lists nest with {@code { }}.
 * Text between backticks (title literals) is opaque to every helper here.
 * </p>
 */
final class ExpressionScanner
{
    private static final char BACKTICK = '`';

    private ExpressionScanner() {
    }

    /**
     * Splits {@code text} on {@code separator} occurrences at nesting depth 0.
     * Pieces are trimmed; empty pieces are dropped.
     */
    static List<String> splitTopLevel(String text, char separator, char open, char close) {
        List<String> pieces = new ArrayList<>();
        int depth = 0;
        boolean quoted = false;
        int start = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == BACKTICK) {
                quoted = !quoted;
            } else if (quoted) {
                continue;
            } else if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
            } else if (c == separator && depth == 0) {
                addPiece(pieces, text.substring(start, i));
                start = i + 1;
            }
        }
        addPiece(pieces, text.substring(start));
        return pieces;
    }

    /**
     * Returns the index of the delimiter closing the one at {@code openIndex},
     * or {@code -1} when it is never closed.
     */
    static int matchingClose(String text, int openIndex, char open, char close) {
        int depth = 0;
        boolean quoted = false;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == BACKTICK) {
                quoted = !quoted;
            } else if (quoted) {
                continue;
            } else if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * True when the depth never goes negative and ends at zero.
     */
    static boolean isBalanced(String text, char open, char close) {
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == BACKTICK) {
                quoted = !quoted;
            } else if (quoted) {
                continue;
            } else if (c == open) {
                depth++;
            } else if (c == close) {
                if (--depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    /**
     * Removes one enclosing {@code open ... close} pair, but only when the
     * leading delimiter is closed by the final character.
     * {@code "{a} {b}"} is returned unchanged.
     */
    static String stripEnclosing(String text, char open, char close) {
        String t = text.trim();
        if (t.length() >= 2
                && t.charAt(0) == open
                && matchingClose(t, 0, open, close) == t.length() - 1) {
            return t.substring(1, t.length() - 1).trim();
        }
        return t;
    }

    private static void addPiece(List<String> pieces, String piece) {
        String trimmed = piece.trim();
        if (!trimmed.isEmpty()) {
            pieces.add(trimmed);
        }
    }
}
