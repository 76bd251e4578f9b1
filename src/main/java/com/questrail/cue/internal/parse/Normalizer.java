package com.questrail.cue.internal.parse;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Normalizer
 * =============================================================================
 * Canonicalizes expression text before any scanner looks at it.
 *
 * <p>After {@link #normalize(String)} the scanners may assume:</p>
 * <ul>
 *   <li>tokens are separated by exactly one space</li>
 *   <li>every {@code '{'} not at the start is preceded by one space</li>
 *   <li>every {@code '}'} not at the end is followed by one space</li>
 *   <li>no leading or trailing whitespace</li>
 * </ul>
 *
 * <p>Both operations are pure, total and idempotent.</p>
 */
public final class Normalizer
{
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern OPEN_BRACE = Pattern.compile("\\s*\\{\\s*");
    private static final Pattern CLOSE_BRACE = Pattern.compile("\\s*\\}\\s*");

    private Normalizer() {
    }

    /**
     * Collapses whitespace runs and trims. Brace spacing is left alone, so the
     * verbatim text of a single action line is preserved.
     */
    public static String collapseWhitespace(String input) {
        Objects.requireNonNull(input, "input");
        return WHITESPACE.matcher(input.trim()).replaceAll(" ");
    }

    /**
     * Collapses whitespace and standardizes spacing around braces.
     */
    public static String normalize(String input) {
        String s = collapseWhitespace(input);
        s = OPEN_BRACE.matcher(s).replaceAll(" {");
        s = CLOSE_BRACE.matcher(s).replaceAll("} ");
        return s.trim();
    }
}
