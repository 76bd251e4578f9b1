package com.questrail.cue.internal.parse;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizerTest {

    @Test
    void collapsesWhitespaceRunsAndTrims() {
        assertEquals("perm essentials.fly", Normalizer.normalize("  perm \t  essentials.fly \n"));
    }

    @Test
    void standardizesSpacingAroundBraces() {
        assertEquals("if {perm a} then {tell hi}", Normalizer.normalize("if{perm a}then{tell hi}"));
        assertEquals("if {perm a} then {tell hi}", Normalizer.normalize("if   {  perm a  }   then{ tell hi }"));
    }

    @Test
    void adjacentClosingBracesAreSeparated() {
        assertEquals("if {perm a} then {if {perm b} then {tell x} }",
                Normalizer.normalize("if {perm a} then {if {perm b} then {tell x}}"));
    }

    @Test
    void collapseWhitespaceLeavesBracesAlone() {
        assertEquals("tell hello{world}", Normalizer.collapseWhitespace("tell\t hello{world}  "));
        assertEquals("tell hello {world}", Normalizer.normalize("tell\t hello{world}  "));
    }

    @Test
    void normalizationIsIdempotent() {
        List<String> inputs = List.of(
                "",
                "   ",
                "if{perm a}then{tell hi}else{ tell bye }",
                "any [ perm a ;perm b]",
                "{{ }}",
                "}{",
                "title `a  b`   `c`");

        for (String input : inputs) {
            String once = Normalizer.normalize(input);
            assertEquals(once, Normalizer.normalize(once), "not idempotent for: " + input);
            assertEquals(once.trim(), once);
            assertFalse(once.contains("  "), "double space in: " + once);
        }
    }

    @Test
    void emptyInputNormalizesToEmpty() {
        assertEquals("", Normalizer.normalize(" \t\n "));
    }
}
