package com.questrail.cue.internal.parse;

import com.questrail.cue.action.ActionBar;
import com.questrail.cue.action.Conditional;
import com.questrail.cue.action.Delay;
import com.questrail.cue.action.RunAsActor;
import com.questrail.cue.action.RunAsHost;
import com.questrail.cue.action.Sound;
import com.questrail.cue.action.Tell;
import com.questrail.cue.action.Ticks;
import com.questrail.cue.action.Title;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActionParserTest {

    private final ActionParser parser = new ActionParser(new ConditionParser(16), 16);

    @Test
    void textActionsKeepTheirValue() {
        assertEquals(new Tell("Hello &aWorld"), parser.parse("tell Hello &aWorld"));
        assertEquals(new Tell("hi"), parser.parse("TELL hi"));
        assertEquals(new ActionBar("Ready"), parser.parse("actionbar Ready"));
    }

    @Test
    void commandsRunAsActorOrHost() {
        assertEquals(new RunAsActor("spawn"), parser.parse("command spawn"));
        assertEquals(new RunAsHost("give {player} diamond 1"), parser.parse("console give {player} diamond 1"));
    }

    @Test
    void unknownTypeFailsAndNamesSupportedTypes() {
        CueParseException e = assertThrows(CueParseException.class, () -> parser.parse("explode now"));
        assertTrue(e.getMessage().contains("explode"));
        assertTrue(e.getMessage().contains("tell"));
    }

    @Test
    void emptyValueFails() {
        assertThrows(CueParseException.class, () -> parser.parse("tell"));
        assertThrows(CueParseException.class, () -> parser.parse("command    "));
        assertThrows(CueParseException.class, () -> parser.parse("   "));
    }

    // ---------------------------------------------------------------------
    // sound
    // ---------------------------------------------------------------------

    @Test
    void soundDefaults() {
        assertEquals(new Sound("ui.button.click", 1.0f, 1.0f), parser.parse("sound ui.button.click"));
        assertEquals(new Sound("ui.button.click", 0.5f, 1.0f), parser.parse("sound ui.button.click-0.5"));
    }

    @Test
    void soundValuesAreClampedNotRejected() {
        assertEquals(
                new Sound("entity.player.levelup", 10.0f, 2.0f),
                parser.parse("sound entity.player.levelup-15.0-3.0"));
        assertEquals(
                new Sound("entity.player.levelup", 0.0f, 0.5f),
                parser.parse("sound entity.player.levelup-0-0.1"));
    }

    @Test
    void unreadableSoundNumbersFallBackToDefault() {
        assertEquals(new Sound("ui.click", 1.0f, 0.5f), parser.parse("sound ui.click-loud-0.1"));
        assertEquals(new Sound("ui.click", 1.0f, 1.0f), parser.parse("sound ui.click-NaN-"));
    }

    @Test
    void soundWithoutNameFails() {
        assertThrows(CueParseException.class, () -> parser.parse("sound -1-1"));
    }

    // ---------------------------------------------------------------------
    // title
    // ---------------------------------------------------------------------

    @Test
    void titleDefaults() {
        Title title = (Title) parser.parse("title `Welcome` `to the server`");
        assertEquals(new Title("Welcome", "to the server", 10, 70, 20), title);
        assertEquals(Duration.ofMillis(500), title.fadeInDuration());
        assertEquals(Duration.ofMillis(3500), title.stayDuration());
        assertEquals(Duration.ofSeconds(1), title.fadeOutDuration());
    }

    @Test
    void titleExplicitTimings() {
        assertEquals(new Title("A", "B", 5, 40, 10), parser.parse("title `A` `B` 5 40 10"));
    }

    @Test
    void invalidTitleTimingsFallBackIndividually() {
        assertEquals(new Title("A", "", 5, 70, 20), parser.parse("title `A` `` 5 x -1"));
    }

    @Test
    void unquotedTitleWordsArePartsToo() {
        assertEquals(new Title("Hello", ""), parser.parse("title Hello"));
    }

    // ---------------------------------------------------------------------
    // delay
    // ---------------------------------------------------------------------

    @Test
    void delayTicks() {
        Delay delay = (Delay) parser.parse("delay 20");
        assertEquals(20, delay.ticks());
        assertEquals(Duration.ofMillis(1000), delay.duration());
    }

    @Test
    void delayWithoutValueIsOneTick() {
        assertEquals(new Delay(1), parser.parse("delay"));
    }

    @Test
    void invalidDelayFails() {
        assertThrows(CueParseException.class, () -> parser.parse("delay abc"));
        assertThrows(CueParseException.class, () -> parser.parse("delay -5"));
        assertThrows(CueParseException.class, () -> parser.parse("delay 1.5"));
    }

    @Test
    void delayWhoseDurationOverflowsFails() {
        assertThrows(CueParseException.class, () -> parser.parse("delay 9223372036854775807"));
        assertThrows(CueParseException.class, () -> parser.parse("delay " + (Ticks.MAX_TICKS + 1)));
        assertThrows(CueParseException.class, () -> parser.parse("delay 9223372036854775808"));

        Delay longest = (Delay) parser.parse("delay " + Ticks.MAX_TICKS);
        assertFalse(longest.duration().isNegative());
    }

    // ---------------------------------------------------------------------
    // conditionals and lists
    // ---------------------------------------------------------------------

    @Test
    void ifLinesAndConditionalTypeBothParseConditionals() {
        assertInstanceOf(Conditional.class, parser.parse("if {perm a} then {tell x}"));
        assertInstanceOf(Conditional.class, parser.parse("if{perm a}then{tell x}"));
        assertInstanceOf(Conditional.class, parser.parse("conditional if {perm a} then {tell x}"));
    }

    @Test
    void wordsStartingWithIfAreNotConditionals() {
        assertThrows(CueParseException.class, () -> parser.parse("iffy value"));
    }

    @Test
    void splitLinesHonoursBracesAndNewlines() {
        assertEquals(
                List.of("tell a", "tell b", "delay 5", "if {perm x} then {tell c; tell d}"),
                ActionParser.splitLines("tell a; tell b\ndelay 5;; if {perm x} then {tell c; tell d}"));
    }
}
