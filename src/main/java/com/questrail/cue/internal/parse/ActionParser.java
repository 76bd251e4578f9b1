package com.questrail.cue.internal.parse;

import com.questrail.cue.action.Action;
import com.questrail.cue.action.ActionBar;
import com.questrail.cue.action.ActionType;
import com.questrail.cue.action.Delay;
import com.questrail.cue.action.RunAsActor;
import com.questrail.cue.action.RunAsHost;
import com.questrail.cue.action.Sound;
import com.questrail.cue.action.Tell;
import com.questrail.cue.action.Ticks;
import com.questrail.cue.action.Title;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * ActionParser
 * =============================================================================
 * Parses one action line of the form {@code <type> <value>}.
 *
 * <p>
 * The type keyword is matched case-insensitively; the value is everything after
 * the first space. Lines starting with {@code if} are conditional actions and
 * are delegated to {@link ConditionalActionParser}, which in turn calls back
 * into this parser for its branches.
 * </p>
 *
 * <h2>Value grammars</h2>
 * <ul>
 *   <li>{@code sound name[-volume[-pitch]]}: out-of-range numbers are clamped,
 *       unreadable ones fall back to 1.0</li>
 *   <li>{@code title `title` `subtitle` [fadeIn stay fadeOut]}: backtick quoted,
 *       invalid timings fall back to 10/70/20</li>
 *   <li>{@code delay [ticks]}: missing value means one tick</li>
 * </ul>
 */
public final class ActionParser
{
    private static final Logger log = LoggerFactory.getLogger(ActionParser.class);

    private final ConditionalActionParser conditionalParser;
    private final int maxDepth;

    public ActionParser(ConditionParser conditionParser, int maxDepth) {
        Objects.requireNonNull(conditionParser, "conditionParser");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1");
        }
        this.maxDepth = maxDepth;
        this.conditionalParser = new ConditionalActionParser(this, conditionParser, maxDepth);
    }

    public Action parse(String line) {
        Objects.requireNonNull(line, "line");
        return parse(line, 0);
    }

    /**
     * Splits a block of action text into individual lines: on newlines, then on
     * {@code ;} outside braces and backticks.
     */
    public static List<String> splitLines(String text) {
        Objects.requireNonNull(text, "text");
        List<String> lines = new ArrayList<>();
        for (String physical : text.split("\\R")) {
            lines.addAll(ExpressionScanner.splitTopLevel(physical, ';', '{', '}'));
        }
        return lines;
    }

    Action parse(String line, int depth) {
        if (depth > maxDepth) {
            throw new CueParseException("Action nesting exceeds " + maxDepth + " levels");
        }

        String text = Normalizer.collapseWhitespace(line);
        if (text.isEmpty()) {
            throw new CueParseException("Empty action line");
        }
        if (ConditionalActionParser.startsWithIf(text)) {
            return conditionalParser.parse(text, depth);
        }

        int sp = text.indexOf(' ');
        String keyword = sp < 0 ? text : text.substring(0, sp);
        String value = sp < 0 ? "" : text.substring(sp + 1).trim();

        ActionType type = ActionType.fromKeyword(keyword)
                .orElseThrow(() -> new CueParseException(
                        "Unknown action type '" + keyword + "'. Supported types: " + supportedKeywords()));

        if (value.isEmpty() && type != ActionType.DELAY) {
            throw new CueParseException("Empty value for action type '" + type.keyword() + "'");
        }

        return switch (type) {
            case TELL -> new Tell(value);
            case SOUND -> parseSound(value);
            case TITLE -> parseTitle(value);
            case ACTIONBAR -> new ActionBar(value);
            case COMMAND -> new RunAsActor(value);
            case CONSOLE -> new RunAsHost(value);
            case DELAY -> parseDelay(value);
            case CONDITIONAL -> conditionalParser.parse(value, depth);
        };
    }

    // ---------------------------------------------------------------------
    // sound
    // ---------------------------------------------------------------------

    static Sound parseSound(String value) {
        String[] parts = value.split("-", -1);
        String name = parts[0].trim();
        if (name.isEmpty()) {
            throw new CueParseException("Missing sound name");
        }

        float volume = parts.length > 1 ? readFloat(parts[1], Sound.DEFAULT_VOLUME, "volume") : Sound.DEFAULT_VOLUME;
        float pitch = parts.length > 2 ? readFloat(parts[2], Sound.DEFAULT_PITCH, "pitch") : Sound.DEFAULT_PITCH;

        return new Sound(
                name,
                clamp(volume, Sound.MIN_VOLUME, Sound.MAX_VOLUME, "volume"),
                clamp(pitch, Sound.MIN_PITCH, Sound.MAX_PITCH, "pitch"));
    }

    private static float readFloat(String raw, float fallback, String what) {
        try {
            float f = Float.parseFloat(raw.trim());
            if (Float.isNaN(f) || Float.isInfinite(f)) {
                log.warn("Invalid sound {} '{}', using {}", what, raw, fallback);
                return fallback;
            }
            return f;
        } catch (NumberFormatException e) {
            log.warn("Invalid sound {} '{}', using {}", what, raw, fallback);
            return fallback;
        }
    }

    private static float clamp(float value, float min, float max, String what) {
        float clamped = Math.max(min, Math.min(max, value));
        if (clamped != value) {
            log.warn("Sound {} {} clamped to {}", what, value, clamped);
        }
        return clamped;
    }

    // ---------------------------------------------------------------------
    // title
    // ---------------------------------------------------------------------

    static Title parseTitle(String value) {
        List<String> parts = splitBackticked(value);

        String title = parts.size() > 0 ? parts.get(0) : "";
        String subtitle = parts.size() > 1 ? parts.get(1) : "";
        int fadeIn = parts.size() > 2 ? readTicks(parts.get(2), Title.DEFAULT_FADE_IN, "fadeIn") : Title.DEFAULT_FADE_IN;
        int stay = parts.size() > 3 ? readTicks(parts.get(3), Title.DEFAULT_STAY, "stay") : Title.DEFAULT_STAY;
        int fadeOut = parts.size() > 4 ? readTicks(parts.get(4), Title.DEFAULT_FADE_OUT, "fadeOut") : Title.DEFAULT_FADE_OUT;

        return new Title(title, subtitle, fadeIn, stay, fadeOut);
    }

    /**
     * Backtick state machine: quoted text is one part (may be empty), unquoted
     * text is split on spaces.
     */
    private static List<String> splitBackticked(String value) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;

        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '`') {
                if (quoted) {
                    parts.add(current.toString());
                    current.setLength(0);
                } else if (current.length() > 0) {
                    parts.add(current.toString());
                    current.setLength(0);
                }
                quoted = !quoted;
            } else if (c == ' ' && !quoted) {
                if (current.length() > 0) {
                    parts.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            parts.add(current.toString());
        }
        return parts;
    }

    private static int readTicks(String raw, int fallback, String what) {
        try {
            int ticks = Integer.parseInt(raw.trim());
            if (ticks >= 0) {
                return ticks;
            }
        } catch (NumberFormatException e) {
            log.debug("Unreadable title {} '{}'", what, raw, e);
        }
        log.warn("Invalid title {} '{}', using {}", what, raw, fallback);
        return fallback;
    }

    // ---------------------------------------------------------------------
    // delay
    // ---------------------------------------------------------------------

    static Delay parseDelay(String value) {
        if (value.isEmpty()) {
            return new Delay(1);
        }
        long ticks;
        try {
            ticks = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new CueParseException("Invalid delay ticks '" + value + "'", e);
        }
        if (ticks < 0) {
            throw new CueParseException("Delay ticks must be >= 0, got " + ticks);
        }
        if (ticks > Ticks.MAX_TICKS) {
            throw new CueParseException("Delay ticks must be <= " + Ticks.MAX_TICKS + ", got " + ticks);
        }
        return new Delay(ticks);
    }

    private static String supportedKeywords() {
        return Arrays.stream(ActionType.values())
                .map(ActionType::keyword)
                .collect(Collectors.joining(", "));
    }
}
