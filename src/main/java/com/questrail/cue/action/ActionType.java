package com.questrail.cue.action;

import java.util.Locale;
import java.util.Optional;

/**
 * The fixed set of action keywords recognized at the start of an action line.
 *
 * <p>
 * The keyword is only a serialization detail of the parser boundary; once
 * parsed, an action is dispatched on its {@link Action} record type.
 * </p>
 */
public enum ActionType
{
    TELL("tell", "tell <message> - Send a text message"),
    SOUND("sound", "sound <sound>-<volume>-<pitch> - Play a sound"),
    TITLE("title", "title `<title>` `<subtitle>` <fadeIn> <stay> <fadeOut> - Send a title"),
    ACTIONBAR("actionbar", "actionbar <message> - Send action bar message"),
    COMMAND("command", "command <command> - Execute command as the actor"),
    CONSOLE("console", "console <command> - Execute command as the host"),
    DELAY("delay", "delay <ticks> - Add delay in ticks"),
    CONDITIONAL("conditional", "if {condition} then {actions} [else {actions}] - Conditional execution");

    private final String keyword;
    private final String help;

    ActionType(String keyword, String help) {
        this.keyword = keyword;
        this.help = help;
    }

    public String keyword() {
        return keyword;
    }

    public String help() {
        return help;
    }

    /**
     * Case-insensitive keyword lookup.
     */
    public static Optional<ActionType> fromKeyword(String keyword) {
        String k = keyword.toLowerCase(Locale.ROOT);
        for (ActionType type : values()) {
            if (type.keyword.equals(k)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
