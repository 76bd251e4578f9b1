package com.questrail.cue.action;

import java.util.Objects;

/**
 * Runs a command with the host's own (console) authority.
 */
public record RunAsHost(String command) implements Action
{
    public RunAsHost {
        Objects.requireNonNull(command, "command");
    }

    @Override
    public ActionType type() {
        return ActionType.CONSOLE;
    }
}
