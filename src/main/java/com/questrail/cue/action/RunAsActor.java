package com.questrail.cue.action;

import java.util.Objects;

/**
 * Runs a command as if the actor had typed it.
 */
public record RunAsActor(String command) implements Action
{
    public RunAsActor {
        Objects.requireNonNull(command, "command");
    }

    @Override
    public ActionType type() {
        return ActionType.COMMAND;
    }
}
