package com.questrail.cue.action;

import java.util.Objects;

/**
 * Sends a chat message to the actor.
 */
public record Tell(String text) implements Action
{
    public Tell {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public ActionType type() {
        return ActionType.TELL;
    }
}
