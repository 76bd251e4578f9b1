package com.questrail.cue.action;

import java.util.Objects;

/**
 * Shows a message in the actor's action bar.
 */
public record ActionBar(String text) implements Action
{
    public ActionBar {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public ActionType type() {
        return ActionType.ACTIONBAR;
    }
}
