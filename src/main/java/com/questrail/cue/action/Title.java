package com.questrail.cue.action;

import java.time.Duration;
import java.util.Objects;

/**
 * Shows a title and subtitle to the actor.
 *
 * <p>
 * Timing fields are in ticks. Defaults are {@value #DEFAULT_FADE_IN} /
 * {@value #DEFAULT_STAY} / {@value #DEFAULT_FADE_OUT}.
 * </p>
 */
public record Title(String title, String subtitle, int fadeIn, int stay, int fadeOut) implements Action
{
    public static final int DEFAULT_FADE_IN = 10;
    public static final int DEFAULT_STAY = 70;
    public static final int DEFAULT_FADE_OUT = 20;

    public Title {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(subtitle, "subtitle");
        if (fadeIn < 0 || stay < 0 || fadeOut < 0) {
            throw new IllegalArgumentException("title timings must be >= 0");
        }
    }

    public Title(String title, String subtitle) {
        this(title, subtitle, DEFAULT_FADE_IN, DEFAULT_STAY, DEFAULT_FADE_OUT);
    }

    public Duration fadeInDuration() {
        return Ticks.toDuration(fadeIn);
    }

    public Duration stayDuration() {
        return Ticks.toDuration(stay);
    }

    public Duration fadeOutDuration() {
        return Ticks.toDuration(fadeOut);
    }

    @Override
    public ActionType type() {
        return ActionType.TITLE;
    }
}
