package com.questrail.cue.action;

import java.time.Duration;

/**
 * Suspends the running sequence for {@code ticks} ticks.
 *
 * <p>
 * This is the only suspension point of a sequence. The executor yields to
 * its scheduler for {@link #duration()} rather than blocking a thread.
 * </p>
 */
public record Delay(long ticks) implements Action
{
    public Delay {
        if (ticks < 0 || ticks > Ticks.MAX_TICKS) {
            throw new IllegalArgumentException("delay ticks must be in [0, " + Ticks.MAX_TICKS + "]");
        }
    }

    public Duration duration() {
        return Ticks.toDuration(ticks);
    }

    @Override
    public ActionType type() {
        return ActionType.DELAY;
    }
}
