package com.questrail.cue.action;

import java.time.Duration;

/**
 * Tick arithmetic.
 *
 * <p>
 * One tick is 50 ms of wall time, the host platform's scheduling
 * granularity. {@link Delay} and the {@link Title} timing fields are
 * expressed in ticks and converted here, nowhere else.
 * </p>
 */
public final class Ticks
{
    public static final long MILLIS_PER_TICK = 50L;

    /** Largest tick count whose duration fits in a {@code long} of milliseconds. */
    public static final long MAX_TICKS = Long.MAX_VALUE / MILLIS_PER_TICK;

    private Ticks() {
    }

    /**
     * @throws ArithmeticException when {@code ticks} exceeds {@link #MAX_TICKS}
     */
    public static Duration toDuration(long ticks) {
        if (ticks < 0) {
            throw new IllegalArgumentException("ticks must be >= 0");
        }
        return Duration.ofMillis(Math.multiplyExact(ticks, MILLIS_PER_TICK));
    }
}
