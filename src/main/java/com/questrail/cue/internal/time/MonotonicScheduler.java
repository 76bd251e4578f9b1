package com.questrail.cue.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Scheduler surface used to resume a suspended action sequence.
 *
 * <h2>Binding invariant</h2>
 * A {@code delay} step never blocks a thread. The running sequence hands its
 * continuation to this scheduler and returns; the continuation runs on the
 * scheduler's thread once the deadline has passed.
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          continuation to run
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Convenience method: schedule after a duration using a provided monotonic clock.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(saturatedDeadline(clock.nowNanos(), delay), task);
    }

    /**
     * {@code now + delay} in nanoseconds, clamped to {@link Long#MAX_VALUE}.
     */
    static long saturatedDeadline(long nowNanos, Duration delay)
    {
        long delayNanos;
        try {
            delayNanos = delay.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
        long deadline = nowNanos + delayNanos;
        return deadline < nowNanos ? Long.MAX_VALUE : deadline;
    }
}
