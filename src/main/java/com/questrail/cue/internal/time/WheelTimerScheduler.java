package com.questrail.cue.internal.time;

import com.questrail.cue.action.Ticks;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * WheelTimerScheduler
 * =============================================================================
 * {@link MonotonicScheduler} backed by a Netty {@link HashedWheelTimer}.
 *
 * <h2>When to use it</h2>
 * <p>Hosts that run thousands of concurrently delayed sequences (one per
 * connected actor) pay one bucket insertion per {@code delay} step instead of
 * one heap operation. The wheel ticks at {@link Ticks#MILLIS_PER_TICK} ms, the same
 * granularity as the action language's tick, so a delay of {@code n} ticks
 * resumes after at least {@code n} wheel rotations of one slot.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this class. Callers only ever see
 * {@link Cancellable}.
 *
 * <h2>Ownership</h2>
 * <p>Unlike {@link ScheduledExecutorScheduler} this class owns its timer
 * thread; {@link #stop()} releases it.</p>
 */
public final class WheelTimerScheduler implements MonotonicScheduler {

    private final Timer timer;
    private final MonotonicClock clock;

    public WheelTimerScheduler(MonotonicClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timer = new HashedWheelTimer(
                new DefaultThreadFactory("cue-wheel-timer", true),
                Ticks.MILLIS_PER_TICK,
                TimeUnit.MILLISECONDS);
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        Timeout timeout = timer.newTimeout(t -> task.run(), delayNanos, TimeUnit.NANOSECONDS);
        return timeout::cancel;
    }

    /**
     * Stops the wheel thread. Pending continuations are discarded.
     */
    public void stop() {
        timer.stop();
    }
}
