package com.questrail.cue.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Real-time tests for the default delay backend. Latch timeouts are generous
 * so loaded build machines do not produce false failures.
 */
class ScheduledExecutorSchedulerTest {

    private final MonotonicClock clock = SystemMonotonicClock.INSTANCE;
    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void oneTickDelayFires() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long start = clock.nowNanos();

        scheduler.scheduleAfter(Duration.ofMillis(50), clock, latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS), "delay should fire");
        assertTrue(clock.nowNanos() - start >= TimeUnit.MILLISECONDS.toNanos(50));
    }

    @Test
    void pastDeadlineRunsPromptly() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAtNanos(clock.nowNanos() - TimeUnit.SECONDS.toNanos(1), latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS));
    }

    @Test
    void cancelledDelayNeverRuns() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean(false);

        Cancellable timer = scheduler.scheduleAfter(Duration.ofMillis(100), clock, () -> ran.set(true));

        assertTrue(timer.cancel());
        Thread.sleep(200);
        assertFalse(ran.get());
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleAfter(Duration.ofMillis(-1), clock, () -> { }));
    }

    @Test
    void distantDeadlinesSaturateInsteadOfWrapping() {
        assertEquals(Long.MAX_VALUE, MonotonicScheduler.saturatedDeadline(1_000L, Duration.ofMillis(Long.MAX_VALUE)));
        assertEquals(Long.MAX_VALUE, MonotonicScheduler.saturatedDeadline(Long.MAX_VALUE - 5, Duration.ofNanos(10)));
        assertEquals(1_050L, MonotonicScheduler.saturatedDeadline(1_000L, Duration.ofNanos(50)));
    }

    @Test
    void distantDelayIsPendingUntilCancelled() {
        AtomicBoolean ran = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAfter(Duration.ofMillis(Long.MAX_VALUE), clock, () -> ran.set(true));
        handle.cancel();

        assertFalse(ran.get());
    }
}
