package com.questrail.cue.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for delay deadlines and execution durations.
 *
 * <h2>Binding invariant</h2>
 * Delay deadlines and {@code ExecutionResult#durationMs()} MUST be computed
 * from a monotonic source. Wall-clock time is permitted only for
 * observability event timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
