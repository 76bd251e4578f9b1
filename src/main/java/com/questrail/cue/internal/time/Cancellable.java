package com.questrail.cue.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for a scheduled continuation.
 *
 * <p>
 * Every suspended {@code delay} step of a running action sequence is parked
 * behind one of these. Implementations exist for:
 * <ul>
 *   <li>a deterministic test scheduler</li>
 *   <li>a JVM {@code ScheduledExecutorService}-backed scheduler</li>
 *   <li>a Netty hashed wheel timer</li>
 * </ul>
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled continuation.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was previously cancelled.
     */
    boolean cancel();
}
