package com.questrail.cue.api;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to an action sequence started on the executor.
 *
 * <p>
 * The result future always completes normally, including after
 * {@link #cancel()}; a cancelled run reports {@link ExecutionResult#cancelled()}.
 * </p>
 */
public interface ExecutionHandle
{
    CompletableFuture<ExecutionResult> result();

    /**
     * Requests cooperative cancellation. No further action starts, a pending
     * delay is abandoned, and the result completes shortly after.
     *
     * @return true if this call transitioned the run to cancelled
     */
    boolean cancel();

    boolean isCancelled();
}
