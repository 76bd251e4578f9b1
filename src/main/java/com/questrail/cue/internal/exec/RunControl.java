package com.questrail.cue.internal.exec;

import com.questrail.cue.internal.time.Cancellable;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Cancellation state shared by a top-level run and every nested branch run.
 *
 * <p>
 * At most one delay is pending per run tree, since actions execute strictly
 * one after another. Cancelling abandons that delay: its timer is cancelled and
 * its future completes with {@link CancellationException}.
 * </p>
 */
final class RunControl
{
    private boolean cancelled;
    private Cancellable pendingTimer;
    private CompletableFuture<Void> pendingDelay;

    synchronized boolean isCancelled() {
        return cancelled;
    }

    boolean cancel() {
        Cancellable timer;
        CompletableFuture<Void> delay;
        synchronized (this) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            timer = pendingTimer;
            delay = pendingDelay;
            pendingTimer = null;
            pendingDelay = null;
        }
        // Completing outside the lock: the delay's continuation resumes the run.
        abandon(timer, delay);
        return true;
    }

    void arm(Cancellable timer, CompletableFuture<Void> delay) {
        synchronized (this) {
            if (!cancelled) {
                pendingTimer = timer;
                pendingDelay = delay;
                return;
            }
        }
        abandon(timer, delay);
    }

    synchronized void disarm(CompletableFuture<Void> delay) {
        if (pendingDelay == delay) {
            pendingTimer = null;
            pendingDelay = null;
        }
    }

    private static void abandon(Cancellable timer, CompletableFuture<Void> delay) {
        if (timer != null) {
            timer.cancel();
        }
        if (delay != null) {
            delay.completeExceptionally(new CancellationException("run cancelled"));
        }
    }
}
