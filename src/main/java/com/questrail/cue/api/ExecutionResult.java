package com.questrail.cue.api;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Outcome of one action sequence run.
 *
 * <p>
 * {@code successCount + failureCount <= totalActions}; the difference is the
 * number of actions that never ran because the actor became unavailable or the
 * run was cancelled.
 * </p>
 */
public record ExecutionResult(
        int totalActions,
        int successCount,
        int failureCount,
        long durationMs,
        List<String> errors,
        boolean cancelled
) {
    public ExecutionResult {
        Objects.requireNonNull(errors, "errors");
        if (totalActions < 0 || successCount < 0 || failureCount < 0 || durationMs < 0) {
            throw new IllegalArgumentException("counts and duration must be >= 0");
        }
        if (successCount + failureCount > totalActions) {
            throw new IllegalArgumentException(
                    "successCount + failureCount exceeds totalActions: "
                            + successCount + " + " + failureCount + " > " + totalActions);
        }
        errors = List.copyOf(errors);
    }

    public boolean isFullySuccessful() {
        return failureCount == 0 && successCount == totalActions;
    }

    /**
     * Percentage of actions that succeeded; an empty run is 100%.
     */
    public double successRate() {
        return totalActions == 0 ? 100.0 : successCount * 100.0 / totalActions;
    }

    public String summary() {
        return String.format(Locale.ROOT,
                "Execution: %d/%d successful (%.1f%%) in %dms%s",
                successCount, totalActions, successRate(), durationMs,
                cancelled ? ", cancelled" : "");
    }
}
