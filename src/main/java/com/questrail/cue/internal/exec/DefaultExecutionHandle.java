package com.questrail.cue.internal.exec;

import com.questrail.cue.api.ExecutionHandle;
import com.questrail.cue.api.ExecutionResult;

import java.util.concurrent.CompletableFuture;

final class DefaultExecutionHandle implements ExecutionHandle
{
    private final CompletableFuture<ExecutionResult> result;
    private final RunControl control;

    DefaultExecutionHandle(CompletableFuture<ExecutionResult> result, RunControl control) {
        // Callers get a dependent copy; completing or cancelling it cannot disturb the run.
        this.result = result.copy();
        this.control = control;
    }

    @Override
    public CompletableFuture<ExecutionResult> result() {
        return result;
    }

    @Override
    public boolean cancel() {
        return control.cancel();
    }

    @Override
    public boolean isCancelled() {
        return control.isCancelled();
    }
}
