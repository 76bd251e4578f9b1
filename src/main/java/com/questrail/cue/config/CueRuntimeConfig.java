package com.questrail.cue.config;

import java.util.Objects;

/**
 * Aggregated configuration for the cue runtime.
 *
 * @param maxNestingDepth       deepest accepted combinator / conditional nesting
 * @param conditionCacheEnabled whether parsed conditions are memoized by text
 * @param schedulerThreads      thread count for the {@link TimerBackend#EXECUTOR} backend
 * @param timerBackend          scheduler implementation used for delays
 */
public record CueRuntimeConfig(
    int maxNestingDepth,
    boolean conditionCacheEnabled,
    int schedulerThreads,
    TimerBackend timerBackend
) {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 16;

    public CueRuntimeConfig {
        Objects.requireNonNull(timerBackend, "timerBackend");
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be >= 1");
        }
        if (schedulerThreads < 1) {
            throw new IllegalArgumentException("schedulerThreads must be >= 1");
        }
    }

    public static CueRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;
        private boolean conditionCacheEnabled = true;
        private int schedulerThreads = 1;
        private TimerBackend timerBackend = TimerBackend.EXECUTOR;

        public Builder withMaxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder withConditionCacheEnabled(boolean enabled) {
            this.conditionCacheEnabled = enabled;
            return this;
        }

        public Builder withSchedulerThreads(int schedulerThreads) {
            this.schedulerThreads = schedulerThreads;
            return this;
        }

        public Builder withTimerBackend(TimerBackend timerBackend) {
            this.timerBackend = timerBackend;
            return this;
        }

        public CueRuntimeConfig build() {
            return new CueRuntimeConfig(maxNestingDepth, conditionCacheEnabled, schedulerThreads, timerBackend);
        }
    }
}
