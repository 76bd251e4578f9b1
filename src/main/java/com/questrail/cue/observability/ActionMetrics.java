package com.questrail.cue.observability;

import com.questrail.cue.action.ActionType;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * ActionMetrics
 * =============================================================================
 * Observability sink that aggregates execution statistics per action type.
 *
 * <p>
 * Counters are lock-free and may be read while runs are in flight; a snapshot
 * is therefore consistent per counter, not across counters.
 * </p>
 */
public final class ActionMetrics implements CueObservabilitySink {

    private final Map<ActionType, Counters> perType = new ConcurrentHashMap<>();
    private final LongAdder sequences = new LongAdder();

    /**
     * Statistics for one action type.
     *
     * @param executions every attempt, failed ones included
     */
    public record ActionStats(ActionType type, long executions, long failures, long totalNanos) {
        public double averageMillis() {
            return executions == 0 ? 0.0 : totalNanos / 1_000_000.0 / executions;
        }

        /** Fraction in [0, 1]; 1.0 when nothing ran. */
        public double successRate() {
            return executions == 0 ? 1.0 : (executions - failures) / (double) executions;
        }
    }

    public record SystemStats(long sequences, long executions, long failures, long totalNanos, int actionTypeCount) {
        public double averageMillis() {
            return executions == 0 ? 0.0 : totalNanos / 1_000_000.0 / executions;
        }

        public double successRate() {
            return executions == 0 ? 1.0 : (executions - failures) / (double) executions;
        }
    }

    private static final class Counters {
        final LongAdder executions = new LongAdder();
        final LongAdder failures = new LongAdder();
        final LongAdder nanos = new LongAdder();
    }

    @Override
    public void onActionExecuted(ActionExecutedEvent event) {
        Counters c = perType.computeIfAbsent(event.type(), t -> new Counters());
        c.executions.increment();
        c.nanos.add(event.elapsed().toNanos());
        if (!event.success()) {
            c.failures.increment();
        }
    }

    @Override
    public void onSequenceCompleted(SequenceCompletedEvent event) {
        sequences.increment();
    }

    @Override
    public void onParseFailure(ParseFailureEvent event) {}

    @Override
    public void onEvaluationError(EvaluationErrorEvent event) {}

    @Override
    public void onActionFailure(ActionFailureEvent event) {}

    public ActionStats stats(ActionType type) {
        Counters c = perType.get(type);
        if (c == null) {
            return new ActionStats(type, 0, 0, 0);
        }
        return new ActionStats(type, c.executions.sum(), c.failures.sum(), c.nanos.sum());
    }

    public Map<ActionType, ActionStats> allStats() {
        Map<ActionType, ActionStats> out = new EnumMap<>(ActionType.class);
        for (ActionType type : perType.keySet()) {
            out.put(type, stats(type));
        }
        return out;
    }

    public SystemStats systemStats() {
        long executions = 0;
        long failures = 0;
        long nanos = 0;
        for (Counters c : perType.values()) {
            executions += c.executions.sum();
            failures += c.failures.sum();
            nanos += c.nanos.sum();
        }
        return new SystemStats(sequences.sum(), executions, failures, nanos, perType.size());
    }

    public void reset() {
        perType.clear();
        sequences.reset();
    }
}
