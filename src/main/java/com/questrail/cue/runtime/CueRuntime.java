package com.questrail.cue.runtime;

import com.questrail.cue.action.Action;
import com.questrail.cue.action.ActionList;
import com.questrail.cue.action.ActionType;
import com.questrail.cue.api.ActorAvailability;
import com.questrail.cue.api.EffectHost;
import com.questrail.cue.api.ExecutionHandle;
import com.questrail.cue.api.ExecutionResult;
import com.questrail.cue.api.PermissionLookup;
import com.questrail.cue.api.PlaceholderResolver;
import com.questrail.cue.api.ValidationResult;
import com.questrail.cue.condition.Condition;
import com.questrail.cue.config.CueRuntimeConfig;
import com.questrail.cue.internal.cache.ConditionCache;
import com.questrail.cue.internal.eval.ConditionEvaluator;
import com.questrail.cue.internal.exec.ActionSequenceExecutor;
import com.questrail.cue.internal.parse.ActionParser;
import com.questrail.cue.internal.parse.ConditionParser;
import com.questrail.cue.internal.parse.CueParseException;
import com.questrail.cue.internal.parse.Normalizer;
import com.questrail.cue.internal.time.MonotonicClock;
import com.questrail.cue.internal.time.MonotonicScheduler;
import com.questrail.cue.internal.time.ScheduledExecutorScheduler;
import com.questrail.cue.internal.time.SystemMonotonicClock;
import com.questrail.cue.internal.time.SystemWallClock;
import com.questrail.cue.internal.time.WallClock;
import com.questrail.cue.internal.time.WheelTimerScheduler;
import com.questrail.cue.observability.ActionMetrics;
import com.questrail.cue.observability.CompositeObservabilitySink;
import com.questrail.cue.observability.CueObservabilitySink;
import com.questrail.cue.observability.EvaluationErrorEvent;
import com.questrail.cue.observability.NullObservabilitySink;
import com.questrail.cue.observability.ParseFailureEvent;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * CueRuntime
 * =============================================================================
 * Composition root and public entry point for conditions and actions.
 *
 * <p>
 * Parse failures never escape as exceptions from this class: text that cannot
 * be parsed yields an empty result (or is skipped inside a list) and is
 * reported to the observability sink. Validation methods report the reason in
 * a {@link ValidationResult} instead and stay silent.
 * </p>
 *
 * <h2>Lifecycle</h2>
 * The runtime owns the delay scheduler it creates and releases it on
 * {@link #close()}. A scheduler supplied through the builder is left alone.
 * Starting a run after close is an {@link IllegalStateException}; runs still
 * waiting on a delay of an owned scheduler do not complete after close.
 *
 * @param <A> the host's actor type
 */
public final class CueRuntime<A> implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(CueRuntime.class);

    private final CueRuntimeConfig config;
    private final ConditionParser conditionParser;
    private final ActionParser actionParser;
    private final ConditionEvaluator<A> evaluator;
    private final ActionSequenceExecutor<A> executor;
    private final ConditionCache conditionCache;
    private final ActionMetrics metrics;
    private final CueObservabilitySink sink;
    private final WallClock wallClock;
    private final Runnable schedulerShutdown;
    private final AtomicBoolean closed = new AtomicBoolean();

    private CueRuntime(Builder<A> b,
                       MonotonicScheduler scheduler,
                       MonotonicClock clock,
                       Runnable schedulerShutdown)
    {
        this.config = b.config;
        this.wallClock = b.wallClock;
        this.metrics = new ActionMetrics();
        this.sink = CompositeObservabilitySink.of(b.observabilitySink, metrics);
        this.conditionParser = new ConditionParser(config.maxNestingDepth());
        this.actionParser = new ActionParser(conditionParser, config.maxNestingDepth());
        this.conditionCache = new ConditionCache();
        this.evaluator = new ConditionEvaluator<>(b.permissions, b.placeholders);
        this.executor = new ActionSequenceExecutor<>(
                b.effects,
                evaluator,
                b.availability,
                scheduler,
                clock,
                wallClock,
                b.commandExecutor,
                sink);
        this.schedulerShutdown = schedulerShutdown;
    }

    public static <A> Builder<A> builder() {
        return new Builder<>();
    }

    public CueRuntimeConfig config() {
        return config;
    }

    public ActionMetrics metrics() {
        return metrics;
    }

    // ---------------------------------------------------------------------
    // Conditions
    // ---------------------------------------------------------------------

    public Optional<Condition> parseCondition(String expression) {
        if (expression == null) {
            return Optional.empty();
        }
        String normalized = Normalizer.normalize(expression);
        try {
            Condition condition = config.conditionCacheEnabled()
                    ? conditionCache.computeIfAbsent(normalized, conditionParser::parse)
                    : conditionParser.parse(normalized);
            return Optional.of(condition);
        } catch (CueParseException e) {
            reportParseFailure("condition", expression, e);
            return Optional.empty();
        }
    }

    /**
     * Parses and evaluates; an expression that does not parse is false.
     */
    public boolean evaluate(A actor, String expression) {
        return parseCondition(expression)
                .map(c -> evaluate(actor, c))
                .orElse(false);
    }

    /**
     * Evaluates a parsed condition. A collaborator that throws makes the
     * condition false and is reported as an evaluation error.
     */
    public boolean evaluate(A actor, Condition condition) {
        Objects.requireNonNull(condition, "condition");
        try {
            return evaluator.evaluate(condition, actor);
        } catch (RuntimeException e) {
            sink.onEvaluationError(new EvaluationErrorEvent(wallClock.now(), condition.describe(), e));
            return false;
        }
    }

    /** True when every expression holds; vacuously true for none. */
    public boolean evaluateAll(A actor, Collection<String> expressions) {
        for (String expression : expressions) {
            if (!evaluate(actor, expression)) {
                return false;
            }
        }
        return true;
    }

    /** True when at least one expression holds; false for none. */
    public boolean evaluateAny(A actor, Collection<String> expressions) {
        for (String expression : expressions) {
            if (evaluate(actor, expression)) {
                return true;
            }
        }
        return false;
    }

    public ValidationResult validateCondition(String expression) {
        if (expression == null) {
            return ValidationResult.invalid("Condition is null");
        }
        try {
            conditionParser.parse(expression);
            return ValidationResult.ok();
        } catch (CueParseException e) {
            return ValidationResult.invalid(e.getMessage());
        }
    }

    public boolean isValidCondition(String expression) {
        return validateCondition(expression).valid();
    }

    public Optional<String> describeCondition(String expression) {
        return parseCondition(expression).map(Condition::describe);
    }

    public void clearConditionCache() {
        conditionCache.clear();
    }

    public int conditionCacheSize() {
        return conditionCache.size();
    }

    // ---------------------------------------------------------------------
    // Actions
    // ---------------------------------------------------------------------

    public Optional<Action> parseAction(String line) {
        if (line == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(actionParser.parse(line));
        } catch (CueParseException e) {
            reportParseFailure("action", line, e);
            return Optional.empty();
        }
    }

    /**
     * Parses newline and top-level {@code ;} separated actions. Lines that do
     * not parse are reported and skipped.
     */
    public ActionList parseActionList(String text) {
        if (text == null) {
            return ActionList.empty();
        }
        return parseLines(ActionParser.splitLines(text));
    }

    /**
     * Parses one action per element. Null elements are ignored.
     */
    public ActionList parseActionList(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        return parseLines(lines);
    }

    /**
     * Accepts the shapes a configuration value can take: absent, a single
     * string, or a list of strings.
     */
    public ActionList parseActionsFromConfig(Object value) {
        if (value == null) {
            return ActionList.empty();
        }
        if (value instanceof String s) {
            return parseActionList(s);
        }
        if (value instanceof List<?> list) {
            List<String> lines = new ArrayList<>(list.size());
            for (Object element : list) {
                if (element != null) {
                    lines.add(element.toString());
                }
            }
            return parseLines(lines);
        }
        sink.onParseFailure(new ParseFailureEvent(wallClock.now(), "action", String.valueOf(value),
                "Unsupported action configuration type " + value.getClass().getName()));
        return ActionList.empty();
    }

    public ValidationResult validateAction(String line) {
        if (line == null) {
            return ValidationResult.invalid("Action is null");
        }
        try {
            actionParser.parse(line);
            return ValidationResult.ok();
        } catch (CueParseException e) {
            return ValidationResult.invalid(e.getMessage());
        }
    }

    /**
     * Validates each line; iteration order of the result follows the input.
     */
    public Map<String, ValidationResult> validateActions(List<String> lines) {
        Map<String, ValidationResult> results = new LinkedHashMap<>();
        for (String line : lines) {
            results.put(line, validateAction(line));
        }
        return results;
    }

    public Set<String> supportedActionTypes() {
        Set<String> types = new LinkedHashSet<>();
        for (ActionType type : ActionType.values()) {
            types.add(type.keyword());
        }
        return types;
    }

    public Optional<String> actionHelp(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return ActionType.fromKeyword(type).map(ActionType::help);
    }

    // ---------------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------------

    public ExecutionHandle execute(A actor, ActionList actions) {
        if (closed.get()) {
            throw new IllegalStateException("CueRuntime is closed");
        }
        return executor.execute(actions, actor);
    }

    public ExecutionHandle execute(A actor, List<String> lines) {
        return execute(actor, parseActionList(lines));
    }

    /**
     * Parses and runs {@code lines}, then hands the result to {@code callback}.
     * A callback that throws is logged.
     */
    public ExecutionHandle execute(A actor, List<String> lines, Consumer<ExecutionResult> callback) {
        Objects.requireNonNull(callback, "callback");
        ExecutionHandle handle = execute(actor, lines);
        handle.result().thenAccept(r -> {
            try {
                callback.accept(r);
            } catch (RuntimeException e) {
                log.warn("Execution callback failed", e);
            }
        });
        return handle;
    }

    /**
     * Runs a single action line; empty when the line does not parse.
     */
    public Optional<ExecutionHandle> executeAction(A actor, String line) {
        return parseAction(line).map(a -> execute(actor, ActionList.of(a)));
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            schedulerShutdown.run();
        }
    }

    private ActionList parseLines(List<String> lines) {
        List<Action> actions = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            parseAction(line).ifPresent(actions::add);
        }
        return new ActionList(actions);
    }

    private void reportParseFailure(String kind, String source, CueParseException e) {
        sink.onParseFailure(new ParseFailureEvent(wallClock.now(), kind, source, e.getMessage()));
    }

    public static final class Builder<A> {
        private PermissionLookup<A> permissions;
        private PlaceholderResolver<A> placeholders = (actor, key) -> null;
        private ActorAvailability<A> availability = ActorAvailability.always();
        private EffectHost<A> effects;
        private Executor commandExecutor = Runnable::run;
        private CueRuntimeConfig config = CueRuntimeConfig.defaults();
        private CueObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicScheduler scheduler;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder<A> withPermissionLookup(PermissionLookup<A> permissions) {
            this.permissions = permissions;
            return this;
        }

        public Builder<A> withPlaceholderResolver(PlaceholderResolver<A> placeholders) {
            this.placeholders = placeholders;
            return this;
        }

        public Builder<A> withActorAvailability(ActorAvailability<A> availability) {
            this.availability = availability;
            return this;
        }

        public Builder<A> withEffectHost(EffectHost<A> effects) {
            this.effects = effects;
            return this;
        }

        /**
         * Executor on which {@code command} and {@code console} actions run,
         * typically the host's main thread. Defaults to the calling thread.
         */
        public Builder<A> withCommandExecutor(Executor commandExecutor) {
            this.commandExecutor = commandExecutor;
            return this;
        }

        public Builder<A> withConfig(CueRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder<A> withObservabilitySink(CueObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Supplies an external scheduler and the clock it runs on. The runtime
         * does not shut it down.
         */
        public Builder<A> withScheduler(MonotonicScheduler scheduler, MonotonicClock clock) {
            this.scheduler = scheduler;
            this.clock = clock;
            return this;
        }

        public Builder<A> withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public CueRuntime<A> build() {
            Objects.requireNonNull(permissions, "permissions");
            Objects.requireNonNull(placeholders, "placeholders");
            Objects.requireNonNull(availability, "availability");
            Objects.requireNonNull(effects, "effects");
            Objects.requireNonNull(commandExecutor, "commandExecutor");
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");

            if (scheduler != null) {
                return new CueRuntime<>(this, scheduler, clock, () -> {});
            }

            switch (config.timerBackend()) {
                case WHEEL: {
                    WheelTimerScheduler wheel = new WheelTimerScheduler(clock);
                    return new CueRuntime<>(this, wheel, clock, wheel::stop);
                }
                case EXECUTOR:
                default: {
                    ScheduledExecutorService exec = Executors.newScheduledThreadPool(
                            config.schedulerThreads(),
                            new DefaultThreadFactory("cue-delay", true));
                    return new CueRuntime<>(this, new ScheduledExecutorScheduler(exec, clock), clock,
                            () -> shutdown(exec));
                }
            }
        }

        private static void shutdown(ScheduledExecutorService exec) {
            exec.shutdown();
            try {
                if (!exec.awaitTermination(5, TimeUnit.SECONDS)) {
                    exec.shutdownNow();
                }
            } catch (InterruptedException e) {
                exec.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
