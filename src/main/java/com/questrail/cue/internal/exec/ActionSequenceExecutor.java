package com.questrail.cue.internal.exec;

import com.questrail.cue.action.Action;
import com.questrail.cue.action.ActionBar;
import com.questrail.cue.action.ActionList;
import com.questrail.cue.action.Conditional;
import com.questrail.cue.action.Delay;
import com.questrail.cue.action.RunAsActor;
import com.questrail.cue.action.RunAsHost;
import com.questrail.cue.action.Sound;
import com.questrail.cue.action.Tell;
import com.questrail.cue.action.Title;
import com.questrail.cue.api.ActorAvailability;
import com.questrail.cue.api.EffectHost;
import com.questrail.cue.api.ExecutionHandle;
import com.questrail.cue.api.ExecutionResult;
import com.questrail.cue.internal.eval.ConditionEvaluator;
import com.questrail.cue.internal.time.Cancellable;
import com.questrail.cue.internal.time.MonotonicClock;
import com.questrail.cue.internal.time.MonotonicScheduler;
import com.questrail.cue.internal.time.WallClock;
import com.questrail.cue.observability.ActionExecutedEvent;
import com.questrail.cue.observability.ActionFailureEvent;
import com.questrail.cue.observability.CueObservabilitySink;
import com.questrail.cue.observability.EvaluationErrorEvent;
import com.questrail.cue.observability.SequenceCompletedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * ActionSequenceExecutor
 * =============================================================================
 * Runs an {@link ActionList} against one actor, strictly in order.
 *
 * <h2>Execution model</h2>
 * <ul>
 *   <li>The run starts on the calling thread and proceeds synchronously until
 *       the first action that has to wait.</li>
 *   <li>{@link Delay} is a scheduler continuation; no thread blocks while a
 *       delay is pending. The run resumes on the scheduler's thread.</li>
 *   <li>{@link RunAsActor} / {@link RunAsHost} hop to the command executor; the
 *       run resumes once the command has returned.</li>
 *   <li>{@link Conditional} evaluates its condition once and runs the chosen
 *       branch as a nested run that shares the cancellation state. The node
 *       counts as one action of the enclosing list; failures inside the branch
 *       are reported but do not fail the node. A condition that cannot be
 *       evaluated is reported and treated as not satisfied, with no else
 *       branch taken.</li>
 * </ul>
 *
 * <h2>Binding invariants</h2>
 * <ul>
 *   <li>Availability is checked before every action. An unavailable actor ends
 *       the run; the remaining actions count as neither success nor failure.</li>
 *   <li>An action that throws is one failure; the next action still runs.</li>
 *   <li>After cancellation no further action starts, in any nested branch.</li>
 *   <li>Durations use the monotonic clock only; wall-clock stamps events.</li>
 * </ul>
 *
 * @param <A> the host's actor type
 */
public final class ActionSequenceExecutor<A>
{
    private static final Logger log = LoggerFactory.getLogger(ActionSequenceExecutor.class);

    private final EffectHost<A> effects;
    private final ConditionEvaluator<A> evaluator;
    private final ActorAvailability<A> availability;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Executor commandExecutor;
    private final CueObservabilitySink sink;

    public ActionSequenceExecutor(EffectHost<A> effects,
                                  ConditionEvaluator<A> evaluator,
                                  ActorAvailability<A> availability,
                                  MonotonicScheduler scheduler,
                                  MonotonicClock clock,
                                  WallClock wallClock,
                                  Executor commandExecutor,
                                  CueObservabilitySink sink)
    {
        this.effects = Objects.requireNonNull(effects, "effects");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.availability = Objects.requireNonNull(availability, "availability");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.commandExecutor = Objects.requireNonNull(commandExecutor, "commandExecutor");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public ExecutionHandle execute(ActionList actions, A actor) {
        Objects.requireNonNull(actions, "actions");
        Objects.requireNonNull(actor, "actor");

        RunControl control = new RunControl();
        SequenceRun run = new SequenceRun(actions, actor, control, true);
        return new DefaultExecutionHandle(run.start(), control);
    }

    /**
     * One pass over one list. Mutable state is confined to whichever thread is
     * currently advancing the run; hand-offs happen through future completion.
     */
    private final class SequenceRun
    {
        private final ActionList actions;
        private final A actor;
        private final RunControl control;
        private final boolean topLevel;
        private final CompletableFuture<ExecutionResult> result = new CompletableFuture<>();
        private final List<String> errors = new ArrayList<>();

        private long startNanos;
        private int index;
        private int successes;
        private int failures;

        SequenceRun(ActionList actions, A actor, RunControl control, boolean topLevel) {
            this.actions = actions;
            this.actor = actor;
            this.control = control;
            this.topLevel = topLevel;
        }

        CompletableFuture<ExecutionResult> start() {
            startNanos = clock.nowNanos();
            advance();
            return result;
        }

        private void advance() {
            while (index < actions.size()) {
                if (control.isCancelled()) {
                    log.debug("Run cancelled before action {} of {}", index + 1, actions.size());
                    break;
                }
                if (!actorAvailable()) {
                    log.debug("Actor unavailable before action {} of {}, stopping", index + 1, actions.size());
                    break;
                }

                Action action = actions.get(index);
                long t0 = clock.nowNanos();
                CompletableFuture<Void> step;
                try {
                    step = dispatch(action);
                } catch (RuntimeException e) {
                    step = CompletableFuture.failedFuture(e);
                }

                if (!step.isDone()) {
                    CompletableFuture<Void> pending = step;
                    pending.whenComplete((v, err) -> {
                        record(action, t0, err);
                        index++;
                        advance();
                    });
                    return;
                }
                record(action, t0, failureOf(step));
                index++;
            }
            finish();
        }

        private boolean actorAvailable() {
            try {
                return availability.isAvailable(actor);
            } catch (RuntimeException e) {
                log.warn("Availability check failed, treating actor as unavailable", e);
                return false;
            }
        }

        private CompletableFuture<Void> dispatch(Action action) {
            if (action instanceof Tell t) {
                effects.sendText(actor, t.text());
            } else if (action instanceof ActionBar a) {
                effects.sendActionBar(actor, a.text());
            } else if (action instanceof Sound s) {
                effects.playSound(actor, s.name(), s.volume(), s.pitch());
            } else if (action instanceof Title t) {
                effects.showTitle(actor, t.title(), t.subtitle(),
                        t.fadeInDuration(), t.stayDuration(), t.fadeOutDuration());
            } else if (action instanceof RunAsActor c) {
                return CompletableFuture.runAsync(() -> effects.runAsActor(actor, c.command()), commandExecutor);
            } else if (action instanceof RunAsHost c) {
                return CompletableFuture.runAsync(() -> effects.runAsHost(actor, c.command()), commandExecutor);
            } else if (action instanceof Delay d) {
                return delay(d);
            } else if (action instanceof Conditional c) {
                return conditional(c);
            } else {
                throw new IllegalStateException("Unhandled action: " + action.getClass().getName());
            }
            return CompletableFuture.completedFuture(null);
        }

        private CompletableFuture<Void> delay(Delay d) {
            if (d.ticks() == 0) {
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> done = new CompletableFuture<>();
            Cancellable timer = scheduler.scheduleAfter(d.duration(), clock, () -> done.complete(null));
            control.arm(timer, done);
            done.whenComplete((v, err) -> control.disarm(done));
            return done;
        }

        private CompletableFuture<Void> conditional(Conditional c) {
            boolean satisfied;
            try {
                satisfied = evaluator.evaluate(c.condition(), actor);
            } catch (RuntimeException e) {
                String text = c.condition().describe();
                log.debug("Condition '{}' could not be evaluated, running neither branch", text);
                sink.onEvaluationError(new EvaluationErrorEvent(wallClock.now(), text, e));
                return CompletableFuture.completedFuture(null);
            }

            Optional<ActionList> branch = satisfied ? Optional.of(c.thenBranch()) : c.elseBranch();
            if (branch.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            String label = satisfied ? "then" : "else";
            return new SequenceRun(branch.get(), actor, control, false)
                    .start()
                    .thenAccept(r -> log.debug("{} branch: {}", label, r.summary()));
        }

        private void record(Action action, long t0, Throwable err) {
            Duration elapsed = Duration.ofNanos(clock.nowNanos() - t0);
            Throwable cause = unwrap(err);

            if (cause instanceof CancellationException && control.isCancelled()) {
                // An abandoned delay is not an outcome.
                return;
            }
            if (cause == null) {
                successes++;
                sink.onActionExecuted(new ActionExecutedEvent(wallClock.now(), action.type(), elapsed, true));
                return;
            }

            failures++;
            String message = "Action " + (index + 1) + " (" + action.type().keyword() + ") failed: " + describe(cause);
            errors.add(message);
            sink.onActionFailure(new ActionFailureEvent(wallClock.now(), action.type(), message, cause));
            sink.onActionExecuted(new ActionExecutedEvent(wallClock.now(), action.type(), elapsed, false));
        }

        private void finish() {
            long durationMs = Math.max(0, (clock.nowNanos() - startNanos) / 1_000_000L);
            ExecutionResult r = new ExecutionResult(
                    actions.size(), successes, failures, durationMs, errors, control.isCancelled());
            if (topLevel) {
                sink.onSequenceCompleted(new SequenceCompletedEvent(wallClock.now(), r));
            }
            result.complete(r);
        }
    }

    private static Throwable failureOf(CompletableFuture<Void> done) {
        if (!done.isCompletedExceptionally()) {
            return null;
        }
        try {
            done.join();
            return null;
        } catch (CompletionException | CancellationException e) {
            return e;
        }
    }

    private static Throwable unwrap(Throwable t) {
        if (t instanceof CompletionException && t.getCause() != null) {
            return t.getCause();
        }
        return t;
    }

    private static String describe(Throwable t) {
        String m = t.getMessage();
        return m == null || m.isBlank() ? t.getClass().getSimpleName() : m;
    }
}
