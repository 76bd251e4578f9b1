package com.questrail.cue.runtime;

import com.questrail.cue.action.ActionList;
import com.questrail.cue.action.ActionType;
import com.questrail.cue.action.Delay;
import com.questrail.cue.action.Tell;
import com.questrail.cue.api.ExecutionHandle;
import com.questrail.cue.api.ExecutionResult;
import com.questrail.cue.api.ValidationResult;
import com.questrail.cue.config.CueRuntimeConfig;
import com.questrail.cue.config.TimerBackend;
import com.questrail.cue.observability.EvaluationErrorEvent;
import com.questrail.cue.observability.ParseFailureEvent;
import com.questrail.cue.observability.RecordingObservabilitySink;
import com.questrail.cue.support.RecordingEffectHost;
import com.questrail.cue.time.DeterministicScheduler;
import com.questrail.cue.time.ManualMonotonicClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CueRuntimeTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingEffectHost host;
    private RecordingObservabilitySink sink;
    private Map<String, String> placeholders;
    private CueRuntime<String> runtime;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        host = new RecordingEffectHost();
        sink = new RecordingObservabilitySink();
        placeholders = new HashMap<>();
        runtime = builder().build();
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    private CueRuntime.Builder<String> builder() {
        return CueRuntime.<String>builder()
                .withPermissionLookup((actor, node) -> Set.of("vip", "fly").contains(node))
                .withPlaceholderResolver((actor, key) -> placeholders.get(key))
                .withEffectHost(host)
                .withObservabilitySink(sink)
                .withScheduler(scheduler, clock);
    }

    // ---------------------------------------------------------------------
    // Conditions
    // ---------------------------------------------------------------------

    @Test
    void conditionsAreCachedByNormalizedText() {
        assertTrue(runtime.parseCondition("perm vip").isPresent());
        assertTrue(runtime.parseCondition("  perm    vip ").isPresent());
        assertEquals(1, runtime.conditionCacheSize());

        runtime.clearConditionCache();
        assertEquals(0, runtime.conditionCacheSize());
    }

    @Test
    void cacheCanBeDisabled() {
        try (CueRuntime<String> uncached = builder()
                .withConfig(CueRuntimeConfig.builder().withConditionCacheEnabled(false).build())
                .build()) {
            assertTrue(uncached.parseCondition("perm vip").isPresent());
            assertEquals(0, uncached.conditionCacheSize());
        }
    }

    @Test
    void invalidConditionIsAbsentAndReported() {
        assertTrue(runtime.parseCondition("any []").isEmpty());
        assertTrue(runtime.parseCondition(null).isEmpty());

        List<ParseFailureEvent> failures = sink.eventsOfType(ParseFailureEvent.class);
        assertEquals(1, failures.size());
        assertEquals("condition", failures.get(0).kind());
        assertEquals("any []", failures.get(0).source());
    }

    @Test
    void evaluateTextExpressions() {
        placeholders.put("%player_level%", "12");

        assertTrue(runtime.evaluate("alice", "perm vip"));
        assertFalse(runtime.evaluate("alice", "perm admin"));
        assertTrue(runtime.evaluate("alice", "all [vip; %player_level% >= 10]"));
        assertTrue(runtime.evaluate("alice", "any [admin; not perm op]"));
        assertFalse(runtime.evaluate("alice", "any []"));
    }

    @Test
    void groupedDoubleNegationMatchesThePlainPermission() {
        assertTrue(runtime.evaluate("alice", "not (not permission vip)"));
        assertFalse(runtime.evaluate("alice", "not (not permission admin)"));
    }

    @Test
    void throwingCollaboratorMakesConditionFalse() {
        try (CueRuntime<String> broken = builder()
                .withPlaceholderResolver((actor, key) -> { throw new IllegalStateException("resolver down"); })
                .build()) {
            assertFalse(broken.evaluate("alice", "%a% > 1"));
            assertEquals(1, sink.eventsOfType(EvaluationErrorEvent.class).size());
        }
    }

    @Test
    void evaluateAllAndAny() {
        assertTrue(runtime.evaluateAll("alice", List.of("vip", "fly")));
        assertFalse(runtime.evaluateAll("alice", List.of("vip", "admin")));
        assertTrue(runtime.evaluateAll("alice", List.of()));

        assertTrue(runtime.evaluateAny("alice", List.of("admin", "fly")));
        assertFalse(runtime.evaluateAny("alice", List.of()));
    }

    @Test
    void validationAndDescription() {
        assertTrue(runtime.isValidCondition("perm a"));
        ValidationResult invalid = runtime.validateCondition("%a% => 1");
        assertFalse(invalid.valid());
        assertTrue(invalid.error().orElseThrow().contains("=>"));

        assertEquals("any [permission a; permission b]",
                runtime.describeCondition("any[perm a;perm b]").orElseThrow());

        assertTrue(sink.eventsOfType(ParseFailureEvent.class).isEmpty(), "validation must stay silent");
    }

    // ---------------------------------------------------------------------
    // Actions
    // ---------------------------------------------------------------------

    @Test
    void textListSkipsInvalidLines() {
        ActionList list = runtime.parseActionList("tell a; bogus line\ndelay 5");

        assertEquals(ActionList.of(new Tell("a"), new Delay(5)), list);
        assertEquals(1, sink.eventsOfType(ParseFailureEvent.class).size());
    }

    @Test
    void listElementsAreSingleLines() {
        assertEquals(ActionList.of(new Tell("a; b")), runtime.parseActionList(List.of("tell a; b")));
    }

    @Test
    void configValuesOfEveryShape() {
        assertTrue(runtime.parseActionsFromConfig(null).isEmpty());
        assertEquals(ActionList.of(new Tell("x")), runtime.parseActionsFromConfig("tell x"));
        assertEquals(
                ActionList.of(new Tell("x"), new Delay(2)),
                runtime.parseActionsFromConfig(Arrays.asList("tell x", null, "delay 2", 5)));

        assertTrue(runtime.parseActionsFromConfig(Map.of("tell", "x")).isEmpty());
        // the integer element and the map
        assertEquals(2, sink.eventsOfType(ParseFailureEvent.class).size());
    }

    @Test
    void validateActionsKeepsInputOrder() {
        Map<String, ValidationResult> results = runtime.validateActions(List.of("tell a", "delay x", "sound"));

        assertEquals(List.of("tell a", "delay x", "sound"), new ArrayList<>(results.keySet()));
        assertTrue(results.get("tell a").valid());
        assertFalse(results.get("delay x").valid());
        assertFalse(results.get("sound").valid());
    }

    @Test
    void supportedTypesAndHelp() {
        assertEquals(
                List.of("tell", "sound", "title", "actionbar", "command", "console", "delay", "conditional"),
                new ArrayList<>(runtime.supportedActionTypes()));
        assertEquals(ActionType.DELAY.help(), runtime.actionHelp("DELAY").orElseThrow());
        assertTrue(runtime.actionHelp("explode").isEmpty());
        assertTrue(runtime.actionHelp(null).isEmpty());
    }

    // ---------------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------------

    @Test
    void executeLinesWithCallback() {
        AtomicReference<ExecutionResult> seen = new AtomicReference<>();

        runtime.execute("alice",
                List.of("if {perm vip} then {tell Welcome VIP} else {tell Welcome}", "delay 20", "tell done"),
                seen::set);

        assertNull(seen.get());
        scheduler.advanceMillisAndRun(1000);

        assertEquals(List.of("tell:alice:Welcome VIP", "tell:alice:done"), host.calls());
        assertEquals(3, seen.get().successCount());
        assertEquals(1000, seen.get().durationMs());
        // conditional, its branch, the delay and the trailing tell
        assertEquals(4, runtime.metrics().systemStats().executions());
        assertEquals(1, runtime.metrics().systemStats().sequences());
    }

    @Test
    void executeSingleAction() {
        assertTrue(runtime.executeAction("alice", "bogus").isEmpty());

        ExecutionHandle handle = runtime.executeAction("alice", "title `Hi` `there`").orElseThrow();

        assertTrue(handle.result().join().isFullySuccessful());
        assertEquals(List.of("title:alice:Hi|there|500/3500/1000"), host.calls());
    }

    @Test
    void executeAfterCloseIsRejected() {
        runtime.close();

        assertThrows(IllegalStateException.class, () -> runtime.execute("alice", ActionList.of(new Tell("x"))));
    }

    @Test
    void ownedExecutorBackendRunsDelays() throws Exception {
        try (CueRuntime<String> real = CueRuntime.<String>builder()
                .withPermissionLookup((actor, node) -> false)
                .withEffectHost(host)
                .build()) {
            ExecutionResult result = real.execute("alice", List.of("delay 1", "tell x"))
                    .result()
                    .get(2, TimeUnit.SECONDS);

            assertEquals(2, result.successCount());
            assertTrue(result.durationMs() >= 50);
        }
    }

    @Test
    void ownedWheelBackendRunsDelays() throws Exception {
        try (CueRuntime<String> real = CueRuntime.<String>builder()
                .withPermissionLookup((actor, node) -> false)
                .withEffectHost(host)
                .withConfig(CueRuntimeConfig.builder().withTimerBackend(TimerBackend.WHEEL).build())
                .build()) {
            ExecutionResult result = real.execute("alice", List.of("delay 2", "tell x"))
                    .result()
                    .get(2, TimeUnit.SECONDS);

            assertEquals(2, result.successCount());
            assertEquals(List.of("tell:alice:x"), host.calls());
        }
    }
}
