package com.questrail.logic.fsm;

import com.questrail.logic.api.BlockEvaluationException;
import com.questrail.logic.api.EventData;
import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.event.Event;
import com.questrail.logic.event.EventType;
import com.questrail.logic.event.HandlerTable;
import com.questrail.logic.event.Recorder;
import com.questrail.logic.kernel.Circuit;
import com.questrail.logic.runtime.CircuitRuntime;
import com.questrail.logic.time.DeterministicScheduler;
import com.questrail.logic.time.ManualMonotonicClock;
import com.questrail.logic.time.ManualWallClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FsmTest {

    static final FsmDefinition<Fsm> TURNSTILE = FsmDefinition.builder(Fsm.class)
            .states("locked", "unlocked")
            .transition("coin", "locked", "unlocked")
            .transition("push", "unlocked", "locked")
            .build();

    static final FsmDefinition<Fsm> WORKER = FsmDefinition.builder(Fsm.class)
            .states("idle", "running")
            .timer("running", 5, "timeout")
            .transition("go", (String) null, "running")
            .transition("timeout", "running", "idle")
            .build();

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final ManualWallClock wallClock = new ManualWallClock(Instant.parse("2024-03-01T08:00:00Z"));
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock, wallClock);
    private final Circuit circuit = Circuit.builder()
            .withClock(clock)
            .withWallClock(wallClock)
            .withScheduler(scheduler)
            .build();
    private final CircuitRuntime runtime = CircuitRuntime.create(circuit);

    private void elapse(Duration duration) {
        scheduler.advance(duration);
        runtime.step();
    }

    @Test
    void startsInTheDefaultState() {
        Fsm f = new Fsm(circuit, "turnstile", TURNSTILE);

        runtime.initialize();

        assertEquals("locked", f.state());
        assertEquals("locked", f.output());
        runtime.terminate();
    }

    @Test
    void transitionsFollowTheTable() {
        Fsm f = new Fsm(circuit, "turnstile", TURNSTILE);
        runtime.initialize();

        assertEquals(true, f.event("coin"));
        assertEquals("unlocked", f.state());
        assertEquals(false, f.event("coin"));
        assertEquals("unlocked", f.state());
        assertEquals(true, f.event("push"));
        assertEquals("locked", f.output());
        runtime.terminate();
    }

    @Test
    void initDefaultSelectsTheInitialState() {
        Fsm f = new Fsm(circuit, "turnstile",
                BlockConfig.builder().withInitDefault("unlocked").build(), TURNSTILE, null);

        runtime.initialize();

        assertEquals("unlocked", f.state());
        runtime.terminate();
    }

    @Test
    void missingTransitionSendsNotrans() {
        Recorder log = new Recorder(circuit, "log");
        Fsm f = new Fsm(circuit, "turnstile", null, TURNSTILE,
                FsmOptions.builder().withOnNotrans(Event.to("log", "notrans")).build());
        runtime.initialize();

        f.event("push");

        EventData data = log.last().data();
        assertEquals("push", data.get(EventData.EVENT));
        assertEquals("locked", data.get(EventData.STATE));
        assertEquals("turnstile", data.get(EventData.SOURCE));
        runtime.terminate();
    }

    @Test
    void gotoBypassesTheTable() {
        Fsm f = new Fsm(circuit, "turnstile", TURNSTILE);
        runtime.initialize();

        f.event(EventType.goTo("unlocked"));
        assertEquals("unlocked", f.state());

        assertThrows(BlockEvaluationException.class, () -> f.event(EventType.goTo("broken")));
    }

    @Test
    void enterAndExitEventsCarryPublicStateData() {
        Recorder log = new Recorder(circuit, "log");
        Fsm f = new Fsm(circuit, "turnstile", null, TURNSTILE, FsmOptions.builder()
                .withEntryAction("unlocked", (fsm, data) -> {
                    fsm.sdata().put("coins", 1);
                    fsm.sdata().put("_internal", "hidden");
                })
                .withOnEnter("unlocked", Event.to("log", "entered"))
                .withOnExit("locked", Event.to("log", "left"))
                .build());
        runtime.initialize();
        assertTrue(log.received().isEmpty());

        f.event("coin");

        assertEquals(2, log.received().size());
        Recorder.Received left = log.received().get(0);
        assertEquals(EventType.of("left"), left.etype());
        assertEquals("exit", left.data().get(EventData.TRIGGER));
        assertEquals("locked", left.data().get(EventData.STATE));
        Recorder.Received entered = log.received().get(1);
        assertEquals("enter", entered.data().get(EventData.TRIGGER));
        assertEquals("unlocked", entered.data().get(EventData.VALUE));
        assertEquals(Map.of("coins", 1), entered.data().get("sdata"));
        runtime.terminate();
    }

    @Test
    void guardsCanRejectTransitions() {
        FsmDefinition<Fsm> def = FsmDefinition.builder(Fsm.class)
                .states("off", "on")
                .transition("start", "off", "on")
                .transition("stop", "on", "off")
                .guard("start", (fsm, data) -> !data.isTrue("blocked"))
                .build();
        List<String> consulted = new ArrayList<>();
        Fsm f = new Fsm(circuit, "f", null, def, FsmOptions.builder()
                .withGuard("start", (fsm, data) -> {
                    consulted.add(fsm.state());
                    return true;
                })
                .build());
        runtime.initialize();

        assertEquals(false, f.event("start", EventData.of("blocked", true)));
        assertEquals("off", f.state());
        assertEquals(true, f.event("start"));
        assertEquals("on", f.state());
        assertEquals(List.of("off", "off"), consulted);
        runtime.terminate();
    }

    @Test
    void firstTransitionSkipsGuards() {
        FsmDefinition<Fsm> def = FsmDefinition.builder(Fsm.class)
                .states("off", "on")
                .transition("start", (String) null, "on")
                .guard("start", (fsm, data) -> false)
                .build();
        Fsm f = new Fsm(circuit, "f", def);

        assertEquals(true, f.event("start"));
        assertEquals("on", f.state());
        assertEquals(false, f.event("start"));
    }

    @Test
    void entryCallbackChainsOneTransition() {
        List<String> trace = new ArrayList<>();
        Recorder log = new Recorder(circuit, "log");
        FsmDefinition<Fsm> def = FsmDefinition.builder(Fsm.class)
                .states("a", "b", "c")
                .transition("go", "a", "b")
                .onEntry("b", (fsm, data) -> {
                    trace.add("enter b");
                    fsm.event(EventType.goTo("c"));
                })
                .onExit("b", (fsm, data) -> trace.add("exit b"))
                .onEntry("c", (fsm, data) -> trace.add("enter c"))
                .build();
        Fsm f = new Fsm(circuit, "f", null, def, FsmOptions.builder()
                .withOnEnter("b", Event.to("log", "b"))
                .withOnEnter("c", Event.to("log", "c"))
                .build());
        runtime.initialize();

        assertEquals(true, f.event("go"));

        assertEquals("c", f.state());
        assertEquals("c", f.output());
        assertEquals(List.of("enter b", "exit b", "enter c"), trace);
        assertEquals(1, log.received().size());
        assertEquals(EventType.of("c"), log.last().etype());
        runtime.terminate();
    }

    @Test
    void twoChainedEventsAreForbidden() {
        FsmDefinition<Fsm> def = FsmDefinition.builder(Fsm.class)
                .states("a", "b", "c")
                .transition("go", "a", "b")
                .onEntry("b", (fsm, data) -> {
                    fsm.event(EventType.goTo("c"));
                    fsm.event(EventType.goTo("a"));
                })
                .build();
        Fsm f = new Fsm(circuit, "f", def);
        runtime.initialize();

        assertThrows(BlockEvaluationException.class, () -> f.event("go"));

        Throwable cause = circuit.error().getCause();
        assertInstanceOf(IllegalStateException.class, cause);
        assertTrue(cause.getMessage().startsWith("Forbidden event multiplication"), cause.getMessage());
    }

    @Test
    void endlessChainIsDetected() {
        FsmDefinition<Fsm> def = FsmDefinition.builder(Fsm.class)
                .states("idle", "ping", "pong")
                .transition("go", "idle", "ping")
                .onEntry("ping", (fsm, data) -> fsm.event(EventType.goTo("pong")))
                .onEntry("pong", (fsm, data) -> fsm.event(EventType.goTo("ping")))
                .build();
        Fsm f = new Fsm(circuit, "f", def);
        runtime.initialize();

        BlockEvaluationException e = assertThrows(BlockEvaluationException.class, () -> f.event("go"));
        assertTrue(e.getMessage().contains("Chained state transition limit reached"), e.getMessage());
    }

    @Test
    void timerRaisesTheTimedEvent() {
        Fsm f = new Fsm(circuit, "worker", WORKER);
        runtime.initialize();

        f.event("go");
        assertEquals("running", f.state());
        assertEquals(wallClock.now().plusSeconds(5), f.timerExpiry());

        elapse(Duration.ofSeconds(4));
        assertEquals("running", f.state());

        elapse(Duration.ofSeconds(1));
        assertEquals("idle", f.state());
        assertNull(f.timerExpiry());
        runtime.terminate();
    }

    @Test
    void reenteringAStateRestartsItsTimer() {
        Fsm f = new Fsm(circuit, "worker", WORKER);
        runtime.initialize();

        f.event("go");
        elapse(Duration.ofSeconds(3));
        f.event("go");
        elapse(Duration.ofSeconds(3));
        assertEquals("running", f.state());

        elapse(Duration.ofSeconds(2));
        assertEquals("idle", f.state());
        assertEquals(0, scheduler.pendingCount());
        runtime.terminate();
    }

    @Test
    void durationPrecedence() {
        Fsm perInstance = new Fsm(circuit, "fast", null, WORKER,
                FsmOptions.builder().withDuration("running", 2).build());
        Fsm perEvent = new Fsm(circuit, "slow", null, WORKER,
                FsmOptions.builder().withDuration("running", 2).build());
        runtime.initialize();

        perInstance.event("go");
        perEvent.event("go", EventData.of(EventData.DURATION, "1m"));

        elapse(Duration.ofSeconds(2));
        assertEquals("idle", perInstance.state());
        assertEquals("running", perEvent.state());

        elapse(Duration.ofSeconds(58));
        assertEquals("idle", perEvent.state());
        runtime.terminate();
    }

    @Test
    void zeroDurationPassesThroughImmediately() {
        Recorder log = new Recorder(circuit, "log");
        Fsm f = new Fsm(circuit, "worker", null, WORKER, FsmOptions.builder()
                .withOnEnter("running", Event.to("log", "running"))
                .withOnEnter("idle", Event.to("log", "idle"))
                .build());
        runtime.initialize();

        f.event("go", EventData.of(EventData.DURATION, 0));

        assertEquals("idle", f.state());
        assertEquals(List.of(EventType.of("idle")), log.received().stream().map(Recorder.Received::etype).toList());
        assertEquals(0, scheduler.pendingCount());
        runtime.terminate();
    }

    @Test
    void unsetDurationIsAnError() {
        FsmDefinition<Fsm> def = FsmDefinition.builder(Fsm.class)
                .states("idle")
                .timer("wait", null, EventType.goTo("idle"))
                .transition("go", "idle", "wait")
                .build();
        Fsm f = new Fsm(circuit, "f", def);
        runtime.initialize();

        BlockEvaluationException e = assertThrows(BlockEvaluationException.class, () -> f.event("go"));
        assertTrue(e.getMessage().contains("Timer duration for state 'wait' not set"), e.getMessage());
    }

    @Test
    void stopCancelsTheTimer() {
        Fsm f = new Fsm(circuit, "worker", WORKER);
        runtime.initialize();
        f.event("go");
        assertEquals(1, scheduler.pendingCount());

        runtime.terminate();

        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void stateIsRestoredWithItsTimer() {
        Map<String, Object> store = new HashMap<>();
        store.put(Circuit.STOP_TIME_KEY, wallClock.now().minusSeconds(60));
        store.put("<Fsm 'worker'>", new FsmSnapshot("running", wallClock.now().plusSeconds(3), Map.of("jobs", 4)));
        circuit.setPersistentData(store);
        List<String> entered = new ArrayList<>();
        Fsm f = new Fsm(circuit, "worker", BlockConfig.builder().withPersistent(true).build(), WORKER,
                FsmOptions.builder().withEntryAction("running", (fsm, data) -> entered.add("running")).build());

        runtime.initialize();
        assertEquals("running", f.state());
        assertEquals(4, f.sdata().get("jobs"));
        assertTrue(entered.isEmpty());

        elapse(Duration.ofSeconds(3));
        assertEquals("idle", f.state());
        runtime.terminate();

        FsmSnapshot saved = (FsmSnapshot) store.get("<Fsm 'worker'>");
        assertEquals("idle", saved.state());
        assertNull(saved.timerExpiry());
        assertEquals(wallClock.now(), store.get(Circuit.STOP_TIME_KEY));
    }

    @Test
    void expiredStateIsNotRestored() {
        Map<String, Object> store = new HashMap<>();
        store.put(Circuit.STOP_TIME_KEY, wallClock.now().minusSeconds(60));
        store.put("<Fsm 'worker'>", new FsmSnapshot("running", wallClock.now().minusSeconds(1), Map.of()));
        circuit.setPersistentData(store);
        Fsm f = new Fsm(circuit, "worker", BlockConfig.builder().withPersistent(true).build(), WORKER, null);

        runtime.initialize();

        assertEquals("idle", f.state());
        runtime.terminate();
    }

    @Test
    void definitionMustMatchTheFsmType() {
        FsmDefinition<Special> def = FsmDefinition.builder(Special.class).states("x").build();

        assertThrows(IllegalArgumentException.class, () -> new Fsm(circuit, "f", def));
    }

    @Test
    void fsmEventsMustNotShadowHandlers() {
        FsmDefinition<Special> def = FsmDefinition.builder(Special.class)
                .states("x", "y")
                .transition("put", "x", "y")
                .build();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new Special(circuit, def));
        assertTrue(e.getMessage().startsWith("Ambiguous event 'put'"), e.getMessage());
    }

    @Test
    void optionsMustNameKnownStates() {
        assertThrows(IllegalArgumentException.class, () -> new Fsm(circuit, "a", null, TURNSTILE,
                FsmOptions.builder().withDuration("locked", 1).build()));
        assertThrows(IllegalArgumentException.class, () -> new Fsm(circuit, "b", null, TURNSTILE,
                FsmOptions.builder().withOnEnter("open", Event.to("x")).build()));
        assertThrows(IllegalArgumentException.class, () -> new Fsm(circuit, "c", null, TURNSTILE,
                FsmOptions.builder().withGuard("kick", (fsm, data) -> true).build()));
    }

    static final class Special extends Fsm {
        static final HandlerTable<Special> HANDLERS = HandlerTable.builder(Special.class)
                .on("put", (s, data) -> null)
                .build();

        Special(Circuit circuit, FsmDefinition<Special> definition) {
            super(circuit, "special", definition);
        }

        @Override
        protected HandlerTable<Special> eventHandlers() {
            return HANDLERS;
        }
    }
}
