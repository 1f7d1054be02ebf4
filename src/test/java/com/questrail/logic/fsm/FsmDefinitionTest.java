package com.questrail.logic.fsm;

import com.questrail.logic.event.EventType;
import com.questrail.logic.time.TimePeriods;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FsmDefinitionTest {

    @Test
    void statesInDeclarationOrderWithTimedStatesLast() {
        FsmDefinition<Fsm> def = FsmDefinition.builder(Fsm.class)
                .states("idle", "busy")
                .timer("cooldown", 5, "ready")
                .transition("ready", "cooldown", "idle")
                .build();

        assertEquals(List.of("idle", "busy", "cooldown"), def.states());
        assertEquals("idle", def.defaultState());
        assertTrue(def.isTimed("cooldown"));
        assertFalse(def.isTimed("idle"));
        assertEquals(9, def.chainLimit());
        assertEquals(Duration.ofSeconds(5), def.defaultDurations().get("cooldown"));
        assertEquals(EventType.of("ready"), def.timedEvent("cooldown"));
    }

    @Test
    void specificTransitionWinsOverWildcard() {
        FsmDefinition<Fsm> def = FsmDefinition.builder(Fsm.class)
                .states("a", "b", "c")
                .transition("go", (String) null, "a")
                .transition("go", "a", "b")
                .transition("go", "c", null)
                .build();

        assertEquals("b", def.nextState("go", "a"));
        assertEquals("a", def.nextState("go", "b"));
        assertNull(def.nextState("go", "c"));
        assertEquals("a", def.nextState("go", null));
        assertNull(def.nextState("other", "a"));
    }

    @Test
    void transitionFromSeveralStates() {
        FsmDefinition<Fsm> def = FsmDefinition.builder(Fsm.class)
                .states("a", "b", "c")
                .transition("reset", List.of("b", "c"), "a")
                .build();

        assertEquals("a", def.nextState("reset", "b"));
        assertEquals("a", def.nextState("reset", "c"));
        assertNull(def.nextState("reset", "a"));
    }

    @Test
    void noStatesIsAnError() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> FsmDefinition.builder(Fsm.class).build());
        assertEquals("Cannot create a state machine with no states", e.getMessage());
    }

    @Test
    void duplicateTransitionIsAnError() {
        FsmDefinition.Builder<Fsm> b = FsmDefinition.builder(Fsm.class)
                .states("a", "b")
                .transition("go", "a", "b");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> b.transition("go", "a", "a"));
        assertEquals("Multiple transitions defined for event 'go' in state 'a'", e.getMessage());
    }

    @Test
    void unknownStatesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> FsmDefinition.builder(Fsm.class)
                .states("a")
                .transition("go", "a", "nowhere")
                .build());
        assertThrows(IllegalArgumentException.class, () -> FsmDefinition.builder(Fsm.class)
                .states("a")
                .transition("go", "elsewhere", "a")
                .build());
        assertThrows(IllegalArgumentException.class, () -> FsmDefinition.builder(Fsm.class)
                .timer("a", 1, EventType.goTo("nowhere"))
                .build());
    }

    @Test
    void timerEventMustBeDefined() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> FsmDefinition.builder(Fsm.class)
                .states("a")
                .timer("a", 1, "expire")
                .build());
        assertEquals("TIMERS['a']: undefined event 'expire'", e.getMessage());
    }

    @Test
    void timerDurationIsValidated() {
        assertThrows(IllegalArgumentException.class, () -> FsmDefinition.builder(Fsm.class)
                .timer("a", "soon", EventType.goTo("a")));
        assertThrows(IllegalArgumentException.class, () -> FsmDefinition.builder(Fsm.class)
                .timer("a", 1, EventType.cond("x", "y")));
    }

    @Test
    void infiniteAndUnsetDurations() {
        FsmDefinition<Fsm> def = FsmDefinition.builder(Fsm.class)
                .timer("a", TimePeriods.INFINITE, EventType.goTo("b"))
                .timer("b", null, EventType.goTo("a"))
                .build();

        assertTrue(TimePeriods.isInfinite(def.defaultDurations().get("a")));
        assertTrue(def.defaultDurations().containsKey("b"));
        assertNull(def.defaultDurations().get("b"));
    }

    @Test
    void callbacksMustNameKnownStatesAndEvents() {
        assertThrows(IllegalArgumentException.class, () -> FsmDefinition.builder(Fsm.class)
                .states("a")
                .guard("go", (f, d) -> true)
                .build());
        assertThrows(IllegalArgumentException.class, () -> FsmDefinition.builder(Fsm.class)
                .states("a")
                .onEntry("b", (f, d) -> { })
                .build());
        assertThrows(IllegalArgumentException.class, () -> FsmDefinition.builder(Fsm.class)
                .states("a")
                .onExit("a", (f, d) -> { })
                .onExit("a", (f, d) -> { }));
    }
}
