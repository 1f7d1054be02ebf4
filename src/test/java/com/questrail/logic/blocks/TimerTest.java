package com.questrail.logic.blocks;

import com.questrail.logic.api.EventData;
import com.questrail.logic.kernel.Circuit;
import com.questrail.logic.runtime.CircuitRuntime;
import com.questrail.logic.time.DeterministicScheduler;
import com.questrail.logic.time.ManualMonotonicClock;
import com.questrail.logic.time.ManualWallClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TimerTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final ManualWallClock wallClock = new ManualWallClock(Instant.parse("2024-03-01T08:00:00Z"));
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock, wallClock);
    private final Circuit circuit = Circuit.builder()
            .withClock(clock)
            .withWallClock(wallClock)
            .withScheduler(scheduler)
            .build();
    private final CircuitRuntime runtime = CircuitRuntime.create(circuit);

    private void elapse(double seconds) {
        scheduler.advance(Duration.ofMillis(Math.round(seconds * 1000)));
        runtime.step();
    }

    @Test
    void monostable() {
        Timer t = new Timer(circuit, "pulse", 10, null);
        runtime.initialize();
        assertEquals(false, t.output());

        t.event("start");
        assertEquals(true, t.output());

        elapse(9.9);
        assertEquals(true, t.output());
        elapse(0.1);
        assertEquals(false, t.output());
        assertEquals(0, scheduler.pendingCount());
        runtime.terminate();
    }

    @Test
    void oscillator() {
        Timer t = new Timer(circuit, "blink", "1s", "2s");
        runtime.initialize();

        t.event("start");
        elapse(1);
        assertEquals(false, t.output());
        elapse(2);
        assertEquals(true, t.output());
        elapse(1);
        assertEquals(false, t.output());
        runtime.terminate();
    }

    @Test
    void restartableTimerRestartsOnStart() {
        Timer t = new Timer(circuit, "pulse", 10, null);
        runtime.initialize();

        t.event("start");
        elapse(6);
        t.event("start");
        elapse(6);
        assertEquals(true, t.output());
        elapse(4);
        assertEquals(false, t.output());
        runtime.terminate();
    }

    @Test
    void nonRestartableTimerKeepsRunning() {
        Timer t = new Timer(circuit, "pulse", null, 10, null, false);
        runtime.initialize();

        assertEquals(true, t.event("start"));
        elapse(6);
        assertEquals(false, t.event("start"));
        elapse(4);
        assertEquals(false, t.output());
        runtime.terminate();
    }

    @Test
    void toggleAndStop() {
        Timer t = new Timer(circuit, "lamp", null, null);
        runtime.initialize();

        t.event("toggle");
        assertEquals(true, t.output());
        t.event("toggle");
        assertEquals(false, t.output());
        t.event("start");
        t.event("stop");
        assertEquals(false, t.output());
        assertEquals(0, scheduler.pendingCount());
        runtime.terminate();
    }

    @Test
    void durationFromEventData() {
        Timer t = new Timer(circuit, "pulse", null, null);
        runtime.initialize();

        t.event("start", EventData.of(EventData.DURATION, 0.5));
        elapse(0.5);

        assertEquals(false, t.output());
        runtime.terminate();
    }
}
