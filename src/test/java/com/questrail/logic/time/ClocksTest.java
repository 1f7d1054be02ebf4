package com.questrail.logic.time;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ClocksTest {

    @Test
    void elapsedAndDeadlinesFollowTheMonotonicClock() {
        ManualMonotonicClock clock = new ManualMonotonicClock(Duration.ofSeconds(100));
        long start = clock.nowNanos();
        long deadline = clock.deadlineAfter(Duration.ofMillis(250));

        clock.advance(Duration.ofMillis(250));

        assertEquals(Duration.ofMillis(250), clock.elapsedSince(start));
        assertEquals(deadline, clock.nowNanos());
        assertThrows(IllegalArgumentException.class, () -> clock.advance(Duration.ofNanos(-1)));
    }

    @Test
    void wallClockComparesInstants() {
        Instant start = Instant.parse("2024-03-01T08:00:00Z");
        ManualWallClock clock = new ManualWallClock(start);
        Instant expiry = start.plusSeconds(30);

        assertEquals(Duration.ofSeconds(30), clock.until(expiry));
        assertFalse(clock.hasPassed(expiry));

        clock.advance(Duration.ofSeconds(31));

        assertTrue(clock.hasPassed(expiry));
        assertTrue(clock.until(expiry).isNegative());
    }

    @Test
    void systemClocksMoveForward() {
        long t0 = SystemMonotonicClock.INSTANCE.nowNanos();
        Instant w0 = SystemWallClock.INSTANCE.now();

        assertFalse(SystemMonotonicClock.INSTANCE.elapsedSince(t0).isNegative());
        assertFalse(SystemWallClock.INSTANCE.hasPassed(w0.plusSeconds(60)));
    }
}
