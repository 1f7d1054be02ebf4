package com.questrail.logic.blocks;

import com.questrail.logic.api.BlockEvaluationException;
import com.questrail.logic.api.EventData;
import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.kernel.Circuit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CounterTest {

    private final Circuit circuit = Circuit.create();

    @Test
    void countsUpAndDown() {
        Counter c = new Counter(circuit, "c");
        c.initialize(true);

        assertEquals(0L, c.output());
        assertEquals(1L, c.event("inc"));
        assertEquals(6L, c.event("inc", EventData.of("amount", 5)));
        assertEquals(4L, c.event("dec", EventData.of("amount", 2)));
        assertEquals(10L, c.put(10));
    }

    @Test
    void resetReturnsToInitDefault() {
        Counter c = new Counter(circuit, "c", BlockConfig.builder().withInitDefault(3).build(), null);
        c.initialize(true);
        c.event("inc");

        assertEquals(3L, c.event("reset"));
    }

    @Test
    void moduloWrapsAround() {
        Counter c = new Counter(circuit, "c", null, 3L);
        c.initialize(true);

        c.event("inc");
        c.event("inc");
        assertEquals(0L, c.event("inc"));
        assertEquals(2L, c.event("dec"));
        assertThrows(IllegalArgumentException.class, () -> new Counter(circuit, "zero", null, 0L));
    }

    @Test
    void nonIntegerValueIsAnError() {
        Counter c = new Counter(circuit, "c");
        c.initialize(true);

        assertThrows(BlockEvaluationException.class, () -> c.put(1.5));
        assertTrue(circuit.isAborted());
    }

    @Test
    void stateIsCapturedAndRestored() {
        Counter c = new Counter(circuit, "c");
        c.initialize(true);
        c.put(7);

        Counter restored = new Counter(circuit, "d");
        restored.restoreState(c.captureState());

        assertEquals(7L, restored.output());
    }
}
