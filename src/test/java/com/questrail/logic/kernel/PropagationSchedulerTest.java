package com.questrail.logic.kernel;

import com.questrail.logic.api.BlockEvaluationException;
import com.questrail.logic.api.CircuitInstabilityException;
import com.questrail.logic.api.Undef;
import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.blocks.FuncBlock;
import com.questrail.logic.blocks.Input;
import com.questrail.logic.blocks.Not;
import com.questrail.logic.blocks.Or;
import com.questrail.logic.runtime.CircuitRuntime;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PropagationSchedulerTest {

    private final Circuit circuit = Circuit.create();
    private final CircuitRuntime runtime = CircuitRuntime.create(circuit);

    private Input input(String name, Object initial) {
        return new Input(circuit, name, BlockConfig.builder().withInitDefault(initial).build());
    }

    @Test
    void changesPropagateThroughAChain() {
        Input a = input("a", true);
        Not n1 = new Not(circuit, "n1");
        n1.connect("a");
        Not n2 = new Not(circuit, "n2");
        n2.connect("n1");

        runtime.initialize();
        assertEquals(true, n2.output());
        assertEquals(false, n1.output());

        a.put(false);
        runtime.step();

        assertEquals(true, n1.output());
        assertEquals(false, n2.output());
        runtime.terminate();
    }

    @Test
    void unchangedInputsLeaveTheOutputUnchanged() {
        Input a = input("a", true);
        Not n = new Not(circuit, "n");
        n.connect("a");
        PropagationScheduler propagation = circuit.propagation();

        runtime.initialize();
        assertTrue(propagation.isIdle());
        assertEquals(0, propagation.pendingCount());

        a.put(false);
        assertFalse(propagation.isIdle());

        assertTrue(n.evalBlock());
        assertFalse(n.evalBlock());
        assertEquals(true, n.output());

        runtime.step();
        assertTrue(propagation.isIdle());
        assertEquals(true, n.output());
        runtime.terminate();
    }

    @Test
    void oscillatingLoopIsDetected() {
        new Not(circuit, "n1").connect("n3");
        new Not(circuit, "n2").connect("n1");
        new Not(circuit, "n3").connect("n2");

        assertThrows(CircuitInstabilityException.class, runtime::initialize);
        assertEquals(CircuitState.TERMINATED, circuit.state());
        assertInstanceOf(CircuitInstabilityException.class, circuit.error());
    }

    @Test
    void feedbackLoopSettlesAndLatches() {
        Input set = input("set", false);
        Or hold = new Or(circuit, "hold");
        hold.connect("set", "hold");

        runtime.initialize();
        assertEquals(false, hold.output());

        set.put(true);
        runtime.step();
        assertEquals(true, hold.output());

        set.put(false);
        runtime.step();
        assertEquals(true, hold.output());
        runtime.terminate();
    }

    @Test
    void blockIsEvaluatedAfterItsPendingInputs() {
        AtomicInteger evaluations = new AtomicInteger();
        Input a = input("a", true);
        FuncBlock z = new FuncBlock(circuit, "z", null, in -> {
            evaluations.incrementAndGet();
            return List.copyOf(in.positional());
        });
        z.connect("x", "y");
        new Not(circuit, "y").connect("x");
        new Not(circuit, "x").connect("a");

        runtime.initialize();
        assertEquals(1, evaluations.get());
        assertEquals(List.of(false, true), z.output());

        a.put(false);
        runtime.step();
        assertEquals(2, evaluations.get());
        assertEquals(List.of(true, false), z.output());
        runtime.terminate();
    }

    @Test
    void evaluationErrorCarriesTheBlockName() {
        input("a", 1);
        new FuncBlock(circuit, "bad", null, in -> {
            throw new ArithmeticException("divide by zero");
        }).connect("a");

        BlockEvaluationException e = assertThrows(BlockEvaluationException.class, runtime::initialize);
        assertEquals("bad", e.blockName());
        assertInstanceOf(ArithmeticException.class, e.getCause());
    }

    @Test
    void undefOutputIsRejected() {
        input("a", 1);
        new FuncBlock(circuit, "undef", null, in -> Undef.UNDEF).connect("a");

        BlockEvaluationException e = assertThrows(BlockEvaluationException.class, runtime::initialize);
        assertTrue(e.getMessage().contains("must not be <UNDEF>"), e.getMessage());
    }
}
