package com.questrail.logic.blocks;

import com.questrail.logic.api.EventData;
import com.questrail.logic.api.UnknownEventException;
import com.questrail.logic.event.Event;
import com.questrail.logic.event.Recorder;
import com.questrail.logic.kernel.Circuit;
import com.questrail.logic.runtime.CircuitRuntime;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutputFuncTest {

    private final Circuit circuit = Circuit.builder().build();
    private final CircuitRuntime runtime = CircuitRuntime.create(circuit);

    @Test
    void successIsReported() {
        Recorder ok = new Recorder(circuit, "ok");
        OutputFunc f = new OutputFunc(circuit, "twice", null, v -> 2 * (Integer) v,
                List.of(Event.to("ok")), null, null);
        runtime.initialize();

        Object result = f.put(21);

        assertEquals(new OutputFunc.Result(true, 42), result);
        assertEquals(List.of(42), ok.values());
        assertEquals("success", ok.last().data().get(EventData.TRIGGER));
        assertEquals("twice", ok.last().data().get(EventData.SOURCE));
        assertEquals(false, f.output());
        runtime.terminate();
    }

    @Test
    void failureIsReportedWithoutAbort() {
        Recorder ok = new Recorder(circuit, "ok");
        Recorder failed = new Recorder(circuit, "failed");
        OutputFunc f = new OutputFunc(circuit, "parse", null, v -> Integer.parseInt((String) v),
                List.of(Event.to("ok")), List.of(Event.to("failed")), null);
        runtime.initialize();

        OutputFunc.Result result = (OutputFunc.Result) f.put("twelve");

        assertFalse(result.success());
        assertInstanceOf(NumberFormatException.class, result.value());
        assertTrue(ok.received().isEmpty());
        assertSame(result.value(), failed.last().data().get("error"));
        assertFalse(circuit.isAborted());
        runtime.terminate();
    }

    @Test
    void stopDataIsProcessedOnStop() {
        List<Object> calls = new ArrayList<>();
        new OutputFunc(circuit, "lamp", null, v -> {
            calls.add(v);
            return null;
        }, null, null, EventData.of(EventData.VALUE, "off"));
        runtime.initialize();

        runtime.terminate();

        assertEquals(List.of("off"), calls);
    }

    @Test
    void onlyPutIsAccepted() {
        OutputFunc f = new OutputFunc(circuit, "sink", v -> v);
        runtime.initialize();

        assertEquals(new OutputFunc.Result(true, null), f.put(null));
        assertThrows(UnknownEventException.class, () -> f.event("toggle"));
        runtime.terminate();
    }
}
