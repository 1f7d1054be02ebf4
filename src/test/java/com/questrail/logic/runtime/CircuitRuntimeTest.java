package com.questrail.logic.runtime;

import com.questrail.logic.api.BlockInitializationException;
import com.questrail.logic.api.CircuitFailureException;
import com.questrail.logic.api.InvalidCircuitStateException;
import com.questrail.logic.block.AsyncStop;
import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.block.SBlock;
import com.questrail.logic.blocks.Counter;
import com.questrail.logic.blocks.InitAsync;
import com.questrail.logic.blocks.Input;
import com.questrail.logic.event.Event;
import com.questrail.logic.filters.DataEdit;
import com.questrail.logic.filters.NotFromUndef;
import com.questrail.logic.kernel.Circuit;
import com.questrail.logic.kernel.CircuitState;
import com.questrail.logic.observability.BlockTaskEvent;
import com.questrail.logic.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CircuitRuntimeTest {

    private static final BlockConfig ZERO = BlockConfig.builder().withInitDefault(0).build();

    private final Circuit circuit = Circuit.builder().build();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final CircuitRuntime runtime = CircuitRuntime.builder(circuit)
            .withObservabilitySink(sink)
            .build();

    @Test
    void stepModeWalksThroughAllStates() {
        Input in = new Input(circuit, "in", ZERO);

        runtime.initialize();
        assertEquals(CircuitState.RUNNING, circuit.state());
        assertTrue(runtime.isReady());
        assertEquals(0, in.output());

        runtime.terminate();

        assertEquals(List.of(CircuitState.FINALIZED, CircuitState.STARTED, CircuitState.INITIALIZING,
                CircuitState.RUNNING, CircuitState.STOPPING, CircuitState.TERMINATED), sink.getStates());
        assertInstanceOf(CancellationException.class, circuit.error());
        assertTrue(runtime.termination().isCompletedExceptionally());
        assertFalse(runtime.isReady());
        assertTrue(sink.getErrors().isEmpty());
    }

    @Test
    void runtimeRunsOnce() {
        new Input(circuit, "in", ZERO);
        runtime.initialize();
        runtime.terminate();

        InvalidCircuitStateException e = assertThrows(InvalidCircuitStateException.class, runtime::initialize);
        assertEquals("Cannot restart a finished simulation.", e.getMessage());
    }

    @Test
    void stepRequiresARunningCircuit() {
        new Input(circuit, "in", ZERO);

        assertThrows(InvalidCircuitStateException.class, runtime::step);
    }

    @Test
    void emptyCircuitCannotStart() {
        assertThrows(InvalidCircuitStateException.class, runtime::initialize);
        assertEquals(CircuitState.TERMINATED, circuit.state());
    }

    @Test
    void uninitializedBlockIsFatal() {
        new Input(circuit, "in", null);

        BlockInitializationException e = assertThrows(BlockInitializationException.class, runtime::initialize);
        assertTrue(e.getMessage().contains("<Input 'in'>"), e.getMessage());
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void asyncInitializationDeliversTheOutput() {
        InitAsync data = new InitAsync(circuit, "data", null, () -> CompletableFuture.supplyAsync(() -> "loaded"));

        runtime.initialize();

        assertEquals("loaded", data.output());
        List<BlockTaskEvent> tasks = sink.getBlockTasks();
        assertEquals(1, tasks.size());
        assertEquals(BlockTaskEvent.Phase.INIT, tasks.get(0).phase());
        assertEquals(BlockTaskEvent.Outcome.COMPLETED, tasks.get(0).outcome());
        runtime.terminate();
    }

    @Test
    void asyncInitializationTimeoutFallsBackToTheDefault() {
        CompletableFuture<Object> never = new CompletableFuture<>();
        InitAsync withDefault = new InitAsync(circuit, "withDefault",
                BlockConfig.builder().withInitTimeout(0.05).withInitDefault("offline").build(), () -> never);
        InitAsync bare = new InitAsync(circuit, "bare",
                BlockConfig.builder().withInitTimeout(0.05).build(), CompletableFuture::new);

        runtime.initialize();

        assertEquals("offline", withDefault.output());
        assertNull(bare.output());
        assertTrue(bare.isInitialized());
        assertTrue(never.isCancelled());
        assertEquals(2, sink.getBlockTasks().stream()
                .filter(t -> t.outcome() == BlockTaskEvent.Outcome.TIMED_OUT).count());
        runtime.terminate();
    }

    @Test
    void abortDuringAsyncInitializationCancelsPendingTasks() throws Exception {
        CompletableFuture<Object> source = new CompletableFuture<>();
        InitAsync data = new InitAsync(circuit, "data",
                BlockConfig.builder().withInitTimeout(30).withInitDefault("offline").build(), () -> source);
        Thread aborter = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            runtime.abort(new CancellationException("operator stop"));
        });
        aborter.start();

        long t0 = System.nanoTime();
        assertThrows(CancellationException.class, runtime::initialize);
        aborter.join();

        assertTrue(Duration.ofNanos(System.nanoTime() - t0).compareTo(Duration.ofSeconds(10)) < 0);
        assertTrue(source.isCancelled());
        assertEquals(CircuitState.TERMINATED, circuit.state());
        assertEquals(List.of(BlockTaskEvent.Outcome.CANCELLED),
                sink.getBlockTasks().stream().map(BlockTaskEvent::outcome).toList());
        assertTrue(sink.getErrors().isEmpty());
        assertNotEquals("loaded", data.output());
    }

    @Test
    void asyncInitializationFailureIsSuppressed() {
        InitAsync data = new InitAsync(circuit, "data", null,
                () -> CompletableFuture.failedFuture(new IOException("offline")));

        runtime.initialize();

        assertNull(data.output());
        assertEquals(BlockTaskEvent.Outcome.FAILED, sink.getBlockTasks().get(0).outcome());
        assertEquals("data", sink.getErrors().get(0).blockName());
        assertEquals(CircuitState.RUNNING, circuit.state());
        runtime.terminate();
    }

    @Test
    void zeroTimeoutSkipsAsyncInitialization() {
        List<String> calls = new ArrayList<>();
        InitAsync data = new InitAsync(circuit, "data",
                BlockConfig.builder().withInitTimeout(0).withInitDefault(1).build(), () -> {
                    calls.add("init");
                    return CompletableFuture.completedFuture(2);
                });

        runtime.initialize();

        assertEquals(1, data.output());
        assertTrue(calls.isEmpty());
        runtime.terminate();
    }

    @Test
    void asyncCleanupRunsAfterStop() {
        List<String> trace = new ArrayList<>();
        new Flusher(circuit, "quick", null, trace, CompletableFuture.completedFuture(null));
        CompletableFuture<Object> hanging = new CompletableFuture<>();
        new Flusher(circuit, "slow", BlockConfig.builder().withStopTimeout(0.05).build(), trace, hanging);
        runtime.initialize();

        runtime.terminate();

        assertEquals(List.of("stop quick", "stop slow", "cleanup quick", "cleanup slow"), trace);
        assertTrue(hanging.isCancelled());
        List<BlockTaskEvent.Outcome> outcomes = sink.getBlockTasks().stream().map(BlockTaskEvent::outcome).toList();
        assertTrue(outcomes.contains(BlockTaskEvent.Outcome.COMPLETED));
        assertTrue(outcomes.contains(BlockTaskEvent.Outcome.TIMED_OUT));
    }

    @Test
    void shutdownEventStopsTheSimulation() {
        Input in = new Input(circuit, "in", BlockConfig.builder()
                .withInitDefault(0)
                .withOnOutput(Event.shutdown().withFilters(NotFromUndef.INSTANCE))
                .build());
        runtime.initialize();

        in.put(1);

        assertThrows(CancellationException.class, runtime::step);
        assertEquals(CircuitState.TERMINATED, circuit.state());
        assertTrue(circuit.error().getMessage().contains("shutdown requested by 'in'"));
        runtime.terminate();
    }

    @Test
    void abortEventFailsTheSimulation() {
        Input in = new Input(circuit, "in", BlockConfig.builder()
                .withInitDefault(0)
                .withOnOutput(Event.abort().withFilters(NotFromUndef.INSTANCE,
                        DataEdit.edit().add("error", new IOException("disk full"))))
                .build());
        runtime.initialize();

        in.put(1);

        CircuitFailureException e = assertThrows(CircuitFailureException.class, runtime::step);
        assertInstanceOf(IOException.class, e.getCause());
        assertSame(e, assertThrows(CircuitFailureException.class, runtime::terminate));
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void persistentStateIsPrunedAndSaved() {
        Map<String, Object> store = new HashMap<>();
        store.put("<Counter 'gone'>", 3L);
        store.put("<Counter 'count'>", 7L);
        store.put(Circuit.RESERVED_KEY_PREFIX + "custom", "kept");
        circuit.setPersistentData(store);
        Counter count = new Counter(circuit, "count", BlockConfig.builder().withPersistent(true).build(), null);

        runtime.initialize();
        assertEquals(7L, count.output());
        assertFalse(store.containsKey("<Counter 'gone'>"));
        assertEquals("kept", store.get(Circuit.RESERVED_KEY_PREFIX + "custom"));

        count.event("inc");
        runtime.terminate();

        assertEquals(8L, store.get("<Counter 'count'>"));
        assertInstanceOf(Instant.class, store.get(Circuit.STOP_TIME_KEY));
    }

    @Test
    void persistenceIsDisabledWithoutStorage() {
        Counter count = new Counter(circuit, "count", BlockConfig.builder().withPersistent(true).build(), null);

        runtime.initialize();

        assertFalse(count.isPersistent());
        assertEquals(0L, count.output());
        runtime.terminate();
    }

    @Test
    void continuousModeRunsOnItsOwnThread() throws Exception {
        Input in = new Input(circuit, "in", ZERO);
        CompletableFuture<Void> termination = runtime.start();
        runtime.waitInit(Duration.ofSeconds(5));
        assertTrue(runtime.isReady());

        CountDownLatch done = new CountDownLatch(1);
        circuit.post(() -> {
            in.put(5);
            done.countDown();
        });
        assertTrue(done.await(5, TimeUnit.SECONDS));

        runtime.shutdown();

        assertEquals(5, in.output());
        assertTrue(termination.isDone());
        assertThrows(CancellationException.class, termination::get);
        assertThrows(InvalidCircuitStateException.class, runtime::start);
    }

    @Test
    void waitInitReportsAFailedStartup() {
        runtime.start();

        assertThrows(InvalidCircuitStateException.class, () -> runtime.waitInit(Duration.ofSeconds(5)));
        InvalidCircuitStateException e = assertThrows(InvalidCircuitStateException.class, runtime::shutdown);
        assertEquals("The circuit is empty", e.getMessage());
    }

    @Test
    void shutdownBeforeStartMakesTheStartFail() throws Exception {
        new Input(circuit, "in", ZERO);

        runtime.shutdown();

        assertThrows(CancellationException.class, runtime::initialize);
        assertEquals(CircuitState.TERMINATED, circuit.state());
    }

    static final class Flusher extends SBlock implements AsyncStop {
        private final List<String> trace;
        private final CompletableFuture<?> cleanup;

        Flusher(Circuit circuit, String name, BlockConfig config, List<String> trace, CompletableFuture<?> cleanup) {
            super(circuit, name, config);
            this.trace = trace;
            this.cleanup = cleanup;
        }

        @Override
        protected void initRegular() {
            setOutput(null);
        }

        @Override
        public void stop() {
            trace.add("stop " + name());
            super.stop();
        }

        @Override
        public CompletableFuture<?> stopAsync() {
            trace.add("cleanup " + name());
            return cleanup;
        }
    }
}
