package com.questrail.logic.runtime;

import com.questrail.logic.api.BlockEvaluationException;
import com.questrail.logic.api.BlockInitializationException;
import com.questrail.logic.api.InvalidCircuitStateException;
import com.questrail.logic.block.AsyncInit;
import com.questrail.logic.block.AsyncStop;
import com.questrail.logic.block.Block;
import com.questrail.logic.block.SBlock;
import com.questrail.logic.kernel.Circuit;
import com.questrail.logic.kernel.CircuitState;
import com.questrail.logic.observability.BlockTaskEvent;
import com.questrail.logic.observability.CircuitErrorEvent;
import com.questrail.logic.observability.CircuitObservabilitySink;
import com.questrail.logic.observability.CircuitStateTransitionEvent;
import com.questrail.logic.observability.NullObservabilitySink;
import com.questrail.logic.time.MonotonicClock;
import com.questrail.logic.time.SystemMonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CircuitRuntime
 * =============================================================================
 * Lifecycle owner of one circuit simulation.
 *
 * <h2>Startup</h2>
 * <ol>
 *   <li>persistent data check: stop timestamp, pruning of unused entries</li>
 *   <li>topology finalization</li>
 *   <li>{@code start()} of every block, then any work posted by the start hooks</li>
 *   <li>sequential block initialization pass 1 (restore persisted state)</li>
 *   <li>asynchronous initialization of the still uninitialized {@link AsyncInit}
 *       blocks, each bounded by its timeout; posted work keeps running meanwhile</li>
 *   <li>initialization pass 2 (regular initialization, init default)</li>
 *   <li>a block still uninitialized is fatal; otherwise the state is saved and
 *       the steady-state loop begins with every combinational block evaluated</li>
 * </ol>
 *
 * <h2>Shutdown</h2>
 * Triggered by {@link #shutdown()} (a cancellation) or by any error. If the
 * startup got past the block start hooks, persistent state and the stop time
 * are saved. {@link AsyncStop} blocks are stopped first, their asynchronous
 * cleanups awaited concurrently within their timeouts, then the remaining
 * blocks are stopped. Errors while stopping are logged only.
 *
 * <h2>Execution modes</h2>
 * <ul>
 *   <li>{@link #runForever()} - runs on the calling thread until stopped; always
 *       ends with the terminating error ({@link CancellationException} for a
 *       normal stop)</li>
 *   <li>{@link #start()} - the same on a dedicated thread</li>
 *   <li>{@link #initialize()}, {@link #step()}, {@link #terminate()} - a
 *       step-driven mode for deterministic drivers and tests; all calls on one
 *       thread</li>
 * </ul>
 *
 * <p>A runtime runs once; a terminated circuit cannot be restarted.</p>
 */
public final class CircuitRuntime {

    private static final Logger log = LoggerFactory.getLogger(CircuitRuntime.class);

    private static final Runnable WAKEUP = () -> { };

    private final Circuit circuit;
    private final LifecyclePolicy policy;
    private final CircuitObservabilitySink sink;
    private final MonotonicClock taskClock;
    private final PersistenceCoordinator persistence;

    private final AtomicBoolean entered = new AtomicBoolean();
    private final CountDownLatch initLatch = new CountDownLatch(1);
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private final Set<Block> started = new LinkedHashSet<>();

    private volatile Thread simulationThread;
    private volatile boolean initDone;
    private boolean stepMode;
    private boolean startOk;

    private CircuitRuntime(Builder b) {
        this.circuit = b.circuit;
        this.policy = b.policy;
        this.sink = b.sink;
        this.taskClock = b.taskClock;
        this.persistence = new PersistenceCoordinator(circuit);
        // wakes up the steady-state loop blocked on the inbox
        circuit.addAbortListener(error -> circuit.post(WAKEUP));
    }

    public static CircuitRuntime create(Circuit circuit) {
        return builder(circuit).build();
    }

    public static Builder builder(Circuit circuit) {
        return new Builder(circuit);
    }

    public Circuit circuit() {
        return circuit;
    }

    /**
     * True after a successful startup, until an error or a stop request.
     */
    public boolean isReady() {
        return initDone && circuit.isReady();
    }

    /**
     * Completes exceptionally with the terminating error once the simulation
     * is over.
     */
    public CompletableFuture<Void> termination() {
        return termination;
    }

    // ---------------------------------------------------------------------
    // Continuous mode
    // ---------------------------------------------------------------------

    /**
     * Runs the simulation on the calling thread until it is stopped.
     *
     * @throws CancellationException after a normal stop
     * @throws RuntimeException      the error that stopped the simulation
     */
    public void runForever() {
        enter(false);
        simulate();
    }

    private void simulate() {
        simulationThread = Thread.currentThread();
        boolean interrupted = false;
        try {
            startAndInitialize();
            if (!circuit.isAborted()) {
                enterRunning();
                circuit.propagation().runUntilAborted();
            }
        } catch (InterruptedException e) {
            interrupted = true;
            circuit.abort(new CancellationException("simulation thread interrupted"));
        } catch (RuntimeException e) {
            circuit.recordError(e);
        }
        try {
            finish();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Runs {@link #runForever()} on a new thread.
     *
     * @return the termination future
     */
    public CompletableFuture<Void> start() {
        enter(false);
        Thread thread = new Thread(() -> {
            try {
                simulate();
            } catch (RuntimeException e) {
                // delivered through the termination future
                log.debug("simulation thread finished: {}", e.toString());
            }
        }, "circuit-simulation");
        thread.start();
        return termination;
    }

    /**
     * Waits until the circuit is initialized and running.
     *
     * @throws InvalidCircuitStateException when called from the simulation
     *         thread, or when the simulation ended without completing startup
     * @throws TimeoutException             when {@code timeout} elapses first
     */
    public void waitInit(Duration timeout) throws InterruptedException, TimeoutException {
        if (Thread.currentThread() == simulationThread) {
            throw new InvalidCircuitStateException("Cannot wait for the initialization from the simulation thread");
        }
        if (!initLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            throw new TimeoutException("The circuit was not initialized within " + timeout);
        }
        if (!isReady()) {
            throw new InvalidCircuitStateException("The simulation is not running", circuit.error());
        }
    }

    /**
     * Stops the simulation and waits for its termination. Before the start it
     * only records the stop request, so the start fails.
     *
     * @throws InvalidCircuitStateException when called from the simulation thread
     * @throws RuntimeException             the error that had stopped the simulation
     *                                      before this request, if any
     */
    public void shutdown() throws InterruptedException {
        if (Thread.currentThread() == simulationThread) {
            throw new InvalidCircuitStateException("Cannot await the simulation from the simulation thread");
        }
        if (stepMode) {
            terminate();
            return;
        }
        circuit.abort(new CancellationException("shutdown"));
        if (!entered.get()) {
            return;
        }
        try {
            termination.get();
        } catch (CancellationException e) {
            log.debug("shutdown complete");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (!(cause instanceof CancellationException)) {
                throw asRuntime(cause);
            }
        }
    }

    /**
     * Aborts the simulation with an error. Thread-safe; the first error wins.
     */
    public void abort(Throwable error) {
        circuit.abort(error);
    }

    // ---------------------------------------------------------------------
    // Step mode
    // ---------------------------------------------------------------------

    /**
     * Performs the whole startup on the calling thread and settles the circuit.
     * A startup failure terminates the simulation and is rethrown.
     */
    public void initialize() {
        enter(true);
        try {
            startAndInitialize();
            if (!circuit.isAborted()) {
                enterRunning();
                circuit.propagation().settle();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            circuit.abort(new CancellationException("interrupted during initialization"));
        } catch (RuntimeException e) {
            circuit.recordError(e);
        }
        if (circuit.isAborted()) {
            finish();
        }
    }

    /**
     * Runs all posted work and settles the circuit, repeatedly, until nothing
     * is left to do.
     *
     * @return the number of posted actions run
     * @throws RuntimeException the terminating error, after the shutdown sequence,
     *                          if the circuit was aborted
     */
    public int step() {
        if (!stepMode || circuit.state() != CircuitState.RUNNING) {
            throw new InvalidCircuitStateException("step() requires a running circuit in step mode, state: "
                    + circuit.state());
        }
        int actions = 0;
        try {
            int ran;
            do {
                ran = circuit.runPosted();
                actions += ran;
                if (!circuit.isAborted()) {
                    circuit.propagation().settle();
                }
            } while (ran > 0 && !circuit.isAborted());
        } catch (RuntimeException e) {
            circuit.recordError(e);
        }
        if (circuit.isAborted()) {
            finish();
        }
        return actions;
    }

    /**
     * Stops a step-mode simulation. Returns normally unless the simulation had
     * already failed with an error.
     */
    public void terminate() {
        if (circuit.state() == CircuitState.TERMINATED) {
            Throwable error = circuit.error();
            if (error != null && !(error instanceof CancellationException)) {
                throw asRuntime(error);
            }
            return;
        }
        circuit.abort(new CancellationException("terminate"));
        try {
            finish();
        } catch (CancellationException e) {
            log.debug("terminated");
        }
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    private void enter(boolean steps) {
        if (!entered.compareAndSet(false, true)) {
            throw new InvalidCircuitStateException(alreadyEnteredMessage());
        }
        this.stepMode = steps;
    }

    private String alreadyEnteredMessage() {
        return termination.isDone() ? "Cannot restart a finished simulation." : "The simulator is already running.";
    }

    private void startAndInitialize() throws InterruptedException {
        Throwable early = circuit.error();
        if (early != null) {
            // stopped before the start
            throw asRuntime(early);
        }
        if (circuit.blockCount() == 0) {
            throw new InvalidCircuitStateException("The circuit is empty");
        }

        log.debug("Initializing the circuit");
        persistence.check();
        CircuitState before = circuit.state();
        circuit.finalizeTopology();
        if (before != circuit.state()) {
            reportTransition(before, circuit.state());
        }

        log.debug("Setting up circuit blocks");
        transition(CircuitState.STARTED);
        for (Block blk : circuit.blocks()) {
            blk.start();
            started.add(blk);
        }
        circuit.runPosted();
        startOk = true;

        log.debug("Initializing sequential blocks");
        transition(CircuitState.INITIALIZING);
        List<SBlock> sblocks = circuit.blocks(SBlock.class);
        for (SBlock blk : sblocks) {
            blk.initialize(false);
        }
        initializeAsync(sblocks);
        if (circuit.isAborted()) {
            return;
        }
        for (SBlock blk : sblocks) {
            // not checked yet, a block may still get an event from another block's init
            blk.initialize(false);
        }
        for (SBlock blk : sblocks) {
            if (!blk.isInitialized()) {
                throw new BlockInitializationException(blk + ": not initialized");
            }
        }
        persistence.saveAll();
        circuit.clearPendingChanges();
    }

    private void initializeAsync(List<SBlock> sblocks) throws InterruptedException {
        BlockTaskGroup group = new BlockTaskGroup(circuit, BlockTaskEvent.Phase.INIT, sink, taskClock, circuit.wallClock());
        int count = 0;
        for (SBlock blk : sblocks) {
            if (blk instanceof AsyncInit async && !blk.isInitialized()) {
                Duration timeout = effective(blk.config().initTimeout(), policy.initTimeout());
                if (!timeout.isZero()) {
                    group.start(blk, async::initAsync, timeout);
                    count++;
                }
            }
        }
        if (count > 0) {
            log.debug("Initializing async sequential blocks");
            group.awaitAll(true);
        }
    }

    private void enterRunning() {
        transition(CircuitState.RUNNING);
        initDone = true;
        initLatch.countDown();
        log.debug("Starting simulation");
        circuit.propagation().scheduleAll();
    }

    /**
     * The shutdown sequence. Always ends by throwing the terminating error.
     */
    private void finish() {
        Throwable error = circuit.error();
        if (error == null) {
            error = new IllegalStateException("simulation ended without an error");
            circuit.recordError(error);
        }
        if (error instanceof CancellationException) {
            log.info("Normal circuit simulation stop");
        } else {
            log.error("Fatal circuit simulation error: {}", error.toString(), error);
            String blockName = error instanceof BlockEvaluationException bee ? bee.blockName() : null;
            sink.onError(new CircuitErrorEvent(circuit.wallClock().now(), blockName, error.toString(), error));
        }
        transition(CircuitState.STOPPING);
        initLatch.countDown();

        if (!started.isEmpty()) {
            // the state is saved first, stop() may invalidate it
            if (startOk) {
                Set<SBlock> startedSBlocks = new LinkedHashSet<>();
                started.stream().filter(SBlock.class::isInstance).map(SBlock.class::cast).forEach(startedSBlocks::add);
                persistence.saveOnStop(startedSBlocks);
            }
            stopBlocks();
        }
        transition(CircuitState.TERMINATED);
        termination.completeExceptionally(error);
        throw asRuntime(error);
    }

    private void stopBlocks() {
        List<Block> asyncBlocks = new ArrayList<>();
        List<Block> syncBlocks = new ArrayList<>();
        for (Block blk : started) {
            if (blk instanceof AsyncStop && !effective(blk.config().stopTimeout(), policy.stopTimeout()).isZero()) {
                asyncBlocks.add(blk);
            } else {
                syncBlocks.add(blk);
            }
        }
        if (!asyncBlocks.isEmpty()) {
            asyncBlocks.forEach(this::stopQuietly);
            BlockTaskGroup group = new BlockTaskGroup(circuit, BlockTaskEvent.Phase.STOP, sink, taskClock, circuit.wallClock());
            for (Block blk : asyncBlocks) {
                group.start(blk, ((AsyncStop) blk)::stopAsync, effective(blk.config().stopTimeout(), policy.stopTimeout()));
            }
            log.debug("Waiting for async cleanup");
            try {
                group.awaitAll(false);
            } catch (InterruptedException e) {
                log.warn("Interrupted while waiting for async cleanup");
                Thread.currentThread().interrupt();
            }
        }
        syncBlocks.forEach(this::stopQuietly);
    }

    private void stopQuietly(Block blk) {
        try {
            blk.stop();
        } catch (RuntimeException e) {
            log.error("{}: ignored error in stop()", blk, e);
            sink.onError(new CircuitErrorEvent(circuit.wallClock().now(), blk.name(), "error in stop()", e));
        }
    }

    private void transition(CircuitState next) {
        CircuitState previous = circuit.advanceState(next);
        reportTransition(previous, next);
    }

    private void reportTransition(CircuitState previous, CircuitState next) {
        sink.onStateTransition(new CircuitStateTransitionEvent(circuit.wallClock().now(), previous, next));
    }

    private static Duration effective(Duration blockValue, Duration defaultValue) {
        return blockValue != null ? blockValue : defaultValue;
    }

    private static RuntimeException asRuntime(Throwable error) {
        if (error instanceof RuntimeException re) {
            return re;
        }
        if (error instanceof Error err) {
            throw err;
        }
        return new InvalidCircuitStateException("The simulation failed: " + error, error);
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private final Circuit circuit;
        private LifecyclePolicy policy = LifecyclePolicy.defaults();
        private CircuitObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private MonotonicClock taskClock = SystemMonotonicClock.INSTANCE;

        private Builder(Circuit circuit) {
            this.circuit = Objects.requireNonNull(circuit, "circuit");
        }

        public Builder withPolicy(LifecyclePolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder withObservabilitySink(CircuitObservabilitySink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        /**
         * Clock bounding the asynchronous init and stop tasks.
         */
        public Builder withTaskClock(MonotonicClock taskClock) {
            this.taskClock = Objects.requireNonNull(taskClock, "taskClock");
            return this;
        }

        public CircuitRuntime build() {
            return new CircuitRuntime(this);
        }
    }
}
