package com.questrail.logic.kernel;

import com.questrail.logic.api.InvalidCircuitStateException;
import com.questrail.logic.block.Block;
import com.questrail.logic.block.BlockRef;
import com.questrail.logic.block.CBlock;
import com.questrail.logic.block.Const;
import com.questrail.logic.block.OutputSource;
import com.questrail.logic.block.SBlock;
import com.questrail.logic.blocks.ControlBlock;
import com.questrail.logic.blocks.Not;
import com.questrail.logic.event.Event;
import com.questrail.logic.time.MonotonicClock;
import com.questrail.logic.time.MonotonicScheduler;
import com.questrail.logic.time.ScheduledExecutorScheduler;
import com.questrail.logic.time.SystemMonotonicClock;
import com.questrail.logic.time.SystemWallClock;
import com.questrail.logic.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Circuit
 * =============================================================================
 * Owner of a set of interconnected blocks and of the simulation kernel state.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>block registry: unique names, generated names, lookup by name or type</li>
 *   <li>one-time topology finalization: name resolution, constant interning,
 *       synthetic {@code _not_NAME} inverters and the {@code _ctrl} control block</li>
 *   <li>the queue of sequential blocks whose output changed, consumed by the
 *       {@link PropagationScheduler}</li>
 *   <li>the inbox: the thread-safe entry point for work that must run on the
 *       simulation thread ({@link #post(Runnable)})</li>
 *   <li>the first-error slot and abort signalling</li>
 *   <li>the optional persistent data map</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Building happens on one thread. After the simulation starts, blocks are
 * touched only on the simulation thread. {@link #post(Runnable)},
 * {@link #abort(Throwable)}, {@link #error()} and {@link #state()} may be used
 * from any thread.
 *
 * <h2>Lifecycle</h2>
 * A circuit is simulated once. The lifecycle is driven by the runtime
 * ({@code CircuitRuntime}); the circuit records it in {@link #state()}.
 */
public final class Circuit {

    private static final Logger log = LoggerFactory.getLogger(Circuit.class);

    /** Name of the automatically created control block. */
    public static final String CONTROL_BLOCK_NAME = "_ctrl";
    /** Prefix of automatically created inverters. */
    public static final String INVERTER_PREFIX = "_not_";
    /** Persistent data keys with this prefix belong to the circuit itself. */
    public static final String RESERVED_KEY_PREFIX = "circuit-";
    /** Persistent data key of the last stop time. */
    public static final String STOP_TIME_KEY = RESERVED_KEY_PREFIX + "stop-time";

    private final MonotonicClock clock;
    private final WallClock wallClock;
    private MonotonicScheduler scheduler;
    private final int maxEvaluationsPerBlock;

    private final Map<String, Block> blocks = new LinkedHashMap<>();
    private final Map<String, Integer> nameCounters = new HashMap<>();
    private final List<Event> events = new ArrayList<>();
    private final List<Consumer<Circuit>> resolutions = new ArrayList<>();
    private final ConstantPool constants = new ConstantPool();
    private final ArrayDeque<SBlock> changeQueue = new ArrayDeque<>();
    private final BlockingQueue<Runnable> inbox = new LinkedBlockingQueue<>();
    private final List<Consumer<Throwable>> abortListeners = new CopyOnWriteArrayList<>();
    private final PropagationScheduler propagation;
    private final Object errorLock = new Object();

    private volatile CircuitState state = CircuitState.BUILDING;
    private volatile Throwable error;
    private boolean materializing;
    private Map<String, Object> persistentData;
    private Instant persistentTimestamp;

    private Circuit(Builder b) {
        this.clock = b.clock;
        this.wallClock = b.wallClock;
        this.scheduler = b.scheduler;
        this.maxEvaluationsPerBlock = b.maxEvaluationsPerBlock;
        this.propagation = new PropagationScheduler(this);
    }

    /**
     * A circuit using the system clocks.
     */
    public static Circuit create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Registry
    // ---------------------------------------------------------------------

    /**
     * Registers a new block. Called from the {@link Block} constructor.
     */
    public void addBlock(Block blk) {
        Objects.requireNonNull(blk, "blk");
        if (!materializing) {
            checkNotFinalized();
        }
        if (blk.circuit() != this) {
            throw new IllegalArgumentException(blk + " belongs to another circuit");
        }
        if (blocks.containsKey(blk.name())) {
            throw new IllegalArgumentException("Duplicate block name '" + blk.name() + "'");
        }
        blocks.put(blk.name(), blk);
    }

    /**
     * Generates a free reserved name {@code _Type_N}.
     */
    public String generateName(Class<? extends Block> type) {
        String typeName = Block.typeName(type);
        String name;
        do {
            int n = nameCounters.merge(typeName, 1, Integer::sum);
            name = "_" + typeName + "_" + n;
        } while (blocks.containsKey(name));
        return name;
    }

    /**
     * Whether blocks with reserved names may be created now. True only while
     * the circuit creates synthetic blocks during finalization.
     */
    public boolean permitsReservedNames() {
        return materializing;
    }

    public Optional<Block> lookup(String name) {
        return Optional.ofNullable(blocks.get(name));
    }

    /**
     * @throws IllegalArgumentException when no such block exists
     */
    public Block findBlock(String name) {
        Block blk = blocks.get(name);
        if (blk == null) {
            throw new IllegalArgumentException("Block '" + name + "' not found");
        }
        return blk;
    }

    public List<Block> blocks() {
        return List.copyOf(blocks.values());
    }

    public <T> List<T> blocks(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Block blk : blocks.values()) {
            if (type.isInstance(blk)) {
                result.add(type.cast(blk));
            }
        }
        return result;
    }

    public int blockCount() {
        return blocks.size();
    }

    /**
     * Finds a block by name. While the circuit is being finalized, the
     * reserved names {@code _ctrl} and {@code _not_NAME} create the synthetic
     * blocks on first use.
     */
    public Block resolveBlock(String name) {
        Objects.requireNonNull(name, "name");
        if (materializing && name.startsWith("_") && !blocks.containsKey(name)) {
            if (name.equals(CONTROL_BLOCK_NAME)) {
                return new ControlBlock(this);
            }
            if (name.startsWith(INVERTER_PREFIX)
                    && name.length() > INVERTER_PREFIX.length()
                    && name.charAt(INVERTER_PREFIX.length()) != '_') {
                return Not.inverterOf(this, name.substring(INVERTER_PREFIX.length()));
            }
        }
        return findBlock(name);
    }

    /**
     * Turns an input specification into a block or a constant.
     */
    public OutputSource resolveInput(Object spec) {
        if (spec instanceof Const c) {
            return c;
        }
        if (spec instanceof String name) {
            return resolveBlock(name);
        }
        if (spec instanceof Block blk) {
            if (blocks.get(blk.name()) != blk) {
                throw new IllegalArgumentException(blk + " is not in the current circuit");
            }
            return blk;
        }
        return constant(spec);
    }

    /**
     * Returns the interned constant for {@code value}.
     */
    public Const constant(Object value) {
        return constants.intern(value);
    }

    int internedConstants() {
        return constants.size();
    }

    /**
     * Registers an event whose destination and filters are resolved at
     * finalization.
     */
    public void registerEvent(Event event) {
        Objects.requireNonNull(event, "event");
        if (isFinalized()) {
            event.resolve(this);
        } else {
            events.add(event);
        }
    }

    /**
     * Registers a block reference resolved at finalization.
     */
    public void registerReference(BlockRef<?> ref) {
        Objects.requireNonNull(ref, "ref");
        if (isFinalized()) {
            ref.resolve(this);
        } else {
            resolutions.add(ref::resolve);
        }
    }

    // ---------------------------------------------------------------------
    // Finalization
    // ---------------------------------------------------------------------

    /**
     * Resolves all references and input connections and freezes the topology.
     * Repeated calls are ignored.
     */
    public void finalizeTopology() {
        if (isFinalized()) {
            return;
        }
        checkNotFinalized();
        materializing = true;
        try {
            for (Event event : events) {
                event.resolve(this);
            }
            for (Consumer<Circuit> resolution : resolutions) {
                resolution.accept(this);
            }
            // resolving may create inverters with their own inputs to resolve
            boolean progress = true;
            while (progress) {
                progress = false;
                for (CBlock blk : blocks(CBlock.class)) {
                    if (!blk.isResolved()) {
                        blk.resolveInputs(this::resolveInput);
                        progress = true;
                    }
                }
            }
        } finally {
            materializing = false;
        }
        events.clear();
        resolutions.clear();
        advanceState(CircuitState.FINALIZED);
        log.debug("circuit finalized: {} block(s), {} interned constant(s)", blocks.size(), constants.size());
    }

    public boolean isFinalized() {
        return state != CircuitState.BUILDING;
    }

    /**
     * @throws InvalidCircuitStateException after an error or once finalized
     */
    public void checkNotFinalized() {
        if (error != null) {
            throw new InvalidCircuitStateException("The circuit was shut down");
        }
        if (isFinalized()) {
            throw new InvalidCircuitStateException("No changes allowed in a finalized circuit");
        }
    }

    // ---------------------------------------------------------------------
    // Lifecycle state
    // ---------------------------------------------------------------------

    public CircuitState state() {
        return state;
    }

    /**
     * Moves the lifecycle forward.
     *
     * @return the previous state
     * @throws InvalidCircuitStateException when {@code next} is not after the current state
     */
    public CircuitState advanceState(CircuitState next) {
        Objects.requireNonNull(next, "next");
        CircuitState previous = state;
        if (next.ordinal() <= previous.ordinal()) {
            throw new InvalidCircuitStateException("Cannot move from " + previous + " to " + next);
        }
        state = next;
        if (next == CircuitState.TERMINATED) {
            constants.clear();
        }
        return previous;
    }

    /**
     * True while the simulation is started and no error occurred.
     */
    public boolean isReady() {
        CircuitState s = state;
        return error == null
                && (s == CircuitState.STARTED || s == CircuitState.INITIALIZING || s == CircuitState.RUNNING);
    }

    // ---------------------------------------------------------------------
    // Change queue and inbox
    // ---------------------------------------------------------------------

    /**
     * Records an output change of a sequential block.
     */
    public void outputChanged(SBlock blk) {
        changeQueue.add(blk);
    }

    SBlock pollChanged() {
        return changeQueue.poll();
    }

    public boolean hasPendingChanges() {
        return !changeQueue.isEmpty();
    }

    public void clearPendingChanges() {
        changeQueue.clear();
    }

    /**
     * Schedules {@code action} to run on the simulation thread. Thread-safe.
     */
    public void post(Runnable action) {
        inbox.add(Objects.requireNonNull(action, "action"));
    }

    /**
     * Waits up to {@code timeout} for a posted action.
     *
     * @return the action or {@code null} on timeout
     */
    public Runnable awaitPosted(long timeout, TimeUnit unit) throws InterruptedException {
        return inbox.poll(timeout, unit);
    }

    Runnable takePosted() throws InterruptedException {
        return inbox.take();
    }

    /**
     * Runs all actions posted so far without blocking.
     *
     * @return the number of actions run
     */
    public int runPosted() {
        int count = 0;
        Runnable action;
        while ((action = inbox.poll()) != null) {
            runAction(action);
            count++;
        }
        return count;
    }

    /**
     * Runs one posted action. Failures are logged; a failure that aborted the
     * circuit ends the simulation through the error slot.
     */
    public void runAction(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            if (error == null) {
                log.error("posted action failed: {}", e.toString(), e);
            } else {
                log.debug("posted action failed after abort: {}", e.toString());
            }
        }
    }

    public PropagationScheduler propagation() {
        return propagation;
    }

    // ---------------------------------------------------------------------
    // Abort
    // ---------------------------------------------------------------------

    /**
     * Aborts the simulation. Only the first error is retained; later ones are
     * ignored with a warning, except cancellations and the retained error or
     * errors caused by it.
     */
    public void abort(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        synchronized (errorLock) {
            Throwable current = error;
            if (current != null) {
                if (cause != current && cause.getCause() != current && !(cause instanceof CancellationException)) {
                    log.warn("subsequent abort({}) ignored, the circuit is already aborting", cause.toString());
                }
                return;
            }
            error = cause;
        }
        if (cause instanceof CancellationException) {
            log.info("abort({})", cause.toString());
        } else {
            log.warn("abort({})", cause.toString());
        }
        for (Consumer<Throwable> listener : abortListeners) {
            listener.accept(cause);
        }
    }

    /**
     * Records a terminating error without signalling, unless one is already held.
     */
    public void recordError(Throwable cause) {
        synchronized (errorLock) {
            if (error == null) {
                error = Objects.requireNonNull(cause, "cause");
            }
        }
    }

    public Throwable error() {
        return error;
    }

    public boolean isAborted() {
        return error != null;
    }

    public void addAbortListener(Consumer<Throwable> listener) {
        abortListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ---------------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------------

    /**
     * Sets the map used to persist block state. Must be called before the
     * circuit is finalized.
     */
    public void setPersistentData(Map<String, Object> data) {
        checkNotFinalized();
        this.persistentData = data;
    }

    public Map<String, Object> persistentData() {
        return persistentData;
    }

    /**
     * Stop time of the previous run read from the persistent data, or {@code null}.
     */
    public Instant persistentTimestamp() {
        return persistentTimestamp;
    }

    public void setPersistentTimestamp(Instant timestamp) {
        this.persistentTimestamp = timestamp;
    }

    // ---------------------------------------------------------------------
    // Debugging
    // ---------------------------------------------------------------------

    /**
     * Sets the debug flag of the selected blocks.
     *
     * @param selectors block names, wildcard patterns, block classes or block instances
     * @return the number of blocks affected
     */
    public int setDebug(boolean value, Object... selectors) {
        if (selectors.length == 0) {
            throw new IllegalArgumentException("No blocks selected");
        }
        List<Block> selected = new ArrayList<>();
        for (Object selector : selectors) {
            if (selector instanceof Block blk) {
                if (blocks.get(blk.name()) != blk) {
                    throw new IllegalArgumentException(blk + " is not in the current circuit");
                }
                selected.add(blk);
            } else if (selector instanceof Class<?> type) {
                if (!Block.class.isAssignableFrom(type)) {
                    throw new IllegalArgumentException(type.getSimpleName() + " is not a block type");
                }
                selected.addAll(blocks(type).stream().map(Block.class::cast).toList());
            } else if (selector instanceof String name) {
                if (GlobPattern.isGlob(name)) {
                    GlobPattern glob = GlobPattern.compile(name);
                    blocks.values().stream().filter(b -> glob.matches(b.name())).forEach(selected::add);
                } else {
                    selected.add(findBlock(name));
                }
            } else {
                throw new IllegalArgumentException("Invalid block selector: " + selector);
            }
        }
        List<Block> distinct = selected.stream().distinct().toList();
        distinct.forEach(b -> b.setDebug(value));
        return distinct.size();
    }

    // ---------------------------------------------------------------------
    // Time
    // ---------------------------------------------------------------------

    public MonotonicClock clock() {
        return clock;
    }

    public WallClock wallClock() {
        return wallClock;
    }

    /**
     * The timer scheduler; without a configured one, a daemon timer thread is
     * created on first use.
     */
    public synchronized MonotonicScheduler scheduler() {
        if (scheduler == null) {
            scheduler = ScheduledExecutorScheduler.daemon(clock);
        }
        return scheduler;
    }

    public int maxEvaluationsPerBlock() {
        return maxEvaluationsPerBlock;
    }

    @Override
    public String toString() {
        return "<Circuit " + blocks.size() + " block(s), " + state + ">";
    }

    public static final class Builder {
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private int maxEvaluationsPerBlock = 3;

        private Builder() {
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            return this;
        }

        /**
         * Evaluation budget per settling burst, as a multiple of the block count.
         */
        public Builder withMaxEvaluationsPerBlock(int maxEvaluationsPerBlock) {
            if (maxEvaluationsPerBlock < 1) {
                throw new IllegalArgumentException("maxEvaluationsPerBlock must be >= 1");
            }
            this.maxEvaluationsPerBlock = maxEvaluationsPerBlock;
            return this;
        }

        public Circuit build() {
            return new Circuit(this);
        }
    }
}
