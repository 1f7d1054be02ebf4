package com.questrail.logic.block;

import com.questrail.logic.api.BlockEvaluationException;
import com.questrail.logic.api.CircuitFailureException;
import com.questrail.logic.api.EventData;
import com.questrail.logic.api.ReentrantEventException;
import com.questrail.logic.api.Undef;
import com.questrail.logic.api.UnknownEventException;
import com.questrail.logic.event.Event;
import com.questrail.logic.event.EventHandler;
import com.questrail.logic.event.EventOutcome;
import com.questrail.logic.event.EventType;
import com.questrail.logic.event.HandlerTable;
import com.questrail.logic.kernel.Circuit;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * SBlock
 * =============================================================================
 * Base class of sequential blocks.
 *
 * <p>
 * A sequential block has no inputs. Its output and internal state change only
 * while it handles an event, see {@link #event(EventType, EventData)}.
 * </p>
 *
 * <h2>Event dispatch</h2>
 * <ol>
 *   <li>A conditional event type is resolved using the payload {@code value}.</li>
 *   <li>The block type's {@link HandlerTable} is consulted for a specialized
 *       handler; otherwise {@link #handleEvent(EventType, EventData)} runs.</li>
 *   <li>An unsupported type raises {@link UnknownEventException} unless the
 *       payload sets {@code ignore_unknown}; then {@link EventOutcome#NOT_IMPLEMENTED}
 *       is returned.</li>
 * </ol>
 * A block never handles two events at once. A nested call for the same block is
 * a fatal {@link ReentrantEventException}, except inside
 * {@link #withEventsEnabled(Supplier)}.
 *
 * <h2>Initialization</h2>
 * Done in two steps by the runtime, or at once when an event arrives early:
 * <ol>
 *   <li>restore persisted state ({@link PersistentState} blocks with persistence enabled)</li>
 *   <li>{@link #initRegular()}; if still uninitialized, apply the configured
 *       {@code initDefault} ({@link InitFromValue} blocks)</li>
 * </ol>
 */
public abstract non-sealed class SBlock extends Block
{
    private boolean eventActive;
    private int initStepsCompleted;
    private boolean persistenceEnabled;

    protected SBlock(Circuit circuit, String name, BlockConfig config)
    {
        super(circuit, name, config);
        this.persistenceEnabled = config().persistent();
        for (Event event : config().onEveryOutput()) {
            circuit.registerEvent(event);
        }
    }

    protected SBlock(Circuit circuit, String name)
    {
        this(circuit, name, null);
    }

    /**
     * Specialized handlers of this block type. Implementations return a static
     * table.
     */
    protected HandlerTable<? extends SBlock> eventHandlers()
    {
        return HandlerTable.empty();
    }

    /**
     * Generic handler for event types without a specialized handler.
     */
    protected Object handleEvent(EventType etype, EventData data)
    {
        throw new UnknownEventException(this + ": Unknown event type '" + etype + "'");
    }

    /**
     * Regular initialization, called even when the state was restored.
     */
    protected void initRegular()
    {
    }

    // ---------------------------------------------------------------------
    // Events
    // ---------------------------------------------------------------------

    public final Object event(String etype)
    {
        return event(EventType.of(etype), EventData.empty());
    }

    public final Object event(String etype, EventData data)
    {
        return event(EventType.of(etype), data);
    }

    public final Object event(EventType etype)
    {
        return event(etype, EventData.empty());
    }

    /**
     * Shortcut for the {@code put} event.
     */
    public final Object put(Object value)
    {
        return event(EventType.of("put"), EventData.of(EventData.VALUE, value));
    }

    /**
     * Handles an event.
     *
     * @return the handler's result, {@code null} for a conditional event with an
     *         unset branch, or {@link EventOutcome#NOT_IMPLEMENTED}
     */
    public final Object event(EventType etype, EventData data)
    {
        Objects.requireNonNull(etype, "etype");
        EventData payload = data == null ? EventData.empty() : data;
        if (payload.isEmpty()) {
            logDebug("got event '{}'", etype);
        } else {
            logDebug("got event '{}', data: {}", etype, payload);
        }
        if (eventActive) {
            throw new ReentrantEventException(this + ": Forbidden recursive event() call");
        }
        eventActive = true;
        try {
            EventType resolved = etype;
            while (resolved instanceof EventType.Conditional cond) {
                resolved = cond.select(payload.isTrue(EventData.VALUE));
                logDebug("conditional event -> {}", resolved);
                if (resolved == null) {
                    return null;
                }
            }
            Object result = dispatch(resolved, payload);
            if (persistenceEnabled && config().syncState()) {
                savePersistentState();
            }
            return result;
        } finally {
            eventActive = false;
        }
    }

    private Object dispatch(EventType etype, EventData data)
    {
        try {
            EventHandler<SBlock> handler = etype instanceof EventType.Named named
                    ? eventHandlers().handlerFor(named.name())
                    : null;
            return handler != null ? handler.handle(this, data) : handleEvent(etype, data);
        } catch (UnknownEventException e) {
            if (data.isTrue(EventData.IGNORE_UNKNOWN)) {
                logDebug("ignoring unknown event '{}'", etype);
                return EventOutcome.NOT_IMPLEMENTED;
            }
            throw e;
        } catch (CircuitFailureException e) {
            abortAfterHandlerError(e);
            throw e;
        } catch (RuntimeException e) {
            BlockEvaluationException err = new BlockEvaluationException(name(),
                    this + ": " + e.getClass().getSimpleName() + " during handling of event '"
                            + etype + "', data: " + data + ": " + e.getMessage(), e);
            abortAfterHandlerError(err);
            throw err;
        }
    }

    private void abortAfterHandlerError(RuntimeException error)
    {
        circuit().abort(error);
        if (persistenceEnabled) {
            // the internal state may be corrupted
            logWarning("Disabling persistent state due to an error");
            persistenceEnabled = false;
        }
    }

    /**
     * Runs {@code action} with the reentrancy guard lifted, allowing exactly the
     * nested event calls made by {@code action}.
     */
    protected final <T> T withEventsEnabled(Supplier<T> action)
    {
        boolean saved = eventActive;
        eventActive = false;
        try {
            return action.get();
        } finally {
            eventActive = saved;
        }
    }

    protected final void withEventsEnabled(Runnable action)
    {
        withEventsEnabled(() -> {
            action.run();
            return null;
        });
    }

    // ---------------------------------------------------------------------
    // Output
    // ---------------------------------------------------------------------

    protected final void setOutput(Object value)
    {
        if (value == Undef.UNDEF) {
            throw new IllegalArgumentException("Output value must not be <UNDEF>");
        }
        Object previous = output();
        EventData data = EventData.of(EventData.TRIGGER, "output", EventData.PREVIOUS, previous, EventData.VALUE, value);
        if (Objects.equals(previous, value)) {
            if (config().onEveryOutput().isEmpty()) {
                return;
            }
            logDebug("output: {} (unchanged)", value);
        } else {
            logDebug("output: {} -> {}", previous, value);
            assignOutput(value);
            circuit().outputChanged(this);
            for (Event event : outputEvents()) {
                event.send(this, data);
            }
        }
        for (Event event : config().onEveryOutput()) {
            event.send(this, data);
        }
    }

    /**
     * Sets the output without sending output events. Used for fallback
     * initialization values that carry no information.
     */
    protected final void setOutputQuietly(Object value)
    {
        if (value == Undef.UNDEF) {
            throw new IllegalArgumentException("Output value must not be <UNDEF>");
        }
        if (!Objects.equals(output(), value)) {
            logDebug("output: {} -> {} (quiet)", output(), value);
            assignOutput(value);
            circuit().outputChanged(this);
        }
    }

    // ---------------------------------------------------------------------
    // Initialization
    // ---------------------------------------------------------------------

    public final int initStepsCompleted()
    {
        return initStepsCompleted;
    }

    /**
     * Performs the pending initialization steps: with {@code full == false} one
     * step per call, with {@code full == true} all remaining ones. After the
     * last step the block may still be uninitialized, but it accepts events.
     */
    public final void initialize(boolean full)
    {
        int steps = initStepsCompleted;
        try {
            if (steps == 0) {
                if (persistenceEnabled) {
                    restoreFromPersistentData();
                    if (isInitialized()) {
                        logDebug("initialized from saved state");
                    }
                }
                initStepsCompleted = 1;
            }
            if (steps == 1 || (steps == 0 && full)) {
                initRegular();
                if (!isInitialized() && this instanceof InitFromValue ifv && config().hasInitDefault()) {
                    ifv.initFromValue(config().initDefault());
                }
                initStepsCompleted = 2;
            }
        } catch (CircuitFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BlockEvaluationException(name(), this + ": initialization error: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------------

    public final boolean isPersistent()
    {
        return persistenceEnabled;
    }

    public final void disablePersistence()
    {
        persistenceEnabled = false;
    }

    /**
     * Key of this block in the persistent data map.
     */
    public final String persistenceKey()
    {
        return toString();
    }

    /**
     * Saves the current state if persistence is enabled. Errors are logged and
     * the stale entry is removed.
     */
    public final void savePersistentState()
    {
        Map<String, Object> store = circuit().persistentData();
        if (!persistenceEnabled || store == null || !(this instanceof PersistentState ps)) {
            return;
        }
        try {
            store.put(persistenceKey(), ps.captureState());
        } catch (RuntimeException e) {
            logWarning("Persistent data save error: {}", e.toString());
            try {
                store.remove(persistenceKey());
            } catch (RuntimeException removeError) {
                logWarning("Persistent data cleanup error: {}", removeError.toString());
            }
        }
    }

    private void restoreFromPersistentData()
    {
        Map<String, Object> store = circuit().persistentData();
        if (store == null || !(this instanceof PersistentState ps)) {
            return;
        }
        Object state;
        try {
            if (!store.containsKey(persistenceKey())) {
                return;
            }
            state = store.get(persistenceKey());
        } catch (RuntimeException e) {
            logWarning("Persistent data retrieval error: {}", e.toString());
            return;
        }
        Duration expiration = config().expiration();
        if (expiration != null) {
            if (expiration.isZero()) {
                return;
            }
            Instant savedAt = circuit().persistentTimestamp();
            if (savedAt != null && circuit().wallClock().hasPassed(savedAt.plus(expiration))) {
                logDebug("The internal state has expired.");
                return;
            }
        }
        try {
            ps.restoreState(state);
        } catch (RuntimeException e) {
            logWarning("Error restoring saved state: {}; state: {}", e.toString(), state);
        }
    }

    @Override
    public Map<String, Object> describe()
    {
        Map<String, Object> conf = super.describe();
        conf.put("type", "sequential");
        if (this instanceof PersistentState) {
            conf.put("persistent", persistenceEnabled);
        }
        return conf;
    }
}
