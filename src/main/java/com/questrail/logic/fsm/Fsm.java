package com.questrail.logic.fsm;

import com.questrail.logic.api.EventData;
import com.questrail.logic.api.Undef;
import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.block.InitFromValue;
import com.questrail.logic.block.PersistentState;
import com.questrail.logic.block.SBlock;
import com.questrail.logic.event.Event;
import com.questrail.logic.event.EventType;
import com.questrail.logic.kernel.Circuit;
import com.questrail.logic.time.Cancellable;
import com.questrail.logic.time.TimePeriods;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fsm
 * =============================================================================
 * A finite-state machine block driven by an {@link FsmDefinition}.
 *
 * <h2>Transitions</h2>
 * <p>
 * An event named in the definition is looked up in the transition table, the
 * state-specific entry first, then the wildcard entry. Without a transition the
 * {@code onNotrans} events are sent and the event returns {@code false}. Guards
 * (class and instance) must all approve; they are not consulted before the
 * first transition. A {@link EventType.Goto} event bypasses the table.
 * </p>
 * <p>
 * Leaving a state runs its exit callbacks, sends its {@code onExit} events and
 * cancels its timer. Entering a state runs its entry callbacks; an entry
 * callback may send exactly one further event to this FSM, making the state
 * intermediate. An intermediate state produces no output and no
 * {@code onEnter} events, only its exit callbacks run. When the final state is
 * reached its timer is started, the output is recomputed and the
 * {@code onEnter} events are sent.
 * </p>
 *
 * <h2>Timers</h2>
 * <p>
 * The duration of a timed state is taken from the event data key
 * {@code duration}, then from the per-instance options, then from the
 * definition. An infinite duration starts no timer; a zero duration raises the
 * timed event at once, as a chained transition. Expired timers post the timed
 * event into the circuit.
 * </p>
 *
 * <h2>Persistence</h2>
 * <p>
 * The state, the timer expiry and the state data are saved as an
 * {@link FsmSnapshot}. Restoring resumes the state without running entry
 * callbacks or sending events; an already expired timer makes the restore
 * fail and the FSM is initialized normally.
 * </p>
 */
public class Fsm extends SBlock implements InitFromValue, PersistentState
{
    private record PendingEvent(EventType etype, EventData data, String newState)
    {
    }

    private final FsmDefinition<Fsm> definition;
    private final FsmOptions<Fsm> options;
    private final Map<String, Duration> durations;
    private final Map<String, Object> sdata = new LinkedHashMap<>();

    private String state;
    private boolean transitionActive;
    private PendingEvent nextEvent;

    private Cancellable activeTimer;
    private Instant timerExpiry;
    private long timerSequence;

    @SuppressWarnings("unchecked")
    public Fsm(Circuit circuit, String name, BlockConfig config,
               FsmDefinition<? extends Fsm> definition, FsmOptions<? extends Fsm> options)
    {
        super(circuit, name, withDefaultState(config, definition));
        Objects.requireNonNull(definition, "definition");
        if (!definition.fsmType().isInstance(this)) {
            throw new IllegalArgumentException(
                    this + ": the FSM definition is for " + definition.fsmType().getSimpleName());
        }
        this.definition = (FsmDefinition<Fsm>) definition;
        this.options = options == null ? FsmOptions.none() : (FsmOptions<Fsm>) options;
        for (String event : definition.events()) {
            if (eventHandlers().handles(event)) {
                throw new IllegalArgumentException(
                        "Ambiguous event '" + event + "': the name is used for both FSM and SBlock event");
            }
        }
        checkOptions();
        Map<String, Duration> merged = new HashMap<>(definition.defaultDurations());
        this.options.durations().forEach((st, duration) -> {
            if (duration != null) {
                merged.put(st, duration);
            }
        });
        this.durations = Collections.unmodifiableMap(merged);
        this.options.onEnter().values().forEach(events -> events.forEach(circuit::registerEvent));
        this.options.onExit().values().forEach(events -> events.forEach(circuit::registerEvent));
        this.options.onNotrans().forEach(circuit::registerEvent);
    }

    public Fsm(Circuit circuit, String name, FsmDefinition<? extends Fsm> definition)
    {
        this(circuit, name, null, definition, null);
    }

    private static BlockConfig withDefaultState(BlockConfig config, FsmDefinition<?> definition)
    {
        BlockConfig cfg = config == null ? BlockConfig.defaults() : config;
        return cfg.hasInitDefault()
                ? cfg
                : cfg.toBuilder().withInitDefault(Objects.requireNonNull(definition, "definition").defaultState()).build();
    }

    private void checkOptions()
    {
        for (String st : options.durations().keySet()) {
            if (!definition.isTimed(st)) {
                throw new IllegalArgumentException("'" + st + "' is not a timed state");
            }
        }
        checkNames(options.guards().keySet(), definition.events(), "guard");
        checkNames(options.entryActions().keySet(), definition.states(), "entry action");
        checkNames(options.exitActions().keySet(), definition.states(), "exit action");
        checkNames(options.onEnter().keySet(), definition.states(), "onEnter");
        checkNames(options.onExit().keySet(), definition.states(), "onExit");
    }

    private void checkNames(Collection<String> names, Collection<String> valid, String kind)
    {
        for (String n : names) {
            if (!valid.contains(n)) {
                throw new IllegalArgumentException(this + ": " + kind + " for unknown name '" + n
                        + "'; accepted are: " + String.join(", ", valid));
            }
        }
    }

    public final FsmDefinition<? extends Fsm> definition()
    {
        return definition;
    }

    /**
     * The current state, {@code null} before initialization.
     */
    public final String state()
    {
        return state;
    }

    /**
     * Additional state data, modifiable by callbacks and saved with the state.
     * Keys starting with {@code '_'} are left out of the enter/exit
     * notifications.
     */
    public final Map<String, Object> sdata()
    {
        return sdata;
    }

    /**
     * Computes the output after a transition. Return {@link Undef#UNDEF} to
     * leave the output unchanged. Defaults to the state name.
     */
    protected Object calcOutput()
    {
        return state;
    }

    // ---------------------------------------------------------------------
    // Events
    // ---------------------------------------------------------------------

    @Override
    protected Object handleEvent(EventType etype, EventData data)
    {
        String newState;
        if (etype instanceof EventType.Goto go) {
            newState = go.state();
            definition.checkState(newState);
        } else if (etype instanceof EventType.Named named && definition.events().contains(named.name())) {
            String event = named.name();
            newState = definition.nextState(event, state);
            if (newState == null) {
                logDebug("No transition defined for event {} in state {}", event, state);
                for (Event notrans : options.onNotrans()) {
                    notrans.send(this, EventData.of(
                            EventData.TRIGGER, "notrans", EventData.EVENT, event, EventData.STATE, state));
                }
                return false;
            }
            if (isInitialized() && !guardsPass(event, data)) {
                logDebug("not executing event {} ({} -> {}), condition not satisfied", event, state, newState);
                return false;
            }
        } else {
            return super.handleEvent(etype, data);
        }

        if (transitionActive) {
            // an entry callback or a zero-duration timer requested a further transition
            if (nextEvent != null) {
                throw new IllegalStateException("Forbidden event multiplication; Two events ("
                        + nextEvent.etype() + " and " + etype + ") were generated while handling a single event");
            }
            nextEvent = new PendingEvent(etype, data, newState);
            return true;
        }
        transitionActive = true;
        try {
            transition(etype, data, newState);
            return true;
        } finally {
            transitionActive = false;
            nextEvent = null;
        }
    }

    private void transition(EventType etype, EventData data, String newState)
    {
        boolean wasInitialized = isInitialized();
        if (wasInitialized) {
            runExitActions(data);
            sendStateEvents(options.onExit(), "exit");
            stopTimer();
        }
        EventType currentType = etype;
        EventData currentData = data;
        String target = newState;
        boolean settled = false;
        for (int i = 0; i < definition.chainLimit(); i++) {
            if (nextEvent != null) {
                // intermediate state
                runExitActions(currentData);
                currentType = nextEvent.etype();
                currentData = nextEvent.data();
                target = nextEvent.newState();
                nextEvent = null;
            }
            logDebug("state: {} -> {} (event: {})", state, target, currentType);
            state = target;
            EventData entryData = currentData;
            withEventsEnabled(() -> runEntryActions(entryData));
            if (nextEvent != null) {
                continue;
            }
            EventType timedEvent = definition.timedEvent(target);
            if (timedEvent != null) {
                withEventsEnabled(() -> startTimer(entryData.get(EventData.DURATION), timedEvent));
                if (nextEvent != null) {
                    continue;
                }
            }
            settled = true;
            break;
        }
        if (!settled) {
            throw new IllegalStateException("Chained state transition limit reached (infinite loop?)");
        }
        Object out = calcOutput();
        if (out != Undef.UNDEF) {
            setOutput(out);
        }
        if (wasInitialized) {
            sendStateEvents(options.onEnter(), "enter");
        }
    }

    private boolean guardsPass(String event, EventData data)
    {
        FsmGuard<? super Fsm> instanceGuard = options.guards().get(event);
        if (instanceGuard != null && !instanceGuard.test(this, data)) {
            return false;
        }
        FsmGuard<? super Fsm> classGuard = definition.guard(event);
        return classGuard == null || classGuard.test(this, data);
    }

    private void runEntryActions(EventData data)
    {
        FsmAction<? super Fsm> instanceAction = options.entryActions().get(state);
        if (instanceAction != null) {
            instanceAction.run(this, data);
        }
        FsmAction<? super Fsm> classAction = definition.entryAction(state);
        if (classAction != null) {
            classAction.run(this, data);
        }
    }

    private void runExitActions(EventData data)
    {
        FsmAction<? super Fsm> instanceAction = options.exitActions().get(state);
        if (instanceAction != null) {
            instanceAction.run(this, data);
        }
        FsmAction<? super Fsm> classAction = definition.exitAction(state);
        if (classAction != null) {
            classAction.run(this, data);
        }
    }

    private void sendStateEvents(Map<String, List<Event>> table, String trigger)
    {
        List<Event> events = table.get(state);
        if (events == null || events.isEmpty()) {
            return;
        }
        Map<String, Object> visible = new LinkedHashMap<>();
        sdata.forEach((k, v) -> {
            if (!k.startsWith("_")) {
                visible.put(k, v);
            }
        });
        EventData data = EventData.of(EventData.TRIGGER, trigger, EventData.STATE, state, EventData.VALUE, output())
                .with("sdata", Collections.unmodifiableMap(visible));
        for (Event event : events) {
            event.send(this, data);
        }
    }

    // ---------------------------------------------------------------------
    // Timer
    // ---------------------------------------------------------------------

    private void startTimer(Object durationArg, EventType timedEvent)
    {
        Duration duration;
        if (durationArg != null) {
            duration = TimePeriods.toDuration(durationArg);
        } else {
            duration = durations.get(state);
            if (duration == null) {
                throw new IllegalStateException("Timer duration for state '" + state + "' not set");
            }
        }
        if (TimePeriods.isInfinite(duration)) {
            return;
        }
        if (duration.isZero() || duration.isNegative()) {
            logDebug("timer: zero delay before {}", timedEvent);
            event(timedEvent);
            return;
        }
        setTimer(duration, timedEvent);
    }

    private void setTimer(Duration duration, EventType timedEvent)
    {
        logDebug("timer: {} before {}", duration, timedEvent);
        long sequence = ++timerSequence;
        timerExpiry = circuit().wallClock().now().plus(duration);
        activeTimer = circuit().scheduler().scheduleAfter(duration, circuit().clock(),
                () -> circuit().post(() -> timerExpired(sequence, timedEvent)));
    }

    private void timerExpired(long sequence, EventType timedEvent)
    {
        if (sequence != timerSequence || activeTimer == null) {
            return;
        }
        activeTimer = null;
        timerExpiry = null;
        event(timedEvent);
    }

    private void stopTimer()
    {
        if (activeTimer != null) {
            activeTimer.cancel();
            activeTimer = null;
            timerExpiry = null;
            timerSequence++;
            logDebug("timer: cancelled");
        }
    }

    /**
     * Wall-clock expiry of the running timer, {@code null} if none.
     */
    public final Instant timerExpiry()
    {
        return timerExpiry;
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void initFromValue(Object value)
    {
        event(EventType.goTo(String.valueOf(value)));
    }

    @Override
    public void stop()
    {
        stopTimer();
        super.stop();
    }

    @Override
    public Object captureState()
    {
        return new FsmSnapshot(state, timerExpiry, sdata);
    }

    @Override
    public void restoreState(Object saved)
    {
        if (!(saved instanceof FsmSnapshot snapshot)) {
            throw new IllegalArgumentException("expected an FsmSnapshot, got: " + saved);
        }
        definition.checkState(snapshot.state());
        if (snapshot.timerExpiry() != null) {
            Duration remaining = circuit().wallClock().until(snapshot.timerExpiry());
            if (remaining.isZero() || remaining.isNegative()) {
                logWarning("restore state: ignoring expired state '{}'", snapshot.state());
                return;
            }
            EventType timedEvent = definition.timedEvent(snapshot.state());
            if (timedEvent == null) {
                throw new IllegalArgumentException(
                        "cannot set a timer for a not timed state '" + snapshot.state() + "'");
            }
            setTimer(remaining, timedEvent);
        }
        state = snapshot.state();
        sdata.clear();
        sdata.putAll(snapshot.sdata());
        logDebug("state: <UNDEF> -> {}", state);
        Object out = calcOutput();
        if (out != Undef.UNDEF) {
            setOutput(out);
        }
    }

    @Override
    public Map<String, Object> describe()
    {
        Map<String, Object> conf = super.describe();
        conf.put("state", state);
        return conf;
    }
}
