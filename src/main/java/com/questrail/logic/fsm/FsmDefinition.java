package com.questrail.logic.fsm;

import com.questrail.logic.event.EventType;
import com.questrail.logic.time.TimePeriods;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * FsmDefinition
 * =============================================================================
 * Compiled control tables of one FSM type.
 *
 * <p>
 * A definition is built once per FSM type, usually into a static field, and
 * shared by all instances. It is immutable; per-instance durations and
 * callbacks are supplied through {@link FsmOptions} and never modify it.
 * </p>
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>states: the declared states plus the timed states; the first one is
 *       the default initial state</li>
 *   <li>transitions keyed by (event, state); a {@code null} state is a wildcard
 *       entry used when no state-specific entry exists</li>
 *   <li>timed states with their default duration and the event raised on
 *       expiry, which may be a {@link EventType.Goto}</li>
 *   <li>guard callbacks per event, entry and exit callbacks per state</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>
 *   static final FsmDefinition&lt;Fsm&gt; TURNSTILE = FsmDefinition.builder(Fsm.class)
 *       .states("locked", "unlocked")
 *       .transition("coin", "locked", "unlocked")
 *       .transition("push", "unlocked", "locked")
 *       .build();
 * </pre>
 */
public final class FsmDefinition<F extends Fsm>
{
    private record TransitionKey(String event, String state)
    {
    }

    private record TimedState(Duration duration, EventType event)
    {
    }

    private final Class<F> fsmType;
    private final List<String> states;
    private final Set<String> events;
    private final Map<TransitionKey, String> transitions;
    private final Map<String, TimedState> timers;
    private final Map<String, FsmGuard<? super F>> guards;
    private final Map<String, FsmAction<? super F>> entryActions;
    private final Map<String, FsmAction<? super F>> exitActions;

    private FsmDefinition(Builder<F> b)
    {
        this.fsmType = b.fsmType;
        this.states = List.copyOf(b.states);
        this.events = Collections.unmodifiableSet(new LinkedHashSet<>(b.events));
        this.transitions = Collections.unmodifiableMap(new HashMap<>(b.transitions));
        this.timers = Collections.unmodifiableMap(new LinkedHashMap<>(b.timers));
        this.guards = Map.copyOf(b.guards);
        this.entryActions = Map.copyOf(b.entryActions);
        this.exitActions = Map.copyOf(b.exitActions);
    }

    public static <F extends Fsm> Builder<F> builder(Class<F> fsmType)
    {
        return new Builder<>(fsmType);
    }

    public Class<F> fsmType()
    {
        return fsmType;
    }

    /** All states in declaration order, timed-only states last. */
    public List<String> states()
    {
        return states;
    }

    public Set<String> events()
    {
        return events;
    }

    public String defaultState()
    {
        return states.get(0);
    }

    public boolean hasState(String state)
    {
        return states.contains(state);
    }

    public boolean isTimed(String state)
    {
        return timers.containsKey(state);
    }

    /**
     * Maximum number of states entered while handling a single event.
     */
    public int chainLimit()
    {
        return 3 * states.size();
    }

    void checkState(String state)
    {
        if (!hasState(state)) {
            throw new IllegalArgumentException("Unknown state '" + state + "'");
        }
    }

    /**
     * Looks up the next state: the entry for {@code state} first, then the
     * wildcard entry.
     *
     * @return the next state or {@code null} if no transition is defined
     */
    public String nextState(String event, String state)
    {
        TransitionKey specific = new TransitionKey(event, state);
        if (state != null && transitions.containsKey(specific)) {
            return transitions.get(specific);
        }
        return transitions.get(new TransitionKey(event, null));
    }

    /**
     * Event raised when the timer of {@code state} expires, {@code null} for
     * a state without a timer.
     */
    public EventType timedEvent(String state)
    {
        TimedState timed = timers.get(state);
        return timed == null ? null : timed.event();
    }

    /**
     * Default timer durations; a value may be {@code null} (duration not set).
     */
    public Map<String, Duration> defaultDurations()
    {
        Map<String, Duration> result = new HashMap<>();
        timers.forEach((state, timed) -> result.put(state, timed.duration()));
        return result;
    }

    FsmGuard<? super F> guard(String event)
    {
        return guards.get(event);
    }

    FsmAction<? super F> entryAction(String state)
    {
        return entryActions.get(state);
    }

    FsmAction<? super F> exitAction(String state)
    {
        return exitActions.get(state);
    }

    @Override
    public String toString()
    {
        return "FsmDefinition[" + fsmType.getSimpleName() + ", states=" + states + ", events=" + events + "]";
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder<F extends Fsm>
    {
        private final Class<F> fsmType;
        private final List<String> states = new ArrayList<>();
        private final Set<String> events = new LinkedHashSet<>();
        private final Map<TransitionKey, String> transitions = new HashMap<>();
        private final Map<String, TimedState> timers = new LinkedHashMap<>();
        private final Map<String, FsmGuard<? super F>> guards = new HashMap<>();
        private final Map<String, FsmAction<? super F>> entryActions = new HashMap<>();
        private final Map<String, FsmAction<? super F>> exitActions = new HashMap<>();

        private Builder(Class<F> fsmType)
        {
            this.fsmType = Objects.requireNonNull(fsmType, "fsmType");
        }

        public Builder<F> states(String... names)
        {
            for (String name : names) {
                checkName(name, "FSM state name");
                if (!states.contains(name)) {
                    states.add(name);
                }
            }
            return this;
        }

        /**
         * Declares a transition; {@code fromState == null} is the wildcard
         * entry and {@code toState == null} explicitly defines "no transition",
         * hiding a wildcard entry for that state.
         */
        public Builder<F> transition(String event, String fromState, String toState)
        {
            checkName(event, "FSM event name");
            events.add(event);
            TransitionKey key = new TransitionKey(event, fromState);
            if (transitions.containsKey(key)) {
                throw new IllegalArgumentException("Multiple transitions defined for event '"
                        + event + "' in state '" + fromState + "'");
            }
            transitions.put(key, toState);
            return this;
        }

        public Builder<F> transition(String event, Collection<String> fromStates, String toState)
        {
            for (String from : fromStates) {
                transition(event, from, toState);
            }
            return this;
        }

        /**
         * Declares a timed state. The duration may be anything
         * {@link TimePeriods#toDuration(Object)} accepts, or {@code null}
         * when every instance must supply its own.
         */
        public Builder<F> timer(String state, Object duration, String event)
        {
            return timer(state, duration, EventType.of(event));
        }

        public Builder<F> timer(String state, Object duration, EventType event)
        {
            checkName(state, "FSM state name");
            if (!(event instanceof EventType.Named) && !(event instanceof EventType.Goto)) {
                throw new IllegalArgumentException("TIMERS['" + state + "']: expected an event name or a Goto, got " + event);
            }
            Duration d;
            try {
                d = TimePeriods.toDuration(duration);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("TIMERS['" + state + "']: " + e.getMessage(), e);
            }
            if (timers.containsKey(state)) {
                throw new IllegalArgumentException("TIMERS['" + state + "']: timer already defined");
            }
            timers.put(state, new TimedState(d, event));
            return this;
        }

        public Builder<F> guard(String event, FsmGuard<? super F> guard)
        {
            putCallback(guards, event, guard, "guard");
            return this;
        }

        public Builder<F> onEntry(String state, FsmAction<? super F> action)
        {
            putCallback(entryActions, state, action, "entry callback");
            return this;
        }

        public Builder<F> onExit(String state, FsmAction<? super F> action)
        {
            putCallback(exitActions, state, action, "exit callback");
            return this;
        }

        private static <T> void putCallback(Map<String, T> map, String name, T callback, String kind)
        {
            Objects.requireNonNull(callback, kind);
            if (map.putIfAbsent(name, callback) != null) {
                throw new IllegalArgumentException("Duplicate " + kind + " for '" + name + "'");
            }
        }

        public FsmDefinition<F> build()
        {
            Set<String> all = new LinkedHashSet<>(states);
            all.addAll(timers.keySet());
            if (all.isEmpty()) {
                throw new IllegalArgumentException("Cannot create a state machine with no states");
            }
            states.clear();
            states.addAll(all);

            for (Map.Entry<TransitionKey, String> e : transitions.entrySet()) {
                TransitionKey key = e.getKey();
                if (key.state() != null && !all.contains(key.state())) {
                    throw new IllegalArgumentException("Unknown state '" + key.state() + "'");
                }
                if (e.getValue() != null && !all.contains(e.getValue())) {
                    throw new IllegalArgumentException("Unknown state '" + e.getValue() + "'");
                }
            }
            for (Map.Entry<String, TimedState> e : timers.entrySet()) {
                EventType event = e.getValue().event();
                if (event instanceof EventType.Goto go) {
                    if (!all.contains(go.state())) {
                        throw new IllegalArgumentException("Unknown state '" + go.state() + "'");
                    }
                } else if (!events.contains(((EventType.Named) event).name())) {
                    throw new IllegalArgumentException(
                            "TIMERS['" + e.getKey() + "']: undefined event '" + event + "'");
                }
            }
            checkCallbackNames(guards.keySet(), events, "guard", "event");
            checkCallbackNames(entryActions.keySet(), all, "entry callback", "state");
            checkCallbackNames(exitActions.keySet(), all, "exit callback", "state");
            return new FsmDefinition<>(this);
        }

        private static void checkCallbackNames(Set<String> names, Set<String> valid, String kind, String what)
        {
            for (String name : names) {
                if (!valid.contains(name)) {
                    throw new IllegalArgumentException(kind + " defined for unknown " + what + " '" + name + "'");
                }
            }
        }

        private static void checkName(String name, String kind)
        {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException(kind + " must be a non-empty string");
            }
        }
    }
}
