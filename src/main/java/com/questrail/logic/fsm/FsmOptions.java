package com.questrail.logic.fsm;

import com.questrail.logic.event.Event;
import com.questrail.logic.time.TimePeriods;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-instance settings of an {@link Fsm}.
 *
 * <p>
 * Everything here is checked against the FSM's {@link FsmDefinition} when the
 * block is created; an unknown state or event name is rejected with the list
 * of accepted names.
 * </p>
 */
public final class FsmOptions<F extends Fsm>
{
    private static final FsmOptions<Fsm> NONE = new Builder<Fsm>().build();

    private final Map<String, Duration> durations;
    private final Map<String, FsmGuard<? super F>> guards;
    private final Map<String, FsmAction<? super F>> entryActions;
    private final Map<String, FsmAction<? super F>> exitActions;
    private final Map<String, List<Event>> onEnter;
    private final Map<String, List<Event>> onExit;
    private final List<Event> onNotrans;

    private FsmOptions(Builder<F> b)
    {
        this.durations = Collections.unmodifiableMap(new LinkedHashMap<>(b.durations));
        this.guards = Map.copyOf(b.guards);
        this.entryActions = Map.copyOf(b.entryActions);
        this.exitActions = Map.copyOf(b.exitActions);
        Map<String, List<Event>> enter = new LinkedHashMap<>();
        b.onEnter.forEach((state, events) -> enter.put(state, List.copyOf(events)));
        this.onEnter = Collections.unmodifiableMap(enter);
        Map<String, List<Event>> exit = new LinkedHashMap<>();
        b.onExit.forEach((state, events) -> exit.put(state, List.copyOf(events)));
        this.onExit = Collections.unmodifiableMap(exit);
        this.onNotrans = List.copyOf(b.onNotrans);
    }

    @SuppressWarnings("unchecked")
    public static <F extends Fsm> FsmOptions<F> none()
    {
        return (FsmOptions<F>) NONE;
    }

    public static <F extends Fsm> Builder<F> builder()
    {
        return new Builder<>();
    }

    /** Duration overrides; a {@code null} value leaves the class default. */
    public Map<String, Duration> durations()
    {
        return durations;
    }

    public Map<String, FsmGuard<? super F>> guards()
    {
        return guards;
    }

    public Map<String, FsmAction<? super F>> entryActions()
    {
        return entryActions;
    }

    public Map<String, FsmAction<? super F>> exitActions()
    {
        return exitActions;
    }

    public Map<String, List<Event>> onEnter()
    {
        return onEnter;
    }

    public Map<String, List<Event>> onExit()
    {
        return onExit;
    }

    public List<Event> onNotrans()
    {
        return onNotrans;
    }

    public static final class Builder<F extends Fsm>
    {
        private final Map<String, Duration> durations = new LinkedHashMap<>();
        private final Map<String, FsmGuard<? super F>> guards = new LinkedHashMap<>();
        private final Map<String, FsmAction<? super F>> entryActions = new LinkedHashMap<>();
        private final Map<String, FsmAction<? super F>> exitActions = new LinkedHashMap<>();
        private final Map<String, List<Event>> onEnter = new LinkedHashMap<>();
        private final Map<String, List<Event>> onExit = new LinkedHashMap<>();
        private final List<Event> onNotrans = new ArrayList<>();

        private Builder()
        {
        }

        /**
         * Overrides the default timer duration of a timed state.
         */
        public Builder<F> withDuration(String state, Object duration)
        {
            durations.put(Objects.requireNonNull(state, "state"), TimePeriods.toDuration(duration));
            return this;
        }

        public Builder<F> withGuard(String event, FsmGuard<? super F> guard)
        {
            guards.put(Objects.requireNonNull(event, "event"), Objects.requireNonNull(guard, "guard"));
            return this;
        }

        public Builder<F> withEntryAction(String state, FsmAction<? super F> action)
        {
            entryActions.put(Objects.requireNonNull(state, "state"), Objects.requireNonNull(action, "action"));
            return this;
        }

        public Builder<F> withExitAction(String state, FsmAction<? super F> action)
        {
            exitActions.put(Objects.requireNonNull(state, "state"), Objects.requireNonNull(action, "action"));
            return this;
        }

        /** Events sent after {@code state} was entered. */
        public Builder<F> withOnEnter(String state, Event... events)
        {
            onEnter.computeIfAbsent(Objects.requireNonNull(state, "state"), k -> new ArrayList<>())
                    .addAll(Arrays.asList(events));
            return this;
        }

        /** Events sent when leaving {@code state}. */
        public Builder<F> withOnExit(String state, Event... events)
        {
            onExit.computeIfAbsent(Objects.requireNonNull(state, "state"), k -> new ArrayList<>())
                    .addAll(Arrays.asList(events));
            return this;
        }

        /** Events sent when an event has no transition in the current state. */
        public Builder<F> withOnNotrans(Event... events)
        {
            onNotrans.addAll(Arrays.asList(events));
            return this;
        }

        public FsmOptions<F> build()
        {
            return new FsmOptions<>(this);
        }
    }
}
