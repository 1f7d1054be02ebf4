package com.questrail.logic.event;

import java.util.Objects;

/**
 * EventType
 * =============================================================================
 * The type tag of an event.
 *
 * <ul>
 *   <li>{@link Named} - a plain event name such as {@code "put"} or {@code "start"}</li>
 *   <li>{@link Conditional} - resolved at delivery time to one of two types
 *       based on the truth value of the payload {@code value} key</li>
 *   <li>{@link Goto} - a direct FSM state change bypassing the transition table</li>
 * </ul>
 */
public sealed interface EventType permits EventType.Named, EventType.Conditional, EventType.Goto {

    static Named of(String name) {
        return new Named(name);
    }

    /**
     * Conditional event type. Each branch may be a {@code String} event name,
     * an {@link EventType} or {@code null} meaning "no event".
     */
    static Conditional cond(Object ifTrue, Object ifFalse) {
        return new Conditional(toType(ifTrue), toType(ifFalse));
    }

    static Goto goTo(String state) {
        return new Goto(state);
    }

    /**
     * Converts a {@code String} or {@link EventType} argument to an event type.
     *
     * @throws IllegalArgumentException for other argument types
     */
    static EventType toType(Object etype) {
        if (etype == null) {
            return null;
        }
        if (etype instanceof EventType t) {
            return t;
        }
        if (etype instanceof String s) {
            return new Named(s);
        }
        throw new IllegalArgumentException(
                "Invalid event type " + etype + " (" + etype.getClass().getSimpleName() + ")");
    }

    record Named(String name) implements EventType {
        public Named {
            Objects.requireNonNull(name, "name");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Event type name must be a non-empty string");
            }
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Conditional(EventType ifTrue, EventType ifFalse) implements EventType {
        /**
         * The branch selected by {@code value}; {@code null} means no event.
         */
        public EventType select(boolean value) {
            return value ? ifTrue : ifFalse;
        }

        @Override
        public String toString() {
            return "Conditional(" + ifTrue + ", " + ifFalse + ")";
        }
    }

    record Goto(String state) implements EventType {
        public Goto {
            Objects.requireNonNull(state, "state");
            if (state.isEmpty()) {
                throw new IllegalArgumentException("Goto state must be a non-empty string");
            }
        }

        @Override
        public String toString() {
            return "Goto(" + state + ")";
        }
    }
}
