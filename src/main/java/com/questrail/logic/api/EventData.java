package com.questrail.logic.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * EventData
 * =============================================================================
 * Immutable key/value payload travelling with an event.
 *
 * <p>
 * The payload is an open bag: handlers read the keys they understand and ignore
 * the rest. Values may be {@code null}. Every "modifying" method returns a new
 * instance, so a payload can be handed to filters, guards and callbacks without
 * any of them affecting the others.
 * </p>
 *
 * <h2>Well-known keys</h2>
 * <ul>
 *   <li>{@link #SOURCE} - name of the sending block, stamped by {@code Event.send}</li>
 *   <li>{@link #VALUE} - the primary value (e.g. for {@code put})</li>
 *   <li>{@link #PREVIOUS} - previous output in output-change notifications</li>
 *   <li>{@link #TRIGGER} - what produced a notification ({@code output}, {@code enter}, ...)</li>
 *   <li>{@link #IGNORE_UNKNOWN} - when true, an unsupported event type is not an error</li>
 * </ul>
 */
public final class EventData
{
    public static final String SOURCE = "source";
    public static final String VALUE = "value";
    public static final String PREVIOUS = "previous";
    public static final String TRIGGER = "trigger";
    public static final String STATE = "state";
    public static final String EVENT = "event";
    public static final String DURATION = "duration";
    public static final String IGNORE_UNKNOWN = "ignore_unknown";

    private static final EventData EMPTY = new EventData(Map.of());

    private final Map<String, Object> values;

    private EventData(Map<String, Object> values)
    {
        this.values = values;
    }

    public static EventData empty()
    {
        return EMPTY;
    }

    public static EventData of(String key, Object value)
    {
        return EMPTY.with(key, value);
    }

    public static EventData of(String k1, Object v1, String k2, Object v2)
    {
        return EMPTY.with(k1, v1).with(k2, v2);
    }

    public static EventData of(String k1, Object v1, String k2, Object v2, String k3, Object v3)
    {
        return EMPTY.with(k1, v1).with(k2, v2).with(k3, v3);
    }

    public static EventData from(Map<String, ?> map)
    {
        Objects.requireNonNull(map, "map");
        if (map.isEmpty()) {
            return EMPTY;
        }
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "key"), v));
        return new EventData(Collections.unmodifiableMap(copy));
    }

    public EventData with(String key, Object value)
    {
        Objects.requireNonNull(key, "key");
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new EventData(Collections.unmodifiableMap(copy));
    }

    public EventData withAll(Map<String, ?> more)
    {
        if (more.isEmpty()) {
            return this;
        }
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
        more.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "key"), v));
        return new EventData(Collections.unmodifiableMap(copy));
    }

    public EventData without(String... keys)
    {
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
        for (String key : keys) {
            copy.remove(key);
        }
        return copy.size() == values.size() ? this : new EventData(Collections.unmodifiableMap(copy));
    }

    public boolean has(String key)
    {
        return values.containsKey(key);
    }

    /**
     * Returns the value for {@code key}, or {@code null} when absent.
     */
    public Object get(String key)
    {
        return values.get(key);
    }

    public Object getOrDefault(String key, Object defaultValue)
    {
        return values.containsKey(key) ? values.get(key) : defaultValue;
    }

    public <T> Optional<T> get(String key, Class<T> type)
    {
        Object value = values.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    /**
     * Truth value of {@code key}; an absent key is false.
     */
    public boolean isTrue(String key)
    {
        return Truth.of(values.get(key));
    }

    public Set<String> keys()
    {
        return values.keySet();
    }

    public int size()
    {
        return values.size();
    }

    public boolean isEmpty()
    {
        return values.isEmpty();
    }

    public Map<String, Object> asMap()
    {
        return values;
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof EventData other && values.equals(other.values);
    }

    @Override
    public int hashCode()
    {
        return values.hashCode();
    }

    @Override
    public String toString()
    {
        return values.toString();
    }
}
