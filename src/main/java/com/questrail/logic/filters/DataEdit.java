package com.questrail.logic.filters;

import com.questrail.logic.api.EventData;
import com.questrail.logic.block.Block;
import com.questrail.logic.block.BlockRef;
import com.questrail.logic.event.EventFilter;
import com.questrail.logic.kernel.Circuit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Edits the event payload. Edits are applied in the order they were added:
 *
 * <pre>
 *   Event.to("display").withFilters(DataEdit.edit().rename("value", "text").add("color", "red"))
 * </pre>
 *
 * <p>A {@link #modify(String, UnaryOperator) modify} function may return
 * {@link Marker#DELETE} to remove the key or {@link Marker#REJECT} to reject the
 * whole event. Copying or renaming a missing key is an error.</p>
 */
public final class DataEdit implements EventFilter {

    /** Special return values of a {@code modify} function. */
    public enum Marker {
        DELETE,
        REJECT
    }

    @FunctionalInterface
    private interface Edit {
        /** Returns {@code false} to reject the event. */
        boolean apply(Map<String, Object> data);
    }

    private final List<Edit> edits = new ArrayList<>();
    private final List<BlockRef<Block>> references = new ArrayList<>();

    private DataEdit() {
    }

    public static DataEdit edit() {
        return new DataEdit();
    }

    /** Adds or overwrites a key. */
    public DataEdit add(String key, Object value) {
        edits.add(data -> {
            data.put(key, value);
            return true;
        });
        return this;
    }

    /** Adds or overwrites a key with the current output of a block. */
    public DataEdit addOutput(String key, Object block) {
        BlockRef<Block> ref = BlockRef.from(block, Block.class);
        references.add(ref);
        edits.add(data -> {
            data.put(key, ref.get().output());
            return true;
        });
        return this;
    }

    /** Adds a key only if missing. */
    public DataEdit setDefault(String key, Object value) {
        edits.add(data -> {
            data.putIfAbsent(key, value);
            return true;
        });
        return this;
    }

    public DataEdit copy(String src, String dst) {
        edits.add(data -> {
            data.put(dst, required(data, src));
            return true;
        });
        return this;
    }

    public DataEdit rename(String src, String dst) {
        edits.add(data -> {
            Object value = required(data, src);
            data.remove(src);
            data.put(dst, value);
            return true;
        });
        return this;
    }

    /** Deletes keys; missing keys are ignored. */
    public DataEdit delete(String... keys) {
        edits.add(data -> {
            for (String key : keys) {
                data.remove(key);
            }
            return true;
        });
        return this;
    }

    /** Deletes all keys except the listed ones. */
    public DataEdit permit(String... keys) {
        Set<String> kept = Set.of(keys);
        edits.add(data -> {
            data.keySet().removeIf(k -> !kept.contains(k));
            return true;
        });
        return this;
    }

    /** Replaces the value of an existing key with {@code func(value)}. */
    public DataEdit modify(String key, UnaryOperator<Object> func) {
        edits.add(data -> {
            Object replacement = func.apply(required(data, key));
            if (replacement == Marker.REJECT) {
                return false;
            }
            if (replacement == Marker.DELETE) {
                data.remove(key);
            } else {
                data.put(key, replacement);
            }
            return true;
        });
        return this;
    }

    private static Object required(Map<String, Object> data, String key) {
        if (!data.containsKey(key)) {
            throw new IllegalArgumentException("DataEdit: missing key '" + key + "'");
        }
        return data.get(key);
    }

    @Override
    public void resolveReferences(Circuit circuit) {
        for (BlockRef<Block> ref : references) {
            ref.resolve(circuit);
        }
    }

    @Override
    public Optional<EventData> apply(EventData data) {
        Map<String, Object> edited = new LinkedHashMap<>(data.asMap());
        for (Edit edit : edits) {
            if (!edit.apply(edited)) {
                return Optional.empty();
            }
        }
        return Optional.of(EventData.from(edited));
    }
}
