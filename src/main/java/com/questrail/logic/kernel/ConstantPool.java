package com.questrail.logic.kernel;

import com.questrail.logic.block.Const;

import java.util.HashMap;
import java.util.Map;

/**
 * Interning cache of {@link Const} instances owned by one circuit.
 *
 * <p>Arrays are never interned; their equality is identity. The pool is cleared
 * when the circuit terminates.</p>
 */
final class ConstantPool {

    private record Key(Object value) {
    }

    private final Map<Key, Const> pool = new HashMap<>();

    synchronized Const intern(Object value) {
        if (value != null && value.getClass().isArray()) {
            return Const.of(value);
        }
        return pool.computeIfAbsent(new Key(value), k -> Const.of(k.value()));
    }

    synchronized int size() {
        return pool.size();
    }

    synchronized void clear() {
        pool.clear();
    }
}
