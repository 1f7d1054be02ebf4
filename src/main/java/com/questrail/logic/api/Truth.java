package com.questrail.logic.api;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Truth value of an arbitrary block output or payload value.
 *
 * <p>False values: {@code null}, {@link Undef#UNDEF}, {@code Boolean.FALSE}, numeric zero,
 * empty strings, empty collections, maps and optionals. Everything else is true.</p>
 */
public final class Truth
{
    private Truth()
    {
    }

    public static boolean of(Object value)
    {
        if (value == null || value == Undef.UNDEF) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence cs) {
            return cs.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        if (value instanceof Optional<?> o) {
            return o.isPresent();
        }
        return true;
    }
}
