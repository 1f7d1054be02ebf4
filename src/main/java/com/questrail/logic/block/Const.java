package com.questrail.logic.block;

import com.questrail.logic.api.Undef;

import java.util.Objects;

/**
 * Const
 * -----------------------------------------------------------------------------
 * Immutable literal usable as an input of any combinational block.
 *
 * <p>
 * A {@code Const} does not belong to a circuit. Bare values given to
 * {@code connect()} are wrapped at finalization time through the circuit's
 * interning pool ({@code Circuit.constant(Object)}), so equal literals share
 * one instance for the lifetime of the circuit.
 * </p>
 */
public final class Const implements OutputSource
{
    private final Object value;

    private Const(Object value)
    {
        if (value == Undef.UNDEF) {
            throw new IllegalArgumentException("<UNDEF> is not a valid constant value");
        }
        this.value = value;
    }

    /**
     * Creates a new, not interned constant.
     */
    public static Const of(Object value)
    {
        return new Const(value);
    }

    public Object value()
    {
        return value;
    }

    @Override
    public Object output()
    {
        return value;
    }

    @Override
    public String name()
    {
        return toString();
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof Const other && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode()
    {
        return Objects.hashCode(value);
    }

    @Override
    public String toString()
    {
        return value instanceof CharSequence ? "<Const '" + value + "'>" : "<Const " + value + ">";
    }
}
