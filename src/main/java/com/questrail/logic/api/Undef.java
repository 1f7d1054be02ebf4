package com.questrail.logic.api;

/**
 * Undef
 * -----------------------------------------------------------------------------
 * Sentinel output value of a block that has not produced an output yet.
 *
 * <p>
 * {@code null} is a legitimate block output, so "no output yet" needs its own
 * value. Once a block output leaves {@link #UNDEF} it never returns to it.
 * </p>
 */
public enum Undef
{
    UNDEF;

    public static boolean isUndef(Object value)
    {
        return value == UNDEF;
    }

    @Override
    public String toString()
    {
        return "<UNDEF>";
    }
}
