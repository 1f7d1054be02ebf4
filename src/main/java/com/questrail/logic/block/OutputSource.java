package com.questrail.logic.block;

/**
 * Anything that can be connected to a combinational block input: a block or a
 * {@link Const}.
 */
public interface OutputSource
{
    String name();

    Object output();
}
