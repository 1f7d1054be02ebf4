package com.questrail.logic.block;

/**
 * Capability of a sequential block that can be initialized from a single
 * value, the {@code initDefault} of its {@link BlockConfig}.
 */
public interface InitFromValue
{
    void initFromValue(Object value);
}
