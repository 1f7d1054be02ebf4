package com.questrail.logic.block;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The actual input shape of a connected block: input names mapped to the
 * group size, or to {@code null} for single inputs.
 */
public final class InputSignature
{
    private final Map<String, Integer> sizes;

    InputSignature(Map<String, Integer> sizes)
    {
        this.sizes = Collections.unmodifiableMap(new LinkedHashMap<>(sizes));
    }

    public Set<String> names()
    {
        return sizes.keySet();
    }

    public boolean isGroup(String name)
    {
        return sizes.get(name) != null;
    }

    /**
     * Group size; {@code null} for a single input.
     */
    public Integer groupSize(String name)
    {
        return sizes.get(name);
    }

    public Map<String, Integer> asMap()
    {
        return sizes;
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof InputSignature other && sizes.equals(other.sizes);
    }

    @Override
    public int hashCode()
    {
        return sizes.hashCode();
    }

    @Override
    public String toString()
    {
        return sizes.toString();
    }
}
