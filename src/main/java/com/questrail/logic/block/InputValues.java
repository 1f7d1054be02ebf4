package com.questrail.logic.block;

import com.questrail.logic.api.Truth;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Read access to the current input values of a combinational block.
 */
public final class InputValues
{
    private final CBlock block;

    InputValues(CBlock block)
    {
        this.block = block;
    }

    /**
     * Value of a single input; for a group the list of member values.
     */
    public Object get(String name)
    {
        List<OutputSource> sources = block.sources(name);
        return block.isGroupInput(name) ? values(sources) : sources.get(0).output();
    }

    public boolean isTrue(String name)
    {
        return Truth.of(get(name));
    }

    public List<Object> group(String name)
    {
        return values(block.sources(name));
    }

    public List<Object> positional()
    {
        return group(Connections.POSITIONAL);
    }

    public Object positional(int index)
    {
        return block.sources(Connections.POSITIONAL).get(index).output();
    }

    public Set<String> names()
    {
        return block.inputNames();
    }

    private static List<Object> values(List<OutputSource> sources)
    {
        List<Object> values = new ArrayList<>(sources.size());
        for (OutputSource source : sources) {
            values.add(source.output());
        }
        return Collections.unmodifiableList(values);
    }
}
