package com.questrail.logic.block;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Connections
 * =============================================================================
 * Input specification of a combinational block, handed to
 * {@link CBlock#connect(Connections)}.
 *
 * <p>
 * Each input is given by one of:
 * </p>
 * <ul>
 *   <li>a {@link Block} of the same circuit</li>
 *   <li>a block name, resolved when the circuit is finalized; the names
 *       {@code "_not_NAME"} and {@code "_ctrl"} create the matching synthetic
 *       blocks on demand</li>
 *   <li>a {@link Const}</li>
 *   <li>any other value, wrapped into an interned {@link Const}</li>
 * </ul>
 *
 * <p>
 * A collection, array or iterator makes a named input an input group.
 * Positional inputs form the reserved group {@value #POSITIONAL}.
 * </p>
 *
 * <pre>
 *   Connections.of("a", "b", true)
 *       .input("enable", "switch")
 *       .input("mode")                 // connected to the block named "mode"
 *       .group("limits", 10, 20);
 * </pre>
 */
public final class Connections
{
    /** Name of the group formed by positional inputs. */
    public static final String POSITIONAL = "_";

    private final Map<String, Object> inputs = new LinkedHashMap<>();

    private Connections()
    {
    }

    /**
     * Positional inputs. Each item must be a single input specification.
     */
    public static Connections of(Object... positional)
    {
        Connections c = new Connections();
        if (positional.length > 0) {
            for (Object item : positional) {
                if (isMultiple(item)) {
                    throw new IllegalArgumentException(item + " is not a single input specification"
                            + " (wrap it in Const if it is a constant)");
                }
            }
            c.inputs.put(POSITIONAL, new Group(Arrays.asList(positional)));
        }
        return c;
    }

    /**
     * Named input; a collection, array or iterator makes it a group.
     */
    public Connections input(String name, Object spec)
    {
        checkName(name);
        inputs.put(name, isMultiple(spec) ? new Group(toList(spec)) : spec);
        return this;
    }

    /**
     * Named input connected to the block with the same name.
     */
    public Connections input(String name)
    {
        return input(name, name);
    }

    public Connections group(String name, Object... specs)
    {
        checkName(name);
        inputs.put(name, new Group(Arrays.asList(specs)));
        return this;
    }

    public boolean isEmpty()
    {
        return inputs.isEmpty();
    }

    public Set<String> names()
    {
        return Collections.unmodifiableSet(inputs.keySet());
    }

    public boolean isGroup(String name)
    {
        return inputs.get(name) instanceof Group;
    }

    /**
     * Members of an input: one element for a single input.
     */
    public List<Object> members(String name)
    {
        if (!inputs.containsKey(name)) {
            throw new IllegalArgumentException("No input named '" + name + "'");
        }
        Object spec = inputs.get(name);
        return spec instanceof Group g ? g.members() : Collections.singletonList(spec);
    }

    Connections copy()
    {
        Connections c = new Connections();
        c.inputs.putAll(inputs);
        return c;
    }

    private void checkName(String name)
    {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Input name must be a non-empty string");
        }
        if (POSITIONAL.equals(name)) {
            throw new IllegalArgumentException("Input name '" + POSITIONAL + "' is reserved");
        }
        if (inputs.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate input name '" + name + "'");
        }
    }

    static boolean isMultiple(Object spec)
    {
        return spec instanceof Collection<?> || spec instanceof Iterator<?> || spec instanceof Object[];
    }

    private static List<Object> toList(Object spec)
    {
        List<Object> list = new ArrayList<>();
        if (spec instanceof Collection<?> c) {
            list.addAll(c);
        } else if (spec instanceof Iterator<?> it) {
            it.forEachRemaining(list::add);
        } else {
            list.addAll(Arrays.asList((Object[]) spec));
        }
        return list;
    }

    private record Group(List<Object> members)
    {
        private Group
        {
            members = Collections.unmodifiableList(new ArrayList<>(members));
        }
    }

    @Override
    public String toString()
    {
        return inputs.toString();
    }
}
