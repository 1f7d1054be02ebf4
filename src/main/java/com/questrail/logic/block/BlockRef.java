package com.questrail.logic.block;

import com.questrail.logic.kernel.Circuit;

import java.util.Objects;

/**
 * A reference to a block given either directly or by name. Names are resolved
 * against the circuit when it is finalized, or on first use afterwards.
 */
public final class BlockRef<T extends Block>
{
    private final Class<T> type;
    private final String name;
    private volatile T block;

    private BlockRef(Class<T> type, String name, T block)
    {
        this.type = type;
        this.name = name;
        this.block = block;
    }

    @SuppressWarnings("unchecked")
    public static <T extends Block> BlockRef<T> of(T block)
    {
        Objects.requireNonNull(block, "block");
        return new BlockRef<>((Class<T>) block.getClass(), block.name(), block);
    }

    public static <T extends Block> BlockRef<T> named(String name, Class<T> type)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Block name must be a non-empty string");
        }
        return new BlockRef<>(type, name, null);
    }

    /**
     * Accepts a block of the expected type or a block name.
     */
    public static <T extends Block> BlockRef<T> from(Object blockOrName, Class<T> type)
    {
        if (blockOrName instanceof String s) {
            return named(s, type);
        }
        if (type.isInstance(blockOrName)) {
            return new BlockRef<>(type, ((Block) blockOrName).name(), type.cast(blockOrName));
        }
        throw new IllegalArgumentException(
                "Expected a " + type.getSimpleName() + " or its name, got: " + blockOrName);
    }

    public String name()
    {
        return name;
    }

    public boolean isResolved()
    {
        return block != null;
    }

    public T resolve(Circuit circuit)
    {
        T resolved = block;
        if (resolved == null) {
            Block found = circuit.resolveBlock(name);
            if (!type.isInstance(found)) {
                throw new IllegalArgumentException(
                        found + " is not a " + type.getSimpleName() + " block");
            }
            resolved = type.cast(found);
            block = resolved;
        }
        return resolved;
    }

    /**
     * Returns the resolved block.
     *
     * @throws IllegalStateException when the reference was not resolved yet
     */
    public T get()
    {
        T resolved = block;
        if (resolved == null) {
            throw new IllegalStateException("Block reference '" + name + "' is not resolved");
        }
        return resolved;
    }

    @Override
    public String toString()
    {
        return name;
    }
}
