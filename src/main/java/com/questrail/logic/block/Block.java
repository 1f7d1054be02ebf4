package com.questrail.logic.block;

import com.questrail.logic.api.Undef;
import com.questrail.logic.event.Event;
import com.questrail.logic.kernel.Circuit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Block
 * =============================================================================
 * A node of a circuit.
 *
 * <p>
 * Every block has a circuit-unique name, an output and the set of
 * combinational blocks reading that output ({@link #oconnections()}). The output
 * starts as {@link Undef#UNDEF} and, once defined, never returns to it.
 * </p>
 *
 * <h2>Kinds</h2>
 * <ul>
 *   <li>{@link CBlock} - combinational: output is a pure function of the inputs</li>
 *   <li>{@link SBlock} - sequential: output changes only in reaction to events</li>
 * </ul>
 *
 * <h2>Naming</h2>
 * Names starting with an underscore are reserved for blocks created by the
 * circuit itself. A {@code null} name requests an automatically generated one.
 *
 * <h2>Threading</h2>
 * Blocks are not thread-safe. After the simulation starts, block state is
 * touched only on the simulation thread; other threads use
 * {@link Circuit#post(Runnable)}.
 */
public abstract sealed class Block implements OutputSource permits CBlock, SBlock
{
    private final Circuit circuit;
    private final String name;
    private final BlockConfig config;
    private final Logger log;
    private final Set<CBlock> oconnections = new LinkedHashSet<>();
    private Object output = Undef.UNDEF;
    private volatile boolean debug;

    protected Block(Circuit circuit, String name, BlockConfig config)
    {
        this.circuit = Objects.requireNonNull(circuit, "circuit");
        this.config = config == null ? BlockConfig.defaults() : config;
        this.log = LoggerFactory.getLogger(getClass());
        this.debug = this.config.debug();
        if (name == null) {
            this.name = circuit.generateName(getClass());
        } else {
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Block name must be a non-empty string");
            }
            if (name.startsWith("_") && !circuit.permitsReservedNames()) {
                throw new IllegalArgumentException(
                        "Block name '" + name + "' is reserved (names starting with '_')");
            }
            this.name = name;
        }
        checkCapabilities(this.config);
        circuit.addBlock(this);
        for (Event event : this.config.onOutput()) {
            circuit.registerEvent(event);
        }
    }

    private void checkCapabilities(BlockConfig cfg)
    {
        if (cfg.hasInitDefault() && !(this instanceof InitFromValue)) {
            throw new IllegalArgumentException(
                    getClass().getSimpleName() + " does not accept an initDefault value");
        }
        if (cfg.persistent() && !(this instanceof PersistentState)) {
            throw new IllegalArgumentException(
                    getClass().getSimpleName() + " does not support persistent state");
        }
        if (cfg.initTimeout() != null && !(this instanceof AsyncInit)) {
            throw new IllegalArgumentException(
                    "initTimeout rejected, " + getClass().getSimpleName() + " has no async initialization");
        }
        if (cfg.stopTimeout() != null && !(this instanceof AsyncStop)) {
            throw new IllegalArgumentException(
                    "stopTimeout rejected, " + getClass().getSimpleName() + " has no async cleanup");
        }
        if (!cfg.onEveryOutput().isEmpty() && !(this instanceof SBlock)) {
            throw new IllegalArgumentException("onEveryOutput is supported by sequential blocks only");
        }
    }

    @Override
    public final String name()
    {
        return name;
    }

    public final Circuit circuit()
    {
        return circuit;
    }

    public final BlockConfig config()
    {
        return config;
    }

    public final String comment()
    {
        return config.comment();
    }

    @Override
    public final Object output()
    {
        return output;
    }

    public final boolean isInitialized()
    {
        return output != Undef.UNDEF;
    }

    /**
     * Combinational blocks reading this block's output. Populated when the
     * circuit is finalized.
     */
    public final Set<CBlock> oconnections()
    {
        return Collections.unmodifiableSet(oconnections);
    }

    final void addOutputConnection(CBlock reader)
    {
        oconnections.add(reader);
    }

    final void assignOutput(Object value)
    {
        output = value;
    }

    final List<Event> outputEvents()
    {
        return config.onOutput();
    }

    /**
     * Called once by the runtime before initialization.
     */
    public void start()
    {
    }

    /**
     * Called once by the runtime during shutdown, for started blocks only.
     */
    public void stop()
    {
    }

    // ---------------------------------------------------------------------
    // Debugging and logging
    // ---------------------------------------------------------------------

    public final boolean isDebug()
    {
        return debug;
    }

    public final void setDebug(boolean debug)
    {
        this.debug = debug;
    }

    public final void logDebug(String format, Object... args)
    {
        if (debug && log.isDebugEnabled()) {
            log.debug(prefix(format), args);
        }
    }

    public final void logInfo(String format, Object... args)
    {
        log.info(prefix(format), args);
    }

    public final void logWarning(String format, Object... args)
    {
        log.warn(prefix(format), args);
    }

    public final void logError(String format, Object... args)
    {
        log.error(prefix(format), args);
    }

    private String prefix(String format)
    {
        return this + ": " + format;
    }

    /**
     * Static description of the block, suitable for diagnostics.
     */
    public Map<String, Object> describe()
    {
        Map<String, Object> conf = new LinkedHashMap<>();
        conf.put("name", name);
        conf.put("class", typeName(getClass()));
        conf.put("comment", config.comment());
        conf.put("debug", debug);
        return conf;
    }

    @Override
    public String toString()
    {
        return "<" + typeName(getClass()) + " '" + name + "'>";
    }

    /**
     * Simple class name; anonymous classes report their nearest named superclass.
     */
    public static String typeName(Class<?> type)
    {
        Class<?> named = type;
        while (named.getSimpleName().isEmpty()) {
            named = named.getSuperclass();
        }
        return named.getSimpleName();
    }
}
