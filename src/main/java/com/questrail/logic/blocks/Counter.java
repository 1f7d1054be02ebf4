package com.questrail.logic.blocks;

import com.questrail.logic.api.EventData;
import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.block.InitFromValue;
import com.questrail.logic.block.PersistentState;
import com.questrail.logic.block.SBlock;
import com.questrail.logic.event.HandlerTable;
import com.questrail.logic.kernel.Circuit;

/**
 * Integer counter, optionally counting modulo {@code M}.
 *
 * <p>Events: {@code inc} and {@code dec} (payload {@code amount}, default 1),
 * {@code put} ({@code value}) and {@code reset} (back to the init default).
 * Each returns the new value. The init default is 0 unless configured.</p>
 */
public final class Counter extends SBlock implements InitFromValue, PersistentState {

    static final HandlerTable<Counter> HANDLERS = HandlerTable.builder(Counter.class)
            .on("inc", (c, data) -> c.update(c.current() + amount(data)))
            .on("dec", (c, data) -> c.update(c.current() - amount(data)))
            .on("put", (c, data) -> c.update(toLong(data.get(EventData.VALUE))))
            .on("reset", (c, data) -> c.update(toLong(c.config().initDefault())))
            .build();

    private final Long modulo;

    public Counter(Circuit circuit, String name, BlockConfig config, Long modulo) {
        super(circuit, name, withZeroDefault(config));
        if (modulo != null && modulo == 0) {
            throw new IllegalArgumentException("modulo must not be zero");
        }
        this.modulo = modulo;
    }

    public Counter(Circuit circuit, String name) {
        this(circuit, name, null, null);
    }

    private static BlockConfig withZeroDefault(BlockConfig config) {
        BlockConfig cfg = config == null ? BlockConfig.defaults() : config;
        return cfg.hasInitDefault() ? cfg : cfg.toBuilder().withInitDefault(0L).build();
    }

    @Override
    protected HandlerTable<Counter> eventHandlers() {
        return HANDLERS;
    }

    private long current() {
        return toLong(output());
    }

    private long update(long value) {
        long result = modulo == null ? value : Math.floorMod(value, modulo);
        setOutput(result);
        return result;
    }

    private static long amount(EventData data) {
        return toLong(data.getOrDefault("amount", 1L));
    }

    private static long toLong(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        throw new IllegalArgumentException("Counter value must be an integer, got: " + value);
    }

    @Override
    public void initFromValue(Object value) {
        update(toLong(value));
    }

    @Override
    public Object captureState() {
        return output();
    }

    @Override
    public void restoreState(Object state) {
        update(toLong(state));
    }
}
