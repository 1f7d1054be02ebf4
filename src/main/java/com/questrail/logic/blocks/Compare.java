package com.questrail.logic.blocks;

import com.questrail.logic.api.Undef;
import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.block.CBlock;
import com.questrail.logic.block.Connections;
import com.questrail.logic.block.InputExpectation;
import com.questrail.logic.kernel.Circuit;

import java.util.Map;

/**
 * Comparator with hysteresis.
 *
 * <p>The output turns true when the input reaches {@code high} and false when it
 * drops below {@code low}. The first evaluation compares with the midpoint.</p>
 */
public final class Compare extends CBlock {

    private final double low;
    private final double high;

    public Compare(Circuit circuit, String name, BlockConfig config, double low, double high) {
        super(circuit, name, config);
        if (high < low) {
            throw new IllegalArgumentException("high threshold cannot be lower than low threshold");
        }
        this.low = low;
        this.high = high;
    }

    public Compare(Circuit circuit, String name, double low, double high) {
        this(circuit, name, null, low, high);
    }

    @Override
    protected Object calcOutput() {
        double threshold;
        if (output() == Undef.UNDEF) {
            threshold = (low + high) / 2;
        } else {
            threshold = Boolean.TRUE.equals(output()) ? low : high;
        }
        return ((Number) in().positional(0)).doubleValue() >= threshold;
    }

    @Override
    public void start() {
        super.start();
        checkSignature(Map.of(Connections.POSITIONAL, InputExpectation.group(1)));
    }
}
