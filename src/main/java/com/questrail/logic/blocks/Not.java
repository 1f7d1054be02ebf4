package com.questrail.logic.blocks;

import com.questrail.logic.api.Truth;
import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.block.CBlock;
import com.questrail.logic.block.Connections;
import com.questrail.logic.block.InputExpectation;
import com.questrail.logic.kernel.Circuit;

import java.util.Map;

/**
 * Boolean negation of the single positional input.
 */
public final class Not extends CBlock {

    public Not(Circuit circuit, String name, BlockConfig config) {
        super(circuit, name, config);
    }

    public Not(Circuit circuit, String name) {
        this(circuit, name, null);
    }

    /**
     * Creates the synthetic inverter {@code _not_SOURCE}. Only valid while the
     * circuit materializes reserved blocks.
     */
    public static Not inverterOf(Circuit circuit, String source) {
        Not inverter = new Not(circuit, Circuit.INVERTER_PREFIX + source,
                BlockConfig.builder().withComment("Inverted output of " + source).build());
        inverter.connect(source);
        return inverter;
    }

    @Override
    protected Object calcOutput() {
        return !Truth.of(in().positional(0));
    }

    @Override
    public void start() {
        super.start();
        checkSignature(Map.of(Connections.POSITIONAL, InputExpectation.group(1)));
    }
}
