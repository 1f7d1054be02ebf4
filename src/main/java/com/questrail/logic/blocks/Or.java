package com.questrail.logic.blocks;

import com.questrail.logic.api.Truth;
import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.kernel.Circuit;

/**
 * Logical OR of the positional inputs; false with no inputs.
 */
public final class Or extends FuncBlock {

    public Or(Circuit circuit, String name, BlockConfig config) {
        super(circuit, name, config, in -> in.positional().stream().anyMatch(Truth::of));
    }

    public Or(Circuit circuit, String name) {
        this(circuit, name, null);
    }
}
