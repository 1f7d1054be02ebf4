package com.questrail.logic.blocks;

import com.questrail.logic.api.Truth;
import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.kernel.Circuit;

/**
 * Logical AND of the positional inputs; true with no inputs.
 */
public final class And extends FuncBlock {

    public And(Circuit circuit, String name, BlockConfig config) {
        super(circuit, name, config, in -> in.positional().stream().allMatch(Truth::of));
    }

    public And(Circuit circuit, String name) {
        this(circuit, name, null);
    }
}
