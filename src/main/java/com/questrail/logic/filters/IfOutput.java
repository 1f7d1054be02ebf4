package com.questrail.logic.filters;

import com.questrail.logic.api.EventData;
import com.questrail.logic.api.Truth;
import com.questrail.logic.block.Block;
import com.questrail.logic.block.BlockRef;
import com.questrail.logic.event.EventFilter;
import com.questrail.logic.kernel.Circuit;

import java.util.Optional;

/**
 * Passes events only while the output of a control block is true.
 */
public final class IfOutput implements EventFilter {

    private final BlockRef<Block> control;

    /**
     * @param control a block or a block name
     */
    public IfOutput(Object control) {
        this.control = BlockRef.from(control, Block.class);
    }

    @Override
    public void resolveReferences(Circuit circuit) {
        control.resolve(circuit);
    }

    @Override
    public Optional<EventData> apply(EventData data) {
        return Truth.of(control.get().output()) ? Optional.of(data) : Optional.empty();
    }
}
