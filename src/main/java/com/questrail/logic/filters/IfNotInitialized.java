package com.questrail.logic.filters;

import com.questrail.logic.api.EventData;
import com.questrail.logic.block.BlockRef;
import com.questrail.logic.block.SBlock;
import com.questrail.logic.event.EventFilter;
import com.questrail.logic.kernel.Circuit;

import java.util.Optional;

/**
 * Passes events only while a sequential block is not initialized. Typically
 * used to feed an initial value from another source.
 */
public final class IfNotInitialized implements EventFilter {

    private final BlockRef<SBlock> control;

    public IfNotInitialized(Object control) {
        this.control = BlockRef.from(control, SBlock.class);
    }

    @Override
    public void resolveReferences(Circuit circuit) {
        control.resolve(circuit);
    }

    @Override
    public Optional<EventData> apply(EventData data) {
        return control.get().isInitialized() ? Optional.empty() : Optional.of(data);
    }
}
