package com.questrail.logic.event;

import com.questrail.logic.api.EventData;
import com.questrail.logic.block.SBlock;

/**
 * Handler of one event type for one sequential block type.
 */
@FunctionalInterface
public interface EventHandler<B extends SBlock> {

    Object handle(B block, EventData data);
}
