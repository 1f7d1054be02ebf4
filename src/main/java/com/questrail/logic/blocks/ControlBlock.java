package com.questrail.logic.blocks;

import com.questrail.logic.api.CircuitFailureException;
import com.questrail.logic.api.EventData;
import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.block.SBlock;
import com.questrail.logic.event.HandlerTable;
import com.questrail.logic.kernel.Circuit;

import java.util.concurrent.CancellationException;

/**
 * The circuit control block {@code _ctrl}, created on first reference.
 *
 * <ul>
 *   <li>{@code shutdown} - stops the simulation with a cancellation</li>
 *   <li>{@code abort} - stops the simulation with an error; the payload key
 *       {@code error} may carry the cause</li>
 * </ul>
 */
public final class ControlBlock extends SBlock {

    static final HandlerTable<ControlBlock> HANDLERS = HandlerTable.builder(ControlBlock.class)
            .on("shutdown", ControlBlock::onShutdown)
            .on("abort", ControlBlock::onAbort)
            .build();

    public ControlBlock(Circuit circuit) {
        super(circuit, Circuit.CONTROL_BLOCK_NAME,
                BlockConfig.builder().withComment("Simulation Control Block").build());
    }

    @Override
    protected HandlerTable<ControlBlock> eventHandlers() {
        return HANDLERS;
    }

    private Object onShutdown(EventData data) {
        Object source = data.getOrDefault(EventData.SOURCE, "<no-source-data>");
        circuit().abort(new CancellationException(this + ": shutdown requested by '" + source + "'"));
        return null;
    }

    private Object onAbort(EventData data) {
        Object source = data.getOrDefault(EventData.SOURCE, "<no-source-data>");
        Object error = data.getOrDefault("error", "<no-error-data>");
        String message = this + ": error reported by '" + source + "': " + error;
        circuit().abort(error instanceof Throwable t
                ? new CircuitFailureException(message, t)
                : new CircuitFailureException(message));
        return null;
    }

    @Override
    protected void initRegular() {
        setOutput(null);
    }
}
