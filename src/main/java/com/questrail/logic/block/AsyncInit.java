package com.questrail.logic.block;

import java.util.concurrent.CompletableFuture;

/**
 * Capability of a block with an asynchronous initialization step.
 *
 * <p>
 * The runtime calls {@link #initAsync()} on the simulation thread and waits for
 * the returned future, bounded by {@code BlockConfig.initTimeout()} or the
 * runtime default. A future still pending at its deadline is cancelled.
 * Completion work touching block state must be posted into the circuit.
 * </p>
 */
public interface AsyncInit
{
    CompletableFuture<?> initAsync();
}
