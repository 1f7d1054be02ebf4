package com.questrail.logic.block;

import java.util.concurrent.CompletableFuture;

/**
 * Capability of a block with an asynchronous cleanup step, awaited after the
 * block's synchronous {@code stop()} and bounded by
 * {@code BlockConfig.stopTimeout()} or the runtime default. Timeouts and
 * failures are logged only.
 */
public interface AsyncStop
{
    CompletableFuture<?> stopAsync();
}
