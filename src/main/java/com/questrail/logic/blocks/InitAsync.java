package com.questrail.logic.blocks;

import com.questrail.logic.block.AsyncInit;
import com.questrail.logic.block.BlockConfig;
import com.questrail.logic.block.InitFromValue;
import com.questrail.logic.block.SBlock;
import com.questrail.logic.kernel.Circuit;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * A block whose output is produced once, asynchronously, during circuit
 * initialization.
 *
 * <p>
 * When the initializer fails or times out, the block falls back to its init
 * default, or to {@code null} without sending output events, so that a slow
 * data source does not prevent the circuit from starting.
 * </p>
 */
public final class InitAsync extends SBlock implements AsyncInit, InitFromValue {

    private final Supplier<? extends CompletableFuture<?>> initializer;

    public InitAsync(Circuit circuit, String name, BlockConfig config,
                     Supplier<? extends CompletableFuture<?>> initializer) {
        super(circuit, name, config);
        this.initializer = Objects.requireNonNull(initializer, "initializer");
    }

    @Override
    public CompletableFuture<?> initAsync() {
        CompletableFuture<?> source = initializer.get();
        CompletableFuture<Void> done = new CompletableFuture<>();
        source.whenComplete((result, error) -> {
            if (error != null) {
                done.completeExceptionally(error);
            } else {
                // the output is set on the simulation thread, unless timed out meanwhile
                circuit().post(() -> {
                    if (!done.isDone()) {
                        setOutput(result);
                        done.complete(null);
                    }
                });
            }
        });
        done.whenComplete((ignored, error) -> {
            if (done.isCancelled()) {
                source.cancel(true);
            }
        });
        return done;
    }

    @Override
    protected void initRegular() {
        if (isInitialized() || config().hasInitDefault()) {
            return;
        }
        // only to prevent a startup failure
        setOutputQuietly(null);
    }

    @Override
    public void initFromValue(Object value) {
        setOutput(value);
    }
}
