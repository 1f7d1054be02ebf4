package com.questrail.logic.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * CircuitLauncher
 * =============================================================================
 * Runs a circuit simulation together with supporting tasks (external data
 * sources, servers, test drivers).
 *
 * <p>
 * When any of them finishes, the others are stopped: supporting tasks are
 * interrupted, the simulation is shut down with its regular cleanup. The
 * simulation error, if any, is rethrown; otherwise a failed supporting task is
 * reported as an {@link IllegalStateException}. Cancellations are normal exits.
 * </p>
 */
public final class CircuitLauncher {

    private static final Logger log = LoggerFactory.getLogger(CircuitLauncher.class);

    private CircuitLauncher() {
    }

    /**
     * Runs the simulation and the supporting tasks until the first of them
     * finishes. Without supporting tasks this is {@link CircuitRuntime#runForever()}
     * with the cancellation treated as a normal exit.
     */
    public static void run(CircuitRuntime runtime, Callable<?>... supportingTasks) throws InterruptedException {
        run(runtime, false, supportingTasks);
    }

    /**
     * Like {@link #run(CircuitRuntime, Callable[])}; with {@code shutdownHook}
     * a JVM shutdown request stops the simulation gracefully.
     */
    public static void run(CircuitRuntime runtime, boolean shutdownHook, Callable<?>... supportingTasks)
            throws InterruptedException {
        Objects.requireNonNull(runtime, "runtime");
        if (shutdownHook) {
            installShutdownHook(runtime);
        }
        if (supportingTasks.length == 0) {
            try {
                runtime.runForever();
            } catch (CancellationException e) {
                log.debug("simulation cancelled: {}", e.getMessage());
            }
            return;
        }

        ExecutorService executor = Executors.newFixedThreadPool(supportingTasks.length + 1, r -> {
            Thread t = new Thread(r, "circuit-support");
            t.setDaemon(true);
            return t;
        });
        ExecutorCompletionService<Object> completion = new ExecutorCompletionService<>(executor);
        List<Future<Object>> futures = new ArrayList<>();
        CompletableFuture<Void> simulation = runtime.start();
        // the simulation's end is signalled through the completion service as well
        futures.add(completion.submit(() -> {
            awaitQuietly(simulation);
            return null;
        }));
        try {
            for (Callable<?> task : supportingTasks) {
                @SuppressWarnings("unchecked")
                Callable<Object> callable = (Callable<Object>) Objects.requireNonNull(task, "task");
                futures.add(completion.submit(callable));
            }
            completion.take();
        } finally {
            for (int i = 1; i < futures.size(); i++) {
                futures.get(i).cancel(true);
            }
            runtime.abort(new CancellationException("shutdown"));
            awaitQuietly(simulation);
            executor.shutdownNow();
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Supporting tasks did not terminate");
            }
        }

        Throwable simError = simulationError(simulation);
        if (simError != null) {
            log.error("Error in the simulation: {}", simError.toString());
            throw simError instanceof RuntimeException re ? re : new IllegalStateException(simError);
        }
        for (int i = 1; i < futures.size(); i++) {
            Future<Object> future = futures.get(i);
            if (future.isCancelled()) {
                continue;
            }
            try {
                future.get();
            } catch (CancellationException e) {
                log.debug("supporting task #{} cancelled", i);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (!(cause instanceof CancellationException) && !(cause instanceof InterruptedException)) {
                    log.error("Error in supporting task #{}: {}", i, cause.toString());
                    throw new IllegalStateException("Supporting task #" + i + " failed", cause);
                }
            }
        }
    }

    private static void awaitQuietly(CompletableFuture<Void> simulation) throws InterruptedException {
        try {
            simulation.get();
        } catch (ExecutionException | CancellationException e) {
            // inspected by simulationError()
            log.trace("simulation finished: {}", e.toString());
        }
    }

    private static Throwable simulationError(CompletableFuture<Void> simulation) {
        if (simulation.isCancelled()) {
            return null;
        }
        try {
            simulation.join();
            return null;
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            return cause instanceof CancellationException ? null : cause;
        }
    }

    /**
     * Stops the simulation gracefully when the JVM is shutting down.
     */
    public static void installShutdownHook(CircuitRuntime runtime) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.warn("JVM shutdown requested");
            try {
                runtime.shutdown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.error("Error during shutdown: {}", e.toString());
            }
        }, "circuit-shutdown-hook"));
    }
}
