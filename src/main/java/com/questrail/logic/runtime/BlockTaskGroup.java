package com.questrail.logic.runtime;

import com.questrail.logic.block.Block;
import com.questrail.logic.kernel.Circuit;
import com.questrail.logic.observability.BlockTaskEvent;
import com.questrail.logic.observability.CircuitErrorEvent;
import com.questrail.logic.observability.CircuitObservabilitySink;
import com.questrail.logic.time.MonotonicClock;
import com.questrail.logic.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * BlockTaskGroup
 * =============================================================================
 * A set of concurrently running asynchronous block tasks (initializations or
 * cleanups), each bounded by its own timeout measured from a common start.
 *
 * <p>
 * Errors are suppressed: a task that fails or times out is logged, reported to
 * the observability sink and counted. A timed out task is cancelled.
 * </p>
 *
 * <p>
 * When the circuit aborts while waiting, the tasks still running are cancelled
 * and reported as {@link BlockTaskEvent.Outcome#CANCELLED}; they are not counted
 * as errors.
 * </p>
 *
 * <h2>Waiting</h2>
 * <ul>
 *   <li>{@link #awaitAll(boolean) awaitAll(true)} keeps running actions posted
 *       into the circuit while waiting. Used during initialization, where task
 *       completions deliver their results through the inbox.</li>
 *   <li>{@link #awaitAll(boolean) awaitAll(false)} only waits. Used during
 *       shutdown.</li>
 * </ul>
 */
final class BlockTaskGroup {

    private static final Logger log = LoggerFactory.getLogger(BlockTaskGroup.class);

    private static final Runnable WAKEUP = () -> { };

    private final class Task {
        final Block block;
        final CompletableFuture<?> future;
        final Duration timeout;
        final long deadlineNanos;
        boolean settled;

        Task(Block block, CompletableFuture<?> future, Duration timeout) {
            this.block = block;
            this.future = future;
            this.timeout = timeout;
            this.deadlineNanos = startNanos + timeout.toNanos();
        }
    }

    private final Circuit circuit;
    private final BlockTaskEvent.Phase phase;
    private final CircuitObservabilitySink sink;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final long startNanos;
    private final List<Task> tasks = new ArrayList<>();
    private int errors;

    BlockTaskGroup(Circuit circuit, BlockTaskEvent.Phase phase, CircuitObservabilitySink sink,
                   MonotonicClock clock, WallClock wallClock) {
        this.circuit = Objects.requireNonNull(circuit, "circuit");
        this.phase = Objects.requireNonNull(phase, "phase");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.startNanos = clock.nowNanos();
    }

    private String jobName() {
        return phase == BlockTaskEvent.Phase.INIT ? "init" : "stop";
    }

    /**
     * Starts a task. A starter that throws counts as a failed task.
     */
    void start(Block block, Supplier<? extends CompletableFuture<?>> starter, Duration timeout) {
        CompletableFuture<?> future;
        try {
            future = Objects.requireNonNull(starter.get(), "async task returned null");
        } catch (RuntimeException e) {
            failed(block, e);
            return;
        }
        future.whenComplete((result, error) -> circuit.post(WAKEUP));
        tasks.add(new Task(block, future, timeout));
    }

    /**
     * Waits for all tasks, longest timeout first.
     *
     * @return the number of failed or timed out tasks
     */
    int awaitAll(boolean pumpInbox) throws InterruptedException {
        if (!tasks.isEmpty()) {
            log.debug("Waiting for {} async {} task(s)", tasks.size(), jobName());
        }
        tasks.sort(Comparator.comparing((Task t) -> t.timeout).reversed());
        if (pumpInbox) {
            pumpUntilSettled();
        } else {
            for (Task task : tasks) {
                waitFor(task);
            }
        }
        if (errors > 0) {
            log.error("{} block {} error(s) suppressed", errors, jobName());
        }
        return errors;
    }

    private void pumpUntilSettled() throws InterruptedException {
        while (true) {
            long now = clock.nowNanos();
            long nextDeadline = Long.MAX_VALUE;
            for (Task task : tasks) {
                if (task.settled) {
                    continue;
                }
                if (task.future.isDone()) {
                    settle(task);
                } else if (now - task.deadlineNanos >= 0) {
                    timedOut(task);
                } else {
                    nextDeadline = Math.min(nextDeadline, task.deadlineNanos);
                }
            }
            if (nextDeadline == Long.MAX_VALUE) {
                return;
            }
            if (circuit.isAborted()) {
                cancelUnsettled();
                return;
            }
            Runnable action = circuit.awaitPosted(nextDeadline - now, TimeUnit.NANOSECONDS);
            if (action != null) {
                circuit.runAction(action);
            }
        }
    }

    private void cancelUnsettled() {
        for (Task task : tasks) {
            if (task.settled) {
                continue;
            }
            task.settled = true;
            task.future.cancel(true);
            task.block.logDebug("{} cancelled, the circuit was aborted", jobName());
            report(task.block, BlockTaskEvent.Outcome.CANCELLED);
        }
    }

    private void waitFor(Task task) throws InterruptedException {
        long remaining = task.deadlineNanos - clock.nowNanos();
        try {
            if (!task.future.isDone()) {
                task.future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
            }
        } catch (TimeoutException e) {
            timedOut(task);
            return;
        } catch (ExecutionException | CancellationException e) {
            // reported by settle()
            log.trace("{} task of {} completed exceptionally", jobName(), task.block.name());
        }
        settle(task);
    }

    private void settle(Task task) {
        task.settled = true;
        Throwable error = exceptionOf(task.future);
        if (error == null) {
            report(task.block, BlockTaskEvent.Outcome.COMPLETED);
        } else {
            failed(task.block, error);
        }
    }

    private void timedOut(Task task) {
        task.settled = true;
        task.future.cancel(true);
        errors++;
        task.block.logWarning("{} timeout, check timeout value ({} ms)", jobName(), task.timeout.toMillis());
        report(task.block, BlockTaskEvent.Outcome.TIMED_OUT);
    }

    private void failed(Block block, Throwable error) {
        errors++;
        block.logError("{} error: {}", jobName(), error.toString(), error);
        report(block, BlockTaskEvent.Outcome.FAILED);
        sink.onError(new CircuitErrorEvent(wallClock.now(), block.name(), jobName() + " error", error));
    }

    private void report(Block block, BlockTaskEvent.Outcome outcome) {
        Duration elapsed = clock.elapsedSince(startNanos);
        sink.onBlockTask(new BlockTaskEvent(wallClock.now(), block.name(), phase, outcome, elapsed));
    }

    private static Throwable exceptionOf(CompletableFuture<?> future) {
        if (!future.isCompletedExceptionally()) {
            return null;
        }
        try {
            future.join();
            return null;
        } catch (CompletionException e) {
            return e.getCause() != null ? e.getCause() : e;
        } catch (CancellationException e) {
            return e;
        }
    }
}
