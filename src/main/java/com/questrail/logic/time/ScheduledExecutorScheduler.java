package com.questrail.logic.time;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a
 * {@link ScheduledExecutorService}.
 *
 * <h2>Design</h2>
 * <p>Monotonic deadlines are converted into relative delays at scheduling time
 * using the provided {@link MonotonicClock}. The same clock must be used by the
 * callers computing the deadlines.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>An executor passed to the constructor is not owned by this class.
 * {@link #daemon(MonotonicClock)} creates a private single-thread daemon
 * executor that lives as long as the JVM.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates a scheduler with its own daemon timer thread.
     */
    public static ScheduledExecutorScheduler daemon(MonotonicClock clock) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "circuit-timers");
            t.setDaemon(true);
            return t;
        });
        return new ScheduledExecutorScheduler(executor, clock);
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // A deadline in the past runs immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }
}
