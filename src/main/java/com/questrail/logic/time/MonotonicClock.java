package com.questrail.logic.time;

import java.time.Duration;

/**
 * Elapsed-time source of a circuit. FSM timers and the async init/stop
 * deadlines are measured with it; persisted timestamps use {@link WallClock}.
 */
public interface MonotonicClock
{
    /**
     * Current tick in nanoseconds. Only differences between two ticks are meaningful.
     */
    long nowNanos();

    /**
     * Time elapsed since a tick taken earlier from this clock.
     */
    default Duration elapsedSince(long startNanos)
    {
        return Duration.ofNanos(nowNanos() - startNanos);
    }

    /**
     * Tick at which {@code delay} from now expires.
     */
    default long deadlineAfter(Duration delay)
    {
        return nowNanos() + delay.toNanos();
    }
}
