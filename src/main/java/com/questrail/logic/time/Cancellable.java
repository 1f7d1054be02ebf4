package com.questrail.logic.time;

/**
 * Handle of a pending {@link MonotonicScheduler} task. An FSM keeps one while
 * its timed state is active.
 */
@FunctionalInterface
public interface Cancellable
{
    /**
     * @return {@code false} when the task has already fired or was cancelled
     */
    boolean cancel();
}
