package com.questrail.logic.runtime;

import java.time.Duration;
import java.util.Objects;

/**
 * LifecyclePolicy
 * -----------------------------------------------------------------------------
 * Runtime-wide timing defaults for the asynchronous lifecycle steps.
 *
 * <p>A block's own {@code BlockConfig.initTimeout()} / {@code stopTimeout()}
 * takes precedence. A zero timeout (from either source) disables the step for
 * that block.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>initTimeout</b> - how long the startup waits for a block's
 *       asynchronous initialization before cancelling it and falling back to
 *       the synchronous initialization.</li>
 *   <li><b>stopTimeout</b> - how long the shutdown waits for a block's
 *       asynchronous cleanup. A timeout is logged, never fatal.</li>
 * </ul>
 */
public record LifecyclePolicy(
        Duration initTimeout,
        Duration stopTimeout
) {
    /**
     * Canonical constructor with validation.
     */
    public LifecyclePolicy {
        Objects.requireNonNull(initTimeout, "initTimeout");
        Objects.requireNonNull(stopTimeout, "stopTimeout");

        if (initTimeout.isNegative()) {
            throw new IllegalArgumentException("initTimeout must be non-negative");
        }
        if (stopTimeout.isNegative()) {
            throw new IllegalArgumentException("stopTimeout must be non-negative");
        }
    }

    /**
     * Default values: 10 s for both steps.
     */
    public static LifecyclePolicy defaults() {
        return new LifecyclePolicy(Duration.ofSeconds(10), Duration.ofSeconds(10));
    }
}
