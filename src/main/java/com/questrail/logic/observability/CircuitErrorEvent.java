package com.questrail.logic.observability;

import java.time.Instant;

/**
 * Record representing an error reported by the circuit runtime.
 *
 * @param blockName the block involved, {@code null} for circuit-wide errors
 */
public record CircuitErrorEvent(
    Instant timestamp,
    String blockName,
    String message,
    Throwable cause
) {
}
