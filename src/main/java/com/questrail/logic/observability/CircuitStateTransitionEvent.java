package com.questrail.logic.observability;

import com.questrail.logic.kernel.CircuitState;

import java.time.Instant;

/**
 * Record representing a lifecycle state change of a circuit.
 */
public record CircuitStateTransitionEvent(
    Instant timestamp,
    CircuitState oldState,
    CircuitState newState
) {
    public boolean isTerminal() {
        return newState == CircuitState.TERMINATED;
    }
}
