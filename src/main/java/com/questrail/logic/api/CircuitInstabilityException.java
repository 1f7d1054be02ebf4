package com.questrail.logic.api;

/**
 * The propagation scheduler exceeded its evaluation limit; the circuit contains
 * a feedback loop that does not settle.
 */
public final class CircuitInstabilityException extends CircuitFailureException
{
    public CircuitInstabilityException(String message) {
        super(message);
    }
}
