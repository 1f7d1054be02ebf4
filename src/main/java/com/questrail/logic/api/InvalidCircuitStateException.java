package com.questrail.logic.api;

/**
 * An operation was attempted in a circuit lifecycle state that does not permit
 * it, e.g. connecting blocks after finalization or restarting a finished
 * simulation.
 */
public final class InvalidCircuitStateException extends CircuitException
{
    public InvalidCircuitStateException(String message) {
        super(message);
    }

    public InvalidCircuitStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
