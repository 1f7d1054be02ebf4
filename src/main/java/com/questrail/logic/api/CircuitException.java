package com.questrail.logic.api;

/**
 * Base type of all circuit runtime errors.
 */
public class CircuitException extends RuntimeException
{
    public CircuitException(String message) {
        super(message);
    }

    public CircuitException(String message, Throwable cause) {
        super(message, cause);
    }
}
