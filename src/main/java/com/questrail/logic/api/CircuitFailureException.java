package com.questrail.logic.api;

/**
 * A fatal error. The circuit cannot continue once one of these was raised:
 * protocol violations, instability, failed initialization and errors escaping
 * block evaluation or event handling.
 */
public class CircuitFailureException extends CircuitException
{
    public CircuitFailureException(String message) {
        super(message);
    }

    public CircuitFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
