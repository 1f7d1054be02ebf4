package com.questrail.logic.api;

/**
 * The destination block does not support the event type.
 */
public final class UnknownEventException extends CircuitException
{
    public UnknownEventException(String message) {
        super(message);
    }
}
