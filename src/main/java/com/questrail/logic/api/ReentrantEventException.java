package com.questrail.logic.api;

/**
 * A block was asked to handle an event while it was still handling another one.
 */
public final class ReentrantEventException extends CircuitFailureException
{
    public ReentrantEventException(String message) {
        super(message);
    }
}
