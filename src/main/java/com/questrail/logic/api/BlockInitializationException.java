package com.questrail.logic.api;

/**
 * One or more sequential blocks were left without an output after all
 * initialization steps.
 */
public final class BlockInitializationException extends CircuitFailureException
{
    public BlockInitializationException(String message) {
        super(message);
    }
}
