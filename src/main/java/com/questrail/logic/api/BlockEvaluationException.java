package com.questrail.logic.api;

import java.util.Objects;

/**
 * An exception raised while a block computed its output or handled an event,
 * wrapped with the identity of that block.
 */
public final class BlockEvaluationException extends CircuitFailureException
{
    private final String blockName;

    public BlockEvaluationException(String blockName, String message, Throwable cause) {
        super(message, cause);
        this.blockName = Objects.requireNonNull(blockName, "blockName");
    }

    public String blockName() {
        return blockName;
    }
}
