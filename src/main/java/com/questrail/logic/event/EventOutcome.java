package com.questrail.logic.event;

/**
 * Special results of {@code SBlock.event}.
 */
public enum EventOutcome {
    /**
     * The event type is not supported and the payload carried the
     * {@code ignore_unknown} flag.
     */
    NOT_IMPLEMENTED
}
