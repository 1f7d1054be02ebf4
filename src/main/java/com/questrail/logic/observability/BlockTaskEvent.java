package com.questrail.logic.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one asynchronous block task (initialization or cleanup).
 */
public record BlockTaskEvent(
    Instant timestamp,
    String blockName,
    Phase phase,
    Outcome outcome,
    Duration elapsed
) {
    public enum Phase {
        INIT,
        STOP
    }

    public enum Outcome {
        COMPLETED,
        TIMED_OUT,
        FAILED,
        CANCELLED
    }
}
