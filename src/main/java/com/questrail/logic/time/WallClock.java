package com.questrail.logic.time;

import java.time.Duration;
import java.time.Instant;

/**
 * Calendar time of a circuit, for timestamps that outlive the process: the
 * stop time, persisted FSM timer expiry, observability events.
 *
 * <p>It may jump (NTP, manual setting) and is never used to schedule timers.</p>
 */
public interface WallClock
{
    Instant now();

    /**
     * Time left until {@code instant}; zero or negative when it has passed.
     */
    default Duration until(Instant instant)
    {
        return Duration.between(now(), instant);
    }

    default boolean hasPassed(Instant instant)
    {
        return instant.isBefore(now());
    }
}
