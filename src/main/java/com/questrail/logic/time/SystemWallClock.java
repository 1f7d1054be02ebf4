package com.questrail.logic.time;

import java.time.Clock;
import java.time.Instant;

/**
 * The host's UTC clock, the default calendar source of a circuit.
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    private final Clock utc = Clock.systemUTC();

    @Override
    public Instant now() {
        return utc.instant();
    }

    @Override
    public String toString() {
        return "system UTC";
    }
}
