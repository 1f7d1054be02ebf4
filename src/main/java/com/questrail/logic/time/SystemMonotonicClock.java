package com.questrail.logic.time;

/**
 * {@link System#nanoTime()}, the default elapsed-time source of a circuit.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }

    @Override
    public String toString() {
        return "system nanoTime";
    }
}
