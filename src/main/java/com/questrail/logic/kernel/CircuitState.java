package com.questrail.logic.kernel;

/**
 * Lifecycle of a circuit. States are only ever entered in declaration order;
 * any state may be skipped on the way to {@link #TERMINATED}.
 */
public enum CircuitState {
    /** Blocks may be added and connected. */
    BUILDING,
    /** Topology frozen, references resolved. */
    FINALIZED,
    /** Every block's start hook ran. */
    STARTED,
    /** Sequential blocks are being initialized. */
    INITIALIZING,
    /** Steady-state propagation. */
    RUNNING,
    /** Blocks are being stopped after a cancellation or an error. */
    STOPPING,
    /** Done; the circuit holds the terminating error. */
    TERMINATED
}
