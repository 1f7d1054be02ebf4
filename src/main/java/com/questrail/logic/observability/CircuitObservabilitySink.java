package com.questrail.logic.observability;

/**
 * Main interface for receiving circuit runtime observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface CircuitObservabilitySink {
    /**
     * Called when the circuit moves to another lifecycle state.
     * @param event the transition event details
     */
    void onStateTransition(CircuitStateTransitionEvent event);

    /**
     * Called when an asynchronous init or stop task of a block finishes.
     * @param event the task outcome
     */
    void onBlockTask(BlockTaskEvent event);

    /**
     * Called when the runtime reports an error.
     * @param event the error event
     */
    void onError(CircuitErrorEvent event);
}
