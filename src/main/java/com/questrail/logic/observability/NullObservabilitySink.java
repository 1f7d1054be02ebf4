package com.questrail.logic.observability;

/**
 * Sink used by a {@code CircuitRuntime} built without one; all events are dropped.
 */
public enum NullObservabilitySink implements CircuitObservabilitySink {
    INSTANCE;

    @Override
    public void onStateTransition(CircuitStateTransitionEvent event) {
    }

    @Override
    public void onBlockTask(BlockTaskEvent event) {
    }

    @Override
    public void onError(CircuitErrorEvent event) {
    }
}
