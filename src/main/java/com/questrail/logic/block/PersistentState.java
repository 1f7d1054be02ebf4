package com.questrail.logic.block;

/**
 * Capability of a sequential block whose state can be saved to the circuit's
 * persistent data map and restored on the next run.
 *
 * <p>The saved value is opaque to the circuit; the storage backing the map
 * decides how it is serialized.</p>
 */
public interface PersistentState
{
    /**
     * Returns the current internal state.
     */
    Object captureState();

    /**
     * Restores a state previously returned by {@link #captureState()}. A block
     * may leave itself uninitialized when the state is no longer usable.
     */
    void restoreState(Object state);
}
