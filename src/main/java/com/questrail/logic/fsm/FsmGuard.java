package com.questrail.logic.fsm;

import com.questrail.logic.api.EventData;

/**
 * Condition gating an FSM transition. Receives the data of the event being
 * processed; returning {@code false} rejects the transition.
 */
@FunctionalInterface
public interface FsmGuard<F extends Fsm>
{
    boolean test(F fsm, EventData data);
}
