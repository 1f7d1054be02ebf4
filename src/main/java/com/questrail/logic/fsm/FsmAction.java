package com.questrail.logic.fsm;

import com.questrail.logic.api.EventData;

/**
 * Entry or exit callback of an FSM state.
 *
 * <p>An entry callback may send one further event to its own FSM, which
 * makes the entered state intermediate (a chained transition).</p>
 */
@FunctionalInterface
public interface FsmAction<F extends Fsm>
{
    void run(F fsm, EventData data);
}
