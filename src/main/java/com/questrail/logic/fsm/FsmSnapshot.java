package com.questrail.logic.fsm;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Saved internal state of an {@link Fsm}.
 *
 * @param state       the FSM state
 * @param timerExpiry wall-clock expiry of the running timer, {@code null} if none
 * @param sdata       additional state data
 */
public record FsmSnapshot(String state, Instant timerExpiry, Map<String, Object> sdata)
{
    public FsmSnapshot
    {
        Objects.requireNonNull(state, "state");
        sdata = sdata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sdata));
    }
}
