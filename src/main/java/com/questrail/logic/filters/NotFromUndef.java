package com.questrail.logic.filters;

import com.questrail.logic.api.EventData;
import com.questrail.logic.api.Undef;
import com.questrail.logic.event.EventFilter;

import java.util.Optional;

/**
 * Rejects the initial output event, the change from {@code <UNDEF>} to the
 * first real value.
 */
public enum NotFromUndef implements EventFilter {
    INSTANCE;

    @Override
    public Optional<EventData> apply(EventData data) {
        return data.getOrDefault(EventData.PREVIOUS, Undef.UNDEF) == Undef.UNDEF
                ? Optional.empty()
                : Optional.of(data);
    }
}
