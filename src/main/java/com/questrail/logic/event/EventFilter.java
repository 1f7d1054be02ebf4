package com.questrail.logic.event;

import com.questrail.logic.api.EventData;
import com.questrail.logic.kernel.Circuit;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * A stage of an event's filter pipeline.
 *
 * <p>A filter returns the (possibly replaced) payload to continue delivery, or
 * an empty result to reject the event.</p>
 */
@FunctionalInterface
public interface EventFilter {

    Optional<EventData> apply(EventData data);

    /**
     * Resolves block references held by the filter. Called once when the
     * circuit is finalized.
     */
    default void resolveReferences(Circuit circuit) {
    }

    /**
     * A filter passing the payload unchanged when {@code predicate} holds.
     */
    static EventFilter when(Predicate<EventData> predicate) {
        return data -> predicate.test(data) ? Optional.of(data) : Optional.empty();
    }
}
