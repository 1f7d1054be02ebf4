package com.questrail.logic.event;

import com.questrail.logic.api.EventData;
import com.questrail.logic.block.Block;
import com.questrail.logic.block.BlockRef;
import com.questrail.logic.block.SBlock;
import com.questrail.logic.kernel.Circuit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Event
 * =============================================================================
 * Descriptor of an event to be sent to a sequential block: destination,
 * event type and a filter pipeline.
 *
 * <p>
 * An {@code Event} is immutable and reusable; it is typically attached to a
 * block's {@code onOutput} configuration. The destination may be given by name
 * and is resolved when the circuit is finalized.
 * </p>
 *
 * <h2>Sending</h2>
 * {@link #send(Block, EventData)} stamps the source block name into the
 * payload, runs the filters in order (a rejecting filter silently drops the
 * event), initializes the destination early if it has not completed its
 * initialization yet, and delivers.
 */
public final class Event {

    public static final String PUT = "put";

    private final BlockRef<SBlock> destination;
    private final EventType etype;
    private final List<EventFilter> filters;

    private Event(BlockRef<SBlock> destination, EventType etype, List<EventFilter> filters) {
        this.destination = Objects.requireNonNull(destination, "destination");
        this.etype = Objects.requireNonNull(etype, "etype");
        this.filters = List.copyOf(filters);
    }

    /**
     * A {@code put} event.
     *
     * @param destination an {@link SBlock} or its name
     */
    public static Event to(Object destination) {
        return to(destination, EventType.of(PUT));
    }

    /**
     * @param destination an {@link SBlock} or its name
     * @param etype       event name or {@link EventType}
     */
    public static Event to(Object destination, Object etype) {
        EventType type = EventType.toType(etype);
        if (type == null) {
            throw new IllegalArgumentException("Event type must not be null");
        }
        return new Event(BlockRef.from(destination, SBlock.class), type, List.of());
    }

    /**
     * An event for the circuit control block requesting an orderly shutdown.
     */
    public static Event shutdown() {
        return to(Circuit.CONTROL_BLOCK_NAME, "shutdown");
    }

    /**
     * An event for the circuit control block aborting the circuit with an
     * error built from the payload.
     */
    public static Event abort() {
        return to(Circuit.CONTROL_BLOCK_NAME, "abort");
    }

    /**
     * Returns a copy with {@code more} appended to the filter pipeline.
     */
    public Event withFilters(EventFilter... more) {
        List<EventFilter> all = new ArrayList<>(filters);
        all.addAll(Arrays.asList(more));
        return new Event(destination, etype, all);
    }

    public BlockRef<SBlock> destination() {
        return destination;
    }

    public EventType type() {
        return etype;
    }

    public List<EventFilter> filters() {
        return filters;
    }

    /**
     * Resolves the destination and the filters' block references.
     */
    public void resolve(Circuit circuit) {
        destination.resolve(circuit);
        for (EventFilter filter : filters) {
            filter.resolveReferences(circuit);
        }
    }

    /**
     * Applies the filters and delivers the event.
     *
     * @return {@code true} if delivered, {@code false} if rejected by a filter
     */
    public boolean send(Block source, EventData data) {
        Objects.requireNonNull(source, "source");
        SBlock dest = destination.resolve(source.circuit());
        if (dest.circuit() != source.circuit()) {
            throw new IllegalArgumentException("event destination " + dest + " is not in the current circuit");
        }
        EventData payload = (data == null ? EventData.empty() : data).with(EventData.SOURCE, source.name());
        for (EventFilter filter : filters) {
            Optional<EventData> result = filter.apply(payload);
            if (result.isEmpty()) {
                source.logDebug("Not sending event {} (rejected by a filter)", this);
                return false;
            }
            payload = result.get();
        }
        if (dest.initStepsCompleted() < 2) {
            // events may arrive while the circuit is still initializing
            dest.logDebug("pending event, initializing early");
            dest.initialize(true);
        }
        source.logDebug("sending event {}", this);
        dest.event(etype, payload);
        return true;
    }

    @Override
    public String toString() {
        return "<Event dest='" + destination.name() + "', event='" + etype + "'>";
    }
}
