package com.questrail.logic.event;

import com.questrail.logic.block.SBlock;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * HandlerTable
 * =============================================================================
 * Immutable mapping from event names to specialized handlers of one block type.
 *
 * <p>
 * Each block type builds its table once, in a static initializer, and returns
 * it from {@code SBlock.eventHandlers()}. Subclasses extend the parent table
 * with {@link #extend(Class)}:
 * </p>
 *
 * <pre>
 *   static final HandlerTable&lt;Counter&gt; HANDLERS = HandlerTable.builder(Counter.class)
 *       .on("inc", Counter::onInc)
 *       .on("dec", Counter::onDec)
 *       .build();
 * </pre>
 *
 * Event types without an entry are delivered to the block's generic handler.
 */
public final class HandlerTable<B extends SBlock> {

    private static final HandlerTable<SBlock> EMPTY = new HandlerTable<>(SBlock.class, Map.of());

    private final Class<B> blockType;
    private final Map<String, EventHandler<? super B>> handlers;

    private HandlerTable(Class<B> blockType, Map<String, EventHandler<? super B>> handlers) {
        this.blockType = blockType;
        this.handlers = handlers;
    }

    public static HandlerTable<SBlock> empty() {
        return EMPTY;
    }

    public static <B extends SBlock> Builder<B> builder(Class<B> blockType) {
        return new Builder<>(blockType, Map.of());
    }

    /**
     * Starts a builder for a subclass, inheriting every entry of this table.
     */
    public <C extends B> Builder<C> extend(Class<C> subType) {
        return new Builder<>(subType, handlers);
    }

    public Class<B> blockType() {
        return blockType;
    }

    public Set<String> eventNames() {
        return handlers.keySet();
    }

    public boolean handles(String eventName) {
        return handlers.containsKey(eventName);
    }

    /**
     * Returns the handler registered for {@code eventName}, or {@code null} when
     * the event goes to the block's generic handler.
     */
    @SuppressWarnings("unchecked")
    public EventHandler<SBlock> handlerFor(String eventName) {
        return (EventHandler<SBlock>) handlers.get(eventName);
    }

    public static final class Builder<B extends SBlock> {
        private final Class<B> blockType;
        private final Map<String, EventHandler<? super B>> handlers;

        private Builder(Class<B> blockType, Map<String, ? extends EventHandler<? super B>> inherited) {
            this.blockType = Objects.requireNonNull(blockType, "blockType");
            this.handlers = new LinkedHashMap<>(inherited);
        }

        public Builder<B> on(String eventName, EventHandler<? super B> handler) {
            EventType.of(eventName);
            Objects.requireNonNull(handler, "handler");
            handlers.put(eventName, handler);
            return this;
        }

        public HandlerTable<B> build() {
            return new HandlerTable<>(blockType, Collections.unmodifiableMap(new LinkedHashMap<>(handlers)));
        }
    }
}
