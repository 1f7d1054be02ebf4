package com.questrail.logic.block;

import com.questrail.logic.api.Undef;
import com.questrail.logic.event.Event;
import com.questrail.logic.time.TimePeriods;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * BlockConfig
 * -----------------------------------------------------------------------------
 * Construction options common to all blocks.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>comment</b> - free text description</li>
 *   <li><b>onOutput</b> - events sent when the output changes</li>
 *   <li><b>onEveryOutput</b> - sequential blocks only: events sent on every
 *       output assignment, changed or not</li>
 *   <li><b>initDefault</b> - fallback initialization value, {@link Undef#UNDEF}
 *       for none; requires {@link InitFromValue}</li>
 *   <li><b>persistent</b>, <b>syncState</b>, <b>expiration</b> - state
 *       persistence options; require {@link PersistentState}. With
 *       {@code syncState} the state is saved after every event, otherwise only
 *       at startup and shutdown. Saved state older than {@code expiration} is
 *       not restored ({@code null} = never expires).</li>
 *   <li><b>initTimeout</b> / <b>stopTimeout</b> - bounds of the asynchronous
 *       steps; require {@link AsyncInit} / {@link AsyncStop}. {@code null} means
 *       the runtime default.</li>
 *   <li><b>debug</b> - initial state of the block's debug flag</li>
 * </ul>
 */
public record BlockConfig(
        String comment,
        List<Event> onOutput,
        List<Event> onEveryOutput,
        Object initDefault,
        boolean persistent,
        boolean syncState,
        Duration expiration,
        Duration initTimeout,
        Duration stopTimeout,
        boolean debug
) {
    private static final BlockConfig DEFAULTS = builder().build();

    public BlockConfig {
        Objects.requireNonNull(comment, "comment");
        onOutput = List.copyOf(Objects.requireNonNull(onOutput, "onOutput"));
        onEveryOutput = List.copyOf(Objects.requireNonNull(onEveryOutput, "onEveryOutput"));
        if (expiration != null && expiration.isNegative()) {
            throw new IllegalArgumentException("expiration must be non-negative");
        }
        if (initTimeout != null && initTimeout.isNegative()) {
            throw new IllegalArgumentException("initTimeout must be non-negative");
        }
        if (stopTimeout != null && stopTimeout.isNegative()) {
            throw new IllegalArgumentException("stopTimeout must be non-negative");
        }
    }

    public static BlockConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasInitDefault() {
        return initDefault != Undef.UNDEF;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.comment = comment;
        b.onOutput.addAll(onOutput);
        b.onEveryOutput.addAll(onEveryOutput);
        b.initDefault = initDefault;
        b.persistent = persistent;
        b.syncState = syncState;
        b.expiration = expiration;
        b.initTimeout = initTimeout;
        b.stopTimeout = stopTimeout;
        b.debug = debug;
        return b;
    }

    public static final class Builder {
        private String comment = "";
        private final List<Event> onOutput = new ArrayList<>();
        private final List<Event> onEveryOutput = new ArrayList<>();
        private Object initDefault = Undef.UNDEF;
        private boolean persistent;
        private boolean syncState = true;
        private Duration expiration;
        private Duration initTimeout;
        private Duration stopTimeout;
        private boolean debug;

        private Builder() {
        }

        public Builder withComment(String comment) {
            this.comment = Objects.requireNonNull(comment, "comment");
            return this;
        }

        public Builder withOnOutput(Event... events) {
            onOutput.addAll(Arrays.asList(events));
            return this;
        }

        public Builder withOnEveryOutput(Event... events) {
            onEveryOutput.addAll(Arrays.asList(events));
            return this;
        }

        public Builder withInitDefault(Object initDefault) {
            this.initDefault = initDefault;
            return this;
        }

        public Builder withPersistent(boolean persistent) {
            this.persistent = persistent;
            return this;
        }

        public Builder withSyncState(boolean syncState) {
            this.syncState = syncState;
            return this;
        }

        /**
         * @param expiration a {@link Duration}, seconds or a period string; {@code null} for none
         */
        public Builder withExpiration(Object expiration) {
            this.expiration = TimePeriods.toDuration(expiration);
            return this;
        }

        public Builder withInitTimeout(Object initTimeout) {
            this.initTimeout = TimePeriods.toDuration(initTimeout);
            return this;
        }

        public Builder withStopTimeout(Object stopTimeout) {
            this.stopTimeout = TimePeriods.toDuration(stopTimeout);
            return this;
        }

        public Builder withDebug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public BlockConfig build() {
            return new BlockConfig(comment, onOutput, onEveryOutput, initDefault,
                    persistent, syncState, expiration, initTimeout, stopTimeout, debug);
        }
    }
}
