package com.questrail.logic.filters;

import com.questrail.logic.api.EventData;
import com.questrail.logic.event.EventFilter;

import java.util.Optional;

/**
 * Passes numeric values differing by at least {@code delta} from the last
 * value passed. The first value always passes.
 *
 * <p>Stateful: use one instance per event.</p>
 */
public final class Delta implements EventFilter {

    private final double delta;
    private Double last;

    public Delta(double delta) {
        if (delta < 0 || Double.isNaN(delta)) {
            throw new IllegalArgumentException("delta must be a non-negative number");
        }
        this.delta = delta;
    }

    @Override
    public Optional<EventData> apply(EventData data) {
        Object raw = data.get(EventData.VALUE);
        if (!(raw instanceof Number n)) {
            throw new IllegalArgumentException("Delta: numeric value expected, got: " + raw);
        }
        double value = n.doubleValue();
        if (last == null || Math.abs(last - value) >= delta) {
            last = value;
            return Optional.of(data);
        }
        return Optional.empty();
    }
}
