package com.questrail.logic.filters;

import com.questrail.logic.api.EventData;
import com.questrail.logic.api.Truth;
import com.questrail.logic.api.Undef;
import com.questrail.logic.event.EventFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Passes output events of logical values by edge type.
 *
 * <ul>
 *   <li>rise: false to true</li>
 *   <li>fall: true to false</li>
 *   <li>undefined rise: initial value true (defaults to the rise setting)</li>
 *   <li>undefined fall: initial value false</li>
 * </ul>
 * Values are compared by their truth value.
 */
public final class Edge implements EventFilter {

    private static final Logger log = LoggerFactory.getLogger(Edge.class);

    private final boolean rise;
    private final boolean fall;
    private final boolean undefRise;
    private final boolean undefFall;

    /**
     * @param undefRise {@code null} to follow {@code rise}
     */
    public Edge(boolean rise, boolean fall, Boolean undefRise, boolean undefFall) {
        this.rise = rise;
        this.fall = fall;
        this.undefRise = undefRise != null ? undefRise : rise;
        this.undefFall = undefFall;
        if (!(this.rise || this.fall || this.undefRise || this.undefFall)) {
            log.warn("Edge: all events will be filtered out!");
        }
    }

    public static Edge rise() {
        return new Edge(true, false, null, false);
    }

    public static Edge fall() {
        return new Edge(false, true, null, false);
    }

    public static Edge both() {
        return new Edge(true, true, null, false);
    }

    @Override
    public Optional<EventData> apply(EventData data) {
        boolean value = Truth.of(data.get(EventData.VALUE));
        Object previous = data.getOrDefault(EventData.PREVIOUS, Undef.UNDEF);
        boolean pass;
        if (previous == Undef.UNDEF) {
            pass = value ? undefRise : undefFall;
        } else {
            boolean prev = Truth.of(previous);
            pass = value ? (!prev && rise) : (prev && fall);
        }
        return pass ? Optional.of(data) : Optional.empty();
    }
}
