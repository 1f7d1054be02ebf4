package com.questrail.logic.time;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TimePeriods
 * -----------------------------------------------------------------------------
 * Conversion of user supplied time periods into {@link Duration}s.
 *
 * <p>Accepted forms:</p>
 * <ul>
 *   <li>a {@link Duration}</li>
 *   <li>a {@link Number} of seconds, fractions allowed</li>
 *   <li>a string with optional day/hour/minute/second parts, e.g. {@code "1d12h"},
 *       {@code "2m30s"}, {@code "0.25s"}, or a plain number of seconds</li>
 *   <li>{@code "inf"} / {@code "infinity"} for {@link #INFINITE}</li>
 * </ul>
 */
public final class TimePeriods {

    /** A period that never expires. Timers with this duration are never armed. */
    public static final Duration INFINITE = ChronoUnit.FOREVER.getDuration();

    private static final Pattern PERIOD = Pattern.compile(
            "(?:(\\d+(?:\\.\\d*)?)d)?\\s*(?:(\\d+(?:\\.\\d*)?)h)?\\s*(?:(\\d+(?:\\.\\d*)?)m)?\\s*(?:(\\d+(?:\\.\\d*)?)s?)?");

    private TimePeriods() {
    }

    public static boolean isInfinite(Duration duration) {
        return duration != null && duration.compareTo(INFINITE) >= 0;
    }

    /**
     * Converts a period value; {@code null} stays {@code null}.
     *
     * @throws IllegalArgumentException for unsupported types, negative numbers or unparsable strings
     */
    public static Duration toDuration(Object period) {
        if (period == null) {
            return null;
        }
        if (period instanceof Duration d) {
            return d;
        }
        if (period instanceof Number n) {
            return ofSeconds(n.doubleValue());
        }
        if (period instanceof CharSequence cs) {
            return parse(cs.toString());
        }
        throw new IllegalArgumentException("Invalid time period: " + period
                + " (expected Duration, number of seconds or string)");
    }

    public static Duration parse(String text) {
        String s = text.trim().toLowerCase(Locale.ROOT);
        if (s.equals("inf") || s.equals("infinity")) {
            return INFINITE;
        }
        Matcher m = PERIOD.matcher(s);
        if (s.isEmpty() || !m.matches()) {
            throw new IllegalArgumentException("Invalid time period string: '" + text + "'");
        }
        double seconds = 0.0;
        seconds += part(m.group(1)) * 86_400.0;
        seconds += part(m.group(2)) * 3_600.0;
        seconds += part(m.group(3)) * 60.0;
        seconds += part(m.group(4));
        return ofSeconds(seconds);
    }

    static Duration ofSeconds(double seconds) {
        if (Double.isNaN(seconds)) {
            throw new IllegalArgumentException("Time period must be a number");
        }
        if (Double.isInfinite(seconds) && seconds > 0) {
            return INFINITE;
        }
        if (seconds < 0) {
            throw new IllegalArgumentException("Time period must not be negative: " + seconds);
        }
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000.0));
    }

    private static double part(String group) {
        return group == null ? 0.0 : Double.parseDouble(group);
    }
}
