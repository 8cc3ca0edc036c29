package com.phillippitts.telesession.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Deadline and window checks on {@link Instant}s read from the injected clock, plus
 * conversion of {@link System#nanoTime()} spans for latency logs.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds (truncated).
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * True once {@code now} has reached {@code since + after}. The boundary instant counts as due.
     * A null {@code since} is never due.
     */
    public static boolean isDue(Instant since, Duration after, Instant now) {
        return since != null && !now.isBefore(since.plus(after));
    }

    /**
     * True while {@code now} is strictly less than {@code window} after {@code last}.
     * A null {@code last} opens no window.
     */
    public static boolean withinWindow(Instant last, Duration window, Instant now) {
        return last != null && Duration.between(last, now).compareTo(window) < 0;
    }
}
