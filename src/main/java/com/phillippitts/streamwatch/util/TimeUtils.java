package com.phillippitts.streamwatch.util;

import java.time.Duration;

/**
 * Utility methods for elapsed time calculations and duration display.
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
     * Calculates elapsed milliseconds since a nanosecond timestamp taken with {@link System#nanoTime()}.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Formats a duration as {@code H:MM:SS}, dropping fractions of a second. Negative durations format as zero.
     */
    public static String formatDuration(Duration duration) {
        if (duration == null || duration.isNegative()) {
            return "0:00:00";
        }
        long seconds = duration.getSeconds();
        return String.format("%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
