package com.phillippitts.reqlog.util;

/**
 * Utility methods for elapsed time measured with {@link System#nanoTime()}.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one microsecond.
     */
    public static final double NANOS_PER_MICRO = 1_000.0;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to microseconds, keeping the fraction.
     *
     * @param nanos time in nanoseconds
     * @return time in microseconds
     */
    public static double nanosToMicros(long nanos) {
        return nanos / NANOS_PER_MICRO;
    }
}
