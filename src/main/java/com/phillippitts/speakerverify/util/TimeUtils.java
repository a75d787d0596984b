package com.phillippitts.speakerverify.util;

import java.time.Duration;

/**
 * Conversions around {@link System#nanoTime()} based timing.
 *
 * @since 1.0
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Elapsed milliseconds since a {@link System#nanoTime()} reading.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Elapsed time since a {@link System#nanoTime()} reading, never negative.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed duration
     */
    public static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(Math.max(0L, System.nanoTime() - startNanos));
    }
}
