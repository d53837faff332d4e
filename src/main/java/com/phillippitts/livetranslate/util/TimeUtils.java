package com.phillippitts.livetranslate.util;

/**
 * Conversions for {@link System#nanoTime()} based timing.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Elapsed milliseconds since {@code startNanos}, a value previously read from {@link System#nanoTime()}.
     */
    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }

    /**
     * Duration in milliseconds of {@code bytes} of 16-bit mono PCM at {@code sampleRate}.
     */
    public static long pcmDurationMillis(int bytes, int sampleRate) {
        if (sampleRate <= 0) {
            return 0;
        }
        return (bytes / 2) * 1000L / sampleRate;
    }
}
