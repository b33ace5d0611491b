package com.phillippitts.streamwatch.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for elapsed time calculations against a {@link java.time.Clock}-derived instant.
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
     * Time elapsed from {@code since} to {@code now}, never negative.
     * A null {@code since} yields {@link Duration#ZERO}.
     */
    public static Duration elapsed(Instant since, Instant now) {
        if (since == null || now == null || now.isBefore(since)) {
            return Duration.ZERO;
        }
        return Duration.between(since, now);
    }
}
