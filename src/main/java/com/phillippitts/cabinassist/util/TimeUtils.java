package com.phillippitts.cabinassist.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Elapsed time helpers for session logging and the listening timeout.
 *
 * @since 1.0
 */
public final class TimeUtils {

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Duration between {@code start} and {@code now}, never negative.
     *
     * @param start start instant (null yields {@link Duration#ZERO})
     * @param now current instant
     * @return non-negative elapsed duration
     */
    public static Duration elapsedBetween(Instant start, Instant now) {
        if (start == null || now == null || now.isBefore(start)) {
            return Duration.ZERO;
        }
        return Duration.between(start, now);
    }
}
