package com.phillippitts.coordination.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for the second-based durations used throughout the engine.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one second.
     */
    public static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Fractional seconds elapsed from {@code start} to {@code end}; negative if {@code end} is earlier.
     */
    public static double secondsBetween(Instant start, Instant end) {
        Duration d = Duration.between(start, end);
        return d.getSeconds() + d.getNano() / NANOS_PER_SECOND;
    }

    /**
     * Converts fractional seconds to a {@link Duration}, truncated to nanoseconds.
     */
    public static Duration toDuration(double seconds) {
        return Duration.ofNanos((long) (seconds * NANOS_PER_SECOND));
    }

    /**
     * Rounds half-up to {@code decimals} places, for analytics output.
     */
    public static double round(double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
    }
}
