package com.topostat.core.check;

import java.time.Instant;

/**
 * Typed predicate checks shared by records, envelopes, dimensions and statistics.
 * All checks are null-safe and return {@code false} instead of throwing.
 */
public final class Checks {

    private Checks() {
        // utility class
    }

    public static boolean isNonEmpty(String value) {
        return value != null && !value.isEmpty();
    }

    /** Non-empty after trimming surrounding whitespace. */
    public static boolean isNonBlank(String value) {
        return value != null && !value.isBlank();
    }

    public static boolean isIntMin(Integer value, int min) {
        return value != null && value >= min;
    }

    public static boolean isFloatMin(Double value, double min) {
        return value != null && !value.isNaN() && !value.isInfinite() && value >= min;
    }

    public static boolean isTimestamp(Instant value) {
        return value != null;
    }
}
