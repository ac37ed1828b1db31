package com.phillippitts.coordination.domain;

import java.util.Locale;

/**
 * Shape of a learned coordination pattern, derived from its strategy label and item count.
 */
public enum PatternType {
    SEQUENTIAL,
    PARALLEL,
    BATCH,
    HYBRID;

    public static PatternType classify(String strategy, int itemCount) {
        String label = strategy == null ? "" : strategy.toLowerCase(Locale.ROOT);
        if (label.contains("batch")) {
            return BATCH;
        }
        if (label.contains("parallel")) {
            return PARALLEL;
        }
        if (itemCount == 1) {
            return SEQUENTIAL;
        }
        return HYBRID;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PatternType fromWireValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
