package com.phillippitts.coordination.domain;

/**
 * Work item priority. Declaration order is the execution rank: critical work is planned first.
 */
public enum Priority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public int rank() {
        return ordinal();
    }
}
