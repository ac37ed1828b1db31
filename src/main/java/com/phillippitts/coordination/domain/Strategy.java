package com.phillippitts.coordination.domain;

import java.util.Locale;

/**
 * Coarse execution approach chosen for a set of work items.
 *
 * <p>Declaration order is escalation order: {@code DIRECT < PARALLEL < STRATEGIC < DEGRADED}.
 */
public enum Strategy {
    DIRECT,
    PARALLEL,
    STRATEGIC,
    DEGRADED;

    /**
     * Returns the lower-case label used in event records and pattern keys.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the more escalated of this strategy and {@code floor}.
     */
    public Strategy atLeast(Strategy floor) {
        if (floor == null) {
            return this;
        }
        return floor.ordinal() > ordinal() ? floor : this;
    }
}
