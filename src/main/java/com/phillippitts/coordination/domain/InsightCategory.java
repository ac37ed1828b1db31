package com.phillippitts.coordination.domain;

import java.util.Locale;

public enum InsightCategory {
    RELIABILITY,
    OPTIMIZATION,
    MONITORING;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static InsightCategory fromWireValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
