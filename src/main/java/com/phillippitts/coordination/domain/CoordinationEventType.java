package com.phillippitts.coordination.domain;

import java.util.Locale;

/**
 * Lifecycle event types. A START followed by one terminal event with the same id forms one
 * completed coordination.
 */
public enum CoordinationEventType {
    START,
    COMPLETE,
    ERROR,
    TIMEOUT;

    public boolean isTerminal() {
        return this != START;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CoordinationEventType fromWireValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
