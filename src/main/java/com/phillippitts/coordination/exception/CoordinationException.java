package com.phillippitts.coordination.exception;

import java.util.Objects;

/**
 * Base exception for all coordination-engine specific errors.
 * Every subclass carries a {@link CoordinationErrorKind} so the REST boundary can map it
 * to a structured response without inspecting messages.
 */
public class CoordinationException extends RuntimeException {

    private final CoordinationErrorKind kind;

    public CoordinationException(CoordinationErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public CoordinationException(CoordinationErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public CoordinationErrorKind getKind() {
        return kind;
    }
}
