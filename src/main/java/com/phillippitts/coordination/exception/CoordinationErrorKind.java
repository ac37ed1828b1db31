package com.phillippitts.coordination.exception;

/**
 * Structured failure kinds reported across the public surface of the engine.
 *
 * <p>Admission kinds are recoverable: the caller may retry later or shrink the request.
 * {@link #ORPHAN_COMPLETION} is informational and {@link #PERSISTENCE_FAILURE} is surfaced
 * to observers but never aborts a decision that was already returned.
 */
public enum CoordinationErrorKind {
    INVALID_COUNT,
    OVER_CAPACITY,
    BUSY,
    BUDGET_EXCEEDED,
    ORPHAN_COMPLETION,
    PERSISTENCE_FAILURE,
    INVALID_REQUEST
}
