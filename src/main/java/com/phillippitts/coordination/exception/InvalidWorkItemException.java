package com.phillippitts.coordination.exception;

/**
 * Thrown when a submitted work item or report is malformed (blank kind, negative duration, blank id).
 */
public class InvalidWorkItemException extends CoordinationException {

    public InvalidWorkItemException(String message) {
        super(CoordinationErrorKind.INVALID_REQUEST, message);
    }
}
