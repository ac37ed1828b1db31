package com.phillippitts.coordination.exception;

/**
 * Thrown when a coordination collection (events, patterns or insights) cannot be written.
 */
public class PersistenceException extends CoordinationException {

    private final String collection;

    public PersistenceException(String collection, String message, Throwable cause) {
        super(CoordinationErrorKind.PERSISTENCE_FAILURE,
                "Failed to persist " + collection + ": " + message, cause);
        this.collection = collection;
    }

    public String getCollection() {
        return collection;
    }
}
