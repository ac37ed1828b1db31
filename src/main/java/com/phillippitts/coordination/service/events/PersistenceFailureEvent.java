package com.phillippitts.coordination.service.events;

import java.time.Instant;

/**
 * Published when a collection could not be written to the pattern store. The in-memory state
 * that triggered the write is already updated when this is published.
 *
 * @param collection {@code events}, {@code patterns} or {@code insights}
 * @param coordinationId coordination being reported, {@code null} for insight generation
 */
public record PersistenceFailureEvent(
        String collection,
        String coordinationId,
        String message,
        Throwable cause,
        Instant at
) {
    public PersistenceFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
