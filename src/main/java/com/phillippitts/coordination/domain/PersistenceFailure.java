package com.phillippitts.coordination.domain;

import java.time.Instant;

/**
 * A failed durable write of one collection. The in-memory state it belongs to stays valid.
 *
 * @param collection {@code events}, {@code patterns} or {@code insights}
 */
public record PersistenceFailure(String collection, String message, Instant at) {
}
