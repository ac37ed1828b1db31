package com.phillippitts.coordination.service.events;

import com.phillippitts.coordination.domain.CoordinationEventType;

import java.time.Instant;

/**
 * Published when a terminal report arrives for an id with no recorded START.
 */
public record OrphanCompletionEvent(String coordinationId, CoordinationEventType type, Instant at) {
}
