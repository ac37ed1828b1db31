package com.phillippitts.coordination.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Append-only coordination log entry.
 *
 * <p>Terminal events copy item count, domains, strategy and item kinds from their START.
 * A terminal event without a START carries {@code itemCount = 0}, no domains, strategy
 * {@value #UNKNOWN_STRATEGY} and no duration.
 *
 * @param durationSeconds seconds since the matching START; {@code null} for START and orphans
 * @param success {@code null} for START events
 * @param itemKinds kinds dispatched by the caller, {@code null} when not reported
 */
public record CoordinationEvent(
        String id,
        CoordinationEventType type,
        Instant timestamp,
        int itemCount,
        List<String> domains,
        String strategy,
        Double durationSeconds,
        Boolean success,
        List<String> itemKinds,
        String errorMessage
) {
    public static final String UNKNOWN_STRATEGY = "unknown";

    public CoordinationEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        domains = domains == null ? List.of() : List.copyOf(domains);
        strategy = strategy == null ? UNKNOWN_STRATEGY : strategy;
        itemKinds = itemKinds == null ? null : List.copyOf(itemKinds);
    }

    public static CoordinationEvent start(String id, Instant at, int itemCount, List<String> domains,
                                          String strategy, List<String> itemKinds) {
        return new CoordinationEvent(id, CoordinationEventType.START, at, itemCount, domains,
                strategy, null, null, itemKinds, null);
    }

    /**
     * Builds the terminal event for {@code start}, which may be {@code null} for orphan completions.
     */
    public static CoordinationEvent terminal(String id, CoordinationEventType type, Instant at,
                                             CoordinationEvent start, Double durationSeconds,
                                             boolean success, String errorMessage) {
        if (start == null) {
            return new CoordinationEvent(id, type, at, 0, List.of(), UNKNOWN_STRATEGY,
                    null, success, null, errorMessage);
        }
        return new CoordinationEvent(id, type, at, start.itemCount(), start.domains(), start.strategy(),
                durationSeconds, success, start.itemKinds(), errorMessage);
    }

    public boolean isTerminal() {
        return type.isTerminal();
    }

    public boolean isSuccessful() {
        return Boolean.TRUE.equals(success);
    }
}
