package com.phillippitts.coordination.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Human-readable observation about pattern performance. Expires a fixed time after creation.
 *
 * @param id stable identifier; regenerating the same observation yields the same id
 * @param appliesTo domains, {@code "all"}, or {@code "strategy_selection"}
 */
public record Insight(
        String id,
        InsightCategory category,
        String description,
        String recommendation,
        double impactScore,
        double confidence,
        Instant createdAt,
        List<String> appliesTo
) {
    public Insight {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(createdAt, "createdAt");
        appliesTo = appliesTo == null ? List.of() : List.copyOf(appliesTo);
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return !createdAt.isAfter(now.minus(ttl));
    }
}
