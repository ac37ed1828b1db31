package com.phillippitts.coordination.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Learned statistics for one {@link PatternKey}. Created on the first completed coordination
 * for its key and replaced, never deleted, on each subsequent completion.
 *
 * @param successRate running success ratio in [0,1]
 * @param avgDuration running mean duration in seconds
 * @param confidence in [0,1]
 */
public record Pattern(
        PatternKey key,
        PatternType type,
        double successRate,
        double avgDuration,
        int usageCount,
        Instant lastUsed,
        double confidence
) {
    public Pattern {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(lastUsed, "lastUsed");
        type = type == null ? PatternType.classify(key.strategy(), key.itemCount()) : type;
    }

    public String id() {
        return key.canonical();
    }

    public List<String> domains() {
        return key.domains();
    }

    public int itemCount() {
        return key.itemCount();
    }

    public String strategy() {
        return key.strategy();
    }
}
