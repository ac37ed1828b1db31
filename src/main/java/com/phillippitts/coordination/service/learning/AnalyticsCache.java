package com.phillippitts.coordination.service.learning;

import com.phillippitts.coordination.domain.CoordinationAnalytics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Time-bounded cache for aggregated analytics. Callers invalidate it synchronously on every
 * new event, so the TTL only bounds staleness of time-relative figures such as recent counts.
 */
public class AnalyticsCache {

    private final Clock clock;
    private final Duration ttl;
    private CoordinationAnalytics cached;
    private Instant cachedAt;

    public AnalyticsCache(Clock clock, Duration ttl) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
    }

    public synchronized CoordinationAnalytics get(Supplier<CoordinationAnalytics> loader) {
        Instant now = clock.instant();
        if (cached != null && now.isBefore(cachedAt.plus(ttl))) {
            return cached;
        }
        cached = loader.get();
        cachedAt = now;
        return cached;
    }

    public synchronized void invalidate() {
        cached = null;
        cachedAt = null;
    }

    public synchronized boolean isPopulated() {
        return cached != null;
    }
}
