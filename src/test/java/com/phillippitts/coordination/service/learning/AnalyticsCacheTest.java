package com.phillippitts.coordination.service.learning;

import com.phillippitts.coordination.domain.CoordinationAnalytics;
import com.phillippitts.coordination.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class AnalyticsCacheTest {

    private MutableClock clock;
    private AnalyticsCache cache;
    private AtomicInteger loads;
    private Supplier<CoordinationAnalytics> loader;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochDay();
        cache = new AnalyticsCache(clock, Duration.ofMinutes(5));
        loads = new AtomicInteger();
        loader = () -> {
            loads.incrementAndGet();
            return CoordinationAnalytics.empty();
        };
    }

    @Test
    void servesCachedValueWithinTtl() {
        cache.get(loader);
        clock.advance(Duration.ofMinutes(4));
        cache.get(loader);

        assertThat(loads.get()).isEqualTo(1);
        assertThat(cache.isPopulated()).isTrue();
    }

    @Test
    void reloadsOnceTtlElapses() {
        cache.get(loader);
        clock.advance(Duration.ofMinutes(5));
        cache.get(loader);

        assertThat(loads.get()).isEqualTo(2);
    }

    @Test
    void invalidateForcesReload() {
        cache.get(loader);
        cache.invalidate();

        assertThat(cache.isPopulated()).isFalse();
        cache.get(loader);
        assertThat(loads.get()).isEqualTo(2);
    }
}
