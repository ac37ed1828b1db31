package com.phillippitts.coordination.service.learning;

import com.phillippitts.coordination.domain.CoordinationAnalytics;
import com.phillippitts.coordination.domain.CoordinationEvent;
import com.phillippitts.coordination.domain.CoordinationEventType;
import com.phillippitts.coordination.domain.Pattern;
import com.phillippitts.coordination.domain.PatternKey;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnalyticsAggregatorTest {

    private static final Instant NOW = Instant.parse("2025-01-15T12:00:00Z");
    private static final Duration HOUR = Duration.ofHours(1);

    @Test
    void summarizesEventsByDomainAndStrategy() {
        Instant t = NOW.minusSeconds(600);
        CoordinationEvent startA = CoordinationEvent.start("a", t, 2, List.of("x", "y"), "direct", null);
        CoordinationEvent doneA = CoordinationEvent.terminal("a", CoordinationEventType.COMPLETE,
                t.plusSeconds(2), startA, 2.0, true, null);
        CoordinationEvent startB = CoordinationEvent.start("b", t, 1, List.of("x"), "direct", null);
        CoordinationEvent failB = CoordinationEvent.terminal("b", CoordinationEventType.ERROR,
                t.plusSeconds(4), startB, 4.0, false, "boom");
        CoordinationEvent orphan = CoordinationEvent.terminal("c", CoordinationEventType.COMPLETE,
                t.plusSeconds(5), null, null, true, null);
        CoordinationEvent old = CoordinationEvent.start("old", NOW.minus(Duration.ofHours(2)), 1, List.of("z"),
                "parallel", null);

        CoordinationAnalytics analytics = AnalyticsAggregator.aggregate(
                List.of(old, startA, doneA, startB, failB, orphan), List.of(), 3, NOW, HOUR);

        CoordinationAnalytics.Summary s = analytics.summary();
        assertThat(s.totalEvents()).isEqualTo(6);
        assertThat(s.completedCoordinations()).isEqualTo(3);
        assertThat(s.successfulCoordinations()).isEqualTo(2);
        assertThat(s.successRate()).isEqualTo(0.667);
        assertThat(s.recentEvents()).isEqualTo(5);
        assertThat(s.insightsRetained()).isEqualTo(3);
        assertThat(s.lastEventAt()).isEqualTo(t.plusSeconds(5));

        assertThat(analytics.domainStats()).containsOnlyKeys("x", "y");
        assertThat(analytics.domainStats().get("x")).isEqualTo(new CoordinationAnalytics.DomainStats(2, 0.5));
        assertThat(analytics.strategyStats().get("direct"))
                .isEqualTo(new CoordinationAnalytics.StrategyStats(2, 0.5, 3.0));
        assertThat(analytics.strategyStats().get("unknown"))
                .isEqualTo(new CoordinationAnalytics.StrategyStats(1, 1.0, 0.0));
    }

    @Test
    void emptyLogYieldsZeroSummary() {
        CoordinationAnalytics analytics = AnalyticsAggregator.aggregate(List.of(), List.of(), 0, NOW, HOUR);

        assertThat(analytics.summary().totalEvents()).isZero();
        assertThat(analytics.summary().successRate()).isZero();
        assertThat(analytics.summary().lastEventAt()).isNull();
        assertThat(analytics.topPatterns()).isEmpty();
    }

    @Test
    void topPatternsRankedByConfidenceThenUsageAndCapped() {
        List<Pattern> patterns = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            patterns.add(new Pattern(PatternKey.of(List.of("d" + i), 1, "direct"), null, 1.0, 1.0,
                    i + 1, NOW, 0.3));
        }
        patterns.add(new Pattern(PatternKey.of(List.of("best"), 2, "parallel"), null, 0.91234, 2.345,
                1, NOW, 0.9));

        CoordinationAnalytics analytics = AnalyticsAggregator.aggregate(List.of(), patterns, 0, NOW, HOUR);

        assertThat(analytics.topPatterns()).hasSize(10);
        CoordinationAnalytics.PatternSummary first = analytics.topPatterns().get(0);
        assertThat(first.patternId()).isEqualTo("best_2_parallel");
        assertThat(first.successRate()).isEqualTo(0.912);
        assertThat(first.avgDuration()).isEqualTo(2.35);
        assertThat(analytics.topPatterns().get(1).usageCount()).isEqualTo(12);
        assertThat(analytics.summary().patternsLearned()).isEqualTo(13);
    }
}
