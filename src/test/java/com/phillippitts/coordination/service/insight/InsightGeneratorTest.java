package com.phillippitts.coordination.service.insight;

import com.phillippitts.coordination.domain.CoordinationAnalytics;
import com.phillippitts.coordination.domain.CoordinationAnalytics.StrategyStats;
import com.phillippitts.coordination.domain.CoordinationAnalytics.Summary;
import com.phillippitts.coordination.domain.Insight;
import com.phillippitts.coordination.domain.InsightCategory;
import com.phillippitts.coordination.domain.Pattern;
import com.phillippitts.coordination.domain.PatternKey;
import com.phillippitts.coordination.service.store.InMemoryCoordinationStore;
import com.phillippitts.coordination.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InsightGeneratorTest {

    private MutableClock clock;
    private InMemoryCoordinationStore store;
    private InsightGenerator generator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochDay();
        store = new InMemoryCoordinationStore();
        generator = new InsightGenerator(store, clock, Duration.ofHours(24), Duration.ofHours(1));
    }

    @Test
    void flagsLowSuccessPatternsWithEnoughUsage() {
        Pattern weak = pattern("backend", 3, "direct", 1.0 / 3, 3, 0.4, clock.instant().minus(Duration.ofHours(3)));

        List<Insight> insights = generator.generate(List.of(weak), analytics(Map.of()));

        assertThat(insights).singleElement().satisfies(i -> {
            assertThat(i.id()).isEqualTo("low_success_backend_3_direct");
            assertThat(i.category()).isEqualTo(InsightCategory.RELIABILITY);
            assertThat(i.impactScore()).isEqualTo(0.8);
            assertThat(i.confidence()).isEqualTo(0.4);
            assertThat(i.appliesTo()).containsExactly("backend");
        });
    }

    @Test
    void picksSingleBestHighPerformer() {
        Instant old = clock.instant().minus(Duration.ofHours(2));
        Pattern good = pattern("a", 2, "parallel", 1.0, 2, 0.7, old);
        Pattern better = pattern("b", 2, "direct", 1.0, 5, 0.95, old);
        Pattern unproven = pattern("c", 2, "direct", 1.0, 1, 0.3, old);

        List<Insight> insights = generator.generate(List.of(good, better, unproven), analytics(Map.of()));

        assertThat(insights).extracting(Insight::id).containsExactly("high_performer_b_2_direct");
        assertThat(insights.get(0).impactScore()).isEqualTo(0.6);
    }

    @Test
    void reportsRecentDegradation() {
        Pattern recent = pattern("a", 1, "direct", 0.5, 2, 0.45, clock.instant().minus(Duration.ofMinutes(10)));
        Pattern stale = pattern("b", 1, "direct", 0.0, 1, 0.1, clock.instant().minus(Duration.ofHours(5)));

        List<Insight> insights = generator.generate(List.of(recent, stale), analytics(Map.of()));

        assertThat(insights).extracting(Insight::id).containsExactly("recent_degradation");
        Insight i = insights.get(0);
        assertThat(i.category()).isEqualTo(InsightCategory.MONITORING);
        assertThat(i.confidence()).isEqualTo(0.7);
        assertThat(i.appliesTo()).containsExactly("all");
    }

    @Test
    void reportsUnderutilizedStrategyOnlyAfterTenCompletions() {
        Map<String, StrategyStats> busy = Map.of(
                "direct", new StrategyStats(10, 0.5, 1.0),
                "parallel", new StrategyStats(1, 1.0, 2.0));
        Map<String, StrategyStats> quiet = Map.of(
                "direct", new StrategyStats(9, 0.5, 1.0),
                "parallel", new StrategyStats(1, 1.0, 2.0));

        assertThat(generator.generate(List.of(), analytics(quiet))).isEmpty();

        List<Insight> insights = generator.generate(List.of(), analytics(busy));
        assertThat(insights).singleElement().satisfies(i -> {
            assertThat(i.id()).isEqualTo("underutilized_parallel");
            assertThat(i.appliesTo()).containsExactly("strategy_selection");
            assertThat(i.impactScore()).isEqualTo(0.4);
        });
    }

    @Test
    void noRulesFireWithoutEvents() {
        Pattern weak = pattern("backend", 3, "direct", 0.0, 3, 0.3, clock.instant());

        assertThat(generator.generate(List.of(weak), CoordinationAnalytics.empty())).isEmpty();
    }

    @Test
    void regeneratingSameObservationReplacesIt() {
        Pattern weak = pattern("backend", 3, "direct", 0.0, 3, 0.3, clock.instant().minus(Duration.ofHours(3)));

        generator.generate(List.of(weak), analytics(Map.of()));
        clock.advance(Duration.ofMinutes(30));
        generator.generate(List.of(weak), analytics(Map.of()));

        assertThat(generator.retained()).singleElement()
                .extracting(Insight::createdAt).isEqualTo(clock.instant());
    }

    @Test
    void prunesInsightsOlderThanTtl() {
        Pattern weak = pattern("backend", 3, "direct", 0.0, 3, 0.3, clock.instant().minus(Duration.ofHours(3)));
        generator.generate(List.of(weak), analytics(Map.of()));

        clock.advance(Duration.ofHours(25));
        generator.generate(List.of(), CoordinationAnalytics.empty());

        assertThat(generator.retained()).isEmpty();
    }

    @Test
    void persistedInsightsReloadIntoNewGenerator() {
        Pattern weak = pattern("backend", 3, "direct", 0.0, 3, 0.3, clock.instant().minus(Duration.ofHours(3)));
        generator.generate(List.of(weak), analytics(Map.of()));
        generator.persist();

        InsightGenerator reloaded = new InsightGenerator(store, clock, Duration.ofHours(24), Duration.ofHours(1));

        assertThat(reloaded.retained()).hasSize(1);
    }

    private static Pattern pattern(String domain, int count, String strategy, double successRate, int usage,
                                   double confidence, Instant lastUsed) {
        return new Pattern(PatternKey.of(List.of(domain), count, strategy), null, successRate, 1.0, usage,
                lastUsed, confidence);
    }

    private static CoordinationAnalytics analytics(Map<String, StrategyStats> strategyStats) {
        Summary summary = new Summary(1, 1, 1, 1.0, 1, 0, 0, null);
        return new CoordinationAnalytics(summary, Map.of(), strategyStats, List.of());
    }
}
