package com.phillippitts.coordination.service.insight;

import com.phillippitts.coordination.domain.CoordinationAnalytics;
import com.phillippitts.coordination.domain.CoordinationAnalytics.StrategyStats;
import com.phillippitts.coordination.domain.Insight;
import com.phillippitts.coordination.domain.InsightCategory;
import com.phillippitts.coordination.domain.Pattern;
import com.phillippitts.coordination.service.store.CoordinationStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives {@link Insight}s from learned patterns and strategy statistics.
 *
 * <p><b>Rules:</b>
 * <ul>
 *   <li>Reliability: every pattern with {@code usage >= 3} and {@code successRate < 0.7}</li>
 *   <li>High performer: the best pattern by {@code successRate * confidence} among those with
 *       {@code successRate > 0.9} and {@code usage >= 2}</li>
 *   <li>Degradation: patterns used within the recent window average {@code successRate < 0.8}</li>
 *   <li>Underutilized: once more than 10 coordinations completed, any strategy with
 *       {@code successRate > 0.85} and a usage share under 10%</li>
 * </ul>
 *
 * <p>Insight ids are stable, so regenerating an observation replaces the retained one instead of
 * duplicating it. Insights older than the TTL are pruned on every run, even when nothing new fires.
 *
 * <p>Not thread-safe; the owning engine serializes access.
 */
public class InsightGenerator {

    private static final Logger LOG = LogManager.getLogger(InsightGenerator.class);

    static final int RELIABILITY_MIN_USAGE = 3;
    static final double RELIABILITY_MAX_SUCCESS = 0.7;
    static final int HIGH_PERFORMER_MIN_USAGE = 2;
    static final double HIGH_PERFORMER_MIN_SUCCESS = 0.9;
    static final double DEGRADATION_THRESHOLD = 0.8;
    static final int UNDERUTILIZED_MIN_COMPLETIONS = 10;
    static final double UNDERUTILIZED_MIN_SUCCESS = 0.85;
    static final double UNDERUTILIZED_MAX_SHARE = 0.1;

    static final String DEGRADATION_ID = "recent_degradation";

    private final CoordinationStore store;
    private final Clock clock;
    private final Duration insightTtl;
    private final Duration recentWindow;
    private final Map<String, Insight> retained = new LinkedHashMap<>();

    public InsightGenerator(CoordinationStore store, Clock clock, Duration insightTtl, Duration recentWindow) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.insightTtl = Objects.requireNonNull(insightTtl, "insightTtl");
        this.recentWindow = Objects.requireNonNull(recentWindow, "recentWindow");
        for (Insight insight : store.loadInsights()) {
            retained.put(insight.id(), insight);
        }
        LOG.info("Insight store loaded with {} insights", retained.size());
    }

    /**
     * Evaluates all rules, merges the results into the retained set and prunes expired insights.
     *
     * @param patterns current learned patterns
     * @param analytics current analytics; no rule fires when no events were recorded
     * @return insights produced by this run
     */
    public List<Insight> generate(List<Pattern> patterns, CoordinationAnalytics analytics) {
        Instant now = clock.instant();
        List<Insight> fresh = new ArrayList<>();
        if (analytics.summary().totalEvents() > 0) {
            fresh.addAll(lowSuccess(patterns, now));
            highPerformer(patterns, now).ifPresent(fresh::add);
            degradation(patterns, now).ifPresent(fresh::add);
            fresh.addAll(underutilized(analytics.strategyStats(), now));
        }
        for (Insight insight : fresh) {
            retained.remove(insight.id());
            retained.put(insight.id(), insight);
        }
        int before = retained.size();
        retained.values().removeIf(i -> i.isExpired(now, insightTtl));
        LOG.debug("Generated {} insights; pruned {}; retained {}", fresh.size(), before - retained.size(),
                retained.size());
        return List.copyOf(fresh);
    }

    /**
     * Writes the retained insights to the store.
     *
     * @throws com.phillippitts.coordination.exception.PersistenceException on write failure
     */
    public void persist() {
        store.saveInsights(retained());
    }

    public List<Insight> retained() {
        return List.copyOf(retained.values());
    }

    private static List<Insight> lowSuccess(List<Pattern> patterns, Instant now) {
        List<Insight> out = new ArrayList<>();
        for (Pattern p : patterns) {
            if (p.usageCount() >= RELIABILITY_MIN_USAGE && p.successRate() < RELIABILITY_MAX_SUCCESS) {
                out.add(new Insight("low_success_" + p.id(), InsightCategory.RELIABILITY,
                        "Pattern " + p.id() + " has low success rate (" + percent(p.successRate()) + ")",
                        "Consider alternative strategies for " + String.join("+", p.domains())
                                + " coordination with " + p.itemCount() + " items",
                        0.8, p.confidence(), now, p.domains()));
            }
        }
        return out;
    }

    private static Optional<Insight> highPerformer(List<Pattern> patterns, Instant now) {
        return patterns.stream()
                .filter(p -> p.successRate() > HIGH_PERFORMER_MIN_SUCCESS && p.usageCount() >= HIGH_PERFORMER_MIN_USAGE)
                .max(Comparator.comparingDouble(p -> p.successRate() * p.confidence()))
                .map(best -> new Insight("high_performer_" + best.id(), InsightCategory.OPTIMIZATION,
                        "Pattern " + best.id() + " shows excellent performance ("
                                + percent(best.successRate()) + " success)",
                        "Prefer " + best.strategy() + " strategy for " + String.join("+", best.domains())
                                + " coordination",
                        0.6, best.confidence(), now, best.domains()));
    }

    private Optional<Insight> degradation(List<Pattern> patterns, Instant now) {
        Instant cutoff = now.minus(recentWindow);
        List<Pattern> recent = patterns.stream().filter(p -> p.lastUsed().isAfter(cutoff)).toList();
        if (recent.isEmpty()) {
            return Optional.empty();
        }
        double avg = recent.stream().mapToDouble(Pattern::successRate).average().orElse(1.0);
        if (avg >= DEGRADATION_THRESHOLD) {
            return Optional.empty();
        }
        return Optional.of(new Insight(DEGRADATION_ID, InsightCategory.MONITORING,
                "Recent coordination success rate is " + percent(avg) + ", below optimal",
                "Review recent coordination failures and consider system resource constraints",
                0.9, 0.7, now, List.of("all")));
    }

    private static List<Insight> underutilized(Map<String, StrategyStats> stats, Instant now) {
        int total = stats.values().stream().mapToInt(StrategyStats::usageCount).sum();
        if (total <= UNDERUTILIZED_MIN_COMPLETIONS) {
            return List.of();
        }
        List<Insight> out = new ArrayList<>();
        stats.forEach((strategy, s) -> {
            double share = (double) s.usageCount() / total;
            if (s.successRate() > UNDERUTILIZED_MIN_SUCCESS && share < UNDERUTILIZED_MAX_SHARE) {
                out.add(new Insight("underutilized_" + strategy, InsightCategory.OPTIMIZATION,
                        "Strategy '" + strategy + "' has high success rate (" + percent(s.successRate())
                                + ") but low usage",
                        "Consider using '" + strategy + "' strategy more frequently for applicable scenarios",
                        0.4, 0.6, now, List.of("strategy_selection")));
            }
        });
        return out;
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.1f%%", ratio * 100);
    }
}
