package com.phillippitts.coordination.service.learning;

import com.phillippitts.coordination.domain.CoordinationAnalytics;
import com.phillippitts.coordination.domain.CoordinationAnalytics.DomainStats;
import com.phillippitts.coordination.domain.CoordinationAnalytics.PatternSummary;
import com.phillippitts.coordination.domain.CoordinationAnalytics.StrategyStats;
import com.phillippitts.coordination.domain.CoordinationAnalytics.Summary;
import com.phillippitts.coordination.domain.CoordinationEvent;
import com.phillippitts.coordination.domain.Pattern;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.phillippitts.coordination.util.TimeUtils.round;

/**
 * Builds {@link CoordinationAnalytics} from the event log and learned patterns.
 *
 * <p>Completed coordinations are all terminal events (COMPLETE, ERROR and TIMEOUT), orphans
 * included. Rates are rounded to 3 decimals and durations to 2.
 */
public final class AnalyticsAggregator {

    static final int TOP_PATTERNS = 10;

    private static final Comparator<Pattern> BY_CONFIDENCE_THEN_USAGE = Comparator
            .comparingDouble((Pattern p) -> round(p.confidence(), 3))
            .thenComparingInt(Pattern::usageCount)
            .reversed();

    private AnalyticsAggregator() {
    }

    public static CoordinationAnalytics aggregate(List<CoordinationEvent> events, List<Pattern> patterns,
                                                  int insightsRetained, Instant now, Duration recentWindow) {
        Instant recentCutoff = now.minus(recentWindow);
        int completed = 0;
        int successful = 0;
        int recent = 0;
        Instant lastEventAt = null;
        Map<String, Counter> domains = new TreeMap<>();
        Map<String, Counter> strategies = new TreeMap<>();

        for (CoordinationEvent event : events) {
            if (event.timestamp().isAfter(recentCutoff)) {
                recent++;
            }
            if (lastEventAt == null || event.timestamp().isAfter(lastEventAt)) {
                lastEventAt = event.timestamp();
            }
            if (!event.isTerminal()) {
                continue;
            }
            completed++;
            boolean success = event.isSuccessful();
            if (success) {
                successful++;
            }
            for (String domain : event.domains()) {
                domains.computeIfAbsent(domain, d -> new Counter()).add(success, null);
            }
            strategies.computeIfAbsent(event.strategy(), s -> new Counter()).add(success, event.durationSeconds());
        }

        Summary summary = new Summary(events.size(), completed, successful,
                completed == 0 ? 0.0 : round((double) successful / completed, 3),
                recent, patterns.size(), insightsRetained, lastEventAt);

        Map<String, DomainStats> domainStats = new TreeMap<>();
        domains.forEach((domain, c) -> domainStats.put(domain, new DomainStats(c.usage, c.successRate())));
        Map<String, StrategyStats> strategyStats = new TreeMap<>();
        strategies.forEach((strategy, c) -> strategyStats.put(strategy,
                new StrategyStats(c.usage, c.successRate(), c.avgDuration())));

        List<PatternSummary> top = patterns.stream()
                .sorted(BY_CONFIDENCE_THEN_USAGE)
                .limit(TOP_PATTERNS)
                .map(AnalyticsAggregator::summarize)
                .toList();

        return new CoordinationAnalytics(summary, domainStats, strategyStats, top);
    }

    private static PatternSummary summarize(Pattern p) {
        return new PatternSummary(p.id(), p.domains(), p.itemCount(), p.strategy(),
                round(p.successRate(), 3), round(p.avgDuration(), 2), p.usageCount(), round(p.confidence(), 3));
    }

    private static final class Counter {
        private int usage;
        private int successes;
        private int timed;
        private double durationSum;

        void add(boolean success, Double duration) {
            usage++;
            if (success) {
                successes++;
            }
            if (duration != null) {
                timed++;
                durationSum += duration;
            }
        }

        double successRate() {
            return usage == 0 ? 0.0 : round((double) successes / usage, 3);
        }

        double avgDuration() {
            return timed == 0 ? 0.0 : round(durationSum / timed, 2);
        }
    }
}
