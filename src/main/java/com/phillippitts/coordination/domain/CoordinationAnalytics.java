package com.phillippitts.coordination.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregated view over the event log and the pattern store.
 */
public record CoordinationAnalytics(
        Summary summary,
        Map<String, DomainStats> domainStats,
        Map<String, StrategyStats> strategyStats,
        List<PatternSummary> topPatterns
) {
    public static CoordinationAnalytics empty() {
        return new CoordinationAnalytics(
                new Summary(0, 0, 0, 0.0, 0, 0, 0, null), Map.of(), Map.of(), List.of());
    }

    public CoordinationAnalytics {
        domainStats = Collections.unmodifiableMap(new TreeMap<>(domainStats));
        strategyStats = Collections.unmodifiableMap(new TreeMap<>(strategyStats));
        topPatterns = List.copyOf(topPatterns);
    }

    /**
     * @param lastEventAt {@code null} when no events were recorded
     */
    public record Summary(
            int totalEvents,
            int completedCoordinations,
            int successfulCoordinations,
            double successRate,
            int recentEvents,
            int patternsLearned,
            int insightsRetained,
            Instant lastEventAt
    ) {
    }

    public record DomainStats(int usageCount, double successRate) {
    }

    public record StrategyStats(int usageCount, double successRate, double avgDuration) {
    }

    public record PatternSummary(
            String patternId,
            List<String> domains,
            int itemCount,
            String strategy,
            double successRate,
            double avgDuration,
            int usageCount,
            double confidence
    ) {
    }
}
