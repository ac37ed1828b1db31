package com.phillippitts.coordination.domain;

import java.util.List;

/**
 * Advisory strategy derived from learned patterns.
 *
 * @param recommendedStrategy strategy label of the best match, {@code null} when nothing matched
 * @param estimatedDuration average duration of the best match in seconds, {@code null} without a match
 * @param matchingPatterns number of patterns that matched the request
 * @param alternatives up to two runner-up matches
 */
public record Recommendation(
        String recommendedStrategy,
        double confidence,
        Double estimatedDuration,
        double successProbability,
        int matchingPatterns,
        List<Alternative> alternatives
) {
    public Recommendation {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public static Recommendation none() {
        return new Recommendation(null, 0.0, null, 0.0, 0, List.of());
    }

    public boolean hasRecommendation() {
        return recommendedStrategy != null;
    }

    /**
     * Runner-up pattern match.
     *
     * @param similarity domain overlap ratio with the request
     */
    public record Alternative(String strategy, double confidence, double successRate, double similarity) {
    }
}
