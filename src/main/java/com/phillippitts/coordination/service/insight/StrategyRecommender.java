package com.phillippitts.coordination.service.insight;

import com.phillippitts.coordination.domain.Pattern;
import com.phillippitts.coordination.domain.Recommendation;
import com.phillippitts.coordination.domain.Recommendation.Alternative;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recommends a strategy for a prospective request from learned patterns.
 *
 * <p>A pattern matches when it shares at least one domain with the request and its item count
 * is within {@value #MAX_COUNT_DISTANCE} of the request's. Matches are scored as
 * {@code overlap * confidence * countScore}, where {@code overlap = |shared| / max(|request|, |pattern|)}
 * and {@code countScore = 1 - |Δcount| / 10}. Ties keep pattern order.
 */
public final class StrategyRecommender {

    static final int MAX_COUNT_DISTANCE = 2;
    static final int MAX_ALTERNATIVES = 2;

    private StrategyRecommender() {
    }

    public static Recommendation recommend(List<Pattern> patterns, Collection<String> domains, int itemCount) {
        Set<String> requested = domains == null ? Set.of() : new HashSet<>(domains);
        if (requested.isEmpty()) {
            return Recommendation.none();
        }
        List<Scored> matches = patterns.stream()
                .filter(p -> Math.abs(p.itemCount() - itemCount) <= MAX_COUNT_DISTANCE)
                .map(p -> score(p, requested, itemCount))
                .filter(s -> s.similarity > 0)
                .sorted(Comparator.comparingDouble((Scored s) -> s.score).reversed())
                .toList();
        if (matches.isEmpty()) {
            return Recommendation.none();
        }
        Pattern best = matches.get(0).pattern;
        List<Alternative> alternatives = matches.stream()
                .skip(1)
                .limit(MAX_ALTERNATIVES)
                .map(s -> new Alternative(s.pattern.strategy(), s.pattern.confidence(),
                        s.pattern.successRate(), s.similarity))
                .toList();
        return new Recommendation(best.strategy(), best.confidence(), best.avgDuration(),
                best.successRate(), matches.size(), alternatives);
    }

    private static Scored score(Pattern pattern, Set<String> requested, int itemCount) {
        Set<String> shared = new HashSet<>(pattern.domains());
        shared.retainAll(requested);
        double similarity = (double) shared.size() / Math.max(requested.size(), pattern.domains().size());
        double countScore = 1.0 - Math.abs(pattern.itemCount() - itemCount) / 10.0;
        return new Scored(pattern, similarity, similarity * pattern.confidence() * countScore);
    }

    private record Scored(Pattern pattern, double similarity, double score) {
    }
}
