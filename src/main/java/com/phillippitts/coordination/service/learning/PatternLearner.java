package com.phillippitts.coordination.service.learning;

import com.phillippitts.coordination.domain.CoordinationEvent;
import com.phillippitts.coordination.domain.Pattern;
import com.phillippitts.coordination.domain.PatternKey;
import com.phillippitts.coordination.domain.PatternType;
import com.phillippitts.coordination.service.store.CoordinationStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maintains weighted statistics per {@link PatternKey} from completed coordinations.
 *
 * <p><b>Update rule</b> for a completion with duration {@code d} and outcome {@code s}:
 * <pre>
 * new key:  usage=1, successRate=s?1:0, avgDuration=d, confidence=0.3
 * existing: avgDuration' = (avgDuration*n + d)/(n+1)
 *           successRate' = (successRate*n + (s?1:0))/(n+1)
 *           confidence'  = min(0.95, (n+1)*0.1 + successRate'*0.5)
 * </pre>
 * For a fixed success rate the confidence never decreases with usage.
 *
 * <p>Not thread-safe; the owning engine serializes access.
 */
public class PatternLearner {

    private static final Logger LOG = LogManager.getLogger(PatternLearner.class);

    static final double INITIAL_CONFIDENCE = 0.3;
    static final double MAX_CONFIDENCE = 0.95;
    static final double USAGE_WEIGHT = 0.1;
    static final double SUCCESS_WEIGHT = 0.5;

    private final CoordinationStore store;
    private final Map<String, Pattern> patterns;

    public PatternLearner(CoordinationStore store) {
        this.store = Objects.requireNonNull(store, "store");
        this.patterns = new LinkedHashMap<>(store.loadPatterns());
        LOG.info("Pattern store loaded with {} patterns", patterns.size());
    }

    /**
     * Folds a completed coordination into its pattern.
     *
     * @param start the START event providing domains, item count and strategy
     * @param terminal the terminal event; must carry a duration
     * @return the created or updated pattern
     */
    public Pattern learn(CoordinationEvent start, CoordinationEvent terminal) {
        Objects.requireNonNull(start, "start");
        Double duration = Objects.requireNonNull(terminal.durationSeconds(), "terminal duration");
        PatternKey key = PatternKey.of(start.domains(), start.itemCount(), start.strategy());
        Pattern updated = update(patterns.get(key.canonical()), key, duration, terminal.isSuccessful(),
                terminal.timestamp());
        patterns.put(key.canonical(), updated);
        LOG.debug("Learned pattern {}: usage={}, successRate={}, confidence={}",
                key, updated.usageCount(), updated.successRate(), updated.confidence());
        return updated;
    }

    /**
     * Pure update step.
     *
     * @param existing current pattern, or {@code null} for a new key
     */
    static Pattern update(Pattern existing, PatternKey key, double duration, boolean success, Instant now) {
        double outcome = success ? 1.0 : 0.0;
        if (existing == null) {
            return new Pattern(key, PatternType.classify(key.strategy(), key.itemCount()),
                    outcome, duration, 1, now, INITIAL_CONFIDENCE);
        }
        int n = existing.usageCount();
        int usage = n + 1;
        double avgDuration = (existing.avgDuration() * n + duration) / usage;
        double successRate = (existing.successRate() * n + outcome) / usage;
        return new Pattern(key, existing.type(), successRate, avgDuration, usage, now,
                confidenceFor(usage, successRate));
    }

    static double confidenceFor(int usageCount, double successRate) {
        return Math.min(MAX_CONFIDENCE, usageCount * USAGE_WEIGHT + successRate * SUCCESS_WEIGHT);
    }

    /**
     * Writes the full pattern map to the store.
     *
     * @throws com.phillippitts.coordination.exception.PersistenceException on write failure
     */
    public void persist() {
        store.savePatterns(new LinkedHashMap<>(patterns));
    }

    public Pattern find(PatternKey key) {
        return patterns.get(key.canonical());
    }

    /**
     * Patterns in first-learned order.
     */
    public List<Pattern> patterns() {
        return List.copyOf(new ArrayList<>(patterns.values()));
    }

    public int size() {
        return patterns.size();
    }
}
