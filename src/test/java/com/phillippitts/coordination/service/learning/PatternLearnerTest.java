package com.phillippitts.coordination.service.learning;

import com.phillippitts.coordination.domain.CoordinationEvent;
import com.phillippitts.coordination.domain.CoordinationEventType;
import com.phillippitts.coordination.domain.Pattern;
import com.phillippitts.coordination.domain.PatternKey;
import com.phillippitts.coordination.domain.PatternType;
import com.phillippitts.coordination.service.store.InMemoryCoordinationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PatternLearnerTest {

    private static final Instant T0 = Instant.parse("2025-01-15T10:00:00Z");

    private InMemoryCoordinationStore store;
    private PatternLearner learner;

    @BeforeEach
    void setUp() {
        store = new InMemoryCoordinationStore();
        learner = new PatternLearner(store);
    }

    @Test
    void firstCompletionCreatesPatternWithInitialConfidence() {
        Pattern p = complete(List.of("testing"), 2, "single_parallel", 1.5, true);

        assertThat(p.id()).isEqualTo("testing_2_single_parallel");
        assertThat(p.usageCount()).isEqualTo(1);
        assertThat(p.successRate()).isEqualTo(1.0);
        assertThat(p.avgDuration()).isEqualTo(1.5);
        assertThat(p.confidence()).isEqualTo(0.3);
        assertThat(p.type()).isEqualTo(PatternType.PARALLEL);
    }

    @Test
    void threeSuccessfulRunsAverageDuration() {
        complete(List.of("backend"), 2, "direct", 1.0, true);
        complete(List.of("backend"), 2, "direct", 2.0, true);
        Pattern p = complete(List.of("backend"), 2, "direct", 3.0, true);

        assertThat(p.usageCount()).isEqualTo(3);
        assertThat(p.avgDuration()).isCloseTo(2.0, within(1e-9));
        assertThat(p.successRate()).isEqualTo(1.0);
        assertThat(p.confidence()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void failureLowersSuccessRateAsRunningMean() {
        complete(List.of("backend"), 2, "direct", 1.0, true);
        Pattern p = complete(List.of("backend"), 2, "direct", 1.0, false);

        assertThat(p.successRate()).isEqualTo(0.5);
        assertThat(p.confidence()).isCloseTo(0.2 + 0.25, within(1e-9));
    }

    @Test
    void confidenceNeverDecreasesForConstantSuccessAndIsCapped() {
        double previous = 0.0;
        for (int i = 0; i < 12; i++) {
            Pattern p = complete(List.of("a"), 1, "direct", 1.0, true);
            assertThat(p.confidence()).isGreaterThanOrEqualTo(previous);
            previous = p.confidence();
        }
        assertThat(previous).isEqualTo(0.95);
    }

    @Test
    void domainOrderDoesNotSplitPatterns() {
        complete(List.of("b", "a"), 2, "direct", 1.0, true);
        complete(List.of("a", "b", "a"), 2, "direct", 1.0, true);

        assertThat(learner.size()).isEqualTo(1);
        assertThat(learner.find(PatternKey.of(List.of("a", "b"), 2, "direct")).usageCount()).isEqualTo(2);
    }

    @Test
    void persistedPatternsReloadIntoNewLearner() {
        complete(List.of("x"), 1, "direct", 1.0, true);
        learner.persist();

        PatternLearner reloaded = new PatternLearner(store);

        assertThat(reloaded.patterns()).hasSize(1);
        assertThat(reloaded.patterns().get(0).id()).isEqualTo("x_1_direct");
    }

    private Pattern complete(List<String> domains, int count, String strategy, double duration, boolean success) {
        CoordinationEvent start = CoordinationEvent.start("c", T0, count, domains, strategy, null);
        CoordinationEvent done = CoordinationEvent.terminal("c",
                success ? CoordinationEventType.COMPLETE : CoordinationEventType.ERROR,
                T0.plusSeconds(1), start, duration, success, null);
        return learner.learn(start, done);
    }
}
