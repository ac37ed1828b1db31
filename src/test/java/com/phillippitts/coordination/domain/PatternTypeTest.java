package com.phillippitts.coordination.domain;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class PatternTypeTest {

    @ParameterizedTest
    @CsvSource({
            "micro_batch, 5, BATCH",
            "Parallel, 4, PARALLEL",
            "direct, 1, SEQUENTIAL",
            "strategic, 8, HYBRID",
            "direct, 2, HYBRID"
    })
    void classifiesByStrategyLabelThenCount(String strategy, int itemCount, PatternType expected) {
        assertThat(PatternType.classify(strategy, itemCount)).isEqualTo(expected);
    }
}
