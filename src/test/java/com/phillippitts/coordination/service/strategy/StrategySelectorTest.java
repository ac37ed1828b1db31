package com.phillippitts.coordination.service.strategy;

import com.phillippitts.coordination.config.properties.StrategyProperties;
import com.phillippitts.coordination.domain.Strategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StrategySelectorTest {

    private final StrategySelector selector = new StrategySelector(StrategyProperties.defaults());

    @ParameterizedTest
    @CsvSource({
            "1, DIRECT", "3, DIRECT",
            "4, PARALLEL", "6, PARALLEL",
            "7, STRATEGIC", "10, STRATEGIC",
            "11, DEGRADED", "25, DEGRADED"
    })
    void selectsByItemCount(int itemCount, Strategy expected) {
        assertThat(selector.select(itemCount, List.of("backend"), false)).isEqualTo(expected);
    }

    @Test
    void constraintViolationAlwaysDegrades() {
        assertThat(selector.select(2, List.of("backend"), true)).isEqualTo(Strategy.DEGRADED);
    }

    @Test
    void fourDistinctDomainsEscalateToStrategic() {
        assertThat(selector.select(2, List.of("a", "b", "c", "d"), false)).isEqualTo(Strategy.STRATEGIC);
        assertThat(selector.select(5, List.of("a", "b", "c", "d"), false)).isEqualTo(Strategy.STRATEGIC);
    }

    @Test
    void duplicateDomainsDoNotEscalate() {
        assertThat(selector.select(2, List.of("a", "a", "b", "c"), false)).isEqualTo(Strategy.DIRECT);
    }

    @Test
    void escalationNeverLowersDegraded() {
        assertThat(selector.select(12, List.of("a", "b", "c", "d"), false)).isEqualTo(Strategy.DEGRADED);
    }

    @Test
    void nullDomainsCountAsNone() {
        assertThat(StrategySelector.distinctDomainCount(null)).isZero();
        assertThat(selector.select(1, null, false)).isEqualTo(Strategy.DIRECT);
    }

    @Test
    void estimatesDurationByBand() {
        assertThat(selector.estimateDuration(1)).isEqualTo(1.0);
        assertThat(selector.estimateDuration(3)).isEqualTo(3.0);
        assertThat(selector.estimateDuration(6)).isEqualTo(4.6, org.assertj.core.data.Offset.offset(1e-9));
    }
}
