package com.phillippitts.coordination.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TimeUtilsTest {

    @Test
    void secondsBetweenKeepsFraction() {
        Instant start = Instant.parse("2025-01-15T10:00:00Z");

        assertThat(TimeUtils.secondsBetween(start, start.plusMillis(2500))).isCloseTo(2.5, within(1e-9));
        assertThat(TimeUtils.secondsBetween(start.plusSeconds(1), start)).isCloseTo(-1.0, within(1e-9));
    }

    @Test
    void toDurationConvertsFractionalSeconds() {
        assertThat(TimeUtils.toDuration(1.5)).isEqualTo(Duration.ofMillis(1500));
        assertThat(TimeUtils.toDuration(0.0)).isEqualTo(Duration.ZERO);
    }

    @Test
    void roundsHalfUp() {
        assertThat(TimeUtils.round(0.6665, 3)).isEqualTo(0.667);
        assertThat(TimeUtils.round(1.005, 2)).isEqualTo(1.01);
        assertThat(TimeUtils.round(2.0 / 3.0, 3)).isEqualTo(0.667);
        assertThat(TimeUtils.round(Double.NaN, 2)).isNaN();
    }
}
