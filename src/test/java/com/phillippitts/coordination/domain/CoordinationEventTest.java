package com.phillippitts.coordination.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CoordinationEventTest {

    private static final Instant T0 = Instant.parse("2025-01-15T10:00:00Z");

    @Test
    void terminalCopiesStartContext() {
        CoordinationEvent start = CoordinationEvent.start("c-1", T0, 3, List.of("a", "b"), "parallel", List.of("k"));

        CoordinationEvent done = CoordinationEvent.terminal("c-1", CoordinationEventType.COMPLETE,
                T0.plusSeconds(4), start, 4.0, true, null);

        assertThat(done.itemCount()).isEqualTo(3);
        assertThat(done.domains()).containsExactly("a", "b");
        assertThat(done.strategy()).isEqualTo("parallel");
        assertThat(done.itemKinds()).containsExactly("k");
        assertThat(done.durationSeconds()).isEqualTo(4.0);
        assertThat(done.isTerminal()).isTrue();
        assertThat(done.isSuccessful()).isTrue();
    }

    @Test
    void orphanTerminalHasNoContextOrDuration() {
        CoordinationEvent orphan = CoordinationEvent.terminal("ghost", CoordinationEventType.TIMEOUT,
                T0, null, 9.0, false, "timed out");

        assertThat(orphan.itemCount()).isZero();
        assertThat(orphan.domains()).isEmpty();
        assertThat(orphan.strategy()).isEqualTo(CoordinationEvent.UNKNOWN_STRATEGY);
        assertThat(orphan.durationSeconds()).isNull();
        assertThat(orphan.isSuccessful()).isFalse();
    }

    @Test
    void startIsNotTerminal() {
        CoordinationEvent start = CoordinationEvent.start("c-1", T0, 1, null, null, null);

        assertThat(start.isTerminal()).isFalse();
        assertThat(start.success()).isNull();
        assertThat(start.itemKinds()).isNull();
    }
}
