package com.phillippitts.coordination.service.health;

import com.phillippitts.coordination.exception.PersistenceException;
import com.phillippitts.coordination.service.orchestration.CoordinationEngine;
import com.phillippitts.coordination.service.store.CoordinationStore;
import com.phillippitts.coordination.service.store.InMemoryCoordinationStore;
import com.phillippitts.coordination.testutil.EventCapturingPublisher;
import com.phillippitts.coordination.testutil.MutableClock;
import com.phillippitts.coordination.testutil.TestEngines;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PatternStoreHealthIndicatorTest {

    @Test
    void shouldReportUpWhenStoreWritable() {
        CoordinationEngine engine = TestEngines.engine(new InMemoryCoordinationStore(), MutableClock.atEpochDay(),
                new EventCapturingPublisher());
        engine.reportStart("c-1", 1, List.of("x"), "direct", null);

        Health health = new PatternStoreHealthIndicator(engine).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "Pattern store writable");
        assertThat(health.getDetails()).containsEntry("events", 1);
        assertThat(health.getDetails()).containsEntry("patterns", 0);
        assertThat(health.getDetails()).doesNotContainKey("failures");
    }

    @Test
    void shouldReportDegradedWhenWritesFail() {
        CoordinationStore store = mock(CoordinationStore.class);
        when(store.loadEvents()).thenReturn(List.of());
        when(store.loadPatterns()).thenReturn(Map.of());
        when(store.loadInsights()).thenReturn(List.of());
        doThrow(new PersistenceException("events", "read-only file system", null))
                .when(store).saveEvents(anyList());
        CoordinationEngine engine = TestEngines.engine(store, MutableClock.atEpochDay(), new EventCapturingPublisher());
        engine.reportStart("c-1", 1, List.of("x"), "direct", null);

        Health health = new PatternStoreHealthIndicator(engine).health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("status", "Pattern store writes failing");
        assertThat(health.getDetails()).containsKey("failures");
        assertThat(health.getDetails().get("failures").toString()).contains("read-only file system");
    }
}
