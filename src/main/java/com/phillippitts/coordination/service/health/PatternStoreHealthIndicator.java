package com.phillippitts.coordination.service.health;

import com.phillippitts.coordination.domain.PersistenceFailure;
import com.phillippitts.coordination.service.orchestration.CoordinationEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the pattern store.
 *
 * <ul>
 *   <li>UP: every collection written successfully since its last failure</li>
 *   <li>DEGRADED: at least one collection has an unresolved write failure; decisions and
 *       in-memory learning continue</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class PatternStoreHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final CoordinationEngine engine;

    public PatternStoreHealthIndicator(CoordinationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Health health() {
        Map<String, PersistenceFailure> failures = engine.outstandingPersistenceFailures();

        Health.Builder builder = failures.isEmpty()
                ? new Health.Builder().up().withDetail("status", "Pattern store writable")
                : new Health.Builder().status(DEGRADED).withDetail("status", "Pattern store writes failing");

        builder.withDetail("events", engine.eventCount())
                .withDetail("patterns", engine.patterns().size())
                .withDetail("openWindows", engine.openWindows());

        if (!failures.isEmpty()) {
            Map<String, String> detail = new LinkedHashMap<>();
            failures.values().forEach(f -> detail.put(f.collection(), f.message() + " (at " + f.at() + ")"));
            builder.withDetail("failures", detail);
        }
        return builder.build();
    }
}
