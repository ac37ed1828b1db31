package com.phillippitts.coordination.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for coordination decisions and outcomes.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Admission outcomes, tagged by result ({@code ok} or the rejection kind)</li>
 *   <li>Plans produced, tagged by strategy and degraded flag</li>
 *   <li>Completions, tagged by event type, strategy and outcome</li>
 *   <li>Store write failures, tagged by collection</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer at /actuator/metrics.
 */
@Component
public class CoordinationMetrics {

    private static final String METRIC_PREFIX = "coordination";

    private final MeterRegistry registry;

    public CoordinationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param result {@code ok} or a lowercase rejection kind
     */
    public void incrementAdmission(String result) {
        Counter.builder(METRIC_PREFIX + ".admission")
                .description("Number of admission decisions")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void incrementPlan(String strategy, boolean degraded) {
        Counter.builder(METRIC_PREFIX + ".plan")
                .description("Number of coordination plans produced")
                .tag("strategy", strategy)
                .tag("degraded", Boolean.toString(degraded))
                .register(registry)
                .increment();
    }

    public void incrementCompletion(String type, String strategy, boolean success) {
        Counter.builder(METRIC_PREFIX + ".completion")
                .description("Number of terminal coordination reports")
                .tag("type", type)
                .tag("strategy", strategy)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    /**
     * Records wall-clock time between START and terminal report.
     */
    public void recordDuration(String strategy, Duration duration) {
        Timer.builder(METRIC_PREFIX + ".duration")
                .description("Time between coordination start and completion")
                .tag("strategy", strategy)
                .register(registry)
                .record(duration);
    }

    public void incrementPersistenceFailure(String collection) {
        Counter.builder(METRIC_PREFIX + ".persistence.failure")
                .description("Number of failed store writes")
                .tag("collection", collection)
                .register(registry)
                .increment();
    }
}
