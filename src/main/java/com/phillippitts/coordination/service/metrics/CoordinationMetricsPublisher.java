package com.phillippitts.coordination.service.metrics;

import com.phillippitts.coordination.domain.AdmissionDecision;
import com.phillippitts.coordination.domain.CoordinationEvent;
import com.phillippitts.coordination.domain.CoordinationPlan;
import com.phillippitts.coordination.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Translates engine outcomes into {@link CoordinationMetrics} calls.
 *
 * <p><b>Null Safety:</b> all methods are no-ops when constructed without metrics, so the engine
 * runs unchanged in unit tests.
 *
 * @see CoordinationMetrics
 */
@Component
public final class CoordinationMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(CoordinationMetricsPublisher.class);

    /**
     * Singleton no-op instance for tests and engines built without a registry.
     */
    public static final CoordinationMetricsPublisher NOOP = new CoordinationMetricsPublisher(null);

    private final CoordinationMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public CoordinationMetricsPublisher(CoordinationMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("CoordinationMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordAdmission(AdmissionDecision decision) {
        if (metrics == null) {
            return;
        }
        String result = decision.admitted()
                ? AdmissionDecision.OK
                : decision.rejection().name().toLowerCase(Locale.ROOT);
        metrics.incrementAdmission(result);
    }

    public void recordPlan(CoordinationPlan plan) {
        if (metrics == null) {
            return;
        }
        metrics.incrementPlan(plan.strategy().label(), plan.degraded());
    }

    /**
     * Records a terminal event and, when it has one, its duration.
     */
    public void recordCompletion(CoordinationEvent terminal) {
        if (metrics == null) {
            return;
        }
        metrics.incrementCompletion(terminal.type().wireValue(), terminal.strategy(), terminal.isSuccessful());
        if (terminal.durationSeconds() != null) {
            metrics.recordDuration(terminal.strategy(), TimeUtils.toDuration(terminal.durationSeconds()));
        }
    }

    public void recordPersistenceFailure(String collection) {
        if (metrics == null) {
            return;
        }
        metrics.incrementPersistenceFailure(collection);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
