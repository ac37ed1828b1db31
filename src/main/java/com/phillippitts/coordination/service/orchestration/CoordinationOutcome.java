package com.phillippitts.coordination.service.orchestration;

import com.phillippitts.coordination.domain.AdmissionDecision;
import com.phillippitts.coordination.domain.CoordinationPlan;
import com.phillippitts.coordination.domain.Recommendation;
import com.phillippitts.coordination.domain.Strategy;

/**
 * Result of {@link CoordinationEngine#coordinate}.
 *
 * @param coordinationId id the caller uses for start and completion reports
 * @param selectedStrategy {@code null} when the request was rejected
 * @param plan {@code null} when the request was rejected
 * @param windowOpen whether a coordination window was opened for this id
 */
public record CoordinationOutcome(
        String coordinationId,
        AdmissionDecision admission,
        Strategy selectedStrategy,
        CoordinationPlan plan,
        Recommendation recommendation,
        boolean windowOpen
) {
    public boolean hasPlan() {
        return plan != null;
    }
}
