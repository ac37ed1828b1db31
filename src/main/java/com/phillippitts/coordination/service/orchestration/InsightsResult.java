package com.phillippitts.coordination.service.orchestration;

import com.phillippitts.coordination.domain.Insight;
import com.phillippitts.coordination.domain.PersistenceFailure;

import java.util.List;

/**
 * Outcome of an insight run. The retained set is updated in memory even when writing it fails.
 *
 * @param insights insights produced by this run
 */
public record InsightsResult(
        List<Insight> insights,
        List<PersistenceFailure> persistenceFailures
) {
    public InsightsResult {
        insights = insights == null ? List.of() : List.copyOf(insights);
        persistenceFailures = persistenceFailures == null ? List.of() : List.copyOf(persistenceFailures);
    }

    public boolean isPersisted() {
        return persistenceFailures.isEmpty();
    }
}
