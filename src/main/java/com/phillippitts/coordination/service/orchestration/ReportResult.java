package com.phillippitts.coordination.service.orchestration;

import com.phillippitts.coordination.domain.CoordinationEvent;
import com.phillippitts.coordination.domain.Pattern;
import com.phillippitts.coordination.domain.PersistenceFailure;

import java.util.List;

/**
 * Outcome of a lifecycle report. The event is always recorded in memory; write failures are
 * listed rather than thrown.
 *
 * @param orphan terminal report without an open START, including a repeated terminal report
 * @param learnedPattern pattern updated by this report, {@code null} for START and orphan reports
 */
public record ReportResult(
        CoordinationEvent event,
        boolean orphan,
        Pattern learnedPattern,
        List<PersistenceFailure> persistenceFailures
) {
    public ReportResult {
        persistenceFailures = persistenceFailures == null ? List.of() : List.copyOf(persistenceFailures);
    }

    public boolean isPersisted() {
        return persistenceFailures.isEmpty();
    }
}
