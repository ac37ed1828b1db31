package com.phillippitts.coordination.domain;

import com.phillippitts.coordination.exception.CoordinationErrorKind;

/**
 * Outcome of an admission check.
 *
 * @param admitted whether the request may proceed
 * @param rejection failure kind, {@code null} when admitted
 * @param reason human-readable reason, {@code "ok"} when admitted
 * @param estimatedCost estimated token/resource cost of the request (0 for invalid counts)
 */
public record AdmissionDecision(
        boolean admitted,
        CoordinationErrorKind rejection,
        String reason,
        int estimatedCost
) {
    public static final String OK = "ok";

    public static AdmissionDecision admit(int estimatedCost) {
        return new AdmissionDecision(true, null, OK, estimatedCost);
    }

    public static AdmissionDecision reject(CoordinationErrorKind kind, String reason, int estimatedCost) {
        return new AdmissionDecision(false, kind, reason, estimatedCost);
    }

    /**
     * Returns {@code true} when the rejection stems from request size or cost rather than
     * from invalid input or a busy engine; such requests may still be planned in degraded mode.
     */
    public boolean violatesConstraints() {
        return rejection == CoordinationErrorKind.OVER_CAPACITY
                || rejection == CoordinationErrorKind.BUDGET_EXCEEDED;
    }
}
