package com.phillippitts.coordination.exception;

import com.phillippitts.coordination.domain.AdmissionDecision;

/**
 * Thrown at the REST boundary when a coordination request is rejected by admission control.
 * The engine itself reports rejections as {@link AdmissionDecision} values.
 */
public class AdmissionRejectedException extends CoordinationException {

    private final AdmissionDecision decision;

    public AdmissionRejectedException(AdmissionDecision decision) {
        super(decision.rejection(), decision.reason());
        this.decision = decision;
    }

    public AdmissionDecision getDecision() {
        return decision;
    }
}
