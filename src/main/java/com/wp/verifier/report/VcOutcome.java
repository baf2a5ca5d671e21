package com.wp.verifier.report;

import com.wp.verifier.model.VerificationCondition;
import com.wp.verifier.model.VerificationResult;

/**
 * The resolved result of one verification condition.
 */
public final class VcOutcome {

    private final VerificationCondition condition;
    private final VerificationResult result;

    public VcOutcome(VerificationCondition condition, VerificationResult result) {
        this.condition = condition;
        this.result = result;
    }

    public VerificationCondition getCondition() {
        return condition;
    }

    public VerificationResult getResult() {
        return result;
    }

    @Override
    public String toString() {
        return condition.getId() + " " + condition.getKind() + " -> " + result;
    }
}
