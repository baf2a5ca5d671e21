package com.wp.verifier.solver;

import com.wp.verifier.model.Expr;
import com.wp.verifier.model.VerificationResult;

/**
 * Decision procedure for the validity of a formula. Implementations must not throw for any
 * formula: whatever prevents a decision is reported as {@link VerificationResult.Outcome#UNKNOWN}.
 */
public interface ValidityChecker {

    /**
     * @return {@code PROVED} if the formula holds in every state, {@code REFUTED} with a falsifying
     *         assignment if it does not, {@code UNKNOWN} otherwise
     */
    VerificationResult checkValidity(Expr formula);
}
