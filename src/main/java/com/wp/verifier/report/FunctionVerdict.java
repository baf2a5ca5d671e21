package com.wp.verifier.report;

/**
 * Aggregate result of verifying one function.
 */
public enum FunctionVerdict {
    /** Every condition proved and no diagnostic weakens the result. */
    VERIFIED,
    /** At least one condition refuted. */
    FAILED,
    /** Nothing refuted, but something could not be decided. */
    INCONCLUSIVE
}
