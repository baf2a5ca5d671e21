package com.wp.verifier.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of discharging a single verification condition.
 */
public final class VerificationResult {

    public enum Outcome {
        PROVED,
        REFUTED,
        UNKNOWN
    }

    private static final VerificationResult PROVED = new VerificationResult(Outcome.PROVED, Collections.emptyMap(), null);

    private final Outcome outcome;
    private final Map<String, String> counterexample;
    private final String reason;

    private VerificationResult(Outcome outcome, Map<String, String> counterexample, String reason) {
        this.outcome = outcome;
        this.counterexample = counterexample;
        this.reason = reason;
    }

    public static VerificationResult proved() {
        return PROVED;
    }

    /**
     * @param counterexample variable assignment under which the condition is false, in report order
     */
    public static VerificationResult refuted(Map<String, String> counterexample) {
        return new VerificationResult(Outcome.REFUTED,
                Collections.unmodifiableMap(new LinkedHashMap<>(counterexample)), null);
    }

    public static VerificationResult unknown(String reason) {
        return new VerificationResult(Outcome.UNKNOWN, Collections.emptyMap(), Objects.requireNonNull(reason));
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Map<String, String> getCounterexample() {
        return counterexample;
    }

    /**
     * Why the condition could not be decided; {@code null} unless the outcome is {@link Outcome#UNKNOWN}.
     */
    public String getReason() {
        return reason;
    }

    public boolean isProved() {
        return outcome == Outcome.PROVED;
    }

    public boolean isRefuted() {
        return outcome == Outcome.REFUTED;
    }

    public boolean isUnknown() {
        return outcome == Outcome.UNKNOWN;
    }

    @Override
    public String toString() {
        switch (outcome) {
            case REFUTED:
                return "Refuted" + counterexample;
            case UNKNOWN:
                return "Unknown(" + reason + ")";
            default:
                return "Proved";
        }
    }
}
