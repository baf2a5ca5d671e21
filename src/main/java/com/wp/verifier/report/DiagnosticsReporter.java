package com.wp.verifier.report;

import com.wp.verifier.model.Diagnostic;
import com.wp.verifier.model.SourceSpan;
import com.wp.verifier.model.VerificationCondition;
import com.wp.verifier.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Aggregates per-condition results into a {@link FunctionReport} and renders failures for humans.
 */
public class DiagnosticsReporter {

    private static final Logger logger = LoggerFactory.getLogger(DiagnosticsReporter.class);

    /**
     * Builds the report of one function.
     *
     * <p>A refutation of a condition that assumed an implicit loop invariant is reported as
     * unknown, since the missing invariant rather than the code may be at fault.
     *
     * @param results result per condition id; must cover exactly the given conditions
     * @throws IllegalStateException if a condition has no result or a result has no condition
     */
    public FunctionReport report(String functionName, SourceSpan span, List<VerificationCondition> conditions,
                                 Map<String, VerificationResult> results, List<Diagnostic> diagnostics) {
        if (results.size() != conditions.size()) {
            throw new IllegalStateException(functionName + ": " + conditions.size() + " conditions emitted but "
                    + results.size() + " resolved");
        }

        List<VcOutcome> outcomes = new ArrayList<>(conditions.size());
        for (VerificationCondition vc : conditions) {
            VerificationResult result = results.get(vc.getId());
            if (result == null) {
                throw new IllegalStateException("No result for " + vc.getId());
            }
            if (result.isRefuted() && vc.assumesImplicitInvariant()) {
                logger.debug("Downgrading refutation of {}: hypothesis uses an implicit invariant", vc.getId());
                result = VerificationResult.unknown("refuted only under an implicit `true` loop invariant");
            }
            outcomes.add(new VcOutcome(vc, result));
        }

        FunctionVerdict verdict = aggregate(outcomes, diagnostics);
        return new FunctionReport(functionName, span, verdict, outcomes, diagnostics);
    }

    /**
     * Report for a function whose CFG could not be built.
     */
    public FunctionReport structuralFailure(String functionName, SourceSpan span, String message,
                                            List<Diagnostic> earlier) {
        return structuralFailure(functionName, span, message, span, earlier);
    }

    /**
     * @param errorSpan location of the offending statement
     */
    public FunctionReport structuralFailure(String functionName, SourceSpan span, String message,
                                            SourceSpan errorSpan, List<Diagnostic> earlier) {
        List<Diagnostic> diagnostics = new ArrayList<>(earlier);
        diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, Diagnostic.Code.STRUCTURAL_ERROR, message, errorSpan));
        return new FunctionReport(functionName, span, FunctionVerdict.INCONCLUSIVE, Collections.emptyList(),
                diagnostics);
    }

    static FunctionVerdict aggregate(List<VcOutcome> outcomes, List<Diagnostic> diagnostics) {
        boolean unknown = false;
        for (VcOutcome outcome : outcomes) {
            if (outcome.getResult().isRefuted()) {
                return FunctionVerdict.FAILED;
            }
            unknown |= outcome.getResult().isUnknown();
        }
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.getCode() == Diagnostic.Code.MISSING_INVARIANT
                    || diagnostic.getCode() == Diagnostic.Code.STRUCTURAL_ERROR) {
                unknown = true;
            }
        }
        return unknown ? FunctionVerdict.INCONCLUSIVE : FunctionVerdict.VERIFIED;
    }

    /**
     * Restates a refuted or undecided condition, e.g.
     * {@code Example.java:7:5: postcondition `y > x` does not hold [POSTCONDITION] counterexample: x = 0, y = -1}.
     */
    public String describe(VcOutcome outcome) {
        VerificationCondition vc = outcome.getCondition();
        VerificationResult result = outcome.getResult();
        StringBuilder sb = new StringBuilder();
        sb.append(vc.getSpan()).append(": ").append(vc.getDescription());
        switch (result.getOutcome()) {
            case PROVED:
                sb.append(" holds");
                break;
            case REFUTED:
                sb.append(" does not hold");
                break;
            default:
                sb.append(" could not be decided");
        }
        sb.append(" [").append(vc.getKind()).append(']');
        if (result.isRefuted() && !result.getCounterexample().isEmpty()) {
            StringJoiner values = new StringJoiner(", ");
            result.getCounterexample().forEach((name, value) -> values.add(name + " = " + value));
            sb.append(" counterexample: ").append(values);
        } else if (result.isUnknown()) {
            sb.append(" (").append(result.getReason()).append(')');
        }
        return sb.toString();
    }

    /**
     * Multi-line summary of a report: verdict, then every non-proved condition, then diagnostics.
     */
    public String format(FunctionReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(report.getFunctionName()).append(": ").append(report.getVerdict());
        sb.append(" (").append(report.count(VerificationResult.Outcome.PROVED)).append('/')
                .append(report.getOutcomes().size()).append(" proved)");
        for (VcOutcome outcome : report.getOutcomes()) {
            if (!outcome.getResult().isProved()) {
                sb.append("\n  ").append(describe(outcome));
            }
        }
        for (Diagnostic diagnostic : report.getDiagnostics()) {
            if (diagnostic.getSeverity() != Diagnostic.Severity.INFO) {
                sb.append("\n  ").append(diagnostic);
            }
        }
        return sb.toString();
    }
}
