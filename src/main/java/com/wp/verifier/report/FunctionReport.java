package com.wp.verifier.report;

import com.wp.verifier.model.Diagnostic;
import com.wp.verifier.model.SourceSpan;
import com.wp.verifier.model.VerificationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the verifier has to say about one function.
 */
public final class FunctionReport {

    private final String functionName;
    private final SourceSpan span;
    private final FunctionVerdict verdict;
    private final List<VcOutcome> outcomes;
    private final List<Diagnostic> diagnostics;

    public FunctionReport(String functionName, SourceSpan span, FunctionVerdict verdict,
                          List<VcOutcome> outcomes, List<Diagnostic> diagnostics) {
        this.functionName = functionName;
        this.span = span;
        this.verdict = verdict;
        this.outcomes = List.copyOf(outcomes);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String getFunctionName() {
        return functionName;
    }

    public SourceSpan getSpan() {
        return span;
    }

    public FunctionVerdict getVerdict() {
        return verdict;
    }

    public List<VcOutcome> getOutcomes() {
        return outcomes;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<VcOutcome> getFailures() {
        List<VcOutcome> failures = new ArrayList<>();
        for (VcOutcome outcome : outcomes) {
            if (outcome.getResult().isRefuted()) {
                failures.add(outcome);
            }
        }
        return failures;
    }

    public boolean hasDiagnostic(Diagnostic.Code code) {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.getCode() == code) {
                return true;
            }
        }
        return false;
    }

    public long count(VerificationResult.Outcome outcome) {
        return outcomes.stream().filter(o -> o.getResult().getOutcome() == outcome).count();
    }

    @Override
    public String toString() {
        return functionName + ": " + verdict + " (" + outcomes.size() + " conditions)";
    }
}
