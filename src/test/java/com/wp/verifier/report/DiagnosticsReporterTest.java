package com.wp.verifier.report;

import com.wp.verifier.model.ConditionKind;
import com.wp.verifier.model.Diagnostic;
import com.wp.verifier.model.Expr;
import com.wp.verifier.model.VerificationCondition;
import com.wp.verifier.model.VerificationResult;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.wp.verifier.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsReporterTest {

    private final DiagnosticsReporter reporter = new DiagnosticsReporter();

    @Test
    void allProvedIsVerified() {
        VerificationCondition vc = condition("f#0", false);
        FunctionReport report = reporter.report("f", line(1), List.of(vc),
                Map.of("f#0", VerificationResult.proved()), Collections.emptyList());

        assertEquals(FunctionVerdict.VERIFIED, report.getVerdict());
        assertTrue(report.getFailures().isEmpty());
    }

    @Test
    void anyRefutationFails() {
        VerificationCondition a = condition("f#0", false);
        VerificationCondition b = condition("f#1", false);
        Map<String, VerificationResult> results = new LinkedHashMap<>();
        results.put("f#0", VerificationResult.unknown("timeout"));
        results.put("f#1", VerificationResult.refuted(Map.of("x", "0")));

        FunctionReport report = reporter.report("f", line(1), List.of(a, b), results, Collections.emptyList());

        assertEquals(FunctionVerdict.FAILED, report.getVerdict());
        assertEquals(2, report.getFailures().size());
    }

    @Test
    void unknownIsInconclusive() {
        FunctionReport report = reporter.report("f", line(1), List.of(condition("f#0", false)),
                Map.of("f#0", VerificationResult.unknown("timeout")), Collections.emptyList());
        assertEquals(FunctionVerdict.INCONCLUSIVE, report.getVerdict());
    }

    @Test
    void missingInvariantMakesProvedFunctionInconclusive() {
        Diagnostic missing = new Diagnostic(Diagnostic.Severity.WARNING, Diagnostic.Code.MISSING_INVARIANT,
                "loop has no invariant", line(5));
        FunctionReport report = reporter.report("f", line(1), List.of(condition("f#0", false)),
                Map.of("f#0", VerificationResult.proved()), List.of(missing));

        assertEquals(FunctionVerdict.INCONCLUSIVE, report.getVerdict());
        assertTrue(report.hasDiagnostic(Diagnostic.Code.MISSING_INVARIANT));
    }

    @Test
    void refutationUnderImplicitInvariantIsDowngraded() {
        FunctionReport report = reporter.report("f", line(1), List.of(condition("f#0", true)),
                Map.of("f#0", VerificationResult.refuted(Map.of("i", "3"))), Collections.emptyList());

        assertEquals(FunctionVerdict.INCONCLUSIVE, report.getVerdict());
        assertTrue(report.getOutcomes().get(0).getResult().isUnknown());
    }

    @Test
    void mismatchedResultsAreRejected() {
        List<VerificationCondition> conditions = List.of(condition("f#0", false), condition("f#1", false));
        Map<String, VerificationResult> results = Map.of("f#0", VerificationResult.proved());
        assertThrows(IllegalStateException.class,
                () -> reporter.report("f", line(1), conditions, results, Collections.emptyList()));
    }

    @Test
    void structuralFailureKeepsBothLocations() {
        FunctionReport report = reporter.structuralFailure("f", line(1), "break outside of a loop", line(9),
                Collections.emptyList());

        assertEquals(FunctionVerdict.INCONCLUSIVE, report.getVerdict());
        assertTrue(report.getOutcomes().isEmpty());
        assertEquals(line(1), report.getSpan());
        Diagnostic error = report.getDiagnostics().get(0);
        assertEquals(Diagnostic.Code.STRUCTURAL_ERROR, error.getCode());
        assertEquals(line(9), error.getSpan());
    }

    @Test
    void describesRefutationWithCounterexample() {
        Map<String, String> counterexample = new LinkedHashMap<>();
        counterexample.put("x", "1");
        counterexample.put("y", "0");
        VcOutcome outcome = new VcOutcome(condition("f#0", false), VerificationResult.refuted(counterexample));

        assertEquals("Fixture.java:2:1: postcondition does not hold [POSTCONDITION] counterexample: x = 1, y = 0",
                reporter.describe(outcome));
    }

    @Test
    void formatListsOnlyOpenConditions() {
        VerificationCondition a = condition("f#0", false);
        VerificationCondition b = condition("f#1", false);
        Map<String, VerificationResult> results = new LinkedHashMap<>();
        results.put("f#0", VerificationResult.proved());
        results.put("f#1", VerificationResult.unknown("timeout"));
        FunctionReport report = reporter.report("f", line(1), List.of(a, b), results, Collections.emptyList());

        String text = reporter.format(report);

        assertTrue(text.startsWith("f: INCONCLUSIVE (1/2 proved)"));
        assertEquals(2, text.split("\n").length);
        assertTrue(text.contains("could not be decided"));
    }

    private static VerificationCondition condition(String id, boolean implicitInvariant) {
        return new VerificationCondition(id, "f", Expr.gt(Y, X), ConditionKind.POSTCONDITION, line(2),
                "postcondition", implicitInvariant);
    }
}
