package com.wp.verifier.evaluation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wp.verifier.model.ConditionKind;
import com.wp.verifier.model.Expr;
import com.wp.verifier.model.VerificationCondition;
import com.wp.verifier.model.VerificationResult;
import com.wp.verifier.report.DiagnosticsReporter;
import com.wp.verifier.report.FunctionReport;
import com.wp.verifier.report.FunctionVerdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.wp.verifier.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MetricsCollectorTest {

    private MetricsCollector collector;

    @BeforeEach
    void setUp() {
        collector = new MetricsCollector();
        collector.startAnalysis();
        collector.recordFile();

        VerificationCondition pre = condition("f#0", ConditionKind.CALL_PRECONDITION);
        VerificationCondition post = condition("f#1", ConditionKind.POSTCONDITION);
        Map<String, VerificationResult> results = new LinkedHashMap<>();
        results.put("f#0", VerificationResult.proved());
        results.put("f#1", VerificationResult.refuted(Map.of("x", "0")));
        DiagnosticsReporter reporter = new DiagnosticsReporter();
        collector.recordReport(reporter.report("f", line(1), List.of(pre, post), results, Collections.emptyList()));
        collector.recordReport(reporter.structuralFailure("g", line(5), "unsupported", Collections.emptyList()));
        collector.recordSolverCalls(2);
        collector.endAnalysis();
    }

    @Test
    void aggregatesReports() {
        MetricsCollector.MetricsReport report = collector.generateReport();

        assertEquals(1, report.totalFiles);
        assertEquals(2, report.totalFunctions);
        assertEquals(2, report.totalConditions);
        assertEquals(2, report.solverCalls);
        assertEquals(50.0, report.provedPercentage, 0.001);
        assertEquals(1, report.verdictCounts.get(FunctionVerdict.FAILED));
        assertEquals(1, report.verdictCounts.get(FunctionVerdict.INCONCLUSIVE));
        assertEquals(1, report.outcomeCounts.get(VerificationResult.Outcome.REFUTED));
        assertEquals(1, report.conditionKindCounts.get(ConditionKind.POSTCONDITION));
    }

    @Test
    void exportsValidJson(@TempDir Path dir) throws IOException {
        Path output = dir.resolve("metrics.json");
        collector.exportJSON(output);

        JsonNode root = new ObjectMapper().readTree(output.toFile());
        assertEquals(2, root.path("codeMetrics").path("totalFunctions").asInt());
        assertEquals(2, root.path("conditions").path("total").asInt());
        assertEquals(50.0, root.path("conditions").path("provedPercentage").asDouble(), 0.001);
        assertEquals(1, root.path("outcomes").path("PROVED").asInt());
        assertEquals(1, root.path("verdicts").path("FAILED").asInt());
    }

    @Test
    void emptyCollectorReportsZeroes() {
        MetricsCollector.MetricsReport report = new MetricsCollector().generateReport();

        assertEquals(0, report.totalFunctions);
        assertEquals(0.0, report.provedPercentage);
        assertEquals(0.0, report.averageTimePerFunction);
    }

    private static VerificationCondition condition(String id, ConditionKind kind) {
        return new VerificationCondition(id, "f", Expr.gt(Y, X), kind, line(2), null, false);
    }
}
