package com.wp.verifier.evaluation;

import com.wp.verifier.cfg.ControlFlowGraph;
import com.wp.verifier.model.ConditionKind;
import com.wp.verifier.model.VerificationResult;
import com.wp.verifier.report.FunctionReport;
import com.wp.verifier.report.FunctionVerdict;
import com.wp.verifier.report.VcOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Collects metrics of a verification run: code size, condition counts and outcomes.
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    // Timing metrics
    private Instant startTime;
    private long totalAnalysisTimeMs = 0;

    // Code metrics
    private int totalFiles = 0;
    private int totalFunctions = 0;
    private int totalBlocks = 0;
    private int totalLoops = 0;

    // Conditions
    private int totalConditions = 0;
    private int solverCalls = 0;
    private final Map<ConditionKind, Integer> conditionKindCounts = new EnumMap<>(ConditionKind.class);
    private final Map<VerificationResult.Outcome, Integer> outcomeCounts = new EnumMap<>(VerificationResult.Outcome.class);

    // Verdicts
    private final Map<FunctionVerdict, Integer> verdictCounts = new EnumMap<>(FunctionVerdict.class);

    public synchronized void startAnalysis() {
        this.startTime = Instant.now();
        logger.info("Metrics collection started");
    }

    public synchronized void endAnalysis() {
        if (startTime == null) {
            return;
        }
        this.totalAnalysisTimeMs = Duration.between(startTime, Instant.now()).toMillis();
        logger.info("Metrics collection completed in {}ms", totalAnalysisTimeMs);
    }

    public synchronized void recordFile() {
        totalFiles++;
    }

    /**
     * Record the shape of a function's CFG.
     */
    public synchronized void recordGraph(ControlFlowGraph cfg) {
        totalBlocks += cfg.size();
        totalLoops += cfg.getLoops().size();
    }

    /**
     * Record the number of solver queries made for a function after merging duplicates.
     */
    public synchronized void recordSolverCalls(int calls) {
        solverCalls += calls;
    }

    /**
     * Record the verdict and every condition outcome of a function.
     */
    public synchronized void recordReport(FunctionReport report) {
        totalFunctions++;
        verdictCounts.merge(report.getVerdict(), 1, Integer::sum);
        for (VcOutcome outcome : report.getOutcomes()) {
            totalConditions++;
            conditionKindCounts.merge(outcome.getCondition().getKind(), 1, Integer::sum);
            outcomeCounts.merge(outcome.getResult().getOutcome(), 1, Integer::sum);
        }
    }

    public synchronized MetricsReport generateReport() {
        MetricsReport report = new MetricsReport();

        report.totalAnalysisTimeMs = totalAnalysisTimeMs;
        report.averageTimePerFunction = totalFunctions > 0 ? (double) totalAnalysisTimeMs / totalFunctions : 0;

        report.totalFiles = totalFiles;
        report.totalFunctions = totalFunctions;
        report.totalBlocks = totalBlocks;
        report.totalLoops = totalLoops;

        report.totalConditions = totalConditions;
        report.solverCalls = solverCalls;
        report.conditionKindCounts = new EnumMap<>(conditionKindCounts);
        report.outcomeCounts = new EnumMap<>(outcomeCounts);
        report.verdictCounts = new EnumMap<>(verdictCounts);
        report.provedPercentage = calculatePercentage(outcomeCounts.getOrDefault(VerificationResult.Outcome.PROVED, 0),
                totalConditions);
        return report;
    }

    /**
     * Export metrics to JSON for further analysis.
     */
    public void exportJSON(Path outputPath) throws IOException {
        MetricsReport report = generateReport();

        try (FileWriter writer = new FileWriter(outputPath.toFile())) {
            writer.write("{\n");
            writer.write("  \"timing\": {\n");
            writer.write(String.format(Locale.ROOT, "    \"totalAnalysisTimeMs\": %d,\n", report.totalAnalysisTimeMs));
            writer.write(String.format(Locale.ROOT, "    \"averageTimePerFunction\": %.2f\n", report.averageTimePerFunction));
            writer.write("  },\n");

            writer.write("  \"codeMetrics\": {\n");
            writer.write(String.format("    \"totalFiles\": %d,\n", report.totalFiles));
            writer.write(String.format("    \"totalFunctions\": %d,\n", report.totalFunctions));
            writer.write(String.format("    \"totalBlocks\": %d,\n", report.totalBlocks));
            writer.write(String.format("    \"totalLoops\": %d\n", report.totalLoops));
            writer.write("  },\n");

            writer.write("  \"conditions\": {\n");
            writer.write(String.format("    \"total\": %d,\n", report.totalConditions));
            writer.write(String.format("    \"solverCalls\": %d,\n", report.solverCalls));
            writer.write(String.format(Locale.ROOT, "    \"provedPercentage\": %.2f\n", report.provedPercentage));
            writer.write("  },\n");

            writeCounts(writer, "conditionKinds", report.conditionKindCounts, true);
            writeCounts(writer, "outcomes", report.outcomeCounts, true);
            writeCounts(writer, "verdicts", report.verdictCounts, false);

            writer.write("}\n");
        }

        logger.info("Metrics exported to: {}", outputPath);
    }

    private static void writeCounts(FileWriter writer, String name, Map<? extends Enum<?>, Integer> counts,
                                    boolean more) throws IOException {
        writer.write("  \"" + name + "\": {\n");
        int count = 0;
        for (Map.Entry<? extends Enum<?>, Integer> entry : counts.entrySet()) {
            writer.write(String.format("    \"%s\": %d", entry.getKey().name(), entry.getValue()));
            if (++count < counts.size()) writer.write(",");
            writer.write("\n");
        }
        writer.write(more ? "  },\n" : "  }\n");
    }

    /**
     * Print a human-readable report to console.
     */
    public void printReport() {
        MetricsReport report = generateReport();

        System.out.println("\n" + "=".repeat(80));
        System.out.println("WP VERIFICATION - METRICS REPORT");
        System.out.println("=".repeat(80));

        System.out.println("\n[TIMING]");
        System.out.printf("  Total Analysis Time: %.2f seconds\n", report.totalAnalysisTimeMs / 1000.0);
        System.out.printf("  Average Time per Function: %.2f ms\n", report.averageTimePerFunction);

        System.out.println("\n[CODE METRICS]");
        System.out.printf("  Files Analyzed: %d\n", report.totalFiles);
        System.out.printf("  Functions:      %d\n", report.totalFunctions);
        System.out.printf("  Basic Blocks:   %d\n", report.totalBlocks);
        System.out.printf("  Loops:          %d\n", report.totalLoops);

        System.out.println("\n[VERIFICATION CONDITIONS]");
        System.out.printf("  Total: %,d (%d solver call(s) after merging)\n", report.totalConditions, report.solverCalls);
        report.conditionKindCounts.forEach((kind, count) ->
                System.out.printf("  %-20s: %,6d\n", kind, count));

        System.out.println("\n[OUTCOMES]");
        for (VerificationResult.Outcome outcome : VerificationResult.Outcome.values()) {
            int count = report.outcomeCounts.getOrDefault(outcome, 0);
            System.out.printf("  %-10s: %,6d (%.1f%%)\n", outcome, count, calculatePercentage(count, report.totalConditions));
        }

        System.out.println("\n[VERDICTS]");
        for (FunctionVerdict verdict : FunctionVerdict.values()) {
            System.out.printf("  %-13s: %,6d\n", verdict, report.verdictCounts.getOrDefault(verdict, 0));
        }

        System.out.println("\n" + "=".repeat(80) + "\n");
    }

    private static double calculatePercentage(int part, int total) {
        return total > 0 ? (100.0 * part / total) : 0.0;
    }

    /**
     * Data class holding all metrics for reporting.
     */
    public static class MetricsReport {
        // Timing
        public long totalAnalysisTimeMs;
        public double averageTimePerFunction;

        // Code metrics
        public int totalFiles;
        public int totalFunctions;
        public int totalBlocks;
        public int totalLoops;

        // Conditions
        public int totalConditions;
        public int solverCalls;
        public double provedPercentage;
        public Map<ConditionKind, Integer> conditionKindCounts;
        public Map<VerificationResult.Outcome, Integer> outcomeCounts;

        // Verdicts
        public Map<FunctionVerdict, Integer> verdictCounts;
    }
}
