package com.wp.verifier.processor;

import com.wp.verifier.VerifierOptions;
import com.wp.verifier.analysis.ContractCache;
import com.wp.verifier.ast.FunctionDecl;
import com.wp.verifier.cfg.CfgBuilder;
import com.wp.verifier.cfg.CfgConstructionException;
import com.wp.verifier.cfg.CfgDotExporter;
import com.wp.verifier.cfg.ControlFlowGraph;
import com.wp.verifier.evaluation.MetricsCollector;
import com.wp.verifier.model.VerificationCondition;
import com.wp.verifier.model.VerificationResult;
import com.wp.verifier.report.DiagnosticsReporter;
import com.wp.verifier.report.FunctionReport;
import com.wp.verifier.simplify.SimplifiedVc;
import com.wp.verifier.simplify.VcSimplifier;
import com.wp.verifier.solver.ValidityChecker;
import com.wp.verifier.solver.Z3ValidityChecker;
import com.wp.verifier.wp.WpResult;
import com.wp.verifier.wp.WpTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs functions through CFG construction, WP generation, simplification and solving.
 *
 * <p>Functions are handled one after the other; the conditions of a function are checked in
 * parallel on a fixed pool. A check that misses its deadline is cancelled and reported as unknown.
 * A failure in one function never affects the others.
 */
public class VerificationPipeline implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(VerificationPipeline.class);

    private final VerifierOptions options;
    private final ValidityChecker checker;
    private final ContractCache contracts;
    private final CfgBuilder cfgBuilder;
    private final WpTransformer wpTransformer = new WpTransformer();
    private final VcSimplifier simplifier = new VcSimplifier();
    private final DiagnosticsReporter reporter = new DiagnosticsReporter();
    private final ExecutorService executor;
    private final MetricsCollector metricsCollector;

    public VerificationPipeline(VerifierOptions options) {
        this(options, new Z3ValidityChecker(options.getSolverTimeoutMillis()), new ContractCache());
    }

    public VerificationPipeline(VerifierOptions options, ValidityChecker checker, ContractCache contracts) {
        this.options = options;
        this.checker = checker;
        this.contracts = contracts;
        this.cfgBuilder = new CfgBuilder(contracts);
        this.metricsCollector = options.isCollectMetrics() ? new MetricsCollector() : null;
        AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(options.getParallelism(), task -> {
            Thread thread = new Thread(task, "vc-checker-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Verifies every function. Declared contracts of the functions are registered first, so calls
     * between methods of the same type are summarised by their contracts. A contract already cached
     * under the same owner, name and arity takes precedence.
     *
     * @return one report per function, in input order
     */
    public List<FunctionReport> verifyAll(Collection<FunctionDecl> functions) {
        for (FunctionDecl function : functions) {
            if (!contracts.contains(function.getOwner(), function.getName(), function.getParameters().size())) {
                contracts.register(function);
            }
        }

        List<FunctionReport> reports = new ArrayList<>(functions.size());
        for (FunctionDecl function : functions) {
            FunctionReport report;
            try {
                report = verify(function);
            } catch (RuntimeException e) {
                logger.error("Error verifying function: {}", function.getQualifiedName(), e);
                report = reporter.structuralFailure(function.getQualifiedName(), function.getSpan(),
                        "internal error: " + e.getMessage(), function.getDiagnostics());
            }
            if (metricsCollector != null) {
                metricsCollector.recordReport(report);
            }
            reports.add(report);
        }
        return reports;
    }

    /**
     * Verifies a single function against the contracts currently cached.
     */
    public FunctionReport verify(FunctionDecl function) {
        logger.debug("Verifying {}", function.getSignature());
        ControlFlowGraph cfg;
        try {
            cfg = cfgBuilder.build(function);
        } catch (CfgConstructionException e) {
            logger.warn("Cannot build CFG of {}: {}", function.getQualifiedName(), e.getMessage());
            return reporter.structuralFailure(function.getQualifiedName(), function.getSpan(), e.getMessage(), e.getSpan(),
                    function.getDiagnostics());
        }
        if (metricsCollector != null) {
            metricsCollector.recordGraph(cfg);
        }
        exportDot(cfg);

        WpResult wp = wpTransformer.transform(cfg);
        List<VerificationCondition> conditions = wp.getConditions();
        List<SimplifiedVc> simplified = simplifier.simplifyAll(conditions);
        Map<String, VerificationResult> results = discharge(simplified);

        FunctionReport report = reporter.report(function.getQualifiedName(), function.getSpan(), conditions,
                results, cfg.getDiagnostics());
        logger.info("{}: {} ({} condition(s))", function.getQualifiedName(), report.getVerdict(), conditions.size());
        return report;
    }

    private Map<String, VerificationResult> discharge(List<SimplifiedVc> simplified) {
        Map<String, VerificationResult> results = new ConcurrentHashMap<>();
        Map<SimplifiedVc, Future<VerificationResult>> pending = new LinkedHashMap<>();
        for (SimplifiedVc vc : simplified) {
            if (vc.isTriviallyValid()) {
                resolve(vc, VerificationResult.proved(), results);
            } else {
                pending.put(vc, executor.submit(() -> checker.checkValidity(vc.getFormula())));
            }
        }
        if (metricsCollector != null) {
            metricsCollector.recordSolverCalls(pending.size());
        }

        long deadline = options.getDeadlineMillis();
        for (Map.Entry<SimplifiedVc, Future<VerificationResult>> entry : pending.entrySet()) {
            Future<VerificationResult> future = entry.getValue();
            VerificationResult result;
            try {
                result = future.get(deadline, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                logger.warn("Check of {} missed its {}ms deadline", entry.getKey().getRepresentative().getId(), deadline);
                result = VerificationResult.unknown("deadline of " + deadline + "ms exceeded");
            } catch (ExecutionException e) {
                logger.error("Check of {} failed", entry.getKey().getRepresentative().getId(), e.getCause());
                result = VerificationResult.unknown("checker failed: " + e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                result = VerificationResult.unknown("interrupted");
            }
            resolve(entry.getKey(), result, results);
        }
        return results;
    }

    private static void resolve(SimplifiedVc vc, VerificationResult result, Map<String, VerificationResult> results) {
        for (VerificationCondition source : vc.getSources()) {
            results.put(source.getId(), result);
        }
    }

    private void exportDot(ControlFlowGraph cfg) {
        if (options.getDotOutputDirectory() == null) {
            return;
        }
        try {
            int written = CfgDotExporter.export(cfg, options.getDotOutputDirectory());
            logger.debug("Wrote {} DOT file(s) for {}", written, cfg.getFunctionName());
        } catch (IOException e) {
            logger.error("Failed to export CFG of {}", cfg.getFunctionName(), e);
        }
    }

    public ContractCache getContracts() {
        return contracts;
    }

    public DiagnosticsReporter getReporter() {
        return reporter;
    }

    /**
     * Get the metrics collector, or {@code null} when metrics are disabled.
     */
    public MetricsCollector getMetricsCollector() {
        return metricsCollector;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(options.getDeadlineMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Checker threads still running after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
