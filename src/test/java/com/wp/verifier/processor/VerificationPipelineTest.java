package com.wp.verifier.processor;

import com.wp.verifier.VerifierOptions;
import com.wp.verifier.analysis.ContractCache;
import com.wp.verifier.ast.FunctionDecl;
import com.wp.verifier.ast.Stmt;
import com.wp.verifier.model.Diagnostic;
import com.wp.verifier.model.Expr;
import com.wp.verifier.model.VerificationResult;
import com.wp.verifier.report.FunctionReport;
import com.wp.verifier.report.FunctionVerdict;
import com.wp.verifier.report.VcOutcome;
import com.wp.verifier.solver.ValidityChecker;
import com.wp.verifier.solver.Z3ValidityChecker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static com.wp.verifier.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class VerificationPipelineTest {

    private VerificationPipeline pipeline;

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
    }

    private VerificationPipeline pipeline(VerifierOptions options) {
        pipeline = new VerificationPipeline(options, new Z3ValidityChecker(options.getSolverTimeoutMillis()),
                new ContractCache());
        return pipeline;
    }

    private static VerifierOptions options() {
        return new VerifierOptions().setCollectMetrics(false).setParallelism(2);
    }

    @Test
    void incrementIsVerified() {
        FunctionReport report = pipeline(options()).verify(increment());

        assertEquals(FunctionVerdict.VERIFIED, report.getVerdict());
        assertEquals(1, report.getOutcomes().size());
    }

    @Test
    void decrementFailsWithCounterexample() {
        FunctionReport report = pipeline(options()).verify(decrement());

        assertEquals(FunctionVerdict.FAILED, report.getVerdict());
        VcOutcome failure = report.getFailures().get(0);
        assertTrue(failure.getResult().isRefuted());
        assertTrue(failure.getResult().getCounterexample().containsKey("x"));
    }

    @Test
    void loopWithStrongInvariantIsVerified() {
        FunctionReport report = pipeline(options()).verify(triangle());

        assertEquals(FunctionVerdict.VERIFIED, report.getVerdict());
        assertEquals(3, report.getOutcomes().size());
    }

    @Test
    void loopWithoutInvariantIsInconclusive() {
        FunctionReport report = pipeline(options()).verify(countWithoutInvariant());

        assertEquals(FunctionVerdict.INCONCLUSIVE, report.getVerdict());
        assertTrue(report.hasDiagnostic(Diagnostic.Code.MISSING_INVARIANT));
        assertEquals(0, report.count(VerificationResult.Outcome.REFUTED));
    }

    @Test
    void structuralErrorIsIsolated() {
        FunctionDecl broken = function("broken", ints("x"), List.of(), null, body(new Stmt.Break(line(7))));

        List<FunctionReport> reports = pipeline(options()).verifyAll(List.of(broken, increment()));

        assertEquals(2, reports.size());
        assertEquals("broken", reports.get(0).getFunctionName());
        assertEquals(FunctionVerdict.INCONCLUSIVE, reports.get(0).getVerdict());
        assertTrue(reports.get(0).hasDiagnostic(Diagnostic.Code.STRUCTURAL_ERROR));
        assertEquals(FunctionVerdict.VERIFIED, reports.get(1).getVerdict());
    }

    @Test
    void callsAreSummarisedByDeclaredContracts() {
        FunctionDecl abs = function("abs", ints("x"), List.of(), post(Expr.ge(RESULT, lit(0))),
                body(new Stmt.If(Expr.lt(X, lit(0)), body(ret(Expr.neg(X))), body(ret(X)), line(5))));
        FunctionDecl caller = function("caller", ints("x"), List.of(), post(Expr.ge(Y, lit(0))),
                body(new Stmt.Invoke(Y, "abs", List.of(X), false, line(6))));

        List<FunctionReport> reports = pipeline(options()).verifyAll(List.of(caller, abs));

        assertEquals(FunctionVerdict.VERIFIED, reports.get(0).getVerdict());
        assertEquals(FunctionVerdict.VERIFIED, reports.get(1).getVerdict());
        assertTrue(pipeline.getContracts().contains("abs", 1));
    }

    @Test
    void missedDeadlineIsUnknown() {
        AtomicInteger calls = new AtomicInteger();
        ValidityChecker sleeping = formula -> {
            calls.incrementAndGet();
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return VerificationResult.proved();
        };
        VerifierOptions options = options().setSolverTimeoutMillis(100).setDeadlineGraceMillis(100);
        pipeline = new VerificationPipeline(options, sleeping, new ContractCache());

        FunctionReport report = pipeline.verify(increment());

        assertEquals(1, calls.get());
        assertEquals(FunctionVerdict.INCONCLUSIVE, report.getVerdict());
        VerificationResult result = report.getOutcomes().get(0).getResult();
        assertTrue(result.isUnknown());
        assertTrue(result.getReason().contains("deadline"));
    }

    @Test
    void checkerFailureIsUnknown() {
        pipeline = new VerificationPipeline(options(), formula -> {
            throw new IllegalStateException("boom");
        }, new ContractCache());

        FunctionReport report = pipeline.verify(increment());

        assertEquals(FunctionVerdict.INCONCLUSIVE, report.getVerdict());
        assertTrue(report.getOutcomes().get(0).getResult().isUnknown());
    }

    @Test
    void collectsMetricsWhenEnabled() {
        VerificationPipeline pipeline = pipeline(options().setCollectMetrics(true));

        pipeline.verifyAll(List.of(increment(), decrement()));

        assertEquals(2, pipeline.getMetricsCollector().generateReport().totalFunctions);
        assertEquals(2, pipeline.getMetricsCollector().generateReport().totalConditions);
    }

    @Test
    void exportsGraphsWhenConfigured(@TempDir Path dotDir) throws IOException {
        pipeline(options().setDotOutputDirectory(dotDir)).verify(increment());

        try (Stream<Path> files = Files.list(dotDir)) {
            assertTrue(files.anyMatch(path -> path.toString().endsWith(".dot")));
        }
    }
}
