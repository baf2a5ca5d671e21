package com.wp.verifier.solver;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import com.wp.verifier.model.Expr;
import com.wp.verifier.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checks validity with Z3 by asking whether the negated formula is satisfiable.
 *
 * <p>Each call creates and closes its own {@link Context}, so checks share no solver state and
 * may run on different threads at the same time.
 */
public class Z3ValidityChecker implements ValidityChecker {

    private static final Logger logger = LoggerFactory.getLogger(Z3ValidityChecker.class);

    private final long timeoutMillis;

    /**
     * @param timeoutMillis solver time limit for a single check
     */
    public Z3ValidityChecker(long timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeoutMillis);
        }
        this.timeoutMillis = timeoutMillis;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    @Override
    public VerificationResult checkValidity(Expr formula) {
        if (Expr.TRUE.equals(formula)) {
            return VerificationResult.proved();
        }
        try (Context ctx = new Context()) {
            Z3ExprTranslator translator = new Z3ExprTranslator(ctx);
            BoolExpr condition = translator.toBool(formula);

            Solver solver = ctx.mkSolver();
            Params params = ctx.mkParams();
            params.add("timeout", (int) Math.min(Integer.MAX_VALUE, timeoutMillis));
            solver.setParameters(params);
            solver.add(ctx.mkNot(condition));

            Status status = solver.check();
            switch (status) {
                case UNSATISFIABLE:
                    return VerificationResult.proved();
                case SATISFIABLE:
                    return VerificationResult.refuted(counterexample(solver.getModel(), translator));
                default:
                    String reason = solver.getReasonUnknown();
                    logger.debug("Solver returned unknown for {}: {}", formula, reason);
                    return VerificationResult.unknown("solver: " + reason);
            }
        } catch (UnsupportedTheoryException e) {
            logger.debug("Untranslatable formula: {}", e.getMessage());
            return VerificationResult.unknown("unsupported: " + e.getMessage());
        } catch (Z3Exception e) {
            logger.warn("Z3 failed on {}: {}", formula, e.getMessage());
            return VerificationResult.unknown("solver error: " + e.getMessage());
        } catch (LinkageError e) {
            logger.error("Z3 native library could not be loaded", e);
            return VerificationResult.unknown("solver unavailable: " + e.getMessage());
        }
    }

    private static Map<String, String> counterexample(Model model, Z3ExprTranslator translator) {
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, com.microsoft.z3.Expr<?>> constant : translator.getConstants().entrySet()) {
            values.put(constant.getKey(), model.evaluate(constant.getValue(), true).toString());
        }
        return values;
    }
}
