package com.wp.verifier.simplify;

import com.wp.verifier.model.Expr;
import com.wp.verifier.model.VerificationCondition;

import java.util.List;

/**
 * A simplified formula together with every original condition that simplified to it.
 */
public final class SimplifiedVc {

    private final Expr formula;
    private final List<VerificationCondition> sources;

    public SimplifiedVc(Expr formula, List<VerificationCondition> sources) {
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("A simplified condition needs at least one source");
        }
        this.formula = formula;
        this.sources = List.copyOf(sources);
    }

    public Expr getFormula() {
        return formula;
    }

    public List<VerificationCondition> getSources() {
        return sources;
    }

    /**
     * The first source, used to label the solver call.
     */
    public VerificationCondition getRepresentative() {
        return sources.get(0);
    }

    public boolean isTriviallyValid() {
        return Expr.TRUE.equals(formula);
    }
}
