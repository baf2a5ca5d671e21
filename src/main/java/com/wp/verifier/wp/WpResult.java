package com.wp.verifier.wp;

import com.wp.verifier.model.Expr;
import com.wp.verifier.model.VerificationCondition;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of {@link WpTransformer}: the verification conditions of one function and the
 * weakest precondition of every block with respect to all obligations at once.
 */
public final class WpResult {

    private final String functionName;
    private final Map<Integer, Expr> blockWp;
    private final List<VerificationCondition> conditions;

    WpResult(String functionName, Map<Integer, Expr> blockWp, List<VerificationCondition> conditions) {
        this.functionName = functionName;
        this.blockWp = Collections.unmodifiableMap(new TreeMap<>(blockWp));
        this.conditions = List.copyOf(conditions);
    }

    public String getFunctionName() {
        return functionName;
    }

    /**
     * @return {@code wp(block)}; for a loop header this is its invariant
     */
    public Expr getWp(int block) {
        Expr wp = blockWp.get(block);
        if (wp == null) {
            throw new IllegalArgumentException("No block " + block + " in " + functionName);
        }
        return wp;
    }

    public Map<Integer, Expr> getBlockWp() {
        return blockWp;
    }

    public List<VerificationCondition> getConditions() {
        return conditions;
    }
}
