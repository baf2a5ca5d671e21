package com.wp.verifier.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Simultaneous replacement of variables by expressions. Arguments of {@code old(..)} denote
 * pre-state values and are never rewritten.
 */
public class Substitution extends ExprTransformer {

    /** Prefix of the constants standing for pre-state values outside the entry segment. */
    public static final String OLD_PREFIX = "old$";

    private final Map<String, Expr> replacements;

    public Substitution(Map<String, ? extends Expr> replacements) {
        this.replacements = Collections.unmodifiableMap(new HashMap<>(replacements));
    }

    /**
     * Computes {@code expr[name ↦ value]}.
     */
    public static Expr replace(Expr expr, String name, Expr value) {
        return new Substitution(Collections.singletonMap(name, value)).transform(expr);
    }

    @Override
    public Expr visitVariable(Expr.Variable expr) {
        Expr replacement = replacements.get(expr.getName());
        return replacement != null ? replacement : expr;
    }

    @Override
    public Expr visitApply(Expr.Apply expr) {
        if (expr.isOld()) {
            return expr;
        }
        return super.visitApply(expr);
    }

    /**
     * Replaces every {@code old(e)} by {@code e}. Valid wherever the pre-state is the current state,
     * i.e. at function entry or at a call site.
     */
    public static Expr eraseOld(Expr expr) {
        return new ExprTransformer() {
            @Override
            public Expr visitApply(Expr.Apply apply) {
                if (apply.isOld()) {
                    return transform(apply.getArguments().get(0));
                }
                return super.visitApply(apply);
            }
        }.transform(expr);
    }

    /**
     * Replaces every {@code old(e)} by {@code e} with each variable {@code x} renamed to the
     * pre-state constant {@code old$x}.
     */
    public static Expr oldAsConstants(Expr expr) {
        ExprTransformer renameToPreState = new ExprTransformer() {
            @Override
            public Expr visitVariable(Expr.Variable variable) {
                return Expr.var(OLD_PREFIX + variable.getName(), variable.getType());
            }

            @Override
            public Expr visitApply(Expr.Apply apply) {
                if (apply.isOld()) {
                    return transform(apply.getArguments().get(0));
                }
                return super.visitApply(apply);
            }
        };
        return new ExprTransformer() {
            @Override
            public Expr visitApply(Expr.Apply apply) {
                if (apply.isOld()) {
                    return renameToPreState.transform(apply.getArguments().get(0));
                }
                return super.visitApply(apply);
            }
        }.transform(expr);
    }
}
