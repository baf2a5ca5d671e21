package com.wp.verifier.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Bottom-up rewriting of expressions. Each {@code construct} method receives the original node
 * and its already transformed children; when no child changed the original node is returned,
 * so untouched subtrees stay shared.
 */
public abstract class ExprTransformer implements ExprVisitor<Expr> {

    public Expr transform(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public Expr visitIntLiteral(Expr.IntLiteral expr) {
        return expr;
    }

    @Override
    public Expr visitBoolLiteral(Expr.BoolLiteral expr) {
        return expr;
    }

    @Override
    public Expr visitVariable(Expr.Variable expr) {
        return expr;
    }

    @Override
    public Expr visitOpaque(Expr.Opaque expr) {
        return expr;
    }

    @Override
    public Expr visitUnary(Expr.Unary expr) {
        return constructUnary(expr, transform(expr.getOperand()));
    }

    @Override
    public Expr visitBinary(Expr.Binary expr) {
        Expr left = transform(expr.getLeft());
        Expr right = transform(expr.getRight());
        return constructBinary(expr, left, right);
    }

    @Override
    public Expr visitConditional(Expr.Conditional expr) {
        Expr condition = transform(expr.getCondition());
        Expr thenValue = transform(expr.getThenValue());
        Expr elseValue = transform(expr.getElseValue());
        return constructConditional(expr, condition, thenValue, elseValue);
    }

    @Override
    public Expr visitApply(Expr.Apply expr) {
        List<Expr> args = new ArrayList<>(expr.getArguments().size());
        for (Expr arg : expr.getArguments()) {
            args.add(transform(arg));
        }
        return constructApply(expr, args);
    }

    protected Expr constructUnary(Expr.Unary expr, Expr operand) {
        if (operand == expr.getOperand()) {
            return expr;
        }
        return new Expr.Unary(expr.getOp(), operand);
    }

    protected Expr constructBinary(Expr.Binary expr, Expr left, Expr right) {
        if (left == expr.getLeft() && right == expr.getRight()) {
            return expr;
        }
        return new Expr.Binary(expr.getOp(), left, right);
    }

    protected Expr constructConditional(Expr.Conditional expr, Expr condition, Expr thenValue, Expr elseValue) {
        if (condition == expr.getCondition() && thenValue == expr.getThenValue() && elseValue == expr.getElseValue()) {
            return expr;
        }
        return new Expr.Conditional(condition, thenValue, elseValue);
    }

    protected Expr constructApply(Expr.Apply expr, List<Expr> args) {
        boolean changed = false;
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i) != expr.getArguments().get(i)) {
                changed = true;
                break;
            }
        }
        return changed ? new Expr.Apply(expr.getFunction(), expr.getType(), args) : expr;
    }
}
