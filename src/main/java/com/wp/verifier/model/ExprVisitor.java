package com.wp.verifier.model;

/**
 * Visitor over the node types of {@link Expr}.
 *
 * @param <R> result type of the traversal
 */
public interface ExprVisitor<R> {

    R visitIntLiteral(Expr.IntLiteral expr);

    R visitBoolLiteral(Expr.BoolLiteral expr);

    R visitVariable(Expr.Variable expr);

    R visitUnary(Expr.Unary expr);

    R visitBinary(Expr.Binary expr);

    R visitConditional(Expr.Conditional expr);

    R visitApply(Expr.Apply expr);

    R visitOpaque(Expr.Opaque expr);
}
