package com.wp.verifier;

import com.wp.verifier.ast.FunctionDecl;
import com.wp.verifier.ast.Stmt;
import com.wp.verifier.model.Annotation;
import com.wp.verifier.model.Expr;
import com.wp.verifier.model.Parameter;
import com.wp.verifier.model.SourceSpan;
import com.wp.verifier.model.Type;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Small builders for hand-written functions used across the tests.
 */
public final class Fixtures {

    public static final String ORIGIN = "Fixture.java";

    public static final Expr.Variable X = Expr.intVar("x");
    public static final Expr.Variable Y = Expr.intVar("y");
    public static final Expr.Variable I = Expr.intVar("i");
    public static final Expr.Variable N = Expr.intVar("n");
    public static final Expr.Variable SUM = Expr.intVar("sum");
    public static final Expr.Variable RESULT = Expr.intVar(Expr.RESULT);

    private Fixtures() {
    }

    public static SourceSpan line(int line) {
        return SourceSpan.line(ORIGIN, line);
    }

    public static Expr lit(long value) {
        return Expr.intLit(value);
    }

    public static Annotation pre(Expr predicate) {
        return new Annotation(Annotation.Kind.PRECONDITION, predicate, line(1));
    }

    public static Annotation post(Expr predicate) {
        return new Annotation(Annotation.Kind.POSTCONDITION, predicate, line(2));
    }

    public static Annotation inv(Expr predicate) {
        return new Annotation(Annotation.Kind.INVARIANT, predicate, line(3));
    }

    public static List<Parameter> ints(String... names) {
        List<Parameter> parameters = new ArrayList<>();
        for (String name : names) {
            parameters.add(new Parameter(name, Type.INT));
        }
        return parameters;
    }

    public static Stmt assign(Expr.Variable target, Expr value) {
        return new Stmt.Assign(target, value, line(10));
    }

    public static Stmt ret(Expr value) {
        return new Stmt.Return(value, line(20));
    }

    public static List<Stmt> body(Stmt... statements) {
        return Arrays.asList(statements);
    }

    /**
     * Function returning {@code int}.
     */
    public static FunctionDecl function(String name, List<Parameter> parameters, List<Annotation> preconditions,
                                        Annotation postcondition, List<Stmt> body) {
        return new FunctionDecl(name, parameters, Type.INT, preconditions, postcondition, body, line(1));
    }

    /**
     * {@code requires x > 0; y = x + 1; ensures y > x}.
     */
    public static FunctionDecl increment() {
        return function("increment", ints("x"), List.of(pre(Expr.gt(X, lit(0)))),
                post(Expr.gt(Y, X)), body(assign(Y, Expr.add(X, lit(1)))));
    }

    /**
     * {@code y = x - 1; ensures y > x}, which does not hold.
     */
    public static FunctionDecl decrement() {
        return function("decrement", ints("x"), List.of(), post(Expr.gt(Y, X)),
                body(assign(Y, Expr.sub(X, lit(1)))));
    }

    /**
     * Sum of {@code 1..n-1} with a loop invariant strong enough for the postcondition.
     */
    public static FunctionDecl triangle() {
        Expr invariant = Expr.and(
                Expr.eq(Expr.mul(lit(2), SUM), Expr.mul(I, Expr.sub(I, lit(1)))),
                Expr.le(I, N));
        Stmt loop = new Stmt.While(Expr.lt(I, N), inv(invariant),
                body(assign(SUM, Expr.add(SUM, I)), assign(I, Expr.add(I, lit(1)))), line(12));
        return function("triangle", ints("n"), List.of(pre(Expr.ge(N, lit(1)))),
                post(Expr.eq(Expr.mul(lit(2), SUM), Expr.mul(N, Expr.sub(N, lit(1))))),
                body(assign(SUM, lit(0)), assign(I, lit(1)), loop));
    }

    /**
     * Counting loop without an invariant whose postcondition needs one.
     */
    public static FunctionDecl countWithoutInvariant() {
        Stmt loop = new Stmt.While(Expr.lt(I, N), null, body(assign(I, Expr.add(I, lit(1)))), line(12));
        return function("count", ints("n"), List.of(pre(Expr.ge(N, lit(0)))), post(Expr.eq(I, N)),
                body(assign(I, lit(0)), loop));
    }
}
