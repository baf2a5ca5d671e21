package com.wp.verifier.visitor;

import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.wp.verifier.ast.Stmt;
import com.wp.verifier.model.Annotation;
import com.wp.verifier.model.Diagnostic;
import com.wp.verifier.model.Expr;
import com.wp.verifier.model.SourceSpan;
import com.wp.verifier.model.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Lowers a Java method body into {@link Stmt}s.
 *
 * <p>Besides ordinary statements the body may contain contract calls:
 * {@code pre(..)}/{@code requires(..)} and {@code post(..)}/{@code ensures(..)} add to the
 * function contract, {@code invariant(..)} attaches to the loop that immediately follows, and
 * {@code panic(..)} aborts. Their argument is either a boolean expression or a string holding one.
 * {@code for (int i : range(lo, hi))} and {@code rangeClosed} loops become range loops.
 */
public class StatementLowering {

    private static final Set<String> PRECONDITION_CALLS = Set.of("pre", "requires");
    private static final Set<String> POSTCONDITION_CALLS = Set.of("post", "ensures");
    private static final String INVARIANT_CALL = "invariant";
    private static final String PANIC_CALL = "panic";

    private final ExpressionLowering expressions;
    private final String origin;
    private final Type returnType;
    private final List<Annotation> preconditions = new ArrayList<>();
    private final List<Annotation> postconditions = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private Annotation pendingInvariant;

    /**
     * @param returnType type of {@code result}, or {@code null} for a method returning nothing
     */
    public StatementLowering(ExpressionLowering expressions, String origin, Type returnType) {
        this.expressions = expressions;
        this.origin = origin;
        this.returnType = returnType;
    }

    public List<Stmt> lowerBody(BlockStmt body) {
        List<Stmt> lowered = lowerAll(body.getStatements());
        dropPendingInvariant();
        return lowered;
    }

    /**
     * Preconditions found in the body.
     */
    public List<Annotation> getPreconditions() {
        return preconditions;
    }

    /**
     * Postconditions found in the body.
     */
    public List<Annotation> getPostconditions() {
        return postconditions;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public static SourceSpan span(Node node, String origin) {
        if (node.getRange().isEmpty()) {
            return SourceSpan.UNKNOWN;
        }
        Range range = node.getRange().get();
        return new SourceSpan(origin, range.begin.line, range.begin.column, range.end.line, range.end.column);
    }

    private SourceSpan span(Node node) {
        return span(node, origin);
    }

    private List<Stmt> lowerAll(List<Statement> statements) {
        List<Stmt> lowered = new ArrayList<>();
        for (Statement statement : statements) {
            if (pendingInvariant != null && !isLoop(statement) && !isInvariantCall(statement)) {
                dropPendingInvariant();
            }
            lower(statement, lowered);
        }
        return lowered;
    }

    private List<Stmt> lowerNested(Statement statement) {
        if (statement instanceof BlockStmt) {
            return lowerAll(((BlockStmt) statement).getStatements());
        }
        return lowerAll(Collections.singletonList(statement));
    }

    private void lower(Statement statement, List<Stmt> out) {
        SourceSpan span = span(statement);
        if (statement instanceof BlockStmt) {
            out.addAll(lowerAll(((BlockStmt) statement).getStatements()));
        } else if (statement instanceof EmptyStmt) {
            return;
        } else if (statement instanceof ExpressionStmt) {
            lowerExpression(((ExpressionStmt) statement).getExpression(), out);
        } else if (statement instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) statement;
            Expr condition = expressions.lower(ifStmt.getCondition(), Type.BOOL);
            List<Stmt> thenBranch = lowerNested(ifStmt.getThenStmt());
            List<Stmt> elseBranch = ifStmt.getElseStmt().isPresent() ? lowerNested(ifStmt.getElseStmt().get()) : null;
            out.add(new Stmt.If(condition, thenBranch, elseBranch, span));
        } else if (statement instanceof WhileStmt) {
            WhileStmt loop = (WhileStmt) statement;
            Annotation invariant = takeInvariant();
            Expr condition = expressions.lower(loop.getCondition(), Type.BOOL);
            out.add(new Stmt.While(condition, invariant, lowerNested(loop.getBody()), span));
        } else if (statement instanceof ForStmt) {
            lowerFor((ForStmt) statement, out);
        } else if (statement instanceof ForEachStmt) {
            lowerForEach((ForEachStmt) statement, out);
        } else if (statement instanceof ReturnStmt) {
            lowerReturn((ReturnStmt) statement, out);
        } else if (statement instanceof ThrowStmt) {
            out.add(new Stmt.Panic(panicMessage(((ThrowStmt) statement).getExpression()), span));
        } else if (statement instanceof AssertStmt) {
            out.add(new Stmt.Assert(expressions.lower(((AssertStmt) statement).getCheck(), Type.BOOL), span));
        } else if (statement instanceof BreakStmt) {
            out.add(((BreakStmt) statement).getLabel().isPresent()
                    ? new Stmt.Unsupported("labelled break", span)
                    : new Stmt.Break(span));
        } else if (statement instanceof ContinueStmt) {
            out.add(((ContinueStmt) statement).getLabel().isPresent()
                    ? new Stmt.Unsupported("labelled continue", span)
                    : new Stmt.Continue(span));
        } else {
            out.add(new Stmt.Unsupported(statement.getClass().getSimpleName(), span));
        }
    }

    private void lowerExpression(Expression expression, List<Stmt> out) {
        SourceSpan span = span(expression);
        if (expression instanceof VariableDeclarationExpr) {
            for (VariableDeclarator declarator : ((VariableDeclarationExpr) expression).getVariables()) {
                Type type = ExpressionLowering.modelType(declarator.getType());
                if (type == null) {
                    out.add(new Stmt.Unsupported("variable '" + declarator.getNameAsString() + "' of type "
                            + declarator.getTypeAsString(), span));
                    continue;
                }
                expressions.declare(declarator.getNameAsString(), type);
                if (declarator.getInitializer().isPresent()) {
                    assign(Expr.var(declarator.getNameAsString(), type), declarator.getInitializer().get(), span, out);
                }
            }
        } else if (expression instanceof AssignExpr) {
            AssignExpr assign = (AssignExpr) expression;
            if (!(assign.getTarget() instanceof NameExpr)) {
                out.add(new Stmt.Unsupported("assignment to " + assign.getTarget(), span));
                return;
            }
            String name = ((NameExpr) assign.getTarget()).getNameAsString();
            Expr.Variable target = Expr.var(name, expressions.typeOf(name));
            if (assign.getOperator() == AssignExpr.Operator.ASSIGN) {
                assign(target, assign.getValue(), span, out);
                return;
            }
            Expr.Binary.Op op = compoundOperator(assign.getOperator());
            if (op == null) {
                out.add(new Stmt.Unsupported("operator " + assign.getOperator().asString(), span));
                return;
            }
            out.add(new Stmt.Assign(target, Expr.binary(op, target, expressions.lower(assign.getValue(), target.getType())), span));
        } else if (expression instanceof UnaryExpr && ((UnaryExpr) expression).getExpression() instanceof NameExpr) {
            UnaryExpr unary = (UnaryExpr) expression;
            String name = ((NameExpr) unary.getExpression()).getNameAsString();
            Expr.Variable target = Expr.var(name, Type.INT);
            switch (unary.getOperator()) {
                case PREFIX_INCREMENT, POSTFIX_INCREMENT ->
                        out.add(new Stmt.Assign(target, Expr.add(target, Expr.intLit(1)), span));
                case PREFIX_DECREMENT, POSTFIX_DECREMENT ->
                        out.add(new Stmt.Assign(target, Expr.sub(target, Expr.intLit(1)), span));
                default -> out.add(new Stmt.Unsupported("expression statement " + expression, span));
            }
        } else if (expression instanceof MethodCallExpr) {
            lowerCallStatement((MethodCallExpr) expression, out);
        } else {
            out.add(new Stmt.Unsupported("expression statement " + expression, span));
        }
    }

    private void lowerCallStatement(MethodCallExpr call, List<Stmt> out) {
        SourceSpan span = span(call);
        String name = call.getNameAsString();
        boolean unqualified = call.getScope().isEmpty();
        if (unqualified && call.getArguments().size() == 1) {
            if (PRECONDITION_CALLS.contains(name)) {
                preconditions.add(new Annotation(Annotation.Kind.PRECONDITION, predicate(call.getArgument(0)), span));
                return;
            }
            if (POSTCONDITION_CALLS.contains(name)) {
                postconditions.add(new Annotation(Annotation.Kind.POSTCONDITION, predicate(call.getArgument(0)), span));
                return;
            }
            if (INVARIANT_CALL.equals(name)) {
                Expr predicate = predicate(call.getArgument(0));
                pendingInvariant = pendingInvariant == null
                        ? new Annotation(Annotation.Kind.INVARIANT, predicate, span)
                        : new Annotation(Annotation.Kind.INVARIANT, Expr.and(pendingInvariant.getPredicate(), predicate),
                        pendingInvariant.getSpan());
                return;
            }
        }
        if (unqualified && PANIC_CALL.equals(name) && call.getArguments().size() <= 1) {
            String message = call.getArguments().isEmpty() ? null : literalOrText(call.getArgument(0));
            out.add(new Stmt.Panic(message, span));
            return;
        }
        if (ExpressionLowering.isMath(call)) {
            return;
        }
        out.add(new Stmt.Invoke(null, name, lowerArguments(call), !unqualified, span));
    }

    private void assign(Expr.Variable target, Expression value, SourceSpan span, List<Stmt> out) {
        if (isInvocation(value)) {
            MethodCallExpr call = (MethodCallExpr) value;
            out.add(new Stmt.Invoke(target, call.getNameAsString(), lowerArguments(call),
                    call.getScope().isPresent(), span));
        } else {
            out.add(new Stmt.Assign(target, expressions.lower(value, target.getType()), span));
        }
    }

    private void lowerReturn(ReturnStmt stmt, List<Stmt> out) {
        SourceSpan span = span(stmt);
        if (stmt.getExpression().isEmpty()) {
            out.add(new Stmt.Return(null, span));
            return;
        }
        Type type = returnType != null ? returnType : Type.INT;
        Expression value = stmt.getExpression().get();
        if (isInvocation(value)) {
            assign(Expr.var(Expr.RESULT, type), value, span, out);
            out.add(new Stmt.Return(null, span));
        } else {
            out.add(new Stmt.Return(expressions.lower(value, type), span));
        }
    }

    private void lowerFor(ForStmt loop, List<Stmt> out) {
        SourceSpan span = span(loop);
        Annotation invariant = takeInvariant();
        for (Expression init : loop.getInitialization()) {
            lowerExpression(init, out);
        }
        Expr condition = loop.getCompare().isPresent()
                ? expressions.lower(loop.getCompare().get(), Type.BOOL)
                : Expr.TRUE;
        List<Stmt> body = lowerNested(loop.getBody());
        List<Stmt> update = new ArrayList<>();
        for (Expression expression : loop.getUpdate()) {
            lowerExpression(expression, update);
        }
        out.add(new Stmt.While(condition, invariant, body, update, span));
    }

    private void lowerForEach(ForEachStmt loop, List<Stmt> out) {
        SourceSpan span = span(loop);
        Annotation invariant = takeInvariant();
        Expression iterable = loop.getIterable();
        if (!(iterable instanceof MethodCallExpr)) {
            out.add(new Stmt.Unsupported("for-each over " + iterable, span));
            return;
        }
        MethodCallExpr range = (MethodCallExpr) iterable;
        String name = range.getNameAsString();
        if (!(name.equals("range") || name.equals("rangeClosed")) || range.getArguments().size() != 2) {
            out.add(new Stmt.Unsupported("for-each over " + iterable, span));
            return;
        }
        String variable = loop.getVariableDeclarator().getNameAsString();
        expressions.declare(variable, Type.INT);
        Expr lower = expressions.lower(range.getArgument(0), Type.INT);
        Expr upper = expressions.lower(range.getArgument(1), Type.INT);
        out.add(new Stmt.ForRange(Expr.intVar(variable), lower, upper, name.equals("rangeClosed"), invariant,
                lowerNested(loop.getBody()), span));
    }

    private static boolean isLoop(Statement statement) {
        return statement instanceof WhileStmt || statement instanceof ForStmt || statement instanceof ForEachStmt;
    }

    private static boolean isInvariantCall(Statement statement) {
        if (!(statement instanceof ExpressionStmt)) {
            return false;
        }
        Expression expression = ((ExpressionStmt) statement).getExpression();
        return expression instanceof MethodCallExpr
                && ((MethodCallExpr) expression).getScope().isEmpty()
                && ((MethodCallExpr) expression).getNameAsString().equals(INVARIANT_CALL);
    }

    private static boolean isInvocation(Expression expression) {
        if (!(expression instanceof MethodCallExpr)) {
            return false;
        }
        MethodCallExpr call = (MethodCallExpr) expression;
        if (ExpressionLowering.isMath(call)) {
            return false;
        }
        String name = call.getNameAsString();
        return call.getScope().isPresent() || !(name.equals(Expr.OLD) || name.equals(ExpressionLowering.IMPLIES));
    }

    private Annotation takeInvariant() {
        Annotation invariant = pendingInvariant;
        pendingInvariant = null;
        return invariant;
    }

    private void dropPendingInvariant() {
        if (pendingInvariant != null) {
            diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, Diagnostic.Code.DANGLING_INVARIANT,
                    "invariant `" + pendingInvariant.getPredicate() + "` is not followed by a loop",
                    pendingInvariant.getSpan()));
            pendingInvariant = null;
        }
    }

    private Expr predicate(Expression argument) {
        if (argument instanceof StringLiteralExpr) {
            return expressions.parsePredicate(((StringLiteralExpr) argument).asString());
        }
        return expressions.lower(argument, Type.BOOL);
    }

    private List<Expr> lowerArguments(MethodCallExpr call) {
        List<Expr> arguments = new ArrayList<>();
        for (Expression argument : call.getArguments()) {
            arguments.add(expressions.lower(argument));
        }
        return arguments;
    }

    private static String panicMessage(Expression thrown) {
        if (thrown instanceof ObjectCreationExpr) {
            ObjectCreationExpr creation = (ObjectCreationExpr) thrown;
            if (!creation.getArguments().isEmpty()) {
                return literalOrText(creation.getArgument(0));
            }
            return creation.getTypeAsString();
        }
        return thrown.toString();
    }

    private static String literalOrText(Expression expression) {
        return expression instanceof StringLiteralExpr
                ? ((StringLiteralExpr) expression).asString()
                : expression.toString();
    }

    private static Expr.Binary.Op compoundOperator(AssignExpr.Operator operator) {
        return switch (operator) {
            case PLUS -> Expr.Binary.Op.ADD;
            case MINUS -> Expr.Binary.Op.SUB;
            case MULTIPLY -> Expr.Binary.Op.MUL;
            case DIVIDE -> Expr.Binary.Op.DIV;
            case REMAINDER -> Expr.Binary.Op.MOD;
            default -> null;
        };
    }
}
