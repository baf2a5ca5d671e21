package com.wp.verifier.visitor;

import com.github.javaparser.ParseProblemException;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.type.PrimitiveType;
import com.wp.verifier.model.Expr;
import com.wp.verifier.model.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers JavaParser expressions into {@link Expr}.
 *
 * <p>Variables are typed from a scope of declared names. {@code old(e)} and {@code \old(e)} refer
 * to the pre-state, {@code result} and {@code \result} to the returned value and
 * {@code implies(a, b)} to implication. {@code Math.abs}, {@code Math.min} and {@code Math.max}
 * become conditionals; other unqualified calls become uninterpreted functions. Anything else is
 * kept as an opaque node instead of failing.
 */
public class ExpressionLowering {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionLowering.class);

    static final String IMPLIES = "implies";

    private final Map<String, Type> scope;

    public ExpressionLowering() {
        this(new HashMap<>());
    }

    public ExpressionLowering(Map<String, Type> scope) {
        this.scope = scope;
    }

    /**
     * Declares a variable, or redeclares it with a new type.
     */
    public void declare(String name, Type type) {
        scope.put(name, type);
    }

    public Type typeOf(String name) {
        return scope.getOrDefault(name, Type.INT);
    }

    /**
     * Maps a Java type to a model type; {@code null} if the model has no counterpart.
     */
    public static Type modelType(com.github.javaparser.ast.type.Type type) {
        if (type.isPrimitiveType()) {
            PrimitiveType.Primitive primitive = type.asPrimitiveType().getType();
            return switch (primitive) {
                case BOOLEAN -> Type.BOOL;
                case INT, LONG, SHORT, BYTE, CHAR -> Type.INT;
                default -> null;
            };
        }
        String name = type.asString();
        return switch (name) {
            case "Integer", "Long", "Short", "Byte", "BigInteger" -> Type.INT;
            case "Boolean" -> Type.BOOL;
            default -> null;
        };
    }

    /**
     * Parses and lowers an annotation predicate such as {@code "x > 0 && \old(y) == y"}.
     * Unparseable text becomes an opaque predicate.
     */
    public Expr parsePredicate(String text) {
        String normalized = text.replace("\\old(", "old(").replace("\\result", Expr.RESULT);
        try {
            return lower(StaticJavaParser.parseExpression(normalized), Type.BOOL);
        } catch (ParseProblemException e) {
            logger.warn("Could not parse predicate '{}': {}", text, e.getMessage());
            return Expr.opaque(text, "unparseable predicate", Type.BOOL);
        }
    }

    public Expr lower(Expression expression) {
        return lower(expression, Type.INT);
    }

    /**
     * @param expected type assumed for the expression when it cannot be inferred
     */
    public Expr lower(Expression expression, Type expected) {
        if (expression instanceof EnclosedExpr) {
            return lower(((EnclosedExpr) expression).getInner(), expected);
        } else if (expression instanceof IntegerLiteralExpr) {
            return Expr.intLit(parseInteger(((IntegerLiteralExpr) expression).getValue()));
        } else if (expression instanceof LongLiteralExpr) {
            return Expr.intLit(parseInteger(((LongLiteralExpr) expression).getValue()));
        } else if (expression instanceof BooleanLiteralExpr) {
            return Expr.bool(((BooleanLiteralExpr) expression).getValue());
        } else if (expression instanceof NameExpr) {
            String name = ((NameExpr) expression).getNameAsString();
            return Expr.var(name, scope.getOrDefault(name, expected));
        } else if (expression instanceof UnaryExpr) {
            return lowerUnary((UnaryExpr) expression, expected);
        } else if (expression instanceof BinaryExpr) {
            return lowerBinary((BinaryExpr) expression, expected);
        } else if (expression instanceof ConditionalExpr) {
            ConditionalExpr conditional = (ConditionalExpr) expression;
            Expr thenValue = lower(conditional.getThenExpr(), expected);
            return Expr.ite(lower(conditional.getCondition(), Type.BOOL),
                    thenValue, lower(conditional.getElseExpr(), thenValue.getType()));
        } else if (expression instanceof CastExpr) {
            CastExpr cast = (CastExpr) expression;
            if (modelType(cast.getType()) == Type.INT) {
                return lower(cast.getExpression(), Type.INT);
            }
        } else if (expression instanceof MethodCallExpr) {
            return lowerCall((MethodCallExpr) expression, expected);
        }
        return opaque(expression, expected, "unsupported " + expression.getClass().getSimpleName());
    }

    private Expr lowerUnary(UnaryExpr unary, Type expected) {
        switch (unary.getOperator()) {
            case MINUS:
                return Expr.neg(lower(unary.getExpression(), Type.INT));
            case PLUS:
                return lower(unary.getExpression(), Type.INT);
            case LOGICAL_COMPLEMENT:
                return Expr.not(lower(unary.getExpression(), Type.BOOL));
            default:
                return opaque(unary, expected, "side effect inside an expression");
        }
    }

    private Expr lowerBinary(BinaryExpr binary, Type expected) {
        Expr.Binary.Op op = operator(binary.getOperator());
        if (op == null) {
            return opaque(binary, expected, "unsupported operator " + binary.getOperator().asString());
        }
        Type operandType = op.getKind() == Expr.Binary.Kind.LOGICAL
                ? Type.BOOL
                : Type.INT;
        Expr left = lower(binary.getLeft(), operandType);
        Expr right;
        if (op == Expr.Binary.Op.EQ || op == Expr.Binary.Op.NE) {
            // equality on booleans: type the right side like the left one
            right = lower(binary.getRight(), left.getType());
        } else {
            right = lower(binary.getRight(), operandType);
        }
        return Expr.binary(op, left, right);
    }

    private static Expr.Binary.Op operator(BinaryExpr.Operator operator) {
        return switch (operator) {
            case PLUS -> Expr.Binary.Op.ADD;
            case MINUS -> Expr.Binary.Op.SUB;
            case MULTIPLY -> Expr.Binary.Op.MUL;
            case DIVIDE -> Expr.Binary.Op.DIV;
            case REMAINDER -> Expr.Binary.Op.MOD;
            case EQUALS -> Expr.Binary.Op.EQ;
            case NOT_EQUALS -> Expr.Binary.Op.NE;
            case LESS -> Expr.Binary.Op.LT;
            case LESS_EQUALS -> Expr.Binary.Op.LE;
            case GREATER -> Expr.Binary.Op.GT;
            case GREATER_EQUALS -> Expr.Binary.Op.GE;
            case AND -> Expr.Binary.Op.AND;
            case OR -> Expr.Binary.Op.OR;
            default -> null;
        };
    }

    private Expr lowerCall(MethodCallExpr call, Type expected) {
        String name = call.getNameAsString();
        List<Expression> args = call.getArguments();

        if (isMath(call)) {
            List<Expr> values = lowerAll(args, Type.INT);
            switch (name) {
                case "abs":
                    return Expr.ite(Expr.lt(values.get(0), Expr.intLit(0)), Expr.neg(values.get(0)), values.get(0));
                case "min":
                    return Expr.ite(Expr.le(values.get(0), values.get(1)), values.get(0), values.get(1));
                case "max":
                    return Expr.ite(Expr.ge(values.get(0), values.get(1)), values.get(0), values.get(1));
                default:
                    break;
            }
        }
        if (call.getScope().isPresent()) {
            return opaque(call, expected, "call through a receiver");
        }
        if (Expr.OLD.equals(name) && args.size() == 1) {
            return Expr.old(lower(args.get(0), expected));
        }
        if (IMPLIES.equals(name) && args.size() == 2) {
            return Expr.implies(lower(args.get(0), Type.BOOL),
                    lower(args.get(1), Type.BOOL));
        }
        return Expr.apply(name, expected, lowerAll(args, Type.INT));
    }

    /**
     * Whether the call is one of the {@code Math} functions lowered to conditionals.
     */
    public static boolean isMath(MethodCallExpr call) {
        if (call.getScope().isEmpty() || !call.getScope().get().toString().equals("Math")) {
            return false;
        }
        String name = call.getNameAsString();
        int arity = call.getArguments().size();
        return (name.equals("abs") && arity == 1) || ((name.equals("min") || name.equals("max")) && arity == 2);
    }

    private List<Expr> lowerAll(List<Expression> expressions, Type expected) {
        List<Expr> lowered = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            lowered.add(lower(expression, expected));
        }
        return lowered;
    }

    private static Expr opaque(Expression expression, Type type, String reason) {
        logger.debug("Keeping '{}' opaque: {}", expression, reason);
        return Expr.opaque(expression.toString(), reason, type);
    }

    private static BigInteger parseInteger(String literal) {
        String digits = literal.replace("_", "");
        if (digits.endsWith("L") || digits.endsWith("l")) {
            digits = digits.substring(0, digits.length() - 1);
        }
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            return new BigInteger(digits.substring(2), 16);
        }
        if (digits.startsWith("0b") || digits.startsWith("0B")) {
            return new BigInteger(digits.substring(2), 2);
        }
        if (digits.length() > 1 && digits.startsWith("0")) {
            return new BigInteger(digits.substring(1), 8);
        }
        return new BigInteger(digits);
    }
}
