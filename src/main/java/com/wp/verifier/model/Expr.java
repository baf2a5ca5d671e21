package com.wp.verifier.model;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable expression tree shared by program code and logical annotations.
 *
 * <p>The same representation is used for right-hand sides of assignments, branch guards,
 * preconditions, postconditions, loop invariants and the verification conditions derived
 * from them. Nodes are never edited in place: every transformation builds new nodes and
 * reuses unchanged subtrees by reference.
 */
public abstract class Expr {

    public static final BoolLiteral TRUE = new BoolLiteral(true);
    public static final BoolLiteral FALSE = new BoolLiteral(false);

    /** Name of the pure function that refers to the pre-state value of its argument. */
    public static final String OLD = "old";

    /** Variable holding the value of a function's return statement. */
    public static final String RESULT = "result";

    public abstract Type getType();

    public abstract <R> R accept(ExprVisitor<R> visitor);

    /**
     * Binding strength used when printing, higher binds tighter.
     */
    protected int precedence() {
        return 100;
    }

    /**
     * Returns the names of all variables occurring in this expression, including those under {@code old(..)}.
     */
    public Set<String> freeVariables() {
        Set<String> names = new LinkedHashSet<>();
        collect(this, names);
        return names;
    }

    /**
     * Whether some part of this expression could not be represented by the model.
     */
    public boolean containsOpaque() {
        List<Expr> work = new ArrayList<>();
        work.add(this);
        while (!work.isEmpty()) {
            Expr e = work.remove(work.size() - 1);
            if (e instanceof Opaque) {
                return true;
            }
            work.addAll(e.children());
        }
        return false;
    }

    public List<Expr> children() {
        return Collections.emptyList();
    }

    private static void collect(Expr expr, Set<String> names) {
        if (expr instanceof Variable) {
            names.add(((Variable) expr).getName());
        }
        for (Expr child : expr.children()) {
            collect(child, names);
        }
    }

    // ========================================================================
    // Factories
    // ========================================================================

    public static IntLiteral intLit(long value) {
        return new IntLiteral(BigInteger.valueOf(value));
    }

    public static IntLiteral intLit(BigInteger value) {
        return new IntLiteral(value);
    }

    public static BoolLiteral bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Variable intVar(String name) {
        return new Variable(name, Type.INT);
    }

    public static Variable boolVar(String name) {
        return new Variable(name, Type.BOOL);
    }

    public static Variable var(String name, Type type) {
        return new Variable(name, type);
    }

    public static Expr neg(Expr operand) {
        return new Unary(Unary.Op.NEG, operand);
    }

    public static Expr not(Expr operand) {
        return new Unary(Unary.Op.NOT, operand);
    }

    public static Expr binary(Binary.Op op, Expr left, Expr right) {
        return new Binary(op, left, right);
    }

    public static Expr add(Expr left, Expr right) {
        return new Binary(Binary.Op.ADD, left, right);
    }

    public static Expr sub(Expr left, Expr right) {
        return new Binary(Binary.Op.SUB, left, right);
    }

    public static Expr mul(Expr left, Expr right) {
        return new Binary(Binary.Op.MUL, left, right);
    }

    public static Expr div(Expr left, Expr right) {
        return new Binary(Binary.Op.DIV, left, right);
    }

    public static Expr mod(Expr left, Expr right) {
        return new Binary(Binary.Op.MOD, left, right);
    }

    public static Expr eq(Expr left, Expr right) {
        return new Binary(Binary.Op.EQ, left, right);
    }

    public static Expr ne(Expr left, Expr right) {
        return new Binary(Binary.Op.NE, left, right);
    }

    public static Expr lt(Expr left, Expr right) {
        return new Binary(Binary.Op.LT, left, right);
    }

    public static Expr le(Expr left, Expr right) {
        return new Binary(Binary.Op.LE, left, right);
    }

    public static Expr gt(Expr left, Expr right) {
        return new Binary(Binary.Op.GT, left, right);
    }

    public static Expr ge(Expr left, Expr right) {
        return new Binary(Binary.Op.GE, left, right);
    }

    public static Expr and(Expr left, Expr right) {
        return new Binary(Binary.Op.AND, left, right);
    }

    public static Expr or(Expr left, Expr right) {
        return new Binary(Binary.Op.OR, left, right);
    }

    public static Expr implies(Expr left, Expr right) {
        return new Binary(Binary.Op.IMPLIES, left, right);
    }

    /**
     * Left-nested conjunction; {@code true} for an empty list.
     */
    public static Expr and(List<? extends Expr> operands) {
        return fold(Binary.Op.AND, operands, TRUE);
    }

    /**
     * Left-nested disjunction; {@code false} for an empty list.
     */
    public static Expr or(List<? extends Expr> operands) {
        return fold(Binary.Op.OR, operands, FALSE);
    }

    private static Expr fold(Binary.Op op, List<? extends Expr> operands, Expr unit) {
        if (operands.isEmpty()) {
            return unit;
        }
        Expr result = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            result = new Binary(op, result, operands.get(i));
        }
        return result;
    }

    public static Expr ite(Expr condition, Expr thenValue, Expr elseValue) {
        return new Conditional(condition, thenValue, elseValue);
    }

    public static Apply apply(String function, Type type, Expr... args) {
        return new Apply(function, type, Arrays.asList(args));
    }

    public static Apply apply(String function, Type type, List<Expr> args) {
        return new Apply(function, type, args);
    }

    public static Apply old(Expr operand) {
        return new Apply(OLD, operand.getType(), Collections.singletonList(operand));
    }

    public static Opaque opaque(String text, String reason, Type type) {
        return new Opaque(text, reason, type);
    }

    // ========================================================================
    // Node types
    // ========================================================================

    public static final class IntLiteral extends Expr {
        private final BigInteger value;

        public IntLiteral(BigInteger value) {
            this.value = Objects.requireNonNull(value);
        }

        public BigInteger getValue() {
            return value;
        }

        @Override
        public Type getType() {
            return Type.INT;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIntLiteral(this);
        }

        @Override
        protected int precedence() {
            return value.signum() < 0 ? 8 : 100;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof IntLiteral && value.equals(((IntLiteral) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    public static final class BoolLiteral extends Expr {
        private final boolean value;

        private BoolLiteral(boolean value) {
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public Type getType() {
            return Type.BOOL;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBoolLiteral(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BoolLiteral && value == ((BoolLiteral) o).value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    public static final class Variable extends Expr {
        private final String name;
        private final Type type;

        public Variable(String name, Type type) {
            this.name = Objects.requireNonNull(name);
            this.type = Objects.requireNonNull(type);
        }

        public String getName() {
            return name;
        }

        @Override
        public Type getType() {
            return type;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariable(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Variable)) return false;
            Variable that = (Variable) o;
            return name.equals(that.name) && type == that.type;
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, type);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Unary extends Expr {
        public enum Op {
            NEG("-"),
            NOT("!");

            private final String symbol;

            Op(String symbol) {
                this.symbol = symbol;
            }

            public String getSymbol() {
                return symbol;
            }
        }

        private final Op op;
        private final Expr operand;

        public Unary(Op op, Expr operand) {
            this.op = Objects.requireNonNull(op);
            this.operand = Objects.requireNonNull(operand);
        }

        public Op getOp() {
            return op;
        }

        public Expr getOperand() {
            return operand;
        }

        @Override
        public Type getType() {
            return op == Op.NOT ? Type.BOOL : Type.INT;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }

        @Override
        protected int precedence() {
            return 8;
        }

        @Override
        public List<Expr> children() {
            return Collections.singletonList(operand);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Unary)) return false;
            Unary that = (Unary) o;
            return op == that.op && operand.equals(that.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, operand);
        }

        @Override
        public String toString() {
            String inner = operand.toString();
            if (operand.precedence() < precedence()) {
                inner = "(" + inner + ")";
            }
            return op.getSymbol() + inner;
        }
    }

    public static final class Binary extends Expr {
        public enum Kind {
            ARITHMETIC,
            COMPARISON,
            LOGICAL
        }

        public enum Op {
            ADD("+", 6, Kind.ARITHMETIC),
            SUB("-", 6, Kind.ARITHMETIC),
            MUL("*", 7, Kind.ARITHMETIC),
            DIV("/", 7, Kind.ARITHMETIC),
            MOD("%", 7, Kind.ARITHMETIC),
            EQ("==", 4, Kind.COMPARISON),
            NE("!=", 4, Kind.COMPARISON),
            LT("<", 5, Kind.COMPARISON),
            LE("<=", 5, Kind.COMPARISON),
            GT(">", 5, Kind.COMPARISON),
            GE(">=", 5, Kind.COMPARISON),
            AND("&&", 3, Kind.LOGICAL),
            OR("||", 2, Kind.LOGICAL),
            IMPLIES("==>", 1, Kind.LOGICAL);

            private final String symbol;
            private final int precedence;
            private final Kind kind;

            Op(String symbol, int precedence, Kind kind) {
                this.symbol = symbol;
                this.precedence = precedence;
                this.kind = kind;
            }

            public String getSymbol() {
                return symbol;
            }

            public Kind getKind() {
                return kind;
            }

            /**
             * The comparison that holds exactly when this one does not.
             */
            public Op negated() {
                switch (this) {
                    case EQ: return NE;
                    case NE: return EQ;
                    case LT: return GE;
                    case LE: return GT;
                    case GT: return LE;
                    case GE: return LT;
                    default: throw new IllegalStateException("Not a comparison: " + this);
                }
            }
        }

        private final Op op;
        private final Expr left;
        private final Expr right;

        public Binary(Op op, Expr left, Expr right) {
            this.op = Objects.requireNonNull(op);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        public Op getOp() {
            return op;
        }

        public Expr getLeft() {
            return left;
        }

        public Expr getRight() {
            return right;
        }

        @Override
        public Type getType() {
            return op.getKind() == Kind.ARITHMETIC ? Type.INT : Type.BOOL;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        protected int precedence() {
            return op.precedence;
        }

        @Override
        public List<Expr> children() {
            return Arrays.asList(left, right);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Binary)) return false;
            Binary that = (Binary) o;
            return op == that.op && left.equals(that.left) && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, left, right);
        }

        @Override
        public String toString() {
            // implication is right associative, everything else left associative
            boolean rightAssoc = op == Op.IMPLIES;
            String l = left.toString();
            String r = right.toString();
            if (left.precedence() < precedence() || (rightAssoc && left.precedence() == precedence())) {
                l = "(" + l + ")";
            }
            if (right.precedence() < precedence() || (!rightAssoc && right.precedence() == precedence())) {
                r = "(" + r + ")";
            }
            return l + " " + op.getSymbol() + " " + r;
        }
    }

    public static final class Conditional extends Expr {
        private final Expr condition;
        private final Expr thenValue;
        private final Expr elseValue;

        public Conditional(Expr condition, Expr thenValue, Expr elseValue) {
            this.condition = Objects.requireNonNull(condition);
            this.thenValue = Objects.requireNonNull(thenValue);
            this.elseValue = Objects.requireNonNull(elseValue);
        }

        public Expr getCondition() {
            return condition;
        }

        public Expr getThenValue() {
            return thenValue;
        }

        public Expr getElseValue() {
            return elseValue;
        }

        @Override
        public Type getType() {
            return thenValue.getType();
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConditional(this);
        }

        @Override
        protected int precedence() {
            return 0;
        }

        @Override
        public List<Expr> children() {
            return Arrays.asList(condition, thenValue, elseValue);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Conditional)) return false;
            Conditional that = (Conditional) o;
            return condition.equals(that.condition) && thenValue.equals(that.thenValue)
                    && elseValue.equals(that.elseValue);
        }

        @Override
        public int hashCode() {
            return Objects.hash(condition, thenValue, elseValue);
        }

        @Override
        public String toString() {
            return "(" + condition + " ? " + thenValue + " : " + elseValue + ")";
        }
    }

    /**
     * Application of a pure logical function, uninterpreted unless it is {@code old}.
     */
    public static final class Apply extends Expr {
        private final String function;
        private final Type type;
        private final List<Expr> arguments;

        public Apply(String function, Type type, List<Expr> arguments) {
            this.function = Objects.requireNonNull(function);
            this.type = Objects.requireNonNull(type);
            this.arguments = List.copyOf(arguments);
        }

        public String getFunction() {
            return function;
        }

        public List<Expr> getArguments() {
            return arguments;
        }

        public boolean isOld() {
            return OLD.equals(function) && arguments.size() == 1;
        }

        @Override
        public Type getType() {
            return type;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitApply(this);
        }

        @Override
        public List<Expr> children() {
            return arguments;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Apply)) return false;
            Apply that = (Apply) o;
            return function.equals(that.function) && type == that.type && arguments.equals(that.arguments);
        }

        @Override
        public int hashCode() {
            return Objects.hash(function, type, arguments);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(function).append('(');
            for (int i = 0; i < arguments.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(arguments.get(i));
            }
            return sb.append(')').toString();
        }
    }

    /**
     * Source the model cannot represent. It survives substitution unchanged and makes any
     * verification condition containing it undecidable for the solver adapter.
     */
    public static final class Opaque extends Expr {
        private final String text;
        private final String reason;
        private final Type type;

        public Opaque(String text, String reason, Type type) {
            this.text = Objects.requireNonNull(text);
            this.reason = Objects.requireNonNull(reason);
            this.type = Objects.requireNonNull(type);
        }

        public String getText() {
            return text;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public Type getType() {
            return type;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitOpaque(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Opaque)) return false;
            Opaque that = (Opaque) o;
            return text.equals(that.text) && reason.equals(that.reason) && type == that.type;
        }

        @Override
        public int hashCode() {
            return Objects.hash(text, reason, type);
        }

        @Override
        public String toString() {
            return "<" + text + ">";
        }
    }
}
