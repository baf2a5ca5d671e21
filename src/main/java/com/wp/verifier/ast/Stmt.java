package com.wp.verifier.ast;

import com.wp.verifier.model.Annotation;
import com.wp.verifier.model.Expr;
import com.wp.verifier.model.SourceSpan;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Statements of the input language. Bodies are plain lists; control constructs nest them.
 */
public abstract class Stmt {

    private final SourceSpan span;

    protected Stmt(SourceSpan span) {
        this.span = span != null ? span : SourceSpan.UNKNOWN;
    }

    public SourceSpan getSpan() {
        return span;
    }

    /**
     * {@code x = e}
     */
    public static final class Assign extends Stmt {
        private final Expr.Variable target;
        private final Expr value;

        public Assign(Expr.Variable target, Expr value, SourceSpan span) {
            super(span);
            this.target = Objects.requireNonNull(target);
            this.value = Objects.requireNonNull(value);
        }

        public Expr.Variable getTarget() {
            return target;
        }

        public Expr getValue() {
            return value;
        }

        @Override
        public String toString() {
            return target + " = " + value;
        }
    }

    /**
     * {@code assert!(c)}
     */
    public static final class Assert extends Stmt {
        private final Expr condition;

        public Assert(Expr condition, SourceSpan span) {
            super(span);
            this.condition = Objects.requireNonNull(condition);
        }

        public Expr getCondition() {
            return condition;
        }

        @Override
        public String toString() {
            return "assert " + condition;
        }
    }

    /**
     * A call whose result is optionally assigned: {@code x = f(a, b)} or {@code f(a, b)}.
     */
    public static final class Invoke extends Stmt {
        private final Expr.Variable target;
        private final String callee;
        private final List<Expr> arguments;
        private final boolean receiverCall;

        public Invoke(Expr.Variable target, String callee, List<Expr> arguments, boolean receiverCall, SourceSpan span) {
            super(span);
            this.target = target;
            this.callee = Objects.requireNonNull(callee);
            this.arguments = List.copyOf(arguments);
            this.receiverCall = receiverCall;
        }

        /**
         * @return the assigned variable, or {@code null} when the result is discarded
         */
        public Expr.Variable getTarget() {
            return target;
        }

        public String getCallee() {
            return callee;
        }

        public List<Expr> getArguments() {
            return arguments;
        }

        /**
         * Whether the call goes through a receiver object ({@code v.f(..)}) whose state the model does not track.
         */
        public boolean isReceiverCall() {
            return receiverCall;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            if (target != null) {
                sb.append(target).append(" = ");
            }
            sb.append(callee).append('(');
            for (int i = 0; i < arguments.size(); i++) {
                sb.append(i > 0 ? ", " : "").append(arguments.get(i));
            }
            return sb.append(')').toString();
        }
    }

    public static final class If extends Stmt {
        private final Expr condition;
        private final List<Stmt> thenBranch;
        private final List<Stmt> elseBranch;

        public If(Expr condition, List<Stmt> thenBranch, List<Stmt> elseBranch, SourceSpan span) {
            super(span);
            this.condition = Objects.requireNonNull(condition);
            this.thenBranch = List.copyOf(thenBranch);
            this.elseBranch = elseBranch != null ? List.copyOf(elseBranch) : null;
        }

        public Expr getCondition() {
            return condition;
        }

        public List<Stmt> getThenBranch() {
            return thenBranch;
        }

        /**
         * @return the else branch, or {@code null} if there is none
         */
        public List<Stmt> getElseBranch() {
            return elseBranch;
        }

        public boolean hasElse() {
            return elseBranch != null;
        }

        @Override
        public String toString() {
            return "if " + condition;
        }
    }

    /**
     * {@code while c { body; update }}. The update statements run after the body and on every {@code continue}.
     */
    public static final class While extends Stmt {
        private final Expr condition;
        private final Annotation invariant;
        private final List<Stmt> body;
        private final List<Stmt> update;

        public While(Expr condition, Annotation invariant, List<Stmt> body, SourceSpan span) {
            this(condition, invariant, body, Collections.emptyList(), span);
        }

        public While(Expr condition, Annotation invariant, List<Stmt> body, List<Stmt> update, SourceSpan span) {
            super(span);
            this.condition = Objects.requireNonNull(condition);
            this.invariant = invariant;
            this.body = List.copyOf(body);
            this.update = List.copyOf(update);
        }

        public Expr getCondition() {
            return condition;
        }

        /**
         * @return the declared invariant, or {@code null} when the loop has none
         */
        public Annotation getInvariant() {
            return invariant;
        }

        public List<Stmt> getBody() {
            return body;
        }

        public List<Stmt> getUpdate() {
            return update;
        }

        @Override
        public String toString() {
            return "while " + condition;
        }
    }

    /**
     * {@code for v in lo..hi} or {@code for v in lo..=hi}.
     */
    public static final class ForRange extends Stmt {
        private final Expr.Variable variable;
        private final Expr lower;
        private final Expr upper;
        private final boolean inclusive;
        private final Annotation invariant;
        private final List<Stmt> body;

        public ForRange(Expr.Variable variable, Expr lower, Expr upper, boolean inclusive,
                        Annotation invariant, List<Stmt> body, SourceSpan span) {
            super(span);
            this.variable = Objects.requireNonNull(variable);
            this.lower = Objects.requireNonNull(lower);
            this.upper = Objects.requireNonNull(upper);
            this.inclusive = inclusive;
            this.invariant = invariant;
            this.body = List.copyOf(body);
        }

        public Expr.Variable getVariable() {
            return variable;
        }

        public Expr getLower() {
            return lower;
        }

        public Expr getUpper() {
            return upper;
        }

        public boolean isInclusive() {
            return inclusive;
        }

        public Annotation getInvariant() {
            return invariant;
        }

        public List<Stmt> getBody() {
            return body;
        }

        @Override
        public String toString() {
            return "for " + variable + " in " + lower + (inclusive ? "..=" : "..") + upper;
        }
    }

    /**
     * {@code return} with an optional value.
     */
    public static final class Return extends Stmt {
        private final Expr value;

        public Return(Expr value, SourceSpan span) {
            super(span);
            this.value = value;
        }

        public Expr getValue() {
            return value;
        }

        @Override
        public String toString() {
            return value != null ? "return " + value : "return";
        }
    }

    public static final class Panic extends Stmt {
        private final String message;

        public Panic(String message, SourceSpan span) {
            super(span);
            this.message = message != null ? message : "explicit panic";
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return "panic!(\"" + message + "\")";
        }
    }

    public static final class Break extends Stmt {
        public Break(SourceSpan span) {
            super(span);
        }

        @Override
        public String toString() {
            return "break";
        }
    }

    public static final class Continue extends Stmt {
        public Continue(SourceSpan span) {
            super(span);
        }

        @Override
        public String toString() {
            return "continue";
        }
    }

    /**
     * A construct the front end recognised but the verifier cannot model.
     */
    public static final class Unsupported extends Stmt {
        private final String description;

        public Unsupported(String description, SourceSpan span) {
            super(span);
            this.description = Objects.requireNonNull(description);
        }

        public String getDescription() {
            return description;
        }

        @Override
        public String toString() {
            return "unsupported: " + description;
        }
    }
}
