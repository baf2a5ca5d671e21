package com.wp.verifier.cfg;

import com.wp.verifier.model.ConditionKind;
import com.wp.verifier.model.Expr;
import com.wp.verifier.model.SourceSpan;

import java.util.Objects;

/**
 * Straight-line instruction inside a basic block.
 */
public abstract class Instruction {

    /**
     * {@code x := e}
     */
    public static final class Assign extends Instruction {
        private final Expr.Variable target;
        private final Expr value;

        public Assign(Expr.Variable target, Expr value) {
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
            return target + " := " + value;
        }
    }

    /**
     * A proof obligation at this point: an assertion or the precondition of a call.
     */
    public static final class Check extends Instruction {
        private final Expr condition;
        private final ConditionKind kind;
        private final SourceSpan span;
        private final String description;

        public Check(Expr condition, ConditionKind kind, SourceSpan span, String description) {
            this.condition = Objects.requireNonNull(condition);
            this.kind = Objects.requireNonNull(kind);
            this.span = span != null ? span : SourceSpan.UNKNOWN;
            this.description = description != null ? description : kind.getDescription();
        }

        public Expr getCondition() {
            return condition;
        }

        public ConditionKind getKind() {
            return kind;
        }

        public SourceSpan getSpan() {
            return span;
        }

        public String getDescription() {
            return description;
        }

        @Override
        public String toString() {
            return "check " + condition;
        }
    }

    /**
     * Condition known to hold from here on, e.g. a callee's postcondition.
     */
    public static final class Assume extends Instruction {
        private final Expr condition;

        public Assume(Expr condition) {
            this.condition = Objects.requireNonNull(condition);
        }

        public Expr getCondition() {
            return condition;
        }

        @Override
        public String toString() {
            return "assume " + condition;
        }
    }

    /**
     * Forgets everything known about a variable.
     */
    public static final class Havoc extends Instruction {
        private final Expr.Variable target;

        public Havoc(Expr.Variable target) {
            this.target = Objects.requireNonNull(target);
        }

        public Expr.Variable getTarget() {
            return target;
        }

        @Override
        public String toString() {
            return "havoc " + target;
        }
    }
}
