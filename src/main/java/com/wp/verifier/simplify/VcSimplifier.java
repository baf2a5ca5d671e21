package com.wp.verifier.simplify;

import com.wp.verifier.model.Expr;
import com.wp.verifier.model.ExprTransformer;
import com.wp.verifier.model.VerificationCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites formulas into smaller equivalent ones before they are sent to the solver.
 *
 * <p>Rewriting is applied bottom-up and repeated until nothing changes, so simplifying an
 * already simplified formula returns it unchanged. Every rule preserves validity over the
 * mathematical integers; integer division and remainder fold as in Java (the quotient is
 * truncated toward zero) and division by zero is left for the solver. Rules that identify two
 * occurrences of the same subterm are not applied to opaque subterms.
 */
public class VcSimplifier {

    private static final Logger logger = LoggerFactory.getLogger(VcSimplifier.class);

    private static final int MAX_PASSES = 64;

    private final Rewriter rewriter = new Rewriter();

    public Expr simplify(Expr formula) {
        Expr current = formula;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            Expr next = rewriter.transform(current);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
        logger.warn("Simplification of {} did not converge after {} passes", formula, MAX_PASSES);
        return current;
    }

    /**
     * Simplifies every condition and merges those whose simplified formulas are identical. The
     * original conditions are kept with each group so results can be reported for all of them.
     */
    public List<SimplifiedVc> simplifyAll(List<VerificationCondition> conditions) {
        Map<Expr, List<VerificationCondition>> groups = new LinkedHashMap<>();
        for (VerificationCondition vc : conditions) {
            groups.computeIfAbsent(simplify(vc.getFormula()), k -> new ArrayList<>()).add(vc);
        }
        List<SimplifiedVc> result = new ArrayList<>(groups.size());
        for (Map.Entry<Expr, List<VerificationCondition>> group : groups.entrySet()) {
            result.add(new SimplifiedVc(group.getKey(), group.getValue()));
        }
        if (result.size() < conditions.size()) {
            logger.debug("Merged {} verification conditions into {}", conditions.size(), result.size());
        }
        return result;
    }

    /**
     * One bottom-up rewriting pass. Children are already simplified when a node is rebuilt.
     */
    private static final class Rewriter extends ExprTransformer {

        @Override
        protected Expr constructUnary(Expr.Unary expr, Expr operand) {
            if (expr.getOp() == Expr.Unary.Op.NEG) {
                if (operand instanceof Expr.IntLiteral) {
                    return Expr.intLit(((Expr.IntLiteral) operand).getValue().negate());
                }
                if (operand instanceof Expr.Unary && ((Expr.Unary) operand).getOp() == Expr.Unary.Op.NEG) {
                    return ((Expr.Unary) operand).getOperand();
                }
                return super.constructUnary(expr, operand);
            }
            if (operand instanceof Expr.BoolLiteral) {
                return Expr.bool(!((Expr.BoolLiteral) operand).getValue());
            }
            if (operand instanceof Expr.Unary && ((Expr.Unary) operand).getOp() == Expr.Unary.Op.NOT) {
                return ((Expr.Unary) operand).getOperand();
            }
            if (operand instanceof Expr.Binary) {
                Expr.Binary comparison = (Expr.Binary) operand;
                if (comparison.getOp().getKind() == Expr.Binary.Kind.COMPARISON) {
                    return Expr.binary(comparison.getOp().negated(), comparison.getLeft(), comparison.getRight());
                }
            }
            return super.constructUnary(expr, operand);
        }

        @Override
        protected Expr constructBinary(Expr.Binary expr, Expr left, Expr right) {
            Expr folded = switch (expr.getOp().getKind()) {
                case ARITHMETIC -> arithmetic(expr.getOp(), left, right);
                case COMPARISON -> comparison(expr.getOp(), left, right);
                case LOGICAL -> logical(expr.getOp(), left, right);
            };
            return folded != null ? folded : super.constructBinary(expr, left, right);
        }

        @Override
        protected Expr constructConditional(Expr.Conditional expr, Expr condition, Expr thenValue, Expr elseValue) {
            if (condition instanceof Expr.BoolLiteral) {
                return ((Expr.BoolLiteral) condition).getValue() ? thenValue : elseValue;
            }
            if (thenValue.equals(elseValue) && !thenValue.containsOpaque()) {
                return thenValue;
            }
            return super.constructConditional(expr, condition, thenValue, elseValue);
        }

        private static Expr arithmetic(Expr.Binary.Op op, Expr left, Expr right) {
            BigInteger l = intValue(left);
            BigInteger r = intValue(right);
            if (l != null && r != null) {
                switch (op) {
                    case ADD:
                        return Expr.intLit(l.add(r));
                    case SUB:
                        return Expr.intLit(l.subtract(r));
                    case MUL:
                        return Expr.intLit(l.multiply(r));
                    case DIV:
                        return r.signum() == 0 ? null : Expr.intLit(l.divide(r));
                    case MOD:
                        return r.signum() == 0 ? null : Expr.intLit(l.remainder(r));
                    default:
                        return null;
                }
            }
            switch (op) {
                case ADD:
                    if (isInt(left, 0)) return right;
                    if (isInt(right, 0)) return left;
                    return null;
                case SUB:
                    if (isInt(right, 0)) return left;
                    if (isInt(left, 0)) return Expr.neg(right);
                    if (left.equals(right) && !left.containsOpaque()) return Expr.intLit(0);
                    return null;
                case MUL:
                    if (isInt(left, 1)) return right;
                    if (isInt(right, 1)) return left;
                    if ((isInt(left, 0) && !right.containsOpaque()) || (isInt(right, 0) && !left.containsOpaque())) {
                        return Expr.intLit(0);
                    }
                    return null;
                case DIV:
                    return isInt(right, 1) ? left : null;
                case MOD:
                    return isInt(right, 1) && !left.containsOpaque() ? Expr.intLit(0) : null;
                default:
                    return null;
            }
        }

        private static Expr comparison(Expr.Binary.Op op, Expr left, Expr right) {
            BigInteger l = intValue(left);
            BigInteger r = intValue(right);
            if (l != null && r != null) {
                int c = l.compareTo(r);
                return switch (op) {
                    case EQ -> Expr.bool(c == 0);
                    case NE -> Expr.bool(c != 0);
                    case LT -> Expr.bool(c < 0);
                    case LE -> Expr.bool(c <= 0);
                    case GT -> Expr.bool(c > 0);
                    case GE -> Expr.bool(c >= 0);
                    default -> null;
                };
            }
            if (left instanceof Expr.BoolLiteral && right instanceof Expr.BoolLiteral) {
                boolean equal = left.equals(right);
                if (op == Expr.Binary.Op.EQ) return Expr.bool(equal);
                if (op == Expr.Binary.Op.NE) return Expr.bool(!equal);
            }
            if (left.equals(right) && !left.containsOpaque()) {
                return switch (op) {
                    case EQ, LE, GE -> Expr.TRUE;
                    case NE, LT, GT -> Expr.FALSE;
                    default -> null;
                };
            }
            return null;
        }

        private static Expr logical(Expr.Binary.Op op, Expr left, Expr right) {
            if (op == Expr.Binary.Op.IMPLIES) {
                return implication(left, right);
            }
            boolean conjunction = op == Expr.Binary.Op.AND;
            Expr absorbing = conjunction ? Expr.FALSE : Expr.TRUE;
            Expr unit = conjunction ? Expr.TRUE : Expr.FALSE;

            Set<Expr> operands = new LinkedHashSet<>();
            flatten(op, left, operands);
            flatten(op, right, operands);
            operands.remove(unit);
            if (operands.contains(absorbing)) {
                return absorbing;
            }
            for (Expr operand : operands) {
                if (!operand.containsOpaque()
                        && (operands.contains(Expr.not(operand)) || operands.contains(complement(operand)))) {
                    return absorbing;
                }
            }
            List<Expr> list = new ArrayList<>(operands);
            Expr rebuilt = conjunction ? Expr.and(list) : Expr.or(list);
            // keep the original node when nothing changed so the pass reaches a fixpoint
            return rebuilt.equals(Expr.binary(op, left, right)) ? null : rebuilt;
        }

        private static Expr implication(Expr left, Expr right) {
            if (left.equals(Expr.TRUE)) return right;
            if (left.equals(Expr.FALSE)) return Expr.TRUE;
            if (right.equals(Expr.TRUE)) return Expr.TRUE;
            if (right.equals(Expr.FALSE)) return Expr.not(left);
            if (left.equals(right) && !left.containsOpaque()) return Expr.TRUE;
            // a ==> (b ==> c) becomes (a && b) ==> c
            if (right instanceof Expr.Binary && ((Expr.Binary) right).getOp() == Expr.Binary.Op.IMPLIES) {
                Expr.Binary inner = (Expr.Binary) right;
                Expr hypothesis = logical(Expr.Binary.Op.AND, left, inner.getLeft());
                if (hypothesis == null) {
                    hypothesis = Expr.and(left, inner.getLeft());
                }
                return Expr.implies(hypothesis, inner.getRight());
            }
            return null;
        }

        private static Expr complement(Expr expr) {
            if (expr instanceof Expr.Binary) {
                Expr.Binary comparison = (Expr.Binary) expr;
                if (comparison.getOp().getKind() == Expr.Binary.Kind.COMPARISON) {
                    return Expr.binary(comparison.getOp().negated(), comparison.getLeft(), comparison.getRight());
                }
            }
            return Expr.not(expr);
        }

        private static void flatten(Expr.Binary.Op op, Expr expr, Set<Expr> into) {
            if (expr instanceof Expr.Binary && ((Expr.Binary) expr).getOp() == op) {
                flatten(op, ((Expr.Binary) expr).getLeft(), into);
                flatten(op, ((Expr.Binary) expr).getRight(), into);
            } else {
                into.add(expr);
            }
        }

        private static BigInteger intValue(Expr expr) {
            return expr instanceof Expr.IntLiteral ? ((Expr.IntLiteral) expr).getValue() : null;
        }

        private static boolean isInt(Expr expr, long value) {
            BigInteger v = intValue(expr);
            return v != null && v.equals(BigInteger.valueOf(value));
        }
    }
}
