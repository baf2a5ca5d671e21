package com.wp.verifier.solver;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.Sort;
import com.wp.verifier.model.Expr;
import com.wp.verifier.model.ExprVisitor;
import com.wp.verifier.model.Type;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates expressions into Z3 terms over linear and non-linear integer arithmetic with
 * uninterpreted functions. Integer division and remainder follow Java, not SMT-LIB.
 * One translator belongs to one {@link Context}.
 */
public class Z3ExprTranslator implements ExprVisitor<com.microsoft.z3.Expr<?>> {

    private final Context ctx;
    private final Map<String, com.microsoft.z3.Expr<?>> constants = new LinkedHashMap<>();

    public Z3ExprTranslator(Context ctx) {
        this.ctx = ctx;
    }

    public BoolExpr toBool(Expr expr) {
        com.microsoft.z3.Expr<?> term = expr.accept(this);
        if (!(term instanceof BoolExpr)) {
            throw new UnsupportedTheoryException("expected a boolean term: " + expr);
        }
        return (BoolExpr) term;
    }

    public IntExpr toInt(Expr expr) {
        com.microsoft.z3.Expr<?> term = expr.accept(this);
        if (!(term instanceof IntExpr)) {
            throw new UnsupportedTheoryException("expected an integer term: " + expr);
        }
        return (IntExpr) term;
    }

    /**
     * Constants declared so far, by name, in order of first occurrence.
     */
    public Map<String, com.microsoft.z3.Expr<?>> getConstants() {
        return Collections.unmodifiableMap(constants);
    }

    @Override
    public com.microsoft.z3.Expr<?> visitIntLiteral(Expr.IntLiteral expr) {
        return ctx.mkInt(expr.getValue().toString());
    }

    @Override
    public com.microsoft.z3.Expr<?> visitBoolLiteral(Expr.BoolLiteral expr) {
        return ctx.mkBool(expr.getValue());
    }

    @Override
    public com.microsoft.z3.Expr<?> visitVariable(Expr.Variable expr) {
        return constants.computeIfAbsent(expr.getName(), k ->
                expr.getType() == Type.BOOL ? ctx.mkBoolConst(expr.getName()) : ctx.mkIntConst(expr.getName()));
    }

    @Override
    public com.microsoft.z3.Expr<?> visitUnary(Expr.Unary expr) {
        if (expr.getOp() == Expr.Unary.Op.NOT) {
            return ctx.mkNot(toBool(expr.getOperand()));
        }
        return ctx.mkUnaryMinus(toInt(expr.getOperand()));
    }

    @Override
    public com.microsoft.z3.Expr<?> visitBinary(Expr.Binary expr) {
        Expr left = expr.getLeft();
        Expr right = expr.getRight();
        switch (expr.getOp()) {
            case ADD:
                return ctx.mkAdd(toInt(left), toInt(right));
            case SUB:
                return ctx.mkSub(toInt(left), toInt(right));
            case MUL:
                return ctx.mkMul(toInt(left), toInt(right));
            case DIV:
                return truncatedDiv(toInt(left), toInt(right));
            case MOD:
                return truncatedRem(toInt(left), toInt(right));
            case EQ:
                return equality(left, right);
            case NE:
                return ctx.mkNot(equality(left, right));
            case LT:
                return ctx.mkLt(toInt(left), toInt(right));
            case LE:
                return ctx.mkLe(toInt(left), toInt(right));
            case GT:
                return ctx.mkGt(toInt(left), toInt(right));
            case GE:
                return ctx.mkGe(toInt(left), toInt(right));
            case AND:
                return ctx.mkAnd(toBool(left), toBool(right));
            case OR:
                return ctx.mkOr(toBool(left), toBool(right));
            case IMPLIES:
                return ctx.mkImplies(toBool(left), toBool(right));
            default:
                throw new UnsupportedTheoryException("operator " + expr.getOp());
        }
    }

    /**
     * Java division: the quotient is rounded toward zero. Z3's {@code div} is Euclidean, so
     * the quotient is corrected when the dividend is negative and the division is inexact.
     */
    private com.microsoft.z3.Expr<IntSort> truncatedDiv(IntExpr dividend, IntExpr divisor) {
        ArithExpr<IntSort> quotient = ctx.mkDiv(dividend, divisor);
        IntExpr zero = ctx.mkInt(0);
        IntExpr one = ctx.mkInt(1);
        BoolExpr exact = ctx.mkOr(ctx.mkGe(dividend, zero), ctx.mkEq(ctx.mkMod(dividend, divisor), zero));
        com.microsoft.z3.Expr<IntSort> corrected = ctx.mkITE(ctx.mkGt(divisor, zero),
                ctx.mkAdd(quotient, one), ctx.mkSub(quotient, one));
        return ctx.mkITE(exact, quotient, corrected);
    }

    /**
     * Java remainder, which takes the sign of the dividend.
     */
    private com.microsoft.z3.Expr<IntSort> truncatedRem(IntExpr dividend, IntExpr divisor) {
        return ctx.mkSub(dividend, ctx.mkMul(divisor, truncatedDiv(dividend, divisor)));
    }

    private BoolExpr equality(Expr left, Expr right) {
        if (left.getType() == Type.BOOL && right.getType() == Type.BOOL) {
            return ctx.mkEq(toBool(left), toBool(right));
        }
        return ctx.mkEq(toInt(left), toInt(right));
    }

    @Override
    public com.microsoft.z3.Expr<?> visitConditional(Expr.Conditional expr) {
        BoolExpr condition = toBool(expr.getCondition());
        com.microsoft.z3.Expr<?> thenTerm = expr.getThenValue().accept(this);
        com.microsoft.z3.Expr<?> elseTerm = expr.getElseValue().accept(this);
        if (!thenTerm.getSort().equals(elseTerm.getSort())) {
            throw new UnsupportedTheoryException("branches of different sorts: " + expr);
        }
        return ctx.mkITE(condition, thenTerm, elseTerm);
    }

    @Override
    public com.microsoft.z3.Expr<?> visitApply(Expr.Apply expr) {
        if (expr.isOld()) {
            throw new UnsupportedTheoryException("old(..) must be resolved before solving: " + expr);
        }
        List<Expr> arguments = expr.getArguments();
        Sort[] domain = new Sort[arguments.size()];
        com.microsoft.z3.Expr<?>[] terms = new com.microsoft.z3.Expr<?>[arguments.size()];
        for (int i = 0; i < arguments.size(); i++) {
            terms[i] = arguments.get(i).accept(this);
            domain[i] = terms[i].getSort();
        }
        Sort range = expr.getType() == Type.BOOL ? ctx.getBoolSort() : ctx.getIntSort();
        FuncDecl<Sort> function = ctx.mkFuncDecl(expr.getFunction(), domain, range);
        return ctx.mkApp(function, terms);
    }

    @Override
    public com.microsoft.z3.Expr<?> visitOpaque(Expr.Opaque expr) {
        throw new UnsupportedTheoryException("cannot translate `" + expr.getText() + "`: " + expr.getReason());
    }
}
