package com.wp.verifier.wp;

import com.wp.verifier.ast.Stmt;
import com.wp.verifier.cfg.CfgBuilder;
import com.wp.verifier.cfg.CfgConstructionException;
import com.wp.verifier.cfg.ControlFlowGraph;
import com.wp.verifier.model.ConditionKind;
import com.wp.verifier.model.Expr;
import com.wp.verifier.model.VerificationCondition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.wp.verifier.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class WpTransformerTest {

    private final CfgBuilder builder = new CfgBuilder();
    private final WpTransformer transformer = new WpTransformer();

    private WpResult transform(com.wp.verifier.ast.FunctionDecl function) throws CfgConstructionException {
        return transformer.transform(builder.build(function));
    }

    @Test
    void straightLineSubstitutesSequentially() throws CfgConstructionException {
        // y = x + 1; z = y * 2; ensures z > x
        Expr.Variable z = Expr.intVar("z");
        WpResult result = transform(function("twice", ints("x"), List.of(), post(Expr.gt(z, X)),
                body(assign(Y, Expr.add(X, lit(1))), assign(z, Expr.mul(Y, lit(2))))));

        assertEquals(Expr.gt(Expr.mul(Expr.add(X, lit(1)), lit(2)), X), result.getWp(0));
        List<VerificationCondition> conditions = result.getConditions();
        assertEquals(1, conditions.size());
        assertEquals(ConditionKind.POSTCONDITION, conditions.get(0).getKind());
        assertEquals(Expr.implies(Expr.TRUE, result.getWp(0)), conditions.get(0).getFormula());
    }

    @Test
    void ifElseConjoinsGuardedBranches() throws CfgConstructionException {
        Expr c = Expr.gt(X, lit(0));
        Expr q = Expr.ge(Y, lit(0));
        Stmt branch = new Stmt.If(c, body(assign(Y, X)), body(assign(Y, Expr.neg(X))), line(5));
        WpResult result = transform(function("abs", ints("x"), List.of(), post(q), body(branch)));

        Expr expected = Expr.and(
                Expr.implies(c, Expr.ge(X, lit(0))),
                Expr.implies(Expr.not(c), Expr.ge(Expr.neg(X), lit(0))));
        assertEquals(expected, result.getWp(0));
    }

    @Test
    void loopYieldsInitiationPreservationAndUse() throws CfgConstructionException {
        Expr p = Expr.ge(N, lit(0));
        Expr invariant = Expr.le(I, N);
        Expr guard = Expr.lt(I, N);
        Expr q = Expr.eq(I, N);
        Stmt loop = new Stmt.While(guard, inv(invariant), body(assign(I, Expr.add(I, lit(1)))), line(6));
        WpResult result = transform(function("count", ints("n"), List.of(pre(p)), post(q),
                body(assign(I, lit(0)), loop)));

        List<VerificationCondition> conditions = result.getConditions();
        assertEquals(3, conditions.size());

        assertEquals(ConditionKind.LOOP_INITIATION, conditions.get(0).getKind());
        assertEquals(Expr.implies(p, Expr.le(lit(0), N)), conditions.get(0).getFormula());

        assertEquals(ConditionKind.LOOP_PRESERVATION, conditions.get(1).getKind());
        assertEquals(Expr.implies(Expr.and(invariant, guard), Expr.le(Expr.add(I, lit(1)), N)),
                conditions.get(1).getFormula());

        assertEquals(ConditionKind.LOOP_USE, conditions.get(2).getKind());
        assertEquals(Expr.implies(Expr.and(invariant, Expr.not(guard)), q), conditions.get(2).getFormula());

        assertEquals(invariant, result.getWp(1));
    }

    @Test
    void conditionIdsAndDescriptions() throws CfgConstructionException {
        List<VerificationCondition> conditions = transform(triangle()).getConditions();

        assertEquals("triangle#0", conditions.get(0).getId());
        assertEquals("triangle#2", conditions.get(2).getId());
        assertTrue(conditions.get(0).getDescription().endsWith("holds on loop entry"));
        assertTrue(conditions.get(1).getDescription().endsWith("preserved by loop body"));
        assertTrue(conditions.get(2).getDescription().endsWith("after loop exit"));
        assertEquals(line(3), conditions.get(0).getSpan());
    }

    @Test
    void implicitInvariantSitesAreSkippedAndFlagged() throws CfgConstructionException {
        List<VerificationCondition> conditions = transform(countWithoutInvariant()).getConditions();

        assertEquals(1, conditions.size());
        assertEquals(ConditionKind.LOOP_USE, conditions.get(0).getKind());
        assertTrue(conditions.get(0).assumesImplicitInvariant());
    }

    @Test
    void implicitPostconditionProducesNoCondition() throws CfgConstructionException {
        WpResult result = transform(function("noPost", ints("x"), List.of(), null, body(assign(Y, X))));

        assertTrue(result.getConditions().isEmpty());
        assertEquals(Expr.TRUE, result.getWp(0));
    }

    @Test
    void assertionIsCheckedSeparately() throws CfgConstructionException {
        Stmt check = new Stmt.Assert(Expr.gt(Y, lit(0)), line(7));
        WpResult result = transform(function("asserts", ints("x"), List.of(pre(Expr.gt(X, lit(0)))),
                post(Expr.gt(Y, lit(1))), body(assign(Y, Expr.add(X, lit(1))), check)));

        List<VerificationCondition> conditions = result.getConditions();
        assertEquals(2, conditions.size());
        VerificationCondition assertion = conditions.get(0);
        assertEquals(ConditionKind.ASSERTION, assertion.getKind());
        assertEquals(line(7), assertion.getSpan());
        assertEquals(Expr.implies(Expr.gt(X, lit(0)), Expr.and(Expr.gt(Expr.add(X, lit(1)), lit(0)), Expr.TRUE)),
                assertion.getFormula());
        // the postcondition may assume the assertion
        assertEquals(Expr.implies(Expr.gt(X, lit(0)),
                        Expr.implies(Expr.gt(Expr.add(X, lit(1)), lit(0)), Expr.gt(Expr.add(X, lit(1)), lit(1)))),
                conditions.get(1).getFormula());
    }

    @Test
    void panicEdgeContributesFalse() throws CfgConstructionException {
        Expr c = Expr.lt(X, lit(0));
        Stmt check = new Stmt.If(c, body(new Stmt.Panic("negative", line(6))), null, line(5));
        WpResult result = transform(function("checked", ints("x"), List.of(pre(Expr.ge(X, lit(0)))), null,
                body(check, ret(X))));

        List<VerificationCondition> conditions = result.getConditions();
        assertEquals(1, conditions.size());
        VerificationCondition panic = conditions.get(0);
        assertEquals(ConditionKind.PANIC_FREEDOM, panic.getKind());
        assertEquals("panic unreachable: negative", panic.getDescription());
        assertEquals(Expr.implies(Expr.ge(X, lit(0)),
                Expr.and(Expr.implies(c, Expr.FALSE), Expr.implies(Expr.not(c), Expr.TRUE))), panic.getFormula());
    }

    @Test
    void oldIsErasedAtEntry() throws CfgConstructionException {
        Expr q = Expr.eq(X, Expr.add(Expr.old(X), lit(1)));
        WpResult result = transform(function("bump", ints("x"), List.of(), post(q),
                body(assign(X, Expr.add(X, lit(1))))));

        assertEquals(Expr.implies(Expr.TRUE, Expr.eq(Expr.add(X, lit(1)), Expr.add(X, lit(1)))),
                result.getConditions().get(0).getFormula());
    }

    @Test
    void oldBecomesPreStateConstantAfterLoop() throws CfgConstructionException {
        Expr q = Expr.ge(I, Expr.old(N));
        Stmt loop = new Stmt.While(Expr.lt(I, N), inv(Expr.le(I, N)), body(assign(I, Expr.add(I, lit(1)))), line(6));
        WpResult result = transform(function("count", ints("n"), List.of(), post(q), body(assign(I, lit(0)), loop)));

        VerificationCondition use = result.getConditions().get(2);
        assertEquals(ConditionKind.LOOP_USE, use.getKind());
        assertTrue(use.getFormula().freeVariables().contains("old$n"));
    }

    @Test
    void fullTableCoversEveryBlock() throws CfgConstructionException {
        ControlFlowGraph cfg = builder.build(triangle());
        WpResult result = transformer.transform(cfg);

        assertEquals(cfg.size(), result.getBlockWp().size());
        assertThrows(IllegalArgumentException.class, () -> result.getWp(99));
    }
}
