package com.wp.verifier.cfg;

import com.wp.verifier.ast.FunctionDecl;
import com.wp.verifier.ast.Stmt;
import com.wp.verifier.model.ConditionKind;
import com.wp.verifier.model.Diagnostic;
import com.wp.verifier.model.Expr;
import com.wp.verifier.model.MethodContract;
import com.wp.verifier.model.Type;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.wp.verifier.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CfgBuilderTest {

    private final CfgBuilder builder = new CfgBuilder();

    @Test
    void straightLineCodeIsOneBlock() throws CfgConstructionException {
        ControlFlowGraph cfg = builder.build(increment());

        assertEquals(1, cfg.size());
        assertEquals(cfg.getEntry(), cfg.getNormalExit());
        assertEquals(BlockKind.NORMAL_EXIT, cfg.getBlock(0).getKind());
        assertEquals(1, cfg.getBlock(0).getInstructions().size());
        assertTrue(cfg.getEdges().isEmpty());
        assertFalse(cfg.hasAbortExit());
    }

    @Test
    void ifElseBranchesAndJoins() throws CfgConstructionException {
        Expr c = Expr.gt(X, lit(0));
        Stmt branch = new Stmt.If(c, body(assign(Y, X)), body(assign(Y, Expr.neg(X))), line(5));
        ControlFlowGraph cfg = builder.build(function("abs", ints("x"), List.of(), post(Expr.ge(Y, lit(0))),
                body(branch)));

        assertEquals(4, cfg.size());
        List<Edge> fromEntry = cfg.getBlock(0).getOutgoing();
        assertEquals(2, fromEntry.size());
        assertEquals(EdgeKind.CONDITIONAL_TRUE, fromEntry.get(0).getKind());
        assertEquals(c, fromEntry.get(0).getGuard());
        assertEquals(EdgeKind.CONDITIONAL_FALSE, fromEntry.get(1).getKind());
        assertEquals(Expr.not(c), fromEntry.get(1).getGuard());

        int join = cfg.getNormalExit();
        assertEquals(3, join);
        assertEquals(2, cfg.getIncoming(join).size());
    }

    @Test
    void ifWithoutElseSendsFalseEdgeToJoin() throws CfgConstructionException {
        Stmt branch = new Stmt.If(Expr.lt(X, lit(0)), body(assign(X, lit(0))), null, line(5));
        ControlFlowGraph cfg = builder.build(function("clampLow", ints("x"), List.of(), post(Expr.ge(X, lit(0))),
                body(branch)));

        assertEquals(3, cfg.size());
        Edge falseEdge = cfg.getBlock(0).getOutgoing().get(1);
        assertEquals(EdgeKind.CONDITIONAL_FALSE, falseEdge.getKind());
        assertEquals(cfg.getNormalExit(), falseEdge.getTarget());
    }

    @Test
    void whileLoopHasHeaderBodyAndBackEdge() throws CfgConstructionException {
        ControlFlowGraph cfg = builder.build(triangle());

        assertEquals(4, cfg.size());
        assertEquals(1, cfg.getLoops().size());
        LoopInfo loop = cfg.getLoops().get(0);
        assertEquals(1, loop.getHeader());
        assertEquals(2, loop.getExitTarget());
        assertEquals(3, loop.getBodyEntry());
        assertEquals(BlockKind.LOOP_HEADER, cfg.getBlock(1).getKind());
        assertNotNull(cfg.getBlock(1).getInvariant());
        assertEquals(cfg.getNormalExit(), 2);

        Edge back = cfg.getBlock(3).getOutgoing().get(0);
        assertEquals(EdgeKind.LOOP_BACK, back.getKind());
        assertEquals(1, back.getTarget());
        assertTrue(loop.containsBlock(3));
        assertFalse(loop.containsBlock(0));
    }

    @Test
    void missingInvariantBecomesImplicitTrueWithWarning() throws CfgConstructionException {
        ControlFlowGraph cfg = builder.build(countWithoutInvariant());

        LoopInfo loop = cfg.getLoops().get(0);
        assertTrue(loop.getInvariant().isImplicit());
        assertEquals(Expr.TRUE, loop.getInvariant().getPredicate());
        assertTrue(cfg.getDiagnostics().stream()
                .anyMatch(d -> d.getCode() == Diagnostic.Code.MISSING_INVARIANT
                        && d.getSeverity() == Diagnostic.Severity.WARNING));
    }

    @Test
    void missingPostconditionIsImplicit() throws CfgConstructionException {
        ControlFlowGraph cfg = builder.build(function("noPost", ints("x"), List.of(), null, body(assign(Y, X))));

        assertTrue(cfg.getPostcondition().isImplicit());
        assertTrue(cfg.getDiagnostics().stream().anyMatch(d -> d.getCode() == Diagnostic.Code.MISSING_POSTCONDITION));
    }

    @Test
    void earlyReturnJumpsToDedicatedExit() throws CfgConstructionException {
        Stmt guard = new Stmt.If(Expr.lt(X, lit(0)), body(ret(lit(0))), null, line(5));
        ControlFlowGraph cfg = builder.build(function("positivePart", ints("x"), List.of(),
                post(Expr.ge(RESULT, lit(0))), body(guard, ret(X))));

        int exit = cfg.getNormalExit();
        assertTrue(cfg.getBlock(exit).getInstructions().isEmpty());
        assertEquals(2, cfg.getIncoming(exit).size());
        for (Edge edge : cfg.getIncoming(exit)) {
            assertEquals(EdgeKind.EARLY_EXIT, edge.getKind());
        }
    }

    @Test
    void statementsAfterReturnAreDropped() throws CfgConstructionException {
        ControlFlowGraph cfg = builder.build(function("early", ints("x"), List.of(), null,
                body(ret(X), assign(Y, lit(1)))));

        assertEquals(2, cfg.size());
        assertEquals(1, cfg.getBlock(cfg.getEntry()).getInstructions().size());
    }

    @Test
    void panicGoesToAbortExit() throws CfgConstructionException {
        Stmt check = new Stmt.If(Expr.lt(X, lit(0)), body(new Stmt.Panic("negative", line(6))), null, line(5));
        ControlFlowGraph cfg = builder.build(function("checked", ints("x"), List.of(), null, body(check, ret(X))));

        assertTrue(cfg.hasAbortExit());
        List<Edge> incoming = cfg.getIncoming(cfg.getAbortExit());
        assertEquals(1, incoming.size());
        assertEquals(EdgeKind.EARLY_EXIT, incoming.get(0).getKind());
        assertEquals("negative", incoming.get(0).getLabel());
    }

    @Test
    void forRangeDesugarsToCountingLoop() throws CfgConstructionException {
        Stmt loop = new Stmt.ForRange(I, lit(0), N, false, inv(Expr.le(I, N)), body(assign(SUM, Expr.add(SUM, I))),
                line(7));
        ControlFlowGraph cfg = builder.build(function("sumTo", ints("n"), List.of(pre(Expr.ge(N, lit(0)))), null,
                body(assign(SUM, lit(0)), loop)));

        Instruction init = cfg.getBlock(0).getInstructions().get(1);
        assertEquals("i := 0", init.toString());
        assertEquals(Expr.lt(I, N), cfg.getLoops().get(0).getGuard());
        List<Instruction> bodyInstructions = cfg.getBlock(cfg.getLoops().get(0).getBodyEntry()).getInstructions();
        assertEquals("i := i + 1", bodyInstructions.get(bodyInstructions.size() - 1).toString());
    }

    @Test
    void inclusiveRangeUsesLessOrEqual() throws CfgConstructionException {
        Stmt loop = new Stmt.ForRange(I, lit(1), N, true, inv(Expr.TRUE), body(), line(7));
        ControlFlowGraph cfg = builder.build(function("loop", ints("n"), List.of(), null, body(loop)));

        assertEquals(Expr.le(I, N), cfg.getLoops().get(0).getGuard());
    }

    @Test
    void continueRunsUpdateBeforeBackEdge() throws CfgConstructionException {
        Stmt skip = new Stmt.If(Expr.eq(I, lit(3)), body(new Stmt.Continue(line(8))), null, line(8));
        Stmt loop = new Stmt.While(Expr.lt(I, N), inv(Expr.le(I, N)), body(skip),
                body(assign(I, Expr.add(I, lit(1)))), line(7));
        ControlFlowGraph cfg = builder.build(function("skipThree", ints("n"), List.of(), null,
                body(assign(I, lit(0)), loop)));

        long backEdges = cfg.getEdges().stream().filter(e -> e.getKind() == EdgeKind.LOOP_BACK).count();
        assertEquals(2, backEdges);
        for (Edge edge : cfg.getEdges()) {
            if (edge.getKind() == EdgeKind.LOOP_BACK) {
                List<Instruction> instructions = cfg.getBlock(edge.getSource()).getInstructions();
                assertEquals("i := i + 1", instructions.get(instructions.size() - 1).toString());
            }
        }
    }

    @Test
    void breakLeavesTheLoop() throws CfgConstructionException {
        Stmt stop = new Stmt.If(Expr.eq(I, lit(3)), body(new Stmt.Break(line(8))), null, line(8));
        Stmt loop = new Stmt.While(Expr.lt(I, N), inv(Expr.TRUE), body(stop, assign(I, Expr.add(I, lit(1)))),
                line(7));
        ControlFlowGraph cfg = builder.build(function("stopAtThree", ints("n"), List.of(), null,
                body(assign(I, lit(0)), loop)));

        int exit = cfg.getLoops().get(0).getExitTarget();
        assertTrue(cfg.getIncoming(exit).stream().anyMatch(e -> e.getKind() == EdgeKind.FALLTHROUGH));
    }

    @Test
    void breakOutsideLoopIsStructuralError() {
        FunctionDecl function = function("bad", ints(), List.of(), null, body(new Stmt.Break(line(4))));
        CfgConstructionException e = assertThrows(CfgConstructionException.class, () -> builder.build(function));
        assertEquals(line(4), e.getSpan());
    }

    @Test
    void unsupportedStatementIsStructuralError() {
        FunctionDecl function = function("bad", ints(), List.of(), null,
                body(new Stmt.Unsupported("TryStmt", line(9))));
        CfgConstructionException e = assertThrows(CfgConstructionException.class, () -> builder.build(function));
        assertTrue(e.getMessage().contains("TryStmt"));
    }

    @Test
    void callWithContractChecksPreconditionAndAssumesPostcondition() throws CfgConstructionException {
        MethodContract abs = new MethodContract("abs", ints("v"), Type.INT, MethodContract.Origin.EXTERNAL);
        abs.addPrecondition(Expr.gt(Expr.intVar("v"), lit(-1000)));
        abs.addPostcondition(Expr.ge(RESULT, lit(0)));
        CfgBuilder withContracts = new CfgBuilder((owner, name, arity) -> name.equals("abs") && arity == 1 ? abs : null);

        Stmt call = new Stmt.Invoke(Y, "abs", List.of(X), false, line(4));
        ControlFlowGraph cfg = withContracts.build(function("caller", ints("x"), List.of(), post(Expr.ge(Y, lit(0))),
                body(call)));

        List<Instruction> instructions = cfg.getBlock(0).getInstructions();
        assertEquals(4, instructions.size());
        assertEquals("abs$v#0 := x", instructions.get(0).toString());
        Instruction.Check check = (Instruction.Check) instructions.get(1);
        assertEquals(ConditionKind.CALL_PRECONDITION, check.getKind());
        assertEquals(Expr.gt(Expr.intVar("abs$v#0"), lit(-1000)), check.getCondition());
        assertEquals("havoc y", instructions.get(2).toString());
        assertEquals(Expr.ge(Y, lit(0)), ((Instruction.Assume) instructions.get(3)).getCondition());
    }

    @Test
    void callWithoutContractIsUninterpreted() throws CfgConstructionException {
        Stmt call = new Stmt.Invoke(Y, "f", List.of(X), false, line(4));
        ControlFlowGraph cfg = builder.build(function("caller", ints("x"), List.of(), null, body(call)));

        Instruction.Assign assign = (Instruction.Assign) cfg.getBlock(0).getInstructions().get(0);
        assertEquals(Expr.apply("f", Type.INT, X), assign.getValue());
    }

    @Test
    void receiverCallIsOpaque() throws CfgConstructionException {
        Stmt call = new Stmt.Invoke(Y, "size", List.of(), true, line(4));
        ControlFlowGraph cfg = builder.build(function("caller", ints("x"), List.of(), null, body(call)));

        Instruction.Assign assign = (Instruction.Assign) cfg.getBlock(0).getInstructions().get(0);
        assertTrue(assign.getValue().containsOpaque());
    }
}
