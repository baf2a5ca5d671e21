package com.wp.verifier.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExprTest {

    private final Expr x = Expr.intVar("x");
    private final Expr y = Expr.intVar("y");

    @Test
    void structuralEquality() {
        assertEquals(Expr.add(x, Expr.intLit(1)), Expr.add(Expr.intVar("x"), Expr.intLit(1)));
        assertEquals(Expr.add(x, Expr.intLit(1)).hashCode(), Expr.add(Expr.intVar("x"), Expr.intLit(1)).hashCode());
        assertNotEquals(Expr.add(x, Expr.intLit(1)), Expr.add(Expr.intLit(1), x));
        assertNotEquals(Expr.intVar("b"), Expr.boolVar("b"));
    }

    @Test
    void typesFollowOperators() {
        assertEquals(Type.INT, Expr.mul(x, y).getType());
        assertEquals(Type.BOOL, Expr.lt(x, y).getType());
        assertEquals(Type.BOOL, Expr.implies(Expr.TRUE, Expr.lt(x, y)).getType());
        assertEquals(Type.INT, Expr.ite(Expr.lt(x, y), x, y).getType());
        assertEquals(Type.INT, Expr.old(x).getType());
    }

    @Test
    void printsWithMinimalParentheses() {
        assertEquals("x + y * 2", Expr.add(x, Expr.mul(y, Expr.intLit(2))).toString());
        assertEquals("(x + y) * 2", Expr.mul(Expr.add(x, y), Expr.intLit(2)).toString());
        assertEquals("x - (y - 1)", Expr.sub(x, Expr.sub(y, Expr.intLit(1))).toString());
        assertEquals("old(x) > 0", Expr.gt(Expr.old(x), Expr.intLit(0)).toString());
    }

    @Test
    void emptyConnectivesAreUnits() {
        assertEquals(Expr.TRUE, Expr.and(List.of()));
        assertEquals(Expr.FALSE, Expr.or(List.of()));
        Expr single = Expr.lt(x, y);
        assertSame(single, Expr.and(List.of(single)));
    }

    @Test
    void freeVariablesIncludeOldArguments() {
        Expr e = Expr.and(Expr.eq(Expr.intVar("result"), Expr.add(Expr.old(x), y)), Expr.boolVar("b"));
        assertEquals(Set.of("result", "x", "y", "b"), e.freeVariables());
    }

    @Test
    void opaqueIsDetectedAnywhere() {
        Expr opaque = Expr.opaque("s.length()", "call through a receiver", Type.INT);
        assertFalse(Expr.lt(x, y).containsOpaque());
        assertTrue(Expr.implies(Expr.TRUE, Expr.lt(x, Expr.add(y, opaque))).containsOpaque());
    }

    @Test
    void comparisonNegation() {
        assertEquals(Expr.Binary.Op.GE, Expr.Binary.Op.LT.negated());
        assertEquals(Expr.Binary.Op.NE, Expr.Binary.Op.EQ.negated());
        assertEquals(Expr.Binary.Op.LE, Expr.Binary.Op.GT.negated());
    }
}
