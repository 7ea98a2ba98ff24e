package com.tidypipe.backend.expr;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.tidypipe.backend.value.Missing;
import com.tidypipe.common.ErrorKind;
import com.tidypipe.common.PipelineException;

import static org.junit.jupiter.api.Assertions.*;

public class ExprTest {

    @Test
    public void testStructuralEquality() throws Exception {
        Expr a = Expr.binary(ExprKind.ADD, Expr.column("red"), Expr.number(1));
        Expr b = Expr.binary(ExprKind.ADD, Expr.column("red"), Expr.number(1));
        Expr c = Expr.binary(ExprKind.SUBTRACT, Expr.column("red"), Expr.number(1));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
        assertNotEquals(Expr.number(1), Expr.text("1"));
        assertEquals(Expr.datetime(Instant.EPOCH), Expr.datetime(Instant.ofEpochMilli(0)));
        assertEquals(Expr.uniform(0, 1), Expr.uniform(0, 1));
        assertNotEquals(Expr.uniform(0, 1), Expr.uniform(0, 2));
        assertEquals(Expr.rownum(), Expr.rownum());
    }

    @Test
    public void testChildren() throws Exception {
        Expr cond = Expr.column("flag");
        Expr ifElse = Expr.ifElse(cond, Expr.number(1), Expr.number(2));
        assertEquals(ExprShape.TERNARY, ifElse.shape());
        assertEquals(List.of(cond, Expr.number(1), Expr.number(2)), ifElse.children());
        assertTrue(Expr.number(3).children().isEmpty());
    }

    @Test
    public void testMissingLiterals() throws Exception {
        assertEquals(Missing.MISSING, ((ValueExpr) Expr.literal(ExprKind.NUMBER, Missing.MISSING)).value());
        assertEquals(Missing.MISSING, ((ValueExpr) Expr.literal(ExprKind.DATETIME, Missing.MISSING)).value());
    }

    @Test
    public void testMalformedConstruction() {
        assertMalformed(() -> Expr.column(""));
        assertMalformed(() -> Expr.literal(ExprKind.NUMBER, "1"));
        assertMalformed(() -> Expr.literal(ExprKind.NUMBER, Double.NaN));
        assertMalformed(() -> Expr.literal(ExprKind.LOGICAL, 1.0));
        assertMalformed(() -> Expr.literal(ExprKind.ADD, 1.0));
        assertMalformed(() -> Expr.binary(ExprKind.ADD, Expr.number(1), null));
        assertMalformed(() -> Expr.unary(ExprKind.ADD, Expr.number(1)));
        assertMalformed(() -> Expr.binary(ExprKind.NOT, Expr.number(1), Expr.number(2)));
        assertMalformed(() -> Expr.exponential(0));
        assertMalformed(() -> Expr.normal(0, -1));
        assertMalformed(() -> Expr.uniform(2, 1));
        assertMalformed(() -> Expr.variate(ExprKind.NORMAL, List.of(1.0)));
    }

    private interface Construction {
        Expr build() throws PipelineException;
    }

    private static void assertMalformed(Construction construction) {
        PipelineException e = assertThrows(PipelineException.class, construction::build);
        assertEquals(ErrorKind.MALFORMED_EXPRESSION, e.getKind());
    }
}
