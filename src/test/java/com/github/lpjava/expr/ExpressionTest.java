package com.github.lpjava.expr;

import com.github.lpjava.model.Comparison;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.lpjava.expr.Expression.literal;
import static com.github.lpjava.expr.Expression.variable;
import static org.junit.jupiter.api.Assertions.*;

class ExpressionTest {
    private final Expression x = variable(ContinuousVariable.of("x"));
    private final Expression y = variable(ContinuousVariable.of("y"));

    @Test
    void combinatorsLeaveOperandsUntouched() {
        var sum = x.plus(y).times(2);

        assertEquals("((x + y) * 2)", sum.toString());
        assertEquals("x", x.toString());
        assertEquals(1, x.arena().size());
    }

    @Test
    void simplifyOnlyAffectsTheCopy() {
        var original = x.times(2).times(3);
        var copy = original.copy();
        copy.simplify();

        assertEquals("((x * 2) * 3)", original.toString());
        assertEquals("(6 * x)", copy.toString());
    }

    @Test
    void sumOfNoTermsIsZero() {
        assertEquals(new Node.Literal(0), Expression.sum(List.of()).root());
    }

    @Test
    void sum() {
        var sum = Expression.sum(List.of(x, y, literal(1)));

        assertEquals("((x + y) + 1)", sum.toString());
        assertEquals(5, sum.arena().size());
    }

    @Test
    void constraintFactories() {
        var le = x.le(y);
        assertEquals(Comparison.LESS_OR_EQUAL, le.comparison());
        assertEquals("(x - y)", le.expression().toString());
        assertEquals(new Node.Literal(0), le.constant().root());

        var eq = x.eq(4);
        assertEquals(Comparison.EQUAL, eq.comparison());
        assertEquals("x", eq.expression().toString());
        assertEquals(new Node.Literal(4), eq.constant().root());

        assertEquals(Comparison.GREATER_OR_EQUAL, x.ge(1).comparison());
    }

    @Test
    void variablesInOrderOfFirstOccurrence() {
        var z = ContinuousVariable.of("z");
        var expr = y.plus(variable(z)).minus(x).plus(y);

        assertEquals(List.of("y", "z", "x"), List.copyOf(expr.variables().keySet()));
        assertSame(z, expr.variables().get("z"));
    }

    @Test
    void boundsIntersectAcrossOccurrences() {
        var expr = variable(ContinuousVariable.of("v", 0, 10)).plus(variable(ContinuousVariable.of("v", 2, 20)));

        assertEquals(new Bound(2, 10), expr.bounds().get("v"));
    }
}
