package com.github.lpjava.expr;

import com.github.lpjava.ModelingException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import static com.github.lpjava.expr.Expression.literal;
import static com.github.lpjava.expr.Expression.variable;
import static org.junit.jupiter.api.Assertions.*;

class DecomposerTest {
    private final Expression a = variable(ContinuousVariable.of("a"));
    private final Expression b = variable(ContinuousVariable.of("b"));

    @Test
    void coefficients() {
        // 4 * (3a - 2b + a) * 1 + b
        var expr = literal(4).times(a.times(3).minus(b.times(2)).plus(a)).times(1).plus(b);
        var decomposition = Decomposer.simplifyAndDecompose(expr);

        assertEquals(16, decomposition.coefficient("a"));
        assertEquals(-7, decomposition.coefficient("b"));
        assertEquals(0, decomposition.constant());
        assertEquals(2, decomposition.variables().size());
    }

    @Test
    void constantsAccumulate() {
        var decomposition = Decomposer.simplifyAndDecompose(a.plus(3).minus(literal(2).minus(b)).times(2));

        assertEquals(2, decomposition.coefficient("a"));
        assertEquals(2, decomposition.coefficient("b"));
        assertEquals(2, decomposition.constant());
    }

    @Test
    void oneEntryPerDistinctVariable() {
        var n = 1000;
        var terms = new ArrayList<Expression>();

        for (var i = 0; i < n; i++) {
            terms.add(variable(ContinuousVariable.of("v" + i)).times(2));
        }
        var decomposition = Decomposer.simplifyAndDecompose(Expression.sum(terms));

        assertEquals(n, decomposition.variables().size());
        for (var i = 0; i < n; i++) {
            assertEquals(2, decomposition.coefficient("v" + i));
        }
    }

    @Test
    void boundsIntersect() {
        var expr = variable(ContinuousVariable.of("x", 0, 10)).plus(variable(ContinuousVariable.of("x", 2, 20)));
        var decomposition = Decomposer.simplifyAndDecompose(expr);

        assertEquals(new Bound(2, 10), decomposition.bound("x"));
        assertEquals(2, decomposition.coefficient("x"));
    }

    @Test
    void requiresSimplifiedProducts() {
        var unsimplified = a.times(3);
        var ex = assertThrows(ModelingException.class, () -> Decomposer.decompose(unsimplified));

        assertEquals(ModelingException.Reason.UNSIMPLIFIED_MULTIPLICATION, ex.getReason());
    }

    @Test
    void leavesArgumentUntouched() {
        var expr = a.times(3);
        Decomposer.simplifyAndDecompose(expr);

        assertEquals("(a * 3)", expr.toString());
    }

    @Test
    void constantOf() {
        assertEquals(10, Decomposer.constantOf(literal(2).times(3).plus(4)));

        var ex = assertThrows(ModelingException.class, () -> Decomposer.constantOf(a.plus(1)));
        assertEquals(ModelingException.Reason.CONSTANT_NOT_SIMPLIFIED, ex.getReason());
    }
}
