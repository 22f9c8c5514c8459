package com.github.lpjava.model;

import com.github.lpjava.ModelingException;
import com.github.lpjava.expr.ContinuousVariable;
import com.github.lpjava.expr.Expression;
import org.junit.jupiter.api.Test;

import static com.github.lpjava.expr.Expression.literal;
import static com.github.lpjava.expr.Expression.variable;
import static org.junit.jupiter.api.Assertions.*;

class ConstraintTest {
    private final Expression x = variable(ContinuousVariable.of("x"));
    private final Expression y = variable(ContinuousVariable.of("y"));

    @Test
    void residualConstantMovesToTheRight() {
        var linear = x.times(2).plus(3).le(literal(10).minus(1)).decompose();

        assertEquals(2, linear.lhs().coefficient("x"));
        assertEquals(Comparison.LESS_OR_EQUAL, linear.comparison());
        assertEquals(6, linear.rhs());
    }

    @Test
    void expressionOnBothSides() {
        var linear = x.ge(y.plus(4)).decompose();

        assertEquals(1, linear.lhs().coefficient("x"));
        assertEquals(-1, linear.lhs().coefficient("y"));
        assertEquals(4, linear.rhs());
    }

    @Test
    void rightHandSideMustBeConstant() {
        var constraint = new Constraint(x, Comparison.EQUAL, y.plus(1));
        var ex = assertThrows(ModelingException.class, constraint::decompose);

        assertEquals(ModelingException.Reason.CONSTANT_NOT_SIMPLIFIED, ex.getReason());
    }

    @Test
    void cancellingTermsAreNotFolded() {
        var constraint = new Constraint(x, Comparison.EQUAL, y.minus(y).plus(y.times(0)).plus(5));

        // y - y isn't folded, so this is still rejected
        assertThrows(ModelingException.class, constraint::decompose);
        assertEquals(5, new Constraint(x, Comparison.EQUAL, y.times(0).plus(5)).decompose().rhs());
    }

    @Test
    void nullsRejected() {
        assertThrows(NullPointerException.class, () -> new Constraint(x, null, literal(0)));
    }
}
