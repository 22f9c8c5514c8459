package com.github.lpjava.solver;

import com.github.lpjava.expr.ContinuousVariable;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;

import static com.github.lpjava.expr.Expression.variable;
import static org.junit.jupiter.api.Assertions.*;

class SolutionTest {
    @Test
    void values() {
        var values = new HashMap<String, Double>();
        values.put("x", 1.5);

        var solution = new Solution(Status.OPTIMAL, values);
        values.put("y", 2.0);

        assertEquals(OptionalDouble.of(1.5), solution.value("x"));
        assertEquals(OptionalDouble.empty(), solution.value("y"));
        assertThrows(UnsupportedOperationException.class, () -> solution.values().put("z", 0.0));
    }

    @Test
    void evaluate() {
        var x = variable(ContinuousVariable.of("x"));
        var y = variable(ContinuousVariable.of("y"));
        var solution = new Solution(Status.OPTIMAL, Map.of("x", 2.0, "y", 3.0));

        assertEquals(2 * 2 + 3 - 1, solution.evaluate(x.times(2).plus(y).minus(1)));
        assertThrows(IllegalArgumentException.class,
                () -> solution.evaluate(variable(ContinuousVariable.of("z"))));
    }

    @Test
    void withStatus() {
        var solution = new Solution(Status.OPTIMAL, Map.of("x", 2.0));
        var changed = solution.withStatus(Status.SUB_OPTIMAL);

        assertEquals(Status.SUB_OPTIMAL, changed.status());
        assertEquals(solution.values(), changed.values());
        assertEquals(Status.OPTIMAL, solution.status());
    }

    @Test
    void feasibility() {
        assertTrue(Status.OPTIMAL.isFeasible());
        assertTrue(Status.SUB_OPTIMAL.isFeasible());
        assertFalse(Status.INFEASIBLE.isFeasible());
        assertFalse(Status.UNBOUNDED.isFeasible());
        assertFalse(Status.NOT_SOLVED.isFeasible());
    }
}
