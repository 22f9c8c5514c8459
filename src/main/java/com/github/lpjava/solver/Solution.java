package com.github.lpjava.solver;

import com.github.lpjava.expr.Decomposer;
import com.github.lpjava.expr.Expression;
import com.github.lpjava.model.Problem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Record type to hold the outcome of one solve.
 *
 * @param status  reports status, whether {@link Status#OPTIMAL}, {@link Status#INFEASIBLE}, etc.
 * @param values  the value of each variable, by name. Empty unless the status is feasible.
 * @param problem the problem that was solved, if the solver kept a reference to it; otherwise null. Read-only.
 */
public record Solution(Status status, Map<String, Double> values, Problem problem) {
    /**
     * @param status  reports status
     * @param values  the value of each variable, by name
     * @param problem the problem that was solved, or null
     */
    public Solution {
        Objects.requireNonNull(status, "status");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Convenience constructor for a solution that doesn't refer back to its problem.
     *
     * @param status reports status
     * @param values the value of each variable, by name
     */
    public Solution(Status status, Map<String, Double> values) {
        this(status, values, null);
    }

    /**
     * @param name a variable name
     * @return its value, or empty if the solution doesn't have one
     */
    public OptionalDouble value(String name) {
        var value = values.get(name);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * Evaluate an expression under this assignment, e.g. to compute the objective value.
     *
     * @param expression a linear expression over variables of this solution
     * @return the value
     * @throws IllegalArgumentException if the expression references a variable with no value
     */
    public double evaluate(Expression expression) {
        var decomposition = Decomposer.simplifyAndDecompose(expression);
        var total = decomposition.constant();

        for (var entry : decomposition.variables().entrySet()) {
            var value = values.get(entry.getKey());

            if (value == null) {
                throw new IllegalArgumentException("no value for variable " + entry.getKey());
            }
            total += entry.getValue().coefficient() * value;
        }
        return total;
    }

    /**
     * @param status the replacement status
     * @return a copy of this solution with the status replaced
     */
    public Solution withStatus(Status status) {
        return new Solution(status, values, problem);
    }

    @Override
    public String toString() {
        return status + " " + values;
    }
}
