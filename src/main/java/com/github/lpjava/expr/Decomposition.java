package com.github.lpjava.expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of decomposing a canonical expression: one {@link VariableAggregate} per distinct variable name, plus the
 * sum of all literal terms.
 *
 * @param variables aggregates by variable name, in the order the decomposer first met them
 * @param constant  residual constant
 */
public record Decomposition(Map<String, VariableAggregate> variables, double constant) {
    /**
     * @param variables aggregates by variable name
     * @param constant  residual constant
     */
    public Decomposition {
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    /**
     * @param name a variable name
     * @return the accumulated coefficient, or 0 if the variable does not occur
     */
    public double coefficient(String name) {
        var aggregate = variables.get(name);
        return aggregate == null ? 0.0 : aggregate.coefficient();
    }

    /**
     * @param name a variable name
     * @return the intersected bound, or {@link Bound#UNBOUNDED} if the variable does not occur
     */
    public Bound bound(String name) {
        var aggregate = variables.get(name);
        return aggregate == null ? Bound.UNBOUNDED : aggregate.bound();
    }
}
