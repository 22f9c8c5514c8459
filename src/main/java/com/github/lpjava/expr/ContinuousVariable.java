package com.github.lpjava.expr;

import java.util.Objects;

import static java.lang.Double.NEGATIVE_INFINITY;
import static java.lang.Double.POSITIVE_INFINITY;

/**
 * A named continuous decision variable. The name is its identity within a problem; two instances with the same name
 * denote the same variable, and their bounds are intersected when the model is decomposed.
 *
 * @param name  unique name within a problem
 * @param bound the admissible interval; {@link Bound#UNBOUNDED} if none was given
 */
public record ContinuousVariable(String name, Bound bound) {
    /**
     * @param name  unique name within a problem
     * @param bound the admissible interval
     */
    public ContinuousVariable {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(bound, "bound");
        if (name.isBlank()) {
            throw new IllegalArgumentException("variable name can't be blank");
        }
    }

    /**
     * Create an unbounded variable.
     *
     * @param name unique name within a problem
     * @return the variable
     */
    public static ContinuousVariable of(String name) {
        return new ContinuousVariable(name, Bound.UNBOUNDED);
    }

    /**
     * Create a variable bounded on both sides.
     *
     * @param name  unique name within a problem
     * @param lower lower bound
     * @param upper upper bound
     * @return the variable
     */
    public static ContinuousVariable of(String name, double lower, double upper) {
        return new ContinuousVariable(name, new Bound(lower, upper));
    }

    /**
     * @param lower the new lower bound
     * @return a copy of this variable with the lower bound replaced
     */
    public ContinuousVariable lower(double lower) {
        return new ContinuousVariable(name, new Bound(lower, bound.upper()));
    }

    /**
     * @param upper the new upper bound
     * @return a copy of this variable with the upper bound replaced
     */
    public ContinuousVariable upper(double upper) {
        return new ContinuousVariable(name, new Bound(bound.lower(), upper));
    }

    /**
     * @return true if no bound was given in either direction
     */
    public boolean isFree() {
        return bound.lower() == NEGATIVE_INFINITY && bound.upper() == POSITIVE_INFINITY;
    }

    @Override
    public String toString() {
        return name;
    }
}
