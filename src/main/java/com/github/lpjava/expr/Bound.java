package com.github.lpjava.expr;

import static java.lang.Double.NEGATIVE_INFINITY;
import static java.lang.Double.POSITIVE_INFINITY;

/**
 * A closed interval of admissible values for a variable. Infinite ends mean "no bound in that direction".
 *
 * @param lower the lower bound, or {@link Double#NEGATIVE_INFINITY}
 * @param upper the upper bound, or {@link Double#POSITIVE_INFINITY}
 */
public record Bound(double lower, double upper) {
    /**
     * The neutral element for {@link #intersect(Bound)}: no bound in either direction.
     */
    public static final Bound UNBOUNDED = new Bound(NEGATIVE_INFINITY, POSITIVE_INFINITY);

    /**
     * @param lower the lower bound, or {@link Double#NEGATIVE_INFINITY}
     * @param upper the upper bound, or {@link Double#POSITIVE_INFINITY}
     * @throws IllegalArgumentException if either end is NaN
     */
    public Bound {
        if (Double.isNaN(lower) || Double.isNaN(upper)) {
            throw new IllegalArgumentException("bounds can't be NaN");
        }
    }

    /**
     * The tightest bound satisfying both this and <code>other</code>. The result may be empty (lower &gt; upper); it's
     * up to the solver to report that as infeasible.
     *
     * @param other another bound on the same variable
     * @return componentwise max of the lower bounds and min of the upper bounds
     */
    public Bound intersect(Bound other) {
        return new Bound(Math.max(lower, other.lower), Math.min(upper, other.upper));
    }

    /**
     * @return true if the lower end is finite
     */
    public boolean hasLower() {
        return lower != NEGATIVE_INFINITY;
    }

    /**
     * @return true if the upper end is finite
     */
    public boolean hasUpper() {
        return upper != POSITIVE_INFINITY;
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + "]";
    }
}
