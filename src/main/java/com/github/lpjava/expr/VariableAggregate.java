package com.github.lpjava.expr;

/**
 * Everything the decomposer learned about one variable: the sum of all factors applied to it, and the intersection
 * of the bounds attached to each occurrence.
 *
 * @param coefficient accumulated coefficient
 * @param bound       intersected bound
 */
public record VariableAggregate(double coefficient, Bound bound) {
    /**
     * Starting point before any occurrence has been seen.
     */
    public static final VariableAggregate EMPTY = new VariableAggregate(0.0, Bound.UNBOUNDED);

    /**
     * Fold one more occurrence into this aggregate.
     *
     * @param factor the factor applied to this occurrence
     * @param other  the bound attached to this occurrence
     * @return the updated aggregate
     */
    public VariableAggregate add(double factor, Bound other) {
        return new VariableAggregate(coefficient + factor, bound.intersect(other));
    }
}
