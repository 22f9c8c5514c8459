package com.github.lpjava.model;

import com.github.lpjava.expr.Decomposer;
import com.github.lpjava.expr.Decomposition;
import com.github.lpjava.expr.Expression;

import java.util.Objects;

/**
 * A linear constraint <code>expression (comparison) constant</code>. The constant side must simplify to a single
 * literal; this is only checked when the constraint is decomposed.
 *
 * @param expression the left-hand side
 * @param comparison the comparator
 * @param constant   the right-hand side
 */
public record Constraint(Expression expression, Comparison comparison, Expression constant) {
    /**
     * @param expression the left-hand side
     * @param comparison the comparator
     * @param constant   the right-hand side
     */
    public Constraint {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(comparison, "comparison");
        Objects.requireNonNull(constant, "constant");
    }

    /**
     * A decomposed constraint. Any residual constant of the left-hand side has been moved to the right.
     *
     * @param lhs        variable terms
     * @param comparison the comparator
     * @param rhs        the constant
     */
    public record Linear(Decomposition lhs, Comparison comparison, double rhs) {
    }

    /**
     * Simplify and decompose both sides. Neither expression is modified.
     *
     * @return the decomposed constraint
     * @throws com.github.lpjava.ModelingException if either side is nonlinear, or the constant side doesn't reduce
     *                                             to a literal
     */
    public Linear decompose() {
        var rhs = Decomposer.constantOf(constant);
        var lhs = Decomposer.simplifyAndDecompose(expression);

        return new Linear(lhs, comparison, rhs - lhs.constant());
    }

    @Override
    public String toString() {
        return expression + " " + comparison.symbol() + " " + constant;
    }
}
