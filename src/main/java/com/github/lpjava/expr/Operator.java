package com.github.lpjava.expr;

import java.util.function.DoubleBinaryOperator;

/**
 * Binary arithmetic operators allowed in a linear expression tree.
 */
public enum Operator {
    /**
     * <code>l + r</code>
     */
    ADD("+", Double::sum),
    /**
     * <code>l - r</code>
     */
    SUBTRACT("-", (l, r) -> l - r),
    /**
     * <code>l * r</code>
     */
    MULTIPLY("*", (l, r) -> l * r);

    private final String symbol;
    private final DoubleBinaryOperator function;

    Operator(String symbol, DoubleBinaryOperator function) {
        this.symbol = symbol;
        this.function = function;
    }

    /**
     * Fold two literal operands.
     *
     * @param l left operand
     * @param r right operand
     * @return the result
     */
    public double apply(double l, double r) {
        return function.applyAsDouble(l, r);
    }

    /**
     * @return <code>+</code>, <code>-</code> or <code>*</code>
     */
    public String symbol() {
        return symbol;
    }
}
