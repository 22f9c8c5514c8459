package com.github.lpjava.model;

/**
 * Comparators allowed in a {@link Constraint}.
 */
public enum Comparison {
    /**
     * <code>lhs &lt;= rhs</code>
     */
    LESS_OR_EQUAL("<="),
    /**
     * <code>lhs &gt;= rhs</code>
     */
    GREATER_OR_EQUAL(">="),
    /**
     * <code>lhs = rhs</code>
     */
    EQUAL("=");

    private final String symbol;

    Comparison(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the operator as written in LP files
     */
    public String symbol() {
        return symbol;
    }
}
