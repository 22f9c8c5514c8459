package com.github.lpjava;

/**
 * Misuse of the expression API detected while simplifying or decomposing a model. Retrying won't help; the model has
 * to be fixed.
 */
public class ModelingException extends SolverException {
    /**
     * The kind of modeling error.
     */
    public enum Reason {
        /**
         * Product of two subtrees, neither of which reduces to a literal.
         */
        NONLINEAR_TERM,
        /**
         * A multiplication whose left operand is not a literal was found during decomposition, meaning the
         * expression was not simplified first.
         */
        UNSIMPLIFIED_MULTIPLICATION,
        /**
         * A node shape the decomposer doesn't know how to handle.
         */
        UNSUPPORTED_EXPRESSION,
        /**
         * The constant side of a constraint does not reduce to a single literal.
         */
        CONSTANT_NOT_SIMPLIFIED,
        /**
         * The problem has no objective.
         */
        MISSING_OBJECTIVE
    }

    private final Reason reason;

    /**
     * @param reason  the kind of error
     * @param message description, usually including the offending subexpression
     */
    public ModelingException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    /**
     * @return the kind of error
     */
    public Reason getReason() {
        return reason;
    }
}
