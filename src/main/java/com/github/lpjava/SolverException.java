package com.github.lpjava;

/**
 * Root of the exceptions thrown while preparing, running or interpreting a solve. None of these are fatal; they
 * report a failure of one {@link com.github.lpjava.solver.Solver#solve} call.
 * <p>
 * Outcomes such as infeasibility are not exceptions; they are reported through
 * {@link com.github.lpjava.solver.Status}.
 */
public class SolverException extends RuntimeException {
    /**
     * @param message description of the failure
     */
    public SolverException(String message) {
        super(message);
    }

    /**
     * @param message description of the failure
     * @param cause   the underlying exception
     */
    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
