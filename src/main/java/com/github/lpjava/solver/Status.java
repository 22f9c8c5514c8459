package com.github.lpjava.solver;

/**
 * Terminal outcome of a solve, common to all backends. None of these are errors; failures to run a solver or read
 * its output are reported as exceptions instead.
 */
public enum Status {
    /**
     * The solver proved the assignment optimal.
     */
    OPTIMAL(true),
    /**
     * The solver stopped with a feasible assignment it did not prove optimal.
     */
    SUB_OPTIMAL(true),
    /**
     * No assignment satisfies the constraints.
     */
    INFEASIBLE(false),
    /**
     * The objective can be improved without limit.
     */
    UNBOUNDED(false),
    /**
     * The solver ran, but didn't determine any of the above.
     */
    NOT_SOLVED(false);

    private final boolean feasible;

    Status(boolean feasible) {
        this.feasible = feasible;
    }

    /**
     * {@link #OPTIMAL} and {@link #SUB_OPTIMAL} both carry a feasible assignment.
     *
     * @return true if this state is one of these.
     */
    public boolean isFeasible() {
        return feasible;
    }
}
