package com.github.lpjava.solver;

import com.github.lpjava.ModelingException;
import com.github.lpjava.SolutionFormatException;
import com.github.lpjava.SolverException;
import com.github.lpjava.model.Problem;
import org.ojalgo.netio.BasicLogger;

import static com.github.lpjava.ModelingException.Reason.MISSING_OBJECTIVE;

/**
 * <p>
 * Abstract superclass for LP solver backends.
 * </p><p>
 * Backends differ widely in how they talk to the underlying optimizer (text files and an external process, or
 * in-process translation), but all of them honour the same contract: the problem is never modified, the returned
 * {@link Solution} only names variables declared by the problem, and any temporary resources are released before
 * {@link #solve(Problem)} returns or throws.
 * </p><p>
 * Instances carry only their configuration, so one instance may be used for many problems.
 * </p>
 */
public abstract class Solver {
    private boolean debug;

    /**
     * Default constructor.
     */
    protected Solver() {
    }

    /**
     * Solve a linear program.
     *
     * @param problem the problem; not modified
     * @return the outcome, which may be infeasible or unbounded
     * @throws ModelingException                          if the model is malformed
     * @throws com.github.lpjava.ProcessException         if an external solver could not be run
     * @throws SolutionFormatException                   if an external solver's output could not be read, or names a
     *                                                    variable the problem doesn't declare
     * @throws SolverException                            for other backend failures
     */
    public final Solution solve(Problem problem) {
        if (problem.getObjective().isEmpty()) {
            throw new ModelingException(MISSING_OBJECTIVE, "Missing objective in problem " + problem.getName());
        }

        var solution = doSolve(problem);
        var declared = problem.variables().keySet();
        var unknown = solution.values().keySet().stream().filter(name -> !declared.contains(name)).toList();

        if (!unknown.isEmpty()) {
            throw new SolutionFormatException("variables not in the problem: " + unknown, 0, null);
        }
        return solution;
    }

    /**
     * To be implemented by subclasses. Called by {@link #solve(Problem)} once the problem is known to have an
     * objective.
     *
     * @param problem the problem; must not be modified
     * @return the outcome
     */
    protected abstract Solution doSolve(Problem problem);

    /**
     * Log a message if debugging is enabled.
     *
     * @param s the message
     */
    protected void debug(String s) {
        if (debug) {
            BasicLogger.debug(s);
        }
    }

    /**
     * Get the debug property
     *
     * @return true if debug logging is enabled
     */
    @SuppressWarnings("unused")
    public boolean isDebug() {
        return debug;
    }

    /**
     * Set the debug property. If enabled, logging works via ojAlgo's {@link BasicLogger} mechanism.
     * You can supply a thin wrapper implementation to redirect it to the logging library of your choice.
     *
     * @param debug true if debug logging is enabled
     */
    public void setDebug(boolean debug) {
        this.debug = debug;
    }
}
