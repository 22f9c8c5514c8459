package com.github.lpjava.solver.external;

import com.github.lpjava.ProcessException;
import com.github.lpjava.SolutionFormatException;
import com.github.lpjava.SolverException;
import com.github.lpjava.model.Problem;
import com.github.lpjava.solver.Solution;
import com.github.lpjava.solver.Solver;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Abstract superclass for solvers that run an external executable. Each solve
 * </p>
 * <ol>
 *     <li>writes the problem to a fresh model file, named after {@link Problem#getUniqueName()}, using the
 *     configured {@link ModelExporter};</li>
 *     <li>runs the command built by {@link #buildCommand(Path, Path)} through the configured {@link CommandRunner};</li>
 *     <li>reads the result file with {@link #read(Path, Problem)}.</li>
 * </ol>
 * <p>
 * The model file, and the result file unless one was configured with {@link #setResultFile(Path)}, are deleted
 * before {@link #solve(Problem)} returns or throws. A failed deletion is logged, never thrown.
 * </p><p>
 * No state is shared between solves, so concurrent calls on one instance are safe as long as its configuration
 * isn't changed meanwhile, and no result file is configured.
 * </p>
 */
public abstract class ExternalSolver extends Solver implements SolutionParser {
    private static final Splitter WHITESPACE = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    // plain or scientific decimal notation only
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final String displayName;
    private String commandName;
    private Path resultFile;
    private ModelExporter exporter = new LpFormatWriter();
    private CommandRunner runner = new ProcessCommandRunner();

    /**
     * @param displayName name of the solver, for messages
     * @param commandName default executable
     */
    protected ExternalSolver(String displayName, String commandName) {
        this.displayName = displayName;
        this.commandName = commandName;
    }

    @Override
    protected final Solution doSolve(Problem problem) {
        try (var model = TempFile.create(problem.getUniqueName() + "_", ".lp");
             var result = resultFile == null ? TempFile.reserve(".sol") : TempFile.retain(resultFile)) {
            exporter.export(problem, model.path());

            var command = buildCommand(model.path(), result.path());
            debug("Running " + String.join(" ", command));

            var output = run(command);
            debug(commandName + " exited with " + output.exitCode());

            if (!output.isSuccess()) {
                throw new ProcessException(commandName, output.exitCode(), output.stdout(), output.stderr());
            }

            var solution = interpret(output, result.path(), problem);
            debug(displayName + ": " + solution.status() + ", " + solution.values().size() + " variables");
            return solution;
        } catch (IOException e) {
            throw new SolverException("I/O error while solving " + problem.getName() + " with " + displayName, e);
        }
    }

    private CommandResult run(List<String> command) {
        try {
            return runner.run(command);
        } catch (IOException e) {
            throw new ProcessException(commandName, "Error running the " + displayName + " solver", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessException(commandName, "Interrupted while running the " + displayName + " solver", e);
        }
    }

    /**
     * Build the command line.
     *
     * @param modelFile  the model file to read
     * @param resultFile where the solver should write its solution
     * @return the executable followed by its arguments
     */
    protected abstract List<String> buildCommand(Path modelFile, Path resultFile);

    /**
     * Turn a successful run into a solution. By default, this just reads the result file.
     *
     * @param output     the command's exit status and captured output
     * @param resultFile the result file, which may not exist
     * @param problem    the problem that was solved
     * @return the solution
     * @throws IOException if the result file can't be read
     */
    protected Solution interpret(CommandResult output, Path resultFile, Problem problem) throws IOException {
        return read(resultFile, problem);
    }

    /**
     * Split a line on runs of whitespace.
     *
     * @param line a line of text
     * @return the non-empty tokens
     */
    protected static List<String> tokenize(String line) {
        return WHITESPACE.splitToList(line);
    }

    /**
     * Parse a numeric field of a solution file, in plain or scientific decimal notation.
     *
     * @param token      the field
     * @param lineNumber 1-based line number, for the error message
     * @param line       the whole line, for the error message
     * @return the value
     * @throws SolutionFormatException if the field isn't a number
     */
    protected static double parseValue(String token, int lineNumber, String line) {
        if (!DECIMAL.matcher(token).matches()) {
            throw new SolutionFormatException("Invalid number " + token, lineNumber, line);
        }
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new SolutionFormatException("Invalid number " + token, lineNumber, line, e);
        }
    }

    /**
     * @return the solver's name, for messages
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return the executable to run
     */
    public String getCommandName() {
        return commandName;
    }

    /**
     * @param commandName the executable to run; a name on the <code>PATH</code>, or a path
     */
    public void setCommandName(String commandName) {
        this.commandName = requireNonNull(commandName);
    }

    /**
     * @return the configured result file, or null if a fresh one is used for each solve
     */
    public Path getResultFile() {
        return resultFile;
    }

    /**
     * Set the file the solver writes its solution to. A configured file is left in place after solving. If null,
     * a fresh file in the system temp directory is used for each solve and then deleted.
     *
     * @param resultFile the result file, or null
     */
    public void setResultFile(Path resultFile) {
        this.resultFile = resultFile;
    }

    /**
     * @return writes the model file
     */
    public ModelExporter getExporter() {
        return exporter;
    }

    /**
     * @param exporter writes the model file
     */
    public void setExporter(ModelExporter exporter) {
        this.exporter = requireNonNull(exporter);
    }

    /**
     * @return runs the executable
     */
    public CommandRunner getRunner() {
        return runner;
    }

    /**
     * @param runner runs the executable
     */
    public void setRunner(CommandRunner runner) {
        this.runner = requireNonNull(runner);
    }
}
