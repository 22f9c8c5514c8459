package com.github.lpjava.solver.external;

import com.github.lpjava.SolutionFormatException;
import com.github.lpjava.model.Problem;
import com.github.lpjava.solver.Solution;
import com.github.lpjava.solver.Status;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.LineNumberReader;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <p>
 * Solves problems with Gurobi's command-line tool, which is invoked as
 * <code>gurobi_cl ResultFile=&lt;result&gt; &lt;model&gt;</code>.
 * </p><p>
 * The result file starts with a header line, followed by <code>name value</code> pairs and <code>#</code> comments.
 * It carries no status, so the status is taken from the tool's standard output. Gurobi writes no result file when
 * the problem is infeasible.
 * </p>
 */
public class GurobiSolver extends ExternalSolver {
    /**
     * Default constructor.
     */
    public GurobiSolver() {
        super("Gurobi", "gurobi_cl");
    }

    @Override
    protected List<String> buildCommand(Path modelFile, Path resultFile) {
        return List.of(getCommandName(), "ResultFile=" + resultFile, modelFile.toString());
    }

    @Override
    protected Solution interpret(CommandResult output, Path resultFile, Problem problem) throws IOException {
        var status = statusOf(output.stdout());

        if (!status.isFeasible()) {
            return new Solution(status, Map.of(), problem);
        }
        return read(resultFile, problem).withStatus(status);
    }

    /**
     * Derive the status from <code>gurobi_cl</code>'s standard output.
     *
     * @param stdout the captured output
     * @return {@link Status#OPTIMAL}, {@link Status#INFEASIBLE}, or otherwise {@link Status#SUB_OPTIMAL}
     */
    static Status statusOf(String stdout) {
        if (stdout.contains("Optimal solution found")) {
            return Status.OPTIMAL;
        }
        // older releases misspell it
        if (stdout.contains("infesible") || stdout.contains("infeasible")) {
            return Status.INFEASIBLE;
        }
        return Status.SUB_OPTIMAL;
    }

    /**
     * Parse a result file. The status is always {@link Status#OPTIMAL}, since the file doesn't record one;
     * {@link #solve(Problem)} replaces it with the status reported on standard output.
     */
    @Override
    public Solution read(BufferedReader reader, Problem problem) throws IOException {
        var in = new LineNumberReader(reader);
        var header = in.readLine();

        if (header == null || tokenize(header).isEmpty()) {
            throw new SolutionFormatException("Missing header", 1, header);
        }

        var values = new LinkedHashMap<String, Double>();
        for (var line = in.readLine(); line != null; line = in.readLine()) {
            if (line.startsWith("#")) {
                continue;
            }
            var tokens = tokenize(line);
            if (tokens.size() != 2) {
                throw new SolutionFormatException("Expected a variable name and value", in.getLineNumber(), line);
            }
            values.put(tokens.get(0), parseValue(tokens.get(1), in.getLineNumber(), line));
        }
        return new Solution(Status.OPTIMAL, values, problem);
    }
}
