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

/**
 * <p>
 * Solves problems with GLPK's <code>glpsol</code>, which is invoked as
 * <code>glpsol --lp &lt;model&gt; -o &lt;result&gt;</code>.
 * </p><p>
 * The result is glpsol's printable report. Its layout is fixed: the row and column counts on the second and third
 * lines, the status on the fifth, then the row section, and finally one line per column, with the variable name in
 * the second field and its value in the fourth.
 * </p>
 */
public class GlpkSolver extends ExternalSolver {
    private static final String STATUS_PREFIX = "Status:";

    // lines between the status line and the first column line, in addition to one line per row
    private static final int ROW_SECTION_OVERHEAD = 7;

    /**
     * Default constructor.
     */
    public GlpkSolver() {
        super("GLPK", "glpsol");
    }

    @Override
    protected List<String> buildCommand(Path modelFile, Path resultFile) {
        return List.of(getCommandName(), "--lp", modelFile.toString(), "-o", resultFile.toString());
    }

    @Override
    public Solution read(BufferedReader reader, Problem problem) throws IOException {
        var in = new LineNumberReader(reader);

        if (in.readLine() == null) {
            throw new SolutionFormatException("Empty solution file", 0, null);
        }
        var rows = readCount(in, "row");
        var columns = readCount(in, "column");

        if (in.readLine() == null) {
            throw new SolutionFormatException("No solution status found", in.getLineNumber() + 1, null);
        }
        var statusLine = in.readLine();
        if (statusLine == null) {
            throw new SolutionFormatException("No solution status found", in.getLineNumber() + 1, null);
        }
        var status = parseStatus(statusLine, in.getLineNumber());

        for (var i = 0; i < rows + ROW_SECTION_OVERHEAD; i++) {
            if (in.readLine() == null) {
                throw new SolutionFormatException("Not all columns are present", in.getLineNumber() + 1, null);
            }
        }

        var values = new LinkedHashMap<String, Double>();
        for (var i = 0; i < columns; i++) {
            var line = in.readLine();
            if (line == null) {
                throw new SolutionFormatException("Not all columns are present: expected " + columns + ", found " +
                        i, in.getLineNumber() + 1, null);
            }
            var tokens = tokenize(line);
            if (tokens.size() < 4) {
                throw new SolutionFormatException("Column specification has too few fields", in.getLineNumber(),
                        line);
            }
            values.put(tokens.get(1), parseValue(tokens.get(3), in.getLineNumber(), line));
        }

        debug("GLPK result: " + status + ", " + values.size() + " of " + rows + " rows x " + columns + " columns");
        return new Solution(status, values, problem);
    }

    private static int readCount(LineNumberReader in, String what) throws IOException {
        var line = in.readLine();
        if (line == null) {
            throw new SolutionFormatException("Missing " + what + " count", in.getLineNumber() + 1, null);
        }
        var tokens = tokenize(line);
        if (tokens.size() < 2) {
            throw new SolutionFormatException("Missing " + what + " count", in.getLineNumber(), line);
        }

        int count;
        try {
            count = Integer.parseInt(tokens.get(1));
        } catch (NumberFormatException e) {
            throw new SolutionFormatException("Invalid " + what + " count", in.getLineNumber(), line, e);
        }
        if (count < 0) {
            throw new SolutionFormatException("Invalid " + what + " count", in.getLineNumber(), line);
        }
        return count;
    }

    /**
     * Parse glpsol's status line, e.g. <code>"Status:     OPTIMAL"</code>.
     *
     * @param line       the line
     * @param lineNumber 1-based line number, for the error message
     * @return the status
     * @throws SolutionFormatException if the line isn't a status line, or the status is unknown
     */
    static Status parseStatus(String line, int lineNumber) {
        if (!line.startsWith(STATUS_PREFIX)) {
            throw new SolutionFormatException("Expected a status line", lineNumber, line);
        }
        var token = line.substring(STATUS_PREFIX.length()).strip();

        return switch (token) {
            case "INTEGER OPTIMAL", "OPTIMAL" -> Status.OPTIMAL;
            case "INFEASIBLE (FINAL)", "INTEGER EMPTY" -> Status.INFEASIBLE;
            case "UNDEFINED" -> Status.NOT_SOLVED;
            case "INTEGER UNDEFINED", "UNBOUNDED" -> Status.UNBOUNDED;
            default -> throw new SolutionFormatException("Unknown solution status " + token, lineNumber, line);
        };
    }
}
