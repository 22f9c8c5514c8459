package com.github.lpjava;

/**
 * A solution file written by an external solver could not be parsed.
 */
public class SolutionFormatException extends SolverException {
    private final int lineNumber;

    /**
     * @param message    what was wrong
     * @param lineNumber 1-based line number, or 0 if the problem isn't tied to a line
     * @param line       the offending line, or null
     */
    public SolutionFormatException(String message, int lineNumber, String line) {
        super(lineNumber > 0 ?
                "Incorrect solution format: " + message + " (line " + lineNumber +
                        (line == null ? ")" : ": \"" + line + "\")") :
                "Incorrect solution format: " + message);
        this.lineNumber = lineNumber;
    }

    /**
     * @param message    what was wrong
     * @param lineNumber 1-based line number
     * @param line       the offending line
     * @param cause      the underlying parse exception
     */
    public SolutionFormatException(String message, int lineNumber, String line, Throwable cause) {
        this(message, lineNumber, line);
        initCause(cause);
    }

    /**
     * @return 1-based line number, or 0 if the problem isn't tied to a line
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
