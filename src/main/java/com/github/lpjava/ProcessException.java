package com.github.lpjava;

/**
 * An external solver process could not be started, or exited unsuccessfully. The captured output is kept for
 * diagnostics.
 */
public class ProcessException extends SolverException {
    private final String command;
    private final int exitCode;
    private final String stdout;
    private final String stderr;

    /**
     * Report a process that ran, but exited with a nonzero status.
     *
     * @param command  the executable name
     * @param exitCode the exit status
     * @param stdout   captured standard output
     * @param stderr   captured standard error
     */
    public ProcessException(String command, int exitCode, String stdout, String stderr) {
        super(command + " exited with " + exitCode + "\n\nSTDOUT:\n" + stdout + "\n\nSTDERR:\n" + stderr + "\n\n");
        this.command = command;
        this.exitCode = exitCode;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    /**
     * Report a process that could not be run at all.
     *
     * @param command the executable name
     * @param message description
     * @param cause   the underlying exception
     */
    public ProcessException(String command, String message, Throwable cause) {
        super(message, cause);
        this.command = command;
        this.exitCode = -1;
        this.stdout = "";
        this.stderr = "";
    }

    /**
     * @return the executable name
     */
    public String getCommand() {
        return command;
    }

    /**
     * @return the exit status, or -1 if the process never ran to completion
     */
    public int getExitCode() {
        return exitCode;
    }

    /**
     * @return captured standard output; empty if the process never ran
     */
    public String getStdout() {
        return stdout;
    }

    /**
     * @return captured standard error; empty if the process never ran
     */
    public String getStderr() {
        return stderr;
    }
}
