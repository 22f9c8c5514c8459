package com.github.lpjava.solver.external;

/**
 * Outcome of running an external command to completion.
 *
 * @param exitCode the exit status
 * @param stdout   captured standard output
 * @param stderr   captured standard error
 */
public record CommandResult(int exitCode, String stdout, String stderr) {
    /**
     * @return true if the exit status is zero
     */
    public boolean isSuccess() {
        return exitCode == 0;
    }
}
