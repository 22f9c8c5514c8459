package com.github.lpjava.solver.external;

import java.io.IOException;
import java.util.List;

/**
 * Runs an external command and waits for it to finish. {@link ExternalSolver} uses this seam to launch solver
 * executables, so alternative implementations can run them remotely, or simulate them in tests.
 */
@FunctionalInterface
public interface CommandRunner {
    /**
     * @param command the executable followed by its arguments
     * @return exit status and captured output
     * @throws IOException          if the command could not be started
     * @throws InterruptedException if interrupted while waiting for the command
     */
    CommandResult run(List<String> command) throws IOException, InterruptedException;
}
