package com.github.lpjava.solver.external;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Runs commands as local processes via {@link ProcessBuilder}. Standard output and standard error are redirected to
 * scratch files, which avoids blocking on full pipes when a solver is chatty, and are deleted afterwards.
 */
public class ProcessCommandRunner implements CommandRunner {
    /**
     * Default constructor.
     */
    public ProcessCommandRunner() {
    }

    @Override
    public CommandResult run(List<String> command) throws IOException, InterruptedException {
        try (var out = TempFile.create("lpjava-", ".out");
             var err = TempFile.create("lpjava-", ".err")) {
            var process = new ProcessBuilder(command)
                    .redirectOutput(out.path().toFile())
                    .redirectError(err.path().toFile())
                    .start();
            var exitCode = waitFor(process);

            return new CommandResult(exitCode, read(out.path()), read(err.path()));
        }
    }

    /**
     * Wait for a process to exit. If interrupted, the process is destroyed before the exception propagates, so it
     * doesn't outlive its redirect files.
     */
    static int waitFor(Process process) throws InterruptedException {
        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            process.destroy();
            throw e;
        }
    }

    // lenient decoding; malformed bytes are replaced
    private static String read(Path path) throws IOException {
        return new String(Files.readAllBytes(path), UTF_8);
    }
}
