package com.github.lpjava.solver.external;

import org.ojalgo.netio.BasicLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * A scratch file owned by a single solve. Closing it deletes the file, at most once. A failed deletion is logged and
 * never thrown, so it can't mask the outcome of the solve.
 * <p>
 * Use with try-with-resources.
 */
final class TempFile implements AutoCloseable {
    private final Path path;
    private final boolean owned;
    private boolean closed;

    private TempFile(Path path, boolean owned) {
        this.path = path;
        this.owned = owned;
    }

    /**
     * Create a new, empty file in the system temp directory.
     */
    static TempFile create(String prefix, String suffix) throws IOException {
        return new TempFile(Files.createTempFile(prefix, suffix), true);
    }

    /**
     * Reserve a fresh path in the system temp directory, named after a random UUID, without creating the file.
     */
    static TempFile reserve(String suffix) {
        var dir = Path.of(System.getProperty("java.io.tmpdir"));
        return new TempFile(dir.resolve(UUID.randomUUID() + suffix), true);
    }

    /**
     * Wrap a path chosen by the caller. It's left in place on close.
     */
    static TempFile retain(Path path) {
        return new TempFile(path, false);
    }

    Path path() {
        return path;
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        if (owned) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                BasicLogger.error("Could not delete temporary file " + path + ": " + e);
            }
        }
    }
}
