package com.github.lpjava.solver.external;

import com.github.lpjava.model.Problem;
import com.github.lpjava.solver.Solution;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads the solution file written by an external solver.
 */
public interface SolutionParser {
    /**
     * Parse solution text.
     *
     * @param reader  the text, read to the end but not closed
     * @param problem the problem that was solved, recorded in the solution; may be null
     * @return the parsed solution
     * @throws IOException                                if reading fails
     * @throws com.github.lpjava.SolutionFormatException if the text is malformed
     */
    Solution read(BufferedReader reader, Problem problem) throws IOException;

    /**
     * Parse a solution file. Malformed UTF-8 is replaced rather than rejected.
     *
     * @param path    the file
     * @param problem the problem that was solved; may be null
     * @return the parsed solution
     * @throws IOException if the file can't be read
     */
    default Solution read(Path path, Problem problem) throws IOException {
        try (var reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), UTF_8))) {
            return read(reader, problem);
        }
    }

    /**
     * Parse solution text held in memory.
     *
     * @param text the text
     * @return the parsed solution, with no problem attached
     */
    default Solution read(String text) {
        try {
            return read(new BufferedReader(new StringReader(text)), null);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
