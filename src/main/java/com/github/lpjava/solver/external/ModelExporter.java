package com.github.lpjava.solver.external;

import com.github.lpjava.model.Problem;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a {@link Problem} to a model file that an external solver can read.
 */
@FunctionalInterface
public interface ModelExporter {
    /**
     * @param problem the problem; not modified
     * @param path    destination; overwritten if it exists
     * @throws IOException                         if the file can't be written
     * @throws com.github.lpjava.ModelingException if the problem can't be expressed linearly
     */
    void export(Problem problem, Path path) throws IOException;
}
