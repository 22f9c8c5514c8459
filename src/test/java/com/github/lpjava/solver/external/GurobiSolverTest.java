package com.github.lpjava.solver.external;

import com.github.lpjava.SolutionFormatException;
import com.github.lpjava.solver.Status;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GurobiSolverTest {
    private final GurobiSolver solver = new GurobiSolver();

    @Test
    void readsSolutionFile() throws Exception {
        var solution = solver.read(Path.of(getClass().getResource("gurobi.sol").toURI()), null);

        assertEquals(Map.of("a", -20.0, "b", -20.0), solution.values());
    }

    @Test
    void headerRequired() {
        assertThrows(SolutionFormatException.class, () -> solver.read(""));
        assertThrows(SolutionFormatException.class, () -> solver.read("   \nx 1\n"));
        assertTrue(solver.read("# header only\n").values().isEmpty());
    }

    @Test
    void exactlyTwoFields() {
        var ex = assertThrows(SolutionFormatException.class, () -> solver.read("# header\nx 1\ny 2 3\n"));
        assertEquals(3, ex.getLineNumber());

        assertThrows(SolutionFormatException.class, () -> solver.read("# header\nx\n"));
        assertThrows(SolutionFormatException.class, () -> solver.read("# header\nx one\n"));
    }

    @Test
    void decimalValuesOnly() {
        for (var token : List.of("1.5f", "2d", "0x1p3", "NaN", "Infinity", "1.2.3", "e5")) {
            assertThrows(SolutionFormatException.class, () -> solver.read("# header\nx " + token + "\n"), token);
        }

        var solution = solver.read("# header\nx 1e-3\ny -2.\nz +.5E+2\n");
        assertEquals(Map.of("x", 0.001, "y", -2.0, "z", 50.0), solution.values());
    }

    @Test
    void statusFromStdout() {
        assertEquals(Status.OPTIMAL, GurobiSolver.statusOf("Solved in 2 iterations\nOptimal solution found\n"));
        assertEquals(Status.INFEASIBLE, GurobiSolver.statusOf("Model is infesible"));
        assertEquals(Status.INFEASIBLE, GurobiSolver.statusOf("Model is infeasible"));
        assertEquals(Status.SUB_OPTIMAL, GurobiSolver.statusOf("Time limit reached"));
    }

    @Test
    void command() {
        assertEquals(List.of("gurobi_cl", "ResultFile=result.sol", "model.lp"),
                solver.buildCommand(Path.of("model.lp"), Path.of("result.sol")));
    }
}
