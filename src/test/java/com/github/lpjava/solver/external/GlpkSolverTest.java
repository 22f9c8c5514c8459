package com.github.lpjava.solver.external;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.lpjava.SolutionFormatException;
import com.github.lpjava.solver.Status;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GlpkSolverTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final GlpkSolver solver = new GlpkSolver();

    private Path resource(String name) throws URISyntaxException {
        return Path.of(getClass().getResource(name).toURI());
    }

    @Test
    void statusTable() throws IOException {
        Map<String, String> table = mapper.readValue(getClass().getResource("glpk-status.json"),
                new TypeReference<>() {
                });

        assertEquals(7, table.size());
        table.forEach((token, status) ->
                assertEquals(Status.valueOf(status), GlpkSolver.parseStatus("Status:     " + token, 5), token));
    }

    @Test
    void unknownStatus() {
        for (var token : List.of("FEASIBLE", "optimal", "INFEASIBLE", "")) {
            var ex = assertThrows(SolutionFormatException.class,
                    () -> GlpkSolver.parseStatus("Status:     " + token, 5), token);
            assertEquals(5, ex.getLineNumber());
        }
        assertThrows(SolutionFormatException.class, () -> GlpkSolver.parseStatus("Objective:  OPTIMAL", 5));
    }

    @Test
    void readsSolutionFile() throws Exception {
        var solution = solver.read(resource("glpk.sol"), null);

        assertEquals(Status.OPTIMAL, solution.status());
        assertEquals(Map.of("a", -20.0, "b", -20.0), solution.values());
        assertEquals(List.of("a", "b"), List.copyOf(solution.values().keySet()));
    }

    @Test
    void missingColumns() {
        var ex = assertThrows(SolutionFormatException.class, () -> solver.read(resource("glpk-truncated.sol"), null));

        assertTrue(ex.getMessage().contains("Not all columns are present"), ex.getMessage());
    }

    @Test
    void badHeader() {
        assertThrows(SolutionFormatException.class, () -> solver.read(""));
        assertThrows(SolutionFormatException.class, () -> solver.read("Problem:\nRows:\n"));

        var ex = assertThrows(SolutionFormatException.class, () -> solver.read("Problem:\nRows: two\n"));
        assertEquals(2, ex.getLineNumber());
    }

    @Test
    void tooFewFields() {
        var text = """
                Problem:
                Rows:       0
                Columns:    1
                Non-zeros:  0
                Status:     OPTIMAL
                Objective:  obj = 0 (MINimum)

                   No.   Row name   St   Activity     Lower bound   Upper bound    Marginal
                ------ ------------ -- ------------- ------------- ------------- -------------

                   No. Column name  St   Activity     Lower bound   Upper bound    Marginal
                ------ ------------ -- ------------- ------------- ------------- -------------
                     1 x            B
                """;
        var ex = assertThrows(SolutionFormatException.class, () -> solver.read(text));

        assertEquals(13, ex.getLineNumber());
    }

    @Test
    void nonNumericValue() {
        var text = """
                Problem:
                Rows:       0
                Columns:    1
                Non-zeros:  0
                Status:     UNDEFINED
                Objective:  obj = 0 (MINimum)

                   No.   Row name   St   Activity     Lower bound   Upper bound    Marginal
                ------ ------------ -- ------------- ------------- ------------- -------------

                   No. Column name  St   Activity     Lower bound   Upper bound    Marginal
                ------ ------------ -- ------------- ------------- ------------- -------------
                     1 x            B           abc
                """;
        var ex = assertThrows(SolutionFormatException.class, () -> solver.read(text));

        assertEquals(13, ex.getLineNumber());
        assertTrue(ex.getMessage().contains("abc"), ex.getMessage());
        assertEquals(Status.NOT_SOLVED, solver.read(text.replace("abc", "1.5")).status());
        assertEquals(1.5, solver.read(text.replace("abc", "1.5")).value("x").orElseThrow());
    }

    @Test
    void command() {
        assertEquals(List.of("glpsol", "--lp", "model.lp", "-o", "result.sol"),
                solver.buildCommand(Path.of("model.lp"), Path.of("result.sol")));

        solver.setCommandName("/opt/glpk/bin/glpsol");
        assertEquals("/opt/glpk/bin/glpsol", solver.buildCommand(Path.of("m"), Path.of("r")).get(0));
    }
}
