package com.github.lpjava.solver.external;

import com.github.lpjava.expr.ContinuousVariable;
import com.github.lpjava.model.Direction;
import com.github.lpjava.model.Problem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.github.lpjava.expr.Expression.variable;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

class LpFormatWriterTest {
    private final LpFormatWriter writer = new LpFormatWriter();

    @Test
    void example(@TempDir Path dir) throws IOException {
        var a = variable(ContinuousVariable.of("a"));
        var b = variable(ContinuousVariable.of("b"));
        var problem = new Problem("example", Direction.MAXIMIZE)
                .setObjective(a.times(10).plus(b.times(20)))
                .addConstraint(a.times(500).minus(b.times(1000)).ge(10000))
                .addConstraint(a.le(b));

        String expected;
        try (var in = getClass().getResourceAsStream("lp-example.lp")) {
            expected = new String(in.readAllBytes(), UTF_8);
        }
        var file = dir.resolve("example.lp");
        writer.export(problem, file);

        assertEquals(expected, Files.readString(file));
        assertEquals(expected, writer.toString(problem));
    }

    @Test
    void boundsAndConstants() {
        var x = variable(ContinuousVariable.of("x", 0, 4.5));
        var y = variable(ContinuousVariable.of("y").upper(3));
        var z = variable(ContinuousVariable.of("z").lower(-1));
        var w = variable(ContinuousVariable.of("w", 2, 2));
        var problem = new Problem("bounds", Direction.MINIMIZE)
                .setObjective(x.times(-0.5).minus(y).plus(7))
                .addConstraint(z.plus(w).plus(3).eq(10));

        assertEquals("""
                \\ Problem name: bounds

                Minimize
                  obj: - 0.5 x - 1 y
                Subject To
                  c1: 1 z + 1 w = 7
                Bounds
                  0 <= x <= 4.5
                  -inf <= y <= 3
                  z >= -1
                  w = 2
                End
                """, writer.toString(problem));
    }

    @Test
    void lineBreaksInName() {
        var x = variable(ContinuousVariable.of("x"));
        var problem = new Problem("two\nlines\r\nname", Direction.MINIMIZE).setObjective(x);
        var text = writer.toString(problem);

        assertTrue(text.startsWith("\\ Problem name: two lines  name\n\nMinimize\n"), text);
        assertEquals("two\nlines\r\nname", problem.getName());
    }

    @Test
    void rowsWithoutVariables() {
        var x = variable(ContinuousVariable.of("x"));
        var problem = new Problem("constant", Direction.MINIMIZE)
                .setObjective(x)
                .addConstraint(x.times(0).ge(1));

        assertTrue(writer.toString(problem).contains("  c1: 0 x >= 1\n"));
    }
}
