package com.github.lpjava.solver.external;

import com.github.lpjava.expr.Bound;
import com.github.lpjava.expr.Decomposer;
import com.github.lpjava.expr.Decomposition;
import com.github.lpjava.model.Constraint;
import com.github.lpjava.model.Problem;
import com.google.common.base.CharMatcher;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.github.lpjava.Util.format;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * <p>
 * Writes problems in the CPLEX LP text format, which both <code>glpsol --lp</code> and <code>gurobi_cl</code> read.
 * </p><p>
 * Expressions are simplified and decomposed before writing, so each row lists one term per variable. Residual
 * constants on the left-hand side are moved to the right. The objective row is named <code>obj</code>, and
 * constraints <code>c1</code>, <code>c2</code>, ... in insertion order.
 * </p><p>
 * The format's default lower bound is zero, so every variable gets an explicit line in the <code>Bounds</code>
 * section: <code>free</code> when it has no bounds at all.
 * </p>
 */
public class LpFormatWriter implements ModelExporter {
    private static final CharMatcher LINE_BREAKS = CharMatcher.anyOf("\r\n\f\u0085\u2028\u2029");

    /**
     * Default constructor.
     */
    public LpFormatWriter() {
    }

    @Override
    public void export(Problem problem, Path path) throws IOException {
        try (var writer = Files.newBufferedWriter(path, UTF_8)) {
            write(problem, writer);
        }
    }

    /**
     * @param problem the problem
     * @return the LP text
     */
    public String toString(Problem problem) {
        var writer = new StringWriter();
        try {
            write(problem, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    /**
     * Write the LP text for a problem.
     *
     * @param problem the problem; must have an objective
     * @param out     destination; not closed
     * @throws IOException if writing fails
     */
    public void write(Problem problem, Writer out) throws IOException {
        var objective = Decomposer.simplifyAndDecompose(problem.getObjective().orElseThrow());
        var constraints = problem.getConstraints().stream().map(Constraint::decompose).toList();

        Set<String> names = new LinkedHashSet<>(objective.variables().keySet());
        constraints.forEach(c -> names.addAll(c.lhs().variables().keySet()));

        // rows with no terms still need a variable, with a zero coefficient
        var placeholder = names.isEmpty() ? null : names.iterator().next();
        var bounds = problem.bounds();

        out.write("\\ Problem name: " + LINE_BREAKS.replaceFrom(problem.getName(), ' ') + "\n\n");
        out.write(problem.getDirection().keyword() + "\n");
        out.write("  obj: " + terms(objective, placeholder) + "\n");

        out.write("Subject To\n");
        for (var i = 0; i < constraints.size(); i++) {
            var c = constraints.get(i);
            out.write("  c" + (i + 1) + ": " + terms(c.lhs(), placeholder) + " " + c.comparison().symbol() + " " +
                    format(c.rhs()) + "\n");
        }

        out.write("Bounds\n");
        for (var name : names) {
            out.write("  " + bound(name, bounds.getOrDefault(name, Bound.UNBOUNDED)) + "\n");
        }
        out.write("End\n");
    }

    private static String terms(Decomposition decomposition, String placeholder) {
        if (decomposition.variables().isEmpty()) {
            return placeholder == null ? "0" : "0 " + placeholder;
        }

        List<String> parts = new ArrayList<>();
        decomposition.variables().forEach((name, aggregate) -> {
            var coefficient = aggregate.coefficient();
            var magnitude = format(Math.abs(coefficient)) + " " + name;

            if (parts.isEmpty()) {
                parts.add(coefficient < 0 ? "- " + magnitude : magnitude);
            } else {
                parts.add((coefficient < 0 ? "- " : "+ ") + magnitude);
            }
        });
        return String.join(" ", parts);
    }

    private static String bound(String name, Bound bound) {
        if (bound.hasLower() && bound.hasUpper()) {
            if (bound.lower() == bound.upper()) {
                return name + " = " + format(bound.lower());
            }
            return format(bound.lower()) + " <= " + name + " <= " + format(bound.upper());
        }
        if (bound.hasLower()) {
            return name + " >= " + format(bound.lower());
        }
        if (bound.hasUpper()) {
            return "-inf <= " + name + " <= " + format(bound.upper());
        }
        return name + " free";
    }
}
