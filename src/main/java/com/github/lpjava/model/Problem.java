package com.github.lpjava.model;

import com.github.lpjava.expr.Bound;
import com.github.lpjava.expr.ContinuousVariable;
import com.github.lpjava.expr.Expression;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * <p>
 * A linear program: an objective direction, an objective expression, and constraints in the order they were added.
 * </p><p>
 * Nothing is validated while the problem is being built; malformed models fail when they are solved. Once a problem
 * has been passed to a {@link com.github.lpjava.solver.Solver}, it should no longer be modified. Solvers never modify
 * it.
 * </p>
 */
public class Problem {
    private final String name;
    private final String uniqueName;
    private final Direction direction;
    private final List<Constraint> constraints = new ArrayList<>();
    private Expression objective;

    /**
     * @param name      a descriptive name; need not be unique
     * @param direction minimize or maximize
     */
    public Problem(String name, Direction direction) {
        this.name = Objects.requireNonNull(name, "name");
        this.direction = Objects.requireNonNull(direction, "direction");
        this.uniqueName = name.replaceAll("[^A-Za-z0-9_-]", "_") + "_" + UUID.randomUUID();
    }

    /**
     * Set the objective. Calling this again replaces the previous objective.
     *
     * @param objective the expression to minimize or maximize
     * @return this problem
     */
    @CanIgnoreReturnValue
    public Problem setObjective(Expression objective) {
        this.objective = Objects.requireNonNull(objective, "objective");
        return this;
    }

    /**
     * Append a constraint.
     *
     * @param constraint the constraint
     * @return this problem
     */
    @CanIgnoreReturnValue
    public Problem addConstraint(Constraint constraint) {
        constraints.add(Objects.requireNonNull(constraint, "constraint"));
        return this;
    }

    /**
     * @return the name given at construction
     */
    public String getName() {
        return name;
    }

    /**
     * @return the name, made safe for use in file names and suffixed with a random UUID
     */
    public String getUniqueName() {
        return uniqueName;
    }

    /**
     * @return minimize or maximize
     */
    public Direction getDirection() {
        return direction;
    }

    /**
     * @return the objective, or empty if it was never set
     */
    public Optional<Expression> getObjective() {
        return Optional.ofNullable(objective);
    }

    /**
     * @return the constraints, in the order they were added
     */
    public List<Constraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    /**
     * Every variable referenced by the objective or by either side of a constraint, by name. The objective's variables
     * come first; otherwise in order of first occurrence.
     *
     * @return an unmodifiable map
     */
    public Map<String, ContinuousVariable> variables() {
        var result = new LinkedHashMap<String, ContinuousVariable>();

        if (objective != null) {
            objective.variables().forEach(result::putIfAbsent);
        }
        for (var constraint : constraints) {
            constraint.expression().variables().forEach(result::putIfAbsent);
            constraint.constant().variables().forEach(result::putIfAbsent);
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * The bound of every variable in the problem: the intersection of the bounds attached to all of its occurrences,
     * in the objective and in both sides of every constraint.
     *
     * @return an unmodifiable map, in the same order as {@link #variables()}
     */
    public Map<String, Bound> bounds() {
        var result = new LinkedHashMap<String, Bound>();

        if (objective != null) {
            objective.bounds().forEach((k, v) -> result.merge(k, v, Bound::intersect));
        }
        for (var constraint : constraints) {
            constraint.expression().bounds().forEach((k, v) -> result.merge(k, v, Bound::intersect));
            constraint.constant().bounds().forEach((k, v) -> result.merge(k, v, Bound::intersect));
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String toString() {
        return name + ": " + direction.keyword() + " " + objective + " subject to " + constraints;
    }
}
