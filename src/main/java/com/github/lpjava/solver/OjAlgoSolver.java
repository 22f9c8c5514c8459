package com.github.lpjava.solver;

import com.github.lpjava.SolverException;
import com.github.lpjava.expr.Bound;
import com.github.lpjava.expr.Decomposer;
import com.github.lpjava.model.Constraint;
import com.github.lpjava.model.Direction;
import com.github.lpjava.model.Problem;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.github.lpjava.Util.newModel;
import static com.github.lpjava.Util.toBigDecimal;
import static org.ojalgo.optimisation.Optimisation.State.INFEASIBLE;
import static org.ojalgo.optimisation.Optimisation.State.UNBOUNDED;

/**
 * <p>
 * In-process solver backed by ojAlgo's {@link ExpressionsBasedModel}. No files or processes are involved.
 * </p><p>
 * The objective is decomposed first, and each of its variables becomes an ojAlgo {@link Variable} weighted by its
 * coefficient. Variables that first appear in a constraint get a zero weight. Each variable's bounds are the
 * intersection of the bounds attached to all of its occurrences, anywhere in the problem (see
 * {@link Problem#bounds()}). This includes variables that only appear in constraints, which therefore don't default
 * to unbounded. If any variable's bounds are empty, the problem is reported infeasible without calling ojAlgo.
 * Constraints are added in order, named <code>c1</code>, <code>c2</code>, ...
 * </p><p>
 * ojAlgo numbers variables in creation order, so the solver keeps a list of names indexed the same way and uses it
 * to read back the result.
 * </p><p>
 * Only {@link Status#OPTIMAL}, {@link Status#INFEASIBLE} and {@link Status#UNBOUNDED} are reported.
 * </p>
 */
public class OjAlgoSolver extends Solver {
    /**
     * Default constructor.
     */
    public OjAlgoSolver() {
    }

    @Override
    protected Solution doSolve(Problem problem) {
        // decompose everything up front, so that modeling errors surface before any ojAlgo state is built.
        var objective = Decomposer.simplifyAndDecompose(problem.getObjective().orElseThrow());
        var constraints = problem.getConstraints().stream().map(Constraint::decompose).toList();
        var bounds = problem.bounds();

        for (var entry : bounds.entrySet()) {
            if (entry.getValue().lower() > entry.getValue().upper()) {
                debug("Variable " + entry.getKey() + " has empty bounds " + entry.getValue());
                return new Solution(Status.INFEASIBLE, Map.of(), problem);
            }
        }

        var model = newModel();
        var names = new ArrayList<String>();
        var variables = new HashMap<String, Variable>();

        objective.variables().forEach((name, aggregate) -> variables.put(name,
                newVariable(model, names, name, aggregate.coefficient(), bounds.get(name))));

        for (var i = 0; i < constraints.size(); i++) {
            var constraint = constraints.get(i);

            if (constraint.lhs().variables().isEmpty()) {
                if (!isSatisfied(constraint)) {
                    debug("Constraint c" + (i + 1) + " has no variables and can't be satisfied: " +
                            problem.getConstraints().get(i));
                    return new Solution(Status.INFEASIBLE, Map.of(), problem);
                }
                continue;
            }
            addConstraint(model, "c" + (i + 1), constraint, names, variables, bounds);
        }

        var start = System.currentTimeMillis();
        var result = problem.getDirection() == Direction.MAXIMIZE ? model.maximise() : model.minimise();
        var elapsed = System.currentTimeMillis() - start;

        debug("Elapsed: " + elapsed + "ms; " + result.getState() + " " + result.getValue());

        return toSolution(result, names, problem);
    }

    private static Variable newVariable(ExpressionsBasedModel model,
                                        List<String> names,
                                        String name,
                                        double weight,
                                        Bound bound) {
        var variable = model.newVariable(name).weight(toBigDecimal(weight));

        if (bound.hasLower()) {
            variable.lower(toBigDecimal(bound.lower()));
        }
        if (bound.hasUpper()) {
            variable.upper(toBigDecimal(bound.upper()));
        }
        names.add(name);
        return variable;
    }

    private static void addConstraint(ExpressionsBasedModel model,
                                      String name,
                                      Constraint.Linear constraint,
                                      List<String> names,
                                      Map<String, Variable> variables,
                                      Map<String, Bound> bounds) {
        var expression = model.newExpression(name);

        constraint.lhs().variables().forEach((varName, aggregate) -> {
            var variable = variables.computeIfAbsent(varName, key ->
                    newVariable(model, names, key, 0.0, bounds.get(key)));
            expression.set(variable, toBigDecimal(aggregate.coefficient()));
        });

        var rhs = toBigDecimal(constraint.rhs());

        switch (constraint.comparison()) {
            case LESS_OR_EQUAL -> expression.upper(rhs);
            case GREATER_OR_EQUAL -> expression.lower(rhs);
            case EQUAL -> expression.level(rhs);
        }
    }

    private static boolean isSatisfied(Constraint.Linear constraint) {
        return switch (constraint.comparison()) {
            case LESS_OR_EQUAL -> 0.0 <= constraint.rhs();
            case GREATER_OR_EQUAL -> 0.0 >= constraint.rhs();
            case EQUAL -> constraint.rhs() == 0.0;
        };
    }

    /**
     * Translate an ojAlgo result back into a {@link Solution}.
     *
     * @param result the ojAlgo result
     * @param names  variable names, indexed the same way as ojAlgo's variables
     * @param problem the problem that was solved
     * @return the solution
     * @throws SolverException if ojAlgo failed, or its variables don't line up with <code>names</code>
     */
    static Solution toSolution(Optimisation.Result result, List<String> names, Problem problem) {
        var state = result.getState();

        if (state == UNBOUNDED) {
            return new Solution(Status.UNBOUNDED, Map.of(), problem);
        }
        if (state == INFEASIBLE) {
            return new Solution(Status.INFEASIBLE, Map.of(), problem);
        }
        if (!state.isFeasible()) {
            throw new SolverException("ojAlgo could not solve " + problem.getName() + ": " + state);
        }

        var count = (int) result.count();
        if (count != names.size()) {
            throw new SolverException("Missing variable name: ojAlgo returned " + count + " values for " +
                    names.size() + " variables");
        }

        var values = new LinkedHashMap<String, Double>();
        for (var i = 0; i < count; i++) {
            values.put(names.get(i), result.get(i).doubleValue());
        }
        return new Solution(Status.OPTIMAL, values, problem);
    }
}
