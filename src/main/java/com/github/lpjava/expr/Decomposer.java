package com.github.lpjava.expr;

import com.github.lpjava.ModelingException;

import java.util.ArrayDeque;
import java.util.LinkedHashMap;

import static com.github.lpjava.ModelingException.Reason.CONSTANT_NOT_SIMPLIFIED;
import static com.github.lpjava.ModelingException.Reason.UNSIMPLIFIED_MULTIPLICATION;
import static com.github.lpjava.ModelingException.Reason.UNSUPPORTED_EXPRESSION;

/**
 * Reduces a canonical expression (see {@link Simplifier}) to a {@link Decomposition}.
 * <p>
 * Depth-first over an explicit stack of <code>(factor, index)</code> pairs, starting from <code>(1, root)</code>.
 * The result doesn't depend on traversal order, up to floating-point reordering of the sums.
 */
public final class Decomposer {
    private Decomposer() {
    }

    private record Pending(double factor, int index) {
    }

    /**
     * Decompose an expression that has already been simplified.
     *
     * @param expression a canonical expression
     * @return the decomposition
     * @throws ModelingException with {@link ModelingException.Reason#UNSIMPLIFIED_MULTIPLICATION} if a product
     *                           without a literal left operand is found
     */
    public static Decomposition decompose(Expression expression) {
        var arena = expression.arena();
        var variables = new LinkedHashMap<String, VariableAggregate>();
        var constant = 0.0;
        var stack = new ArrayDeque<Pending>();
        stack.push(new Pending(1.0, arena.rootIndex()));

        while (!stack.isEmpty()) {
            var pending = stack.pop();
            var factor = pending.factor();
            var node = arena.nodeAt(pending.index());

            if (node instanceof Node.VariableRef ref) {
                var variable = ref.variable();
                variables.merge(variable.name(), VariableAggregate.EMPTY.add(factor, variable.bound()),
                        (prev, cur) -> prev.add(cur.coefficient(), cur.bound()));
            } else if (node instanceof Node.Literal literal) {
                constant += factor * literal.value();
            } else if (node instanceof Node.BinaryOp op) {
                switch (op.operator()) {
                    case MULTIPLY -> {
                        if (!(arena.nodeAt(op.left()) instanceof Node.Literal lhs)) {
                            throw new ModelingException(UNSIMPLIFIED_MULTIPLICATION, "Non-simplified multiplication: " +
                                    Expression.render(arena, pending.index()));
                        }
                        stack.push(new Pending(factor * lhs.value(), op.right()));
                    }
                    case ADD -> {
                        stack.push(new Pending(factor, op.right()));
                        stack.push(new Pending(factor, op.left()));
                    }
                    case SUBTRACT -> {
                        stack.push(new Pending(-factor, op.right()));
                        stack.push(new Pending(factor, op.left()));
                    }
                    default -> throw unsupported(arena, pending.index());
                }
            } else {
                throw unsupported(arena, pending.index());
            }
        }

        return new Decomposition(variables, constant);
    }

    /**
     * Simplify a copy of the expression, then decompose it. The argument is left untouched.
     *
     * @param expression any linear expression
     * @return the decomposition
     * @throws ModelingException if the expression is nonlinear
     */
    public static Decomposition simplifyAndDecompose(Expression expression) {
        var copy = expression.copy();
        copy.simplify();
        return decompose(copy);
    }

    /**
     * Reduce an expression that must be constant, such as the right-hand side of a constraint.
     *
     * @param expression an expression without variables
     * @return its value
     * @throws ModelingException with {@link ModelingException.Reason#CONSTANT_NOT_SIMPLIFIED} if the simplified
     *                           expression is not a single literal
     */
    public static double constantOf(Expression expression) {
        var copy = expression.copy();
        copy.simplify();

        if (copy.root() instanceof Node.Literal literal) {
            return literal.value();
        }
        throw new ModelingException(CONSTANT_NOT_SIMPLIFIED, "Not properly simplified, expected a constant: " + copy);
    }

    private static ModelingException unsupported(ExpressionArena arena, int index) {
        return new ModelingException(UNSUPPORTED_EXPRESSION, "Unsupported expression: " +
                Expression.render(arena, index));
    }
}
