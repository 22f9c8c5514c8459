package com.github.lpjava.expr;

import com.github.lpjava.model.Comparison;
import com.github.lpjava.model.Constraint;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

import static com.github.lpjava.expr.Operator.ADD;
import static com.github.lpjava.expr.Operator.MULTIPLY;
import static com.github.lpjava.expr.Operator.SUBTRACT;
import static com.google.common.base.Preconditions.checkArgument;

/**
 * A linear expression: an {@link ExpressionArena} plus the index of its root node.
 * <p>
 * The combinators ({@link #plus(Expression)}, {@link #times(double)}, etc.) never modify their operands; they copy
 * both arenas into a new one. {@link #simplify()} is the only operation that rewrites an expression in place.
 */
public final class Expression {
    private final ExpressionArena arena;

    /**
     * Wrap an arena that already has a root.
     *
     * @param arena a non-empty arena
     */
    public Expression(ExpressionArena arena) {
        checkArgument(arena.size() > 0, "empty arena");
        this.arena = arena;
    }

    /**
     * @param value the constant
     * @return an expression consisting of a single literal
     */
    public static Expression literal(double value) {
        var arena = new ExpressionArena();
        arena.addLiteral(value);
        return new Expression(arena);
    }

    /**
     * @param variable the variable
     * @return an expression consisting of a single variable reference
     */
    public static Expression variable(ContinuousVariable variable) {
        var arena = new ExpressionArena();
        arena.addVariable(variable);
        return new Expression(arena);
    }

    /**
     * Sum a collection of expressions into a single arena. Unlike chaining {@link #plus(Expression)}, this copies
     * each term only once, so it's suitable for sums over many terms.
     *
     * @param terms the terms; if empty, the result is the literal 0
     * @return the sum
     */
    public static Expression sum(Collection<Expression> terms) {
        if (terms.isEmpty()) {
            return literal(0.0);
        }
        var arena = new ExpressionArena();
        var acc = -1;

        for (var term : terms) {
            var idx = arena.appendAll(term.arena);
            acc = acc < 0 ? idx : arena.addOp(ADD, acc, idx);
        }
        arena.setRootIndex(acc);
        return new Expression(arena);
    }

    /**
     * @param other right operand
     * @return <code>this + other</code>
     */
    public Expression plus(Expression other) {
        return combine(ADD, other);
    }

    /**
     * @param value right operand
     * @return <code>this + value</code>
     */
    public Expression plus(double value) {
        return combine(ADD, literal(value));
    }

    /**
     * @param other right operand
     * @return <code>this - other</code>
     */
    public Expression minus(Expression other) {
        return combine(SUBTRACT, other);
    }

    /**
     * @param value right operand
     * @return <code>this - value</code>
     */
    public Expression minus(double value) {
        return combine(SUBTRACT, literal(value));
    }

    /**
     * Multiply by another expression. At least one side must reduce to a literal, or {@link #simplify()} will reject
     * the result as nonlinear.
     *
     * @param other right operand
     * @return <code>this * other</code>
     */
    public Expression times(Expression other) {
        return combine(MULTIPLY, other);
    }

    /**
     * @param value right operand
     * @return <code>this * value</code>
     */
    public Expression times(double value) {
        return combine(MULTIPLY, literal(value));
    }

    /**
     * @param other right-hand side
     * @return the constraint <code>this - other &lt;= 0</code>
     */
    public Constraint le(Expression other) {
        return new Constraint(minus(other), Comparison.LESS_OR_EQUAL, literal(0.0));
    }

    /**
     * @param value right-hand side
     * @return the constraint <code>this &lt;= value</code>
     */
    public Constraint le(double value) {
        return new Constraint(this, Comparison.LESS_OR_EQUAL, literal(value));
    }

    /**
     * @param other right-hand side
     * @return the constraint <code>this - other &gt;= 0</code>
     */
    public Constraint ge(Expression other) {
        return new Constraint(minus(other), Comparison.GREATER_OR_EQUAL, literal(0.0));
    }

    /**
     * @param value right-hand side
     * @return the constraint <code>this &gt;= value</code>
     */
    public Constraint ge(double value) {
        return new Constraint(this, Comparison.GREATER_OR_EQUAL, literal(value));
    }

    /**
     * @param other right-hand side
     * @return the constraint <code>this - other = 0</code>
     */
    public Constraint eq(Expression other) {
        return new Constraint(minus(other), Comparison.EQUAL, literal(0.0));
    }

    /**
     * @param value right-hand side
     * @return the constraint <code>this = value</code>
     */
    public Constraint eq(double value) {
        return new Constraint(this, Comparison.EQUAL, literal(value));
    }

    /**
     * Rewrite this expression in place into canonical form.
     *
     * @throws com.github.lpjava.ModelingException if the expression is nonlinear
     * @see Simplifier
     */
    public void simplify() {
        Simplifier.simplify(arena);
    }

    /**
     * @return an independent copy, which can be simplified without affecting this expression
     */
    public Expression copy() {
        return new Expression(arena.copy());
    }

    /**
     * @return the underlying arena
     */
    public ExpressionArena arena() {
        return arena;
    }

    /**
     * @return index of the root node
     */
    public int rootIndex() {
        return arena.rootIndex();
    }

    /**
     * @return the root node
     */
    public Node root() {
        return arena.nodeAt(arena.rootIndex());
    }

    /**
     * The distinct variables referenced by this expression, by name, in left-to-right order of first occurrence.
     * When the same name occurs with different bounds, the first occurrence is returned.
     *
     * @return an unmodifiable map
     */
    public Map<String, ContinuousVariable> variables() {
        var result = new LinkedHashMap<String, ContinuousVariable>();
        forEachVariable(variable -> result.putIfAbsent(variable.name(), variable));
        return Collections.unmodifiableMap(result);
    }

    /**
     * The bound of each variable referenced by this expression: the intersection of the bounds of all its
     * occurrences.
     *
     * @return an unmodifiable map, in left-to-right order of first occurrence
     */
    public Map<String, Bound> bounds() {
        var result = new LinkedHashMap<String, Bound>();
        forEachVariable(variable -> result.merge(variable.name(), variable.bound(), Bound::intersect));
        return Collections.unmodifiableMap(result);
    }

    private void forEachVariable(Consumer<ContinuousVariable> action) {
        var stack = new ArrayDeque<Integer>();
        stack.push(arena.rootIndex());

        while (!stack.isEmpty()) {
            var node = arena.nodeAt(stack.pop());

            if (node instanceof Node.VariableRef ref) {
                action.accept(ref.variable());
            } else if (node instanceof Node.BinaryOp op) {
                stack.push(op.right());
                stack.push(op.left());
            }
        }
    }

    private Expression combine(Operator operator, Expression other) {
        var combined = arena.copy();
        var left = combined.rootIndex();
        var right = combined.appendAll(other.arena);

        combined.addOp(operator, left, right);
        return new Expression(combined);
    }

    /**
     * Render the tree reachable from the root, fully parenthesized.
     */
    @Override
    public String toString() {
        return render(arena, arena.rootIndex());
    }

    static String render(ExpressionArena arena, int index) {
        var sb = new StringBuilder();
        var stack = new ArrayDeque<Object>(); // either a String to emit, or a node index to expand
        stack.push(index);

        while (!stack.isEmpty()) {
            var item = stack.pop();

            if (item instanceof String s) {
                sb.append(s);
                continue;
            }
            var node = arena.nodeAt((Integer) item);

            if (node instanceof Node.BinaryOp op) {
                stack.push(")");
                stack.push(op.right());
                stack.push(" " + op.operator().symbol() + " ");
                stack.push(op.left());
                stack.push("(");
            } else {
                sb.append(node);
            }
        }
        return sb.toString();
    }
}
