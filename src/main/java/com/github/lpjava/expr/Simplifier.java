package com.github.lpjava.expr;

import com.github.lpjava.ModelingException;

import java.util.ArrayDeque;
import java.util.Deque;

import static com.github.lpjava.ModelingException.Reason.NONLINEAR_TERM;
import static com.github.lpjava.expr.Operator.MULTIPLY;

/**
 * <p>
 * Rewrites an expression tree in place into canonical form:
 * </p>
 * <ul>
 *     <li>literal-by-literal operations are folded into a single literal;</li>
 *     <li>every multiplication has a literal on the left, and a variable reference on the right (nested products
 *     are merged, and products over sums or differences are distributed);</li>
 *     <li>multiplication by one, multiplication by zero, and addition of zero are removed.</li>
 * </ul>
 * <p>
 * The traversal is post-order over an explicit stack, so long sums can't exhaust the call stack. Each rewrite
 * preserves the value of the node at its index, so nodes reachable from more than one parent stay consistent. New
 * nodes may be appended while distributing; the root index is left unchanged.
 * </p><p>
 * Simplifying an expression that is already canonical leaves it unchanged.
 * </p>
 */
public final class Simplifier {
    private Simplifier() {
    }

    private record Frame(int index, boolean expanded) {
    }

    /**
     * Simplify the tree reachable from the arena's root.
     *
     * @param arena the arena to rewrite
     * @throws ModelingException with {@link ModelingException.Reason#NONLINEAR_TERM} if a product of two
     *                           non-literal subtrees is found
     */
    public static void simplify(ExpressionArena arena) {
        var root = arena.rootIndex();
        var stack = new ArrayDeque<Frame>();
        stack.push(new Frame(root, false));

        while (!stack.isEmpty()) {
            var frame = stack.pop();

            if (!(arena.nodeAt(frame.index()) instanceof Node.BinaryOp op)) {
                continue;
            }
            if (frame.expanded()) {
                rewrite(arena, frame.index(), op, stack);
            } else {
                // children first
                stack.push(new Frame(frame.index(), true));
                stack.push(new Frame(op.right(), false));
                stack.push(new Frame(op.left(), false));
            }
        }

        arena.setRootIndex(root);
    }

    /**
     * Rewrite one node whose children are already canonical.
     */
    private static void rewrite(ExpressionArena arena, int index, Node.BinaryOp op, Deque<Frame> stack) {
        var left = arena.nodeAt(op.left());
        var right = arena.nodeAt(op.right());

        if (left instanceof Node.Literal l && right instanceof Node.Literal r) {
            arena.set(index, new Node.Literal(op.operator().apply(l.value(), r.value())));
            return;
        }

        switch (op.operator()) {
            case ADD -> {
                if (isZero(left)) {
                    arena.set(index, right);
                } else if (isZero(right)) {
                    arena.set(index, left);
                }
            }
            case SUBTRACT -> {
                if (isZero(right)) {
                    arena.set(index, left);
                }
            }
            case MULTIPLY -> rewriteProduct(arena, index, op, stack);
        }
    }

    private static void rewriteProduct(ExpressionArena arena, int index, Node.BinaryOp op, Deque<Frame> stack) {
        int literalIdx;
        int otherIdx;

        if (arena.nodeAt(op.left()) instanceof Node.Literal) {
            literalIdx = op.left();
            otherIdx = op.right();
        } else if (arena.nodeAt(op.right()) instanceof Node.Literal) {
            literalIdx = op.right();
            otherIdx = op.left();
        } else {
            throw new ModelingException(NONLINEAR_TERM, "Nonlinear term: " +
                    Expression.render(arena, op.left()) + " * " + Expression.render(arena, op.right()));
        }

        var factor = ((Node.Literal) arena.nodeAt(literalIdx)).value();
        var other = arena.nodeAt(otherIdx);

        if (factor == 1.0) {
            arena.set(index, other);
            return;
        }
        if (factor == 0.0) {
            arena.set(index, new Node.Literal(0.0));
            return;
        }

        if (other instanceof Node.BinaryOp inner) {
            switch (inner.operator()) {
                case MULTIPLY -> {
                    // canonical, so the inner literal is on the left
                    if (arena.nodeAt(inner.left()) instanceof Node.Literal innerLiteral) {
                        var product = factor * innerLiteral.value();

                        if (product == 1.0) {
                            arena.set(index, arena.nodeAt(inner.right()));
                        } else if (product == 0.0) {
                            arena.set(index, new Node.Literal(0.0));
                        } else {
                            var merged = arena.addLiteral(product);
                            arena.set(index, new Node.BinaryOp(MULTIPLY, merged, inner.right()));
                        }
                        return;
                    }
                }
                case ADD, SUBTRACT -> {
                    var l = arena.addOp(MULTIPLY, literalIdx, inner.left());
                    var r = arena.addOp(MULTIPLY, literalIdx, inner.right());
                    arena.set(index, new Node.BinaryOp(inner.operator(), l, r));

                    // the new products have canonical children, but may need distributing or folding themselves;
                    // then revisit this node in case an identity appeared.
                    stack.push(new Frame(index, true));
                    stack.push(new Frame(r, true));
                    stack.push(new Frame(l, true));
                    return;
                }
            }
        }

        if (literalIdx != op.left()) {
            arena.set(index, new Node.BinaryOp(MULTIPLY, literalIdx, otherIdx));
        }
    }

    private static boolean isZero(Node node) {
        return node instanceof Node.Literal l && l.value() == 0.0;
    }
}
