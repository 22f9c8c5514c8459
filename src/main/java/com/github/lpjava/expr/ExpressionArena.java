package com.github.lpjava.expr;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;

/**
 * Flat, append-only storage of expression {@link Node}s, addressed by index.
 * <p>
 * Every node added becomes the new root, since a parent is always added after its children. Indices are only valid
 * within the arena that issued them. The only in-place mutation is performed by {@link Simplifier}.
 */
public final class ExpressionArena {
    private final List<Node> nodes;
    private int root = -1;

    /**
     * Create an empty arena.
     */
    public ExpressionArena() {
        this.nodes = new ArrayList<>();
    }

    private ExpressionArena(List<Node> nodes, int root) {
        this.nodes = new ArrayList<>(nodes);
        this.root = root;
    }

    /**
     * @param value the constant
     * @return index of the new node
     */
    @CanIgnoreReturnValue
    public int addLiteral(double value) {
        return append(new Node.Literal(value));
    }

    /**
     * @param variable the variable to reference
     * @return index of the new node
     */
    @CanIgnoreReturnValue
    public int addVariable(ContinuousVariable variable) {
        return append(new Node.VariableRef(variable));
    }

    /**
     * @param operator the operator
     * @param left     index of the left operand, which must already be in this arena
     * @param right    index of the right operand, which must already be in this arena
     * @return index of the new node
     * @throws IndexOutOfBoundsException if either index is out of range
     */
    @CanIgnoreReturnValue
    public int addOp(Operator operator, int left, int right) {
        checkElementIndex(left, nodes.size(), "left operand");
        checkElementIndex(right, nodes.size(), "right operand");
        return append(new Node.BinaryOp(operator, left, right));
    }

    /**
     * @param index a node index
     * @return the node at that index
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public Node nodeAt(int index) {
        checkElementIndex(index, nodes.size(), "node index");
        return nodes.get(index);
    }

    /**
     * @return index of the root node
     * @throws IllegalStateException if the arena is empty
     */
    public int rootIndex() {
        checkState(root >= 0, "empty arena");
        return root;
    }

    /**
     * @return the number of nodes, including any no longer reachable from the root
     */
    public int size() {
        return nodes.size();
    }

    /**
     * Append all nodes of <code>other</code> to this arena, shifting their child indices. Used to combine expressions
     * without sharing nodes between arenas.
     *
     * @param other another arena
     * @return the index of <code>other</code>'s root within this arena
     */
    int appendAll(ExpressionArena other) {
        var offset = nodes.size();

        for (var node : other.nodes) {
            if (node instanceof Node.BinaryOp op) {
                nodes.add(new Node.BinaryOp(op.operator(), op.left() + offset, op.right() + offset));
            } else {
                nodes.add(node);
            }
        }
        return other.rootIndex() + offset;
    }

    void set(int index, Node node) {
        checkElementIndex(index, nodes.size(), "node index");
        nodes.set(index, node);
    }

    void setRootIndex(int root) {
        checkElementIndex(root, nodes.size(), "root index");
        this.root = root;
    }

    ExpressionArena copy() {
        return new ExpressionArena(nodes, root);
    }

    private int append(Node node) {
        nodes.add(node);
        root = nodes.size() - 1;
        return root;
    }
}
