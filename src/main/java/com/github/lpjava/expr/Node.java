package com.github.lpjava.expr;

import com.github.lpjava.Util;

import java.util.Objects;

/**
 * A node in an {@link ExpressionArena}. Nodes refer to their children by index into the same arena.
 */
public sealed interface Node permits Node.Literal, Node.VariableRef, Node.BinaryOp {
    /**
     * A numeric constant.
     *
     * @param value the value
     */
    record Literal(double value) implements Node {
        @Override
        public String toString() {
            return Double.isFinite(value) ? Util.format(value) : Double.toString(value);
        }
    }

    /**
     * A reference to a variable. Many nodes may reference the same variable.
     *
     * @param variable the variable
     */
    record VariableRef(ContinuousVariable variable) implements Node {
        /**
         * @param variable the variable
         */
        public VariableRef {
            Objects.requireNonNull(variable, "variable");
        }

        @Override
        public String toString() {
            return variable.name();
        }
    }

    /**
     * A binary operation over two child nodes.
     *
     * @param operator the operator
     * @param left     index of the left operand
     * @param right    index of the right operand
     */
    record BinaryOp(Operator operator, int left, int right) implements Node {
        /**
         * @param operator the operator
         * @param left     index of the left operand
         * @param right    index of the right operand
         */
        public BinaryOp {
            Objects.requireNonNull(operator, "operator");
        }

        @Override
        public String toString() {
            return "#" + left + " " + operator.symbol() + " #" + right;
        }
    }
}
