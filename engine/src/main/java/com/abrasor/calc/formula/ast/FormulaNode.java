package com.abrasor.calc.formula.ast;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parsed calculator formula.
 *
 * A node is exactly one of a numeric literal, a reference to a calculator
 * input, or a binary arithmetic operation. Nodes are immutable; editing a
 * formula always produces a new tree.
 */
public sealed interface FormulaNode permits FormulaNode.Literal, FormulaNode.Variable, FormulaNode.BinaryOp {

    Pattern NUMBER = Pattern.compile("[0-9]+(\\.[0-9]+)?");

    Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    <T> T accept(FormulaVisitor<T> visitor);

    /**
     * @return This tree with every variable label removed
     */
    FormulaNode withoutLabels();

    // ==================== Factory Methods ====================

    static Literal literal(String value) {
        return new Literal(value);
    }

    static Variable variable(String name) {
        return new Variable(name, null);
    }

    static Variable variable(String name, String label) {
        return new Variable(name, label);
    }

    static BinaryOp add(FormulaNode left, FormulaNode right) {
        return new BinaryOp(left, Operator.ADD, right);
    }

    static BinaryOp subtract(FormulaNode left, FormulaNode right) {
        return new BinaryOp(left, Operator.SUBTRACT, right);
    }

    static BinaryOp multiply(FormulaNode left, FormulaNode right) {
        return new BinaryOp(left, Operator.MULTIPLY, right);
    }

    static BinaryOp divide(FormulaNode left, FormulaNode right) {
        return new BinaryOp(left, Operator.DIVIDE, right);
    }

    static boolean isNumber(String text) {
        return text != null && NUMBER.matcher(text).matches();
    }

    /**
     * @return Whether the text lexes as a single identifier token
     */
    static boolean isName(String text) {
        return text != null && NAME.matcher(text).matches();
    }

    /**
     * Compares two trees ignoring variable labels, which cannot be recovered
     * from formula text.
     */
    static boolean sameStructure(FormulaNode a, FormulaNode b) {
        return a.withoutLabels().equals(b.withoutLabels());
    }

    /**
     * @return Referenced input names in order of first appearance, left to right
     */
    static ImmutableList<String> variables(FormulaNode node) {
        MutableList<String> names = Lists.mutable.empty();
        collectVariables(node, names);
        return names.distinct().toImmutable();
    }

    private static void collectVariables(FormulaNode node, MutableList<String> names) {
        if (node instanceof Variable v) {
            names.add(v.name());
        } else if (node instanceof BinaryOp op) {
            collectVariables(op.left(), names);
            collectVariables(op.right(), names);
        }
    }

    // ==================== Node Types ====================

    /**
     * Numeric constant, kept as its decimal text until evaluation.
     */
    record Literal(String value) implements FormulaNode {
        public Literal {
            if (!isNumber(value)) {
                throw new IllegalArgumentException("Not a numeric literal: " + value);
            }
        }

        @Override
        public <T> T accept(FormulaVisitor<T> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public FormulaNode withoutLabels() {
            return this;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * Reference to a calculator input. The label is display text only.
     *
     * @param name  The binding key
     * @param label Human-readable input description, may be null
     */
    record Variable(String name, String label) implements FormulaNode {
        public Variable {
            Objects.requireNonNull(name, "Variable name cannot be null");
            if (!isName(name)) {
                throw new IllegalArgumentException("Not a variable name: '" + name + "'");
            }
        }

        public boolean hasLabel() {
            return label != null && !label.isEmpty();
        }

        public Variable withLabel(String newLabel) {
            return Objects.equals(label, newLabel) ? this : new Variable(name, newLabel);
        }

        @Override
        public <T> T accept(FormulaVisitor<T> visitor) {
            return visitor.visitVariable(this);
        }

        @Override
        public FormulaNode withoutLabels() {
            return withLabel(null);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Binary operation: left op right
     */
    record BinaryOp(FormulaNode left, Operator operator, FormulaNode right) implements FormulaNode {
        public BinaryOp {
            Objects.requireNonNull(left, "Left operand cannot be null");
            Objects.requireNonNull(operator, "Operator cannot be null");
            Objects.requireNonNull(right, "Right operand cannot be null");
        }

        @Override
        public <T> T accept(FormulaVisitor<T> visitor) {
            return visitor.visitBinaryOp(this);
        }

        @Override
        public FormulaNode withoutLabels() {
            FormulaNode l = left.withoutLabels();
            FormulaNode r = right.withoutLabels();
            return l == left && r == right ? this : new BinaryOp(l, operator, r);
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.symbol() + " " + right + ")";
        }
    }
}
