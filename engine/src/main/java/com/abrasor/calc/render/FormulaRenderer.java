package com.abrasor.calc.render;

import com.abrasor.calc.formula.ast.FormulaNode;
import com.abrasor.calc.formula.ast.FormulaVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a formula tree back to formula text.
 *
 * Operands are separated from operators by single spaces. A child operation
 * is parenthesized when re-parsing the text without parentheses would give a
 * different tree:
 * - a lower-precedence child, e.g. {@code (a + b) * c}
 * - an equal-precedence right child, e.g. {@code a - (b - c)}
 *
 * Labels are not rendered; a variable renders as its name.
 */
public final class FormulaRenderer implements FormulaVisitor<String> {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormulaRenderer.class);

    public static final FormulaRenderer INSTANCE = new FormulaRenderer();

    private FormulaRenderer() {
    }

    public static String render(FormulaNode formula) {
        String text = formula.accept(INSTANCE);
        LOGGER.debug("Rendered {} as '{}'", formula, text);
        return text;
    }

    @Override
    public String visitLiteral(FormulaNode.Literal literal) {
        return literal.value();
    }

    @Override
    public String visitVariable(FormulaNode.Variable variable) {
        return variable.name();
    }

    @Override
    public String visitBinaryOp(FormulaNode.BinaryOp binaryOp) {
        int precedence = binaryOp.operator().precedence();
        String left = renderOperand(binaryOp.left(), precedence, false);
        String right = renderOperand(binaryOp.right(), precedence, true);
        return left + " " + binaryOp.operator().symbol() + " " + right;
    }

    private String renderOperand(FormulaNode operand, int parentPrecedence, boolean rightSide) {
        String text = operand.accept(this);
        if (operand instanceof FormulaNode.BinaryOp child) {
            int childPrecedence = child.operator().precedence();
            if (childPrecedence < parentPrecedence || (rightSide && childPrecedence == parentPrecedence)) {
                return "(" + text + ")";
            }
        }
        return text;
    }
}
