package com.abrasor.calc.execution;

import com.abrasor.calc.formula.ast.FormulaNode;
import com.abrasor.calc.formula.ast.FormulaVisitor;
import com.abrasor.calc.formula.ast.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Evaluates a formula tree against input values.
 *
 * Evaluation walks the tree on every call; nothing is cached or folded.
 * The left operand is evaluated before the right, so the first failure in
 * reading order is the one reported.
 */
public final class FormulaEvaluator implements FormulaVisitor<Double> {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormulaEvaluator.class);

    private final Map<String, ? extends Number> bindings;

    public FormulaEvaluator(Map<String, ? extends Number> bindings) {
        this.bindings = bindings == null ? Map.of() : bindings;
    }

    /**
     * @throws FormulaEvaluationException for an unbound input or a zero divisor
     */
    public static double evaluate(FormulaNode formula, Map<String, ? extends Number> bindings) {
        double result = formula.accept(new FormulaEvaluator(bindings));
        LOGGER.debug("Evaluated {} = {}", formula, result);
        return result;
    }

    @Override
    public Double visitLiteral(FormulaNode.Literal literal) {
        return Double.parseDouble(literal.value());
    }

    @Override
    public Double visitVariable(FormulaNode.Variable variable) {
        Number value = bindings.get(variable.name());
        if (value == null) {
            throw FormulaEvaluationException.unboundVariable(variable.name());
        }
        return value.doubleValue();
    }

    @Override
    public Double visitBinaryOp(FormulaNode.BinaryOp binaryOp) {
        double left = binaryOp.left().accept(this);
        double right = binaryOp.right().accept(this);
        if (binaryOp.operator() == Operator.DIVIDE && right == 0.0) {
            throw FormulaEvaluationException.divisionByZero();
        }
        return binaryOp.operator().apply(left, right);
    }
}
