package com.abrasor.calc.calculator;

import com.abrasor.calc.formula.ast.FormulaNode;
import com.abrasor.calc.formula.ast.FormulaVisitor;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The inputs a calculator declares, looked up by name.
 *
 * Used to put display labels on formula variables and to report variables
 * the calculator does not declare. Neither affects parsing or evaluation.
 */
public final class InputCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(InputCatalog.class);

    private static final InputCatalog EMPTY = new InputCatalog(Lists.immutable.empty());

    private final ImmutableList<CalculatorInput> inputs;
    private final ImmutableMap<String, CalculatorInput> byName;

    private InputCatalog(ImmutableList<CalculatorInput> inputs) {
        MutableMap<String, CalculatorInput> map = Maps.mutable.empty();
        for (CalculatorInput input : inputs) {
            if (map.put(input.name(), input) != null) {
                throw new IllegalArgumentException("Input '" + input.name() + "' is declared twice");
            }
        }
        this.inputs = inputs;
        this.byName = map.toImmutable();
    }

    public static InputCatalog of(Iterable<CalculatorInput> inputs) {
        return new InputCatalog(Lists.immutable.withAll(inputs));
    }

    public static InputCatalog of(CalculatorInput... inputs) {
        return new InputCatalog(Lists.immutable.with(inputs));
    }

    public static InputCatalog empty() {
        return EMPTY;
    }

    public ImmutableList<CalculatorInput> inputs() {
        return inputs;
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /**
     * @return The declared input, or null
     */
    public CalculatorInput get(String name) {
        return byName.get(name);
    }

    /**
     * Returns a copy of the formula whose variables carry the labels of the
     * matching declared inputs. Undeclared variables lose any label they had.
     */
    public FormulaNode attachLabels(FormulaNode formula) {
        return formula.accept(new LabelAttacher());
    }

    /**
     * @return Variables the formula uses that this catalog does not declare, in formula order
     */
    public ImmutableList<String> undeclaredVariables(FormulaNode formula) {
        ImmutableList<String> undeclared = FormulaNode.variables(formula).reject(byName::containsKey);
        if (undeclared.notEmpty()) {
            LOGGER.warn("Formula {} uses undeclared inputs {}", formula, undeclared);
        }
        return undeclared;
    }

    private final class LabelAttacher implements FormulaVisitor<FormulaNode> {

        @Override
        public FormulaNode visitLiteral(FormulaNode.Literal literal) {
            return literal;
        }

        @Override
        public FormulaNode visitVariable(FormulaNode.Variable variable) {
            CalculatorInput input = byName.get(variable.name());
            return variable.withLabel(input == null ? null : input.label());
        }

        @Override
        public FormulaNode visitBinaryOp(FormulaNode.BinaryOp binaryOp) {
            FormulaNode left = binaryOp.left().accept(this);
            FormulaNode right = binaryOp.right().accept(this);
            if (left == binaryOp.left() && right == binaryOp.right()) {
                return binaryOp;
            }
            return new FormulaNode.BinaryOp(left, binaryOp.operator(), right);
        }
    }
}
