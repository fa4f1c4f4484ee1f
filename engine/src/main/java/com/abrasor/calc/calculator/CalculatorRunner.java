package com.abrasor.calc.calculator;

import com.abrasor.calc.execution.FormulaEvaluationException;
import com.abrasor.calc.execution.FormulaEvaluator;
import com.abrasor.calc.formula.ast.FormulaNode;
import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.map.MutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Runs a calculator's formula on values entered by an end user.
 *
 * Only declared inputs are bound; a value supplied for any other name is
 * ignored, so a formula that refers to an undeclared input fails as unbound.
 */
public final class CalculatorRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(CalculatorRunner.class);

    private CalculatorRunner() {
    }

    /**
     * @param definition The calculator to run
     * @param values     Entered values by input name
     * @param unitSystem Unit system for the result unit
     * @throws IllegalStateException      if the calculator is disabled or has no formula
     * @throws IllegalArgumentException   if a value lies outside its input's declared range
     * @throws FormulaEvaluationException if an input is missing or a divisor is zero
     */
    public static CalculationResult calculate(
            CalculatorDefinition definition,
            Map<String, ? extends Number> values,
            UnitSystem unitSystem) {
        if (!definition.enabled()) {
            throw new IllegalStateException("Calculator '" + definition.id() + "' is disabled");
        }
        FormulaNode formula = definition.formulaIfDefined()
                .orElseThrow(() -> new IllegalStateException(
                        "Calculator '" + definition.id() + "' has no formula"));

        MutableMap<String, Double> bindings = Maps.mutable.empty();
        for (CalculatorInput input : definition.inputs()) {
            Number value = values.get(input.name());
            if (value == null) {
                continue;
            }
            double v = value.doubleValue();
            if (!input.accepts(v)) {
                throw new IllegalArgumentException("Value " + v + " for '" + input.name()
                        + "' is outside [" + input.min() + ", " + input.max() + "]");
            }
            bindings.put(input.name(), v);
        }

        double result = FormulaEvaluator.evaluate(formula, bindings);
        LOGGER.debug("Calculator '{}' produced {} from {}", definition.id(), result, bindings);
        return new CalculationResult(definition.shortName(), result, definition.resultUnit(unitSystem));
    }
}
