package com.abrasor.calc.calculator;

import com.abrasor.calc.formula.ast.FormulaNode;

import java.util.Objects;

/**
 * An input field declared by a calculator.
 *
 * @param name         The key formulas refer to, e.g. "vw"
 * @param label        Display name, e.g. "Work Speed"
 * @param unitMetric   Metric unit text, may be empty
 * @param unitImperial Imperial unit text, may be empty
 * @param min          Smallest accepted value, or null
 * @param max          Largest accepted value, or null
 */
public record CalculatorInput(
        String name,
        String label,
        String unitMetric,
        String unitImperial,
        Double min,
        Double max) {

    public CalculatorInput {
        Objects.requireNonNull(name, "Input name cannot be null");
        if (!FormulaNode.isName(name)) {
            throw new IllegalArgumentException("Input name '" + name
                    + "' must start with a letter or '_' and hold only letters, digits and '_'");
        }
        unitMetric = unitMetric == null ? "" : unitMetric;
        unitImperial = unitImperial == null ? "" : unitImperial;
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("Input '" + name + "' has min " + min + " above max " + max);
        }
    }

    public static CalculatorInput of(String name, String label, String unit) {
        return new CalculatorInput(name, label, unit, unit, null, null);
    }

    public CalculatorInput withUnits(String metric, String imperial) {
        return new CalculatorInput(name, label, metric, imperial, min, max);
    }

    public CalculatorInput withRange(Double newMin, Double newMax) {
        return new CalculatorInput(name, label, unitMetric, unitImperial, newMin, newMax);
    }

    public String unit(UnitSystem system) {
        return system == UnitSystem.IMPERIAL ? unitImperial : unitMetric;
    }

    public boolean accepts(double value) {
        return (min == null || value >= min) && (max == null || value <= max);
    }
}
