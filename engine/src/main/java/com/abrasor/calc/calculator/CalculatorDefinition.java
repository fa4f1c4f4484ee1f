package com.abrasor.calc.calculator;

import com.abrasor.calc.formula.ast.FormulaNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A calculator as configured by an administrator.
 *
 * @param id                 Stable identifier
 * @param name               Full name, e.g. "Speed Ratio"
 * @param shortName          Result label, e.g. "Qs"
 * @param description        Free text, may be empty
 * @param categories         Grinding process categories the calculator is listed under
 * @param inputs             Declared input fields
 * @param formula            The formula, or null while none is defined
 * @param resultUnitMetric   Result unit for metric display
 * @param resultUnitImperial Result unit for imperial display
 * @param enabled            Whether end users may run it
 */
public record CalculatorDefinition(
        String id,
        String name,
        String shortName,
        String description,
        List<String> categories,
        List<CalculatorInput> inputs,
        FormulaNode formula,
        String resultUnitMetric,
        String resultUnitImperial,
        boolean enabled) {

    public CalculatorDefinition {
        Objects.requireNonNull(id, "Calculator id cannot be null");
        Objects.requireNonNull(name, "Calculator name cannot be null");
        shortName = shortName == null || shortName.isBlank() ? name : shortName;
        description = description == null ? "" : description;
        categories = categories == null ? List.of() : List.copyOf(categories);
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        resultUnitMetric = resultUnitMetric == null ? "" : resultUnitMetric;
        resultUnitImperial = resultUnitImperial == null ? resultUnitMetric : resultUnitImperial;
    }

    public Optional<FormulaNode> formulaIfDefined() {
        return Optional.ofNullable(formula);
    }

    /**
     * @return A copy holding the given formula, with labels taken from the declared inputs
     */
    public CalculatorDefinition withFormula(FormulaNode newFormula) {
        FormulaNode labelled = newFormula == null ? null : catalog().attachLabels(newFormula);
        return new CalculatorDefinition(id, name, shortName, description, categories, inputs,
                labelled, resultUnitMetric, resultUnitImperial, enabled);
    }

    public CalculatorDefinition withEnabled(boolean newEnabled) {
        return new CalculatorDefinition(id, name, shortName, description, categories, inputs,
                formula, resultUnitMetric, resultUnitImperial, newEnabled);
    }

    public String resultUnit(UnitSystem system) {
        return system == UnitSystem.IMPERIAL ? resultUnitImperial : resultUnitMetric;
    }

    public InputCatalog catalog() {
        return InputCatalog.of(inputs);
    }
}
