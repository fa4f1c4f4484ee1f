package com.abrasor.calc.calculator;

/**
 * Outcome of running a calculator.
 *
 * @param label The calculator's short name
 * @param value The formula result
 * @param unit  Result unit in the requested unit system
 */
public record CalculationResult(String label, double value, String unit) {
}
