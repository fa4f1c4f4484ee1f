package com.abrasor.calc.calculator;

/**
 * Measurement system a calculation is displayed in.
 */
public enum UnitSystem {
    METRIC,
    IMPERIAL
}
