package com.abrasor.calc.formula;

/**
 * Tunables for formula tokenizing.
 *
 * System properties / environment variables:
 * - abrasor.formula.strict / ABRASOR_FORMULA_STRICT: "true" rejects characters
 *   outside the formula alphabet instead of dropping them (default false)
 *
 * @param strictCharacters Whether unrecognized characters are an error
 */
public record FormulaSettings(boolean strictCharacters) {

    public static final String STRICT_PROPERTY = "abrasor.formula.strict";
    public static final String STRICT_ENV = "ABRASOR_FORMULA_STRICT";

    private static final FormulaSettings DEFAULTS = new FormulaSettings(false);
    private static final FormulaSettings STRICT = new FormulaSettings(true);

    public static FormulaSettings defaults() {
        return DEFAULTS;
    }

    public static FormulaSettings strict() {
        return STRICT;
    }

    /**
     * Resolves settings from the system property, falling back to the
     * environment variable, then to the lenient defaults.
     */
    public static FormulaSettings fromEnvironment() {
        String strict = System.getProperty(STRICT_PROPERTY);
        if (strict == null || strict.isBlank()) {
            strict = System.getenv(STRICT_ENV);
        }
        if (strict == null || strict.isBlank()) {
            return DEFAULTS;
        }
        return Boolean.parseBoolean(strict.trim()) ? STRICT : DEFAULTS;
    }
}
