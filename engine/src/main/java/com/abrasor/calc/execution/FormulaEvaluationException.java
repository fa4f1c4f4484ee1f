package com.abrasor.calc.execution;

/**
 * Exception thrown when a formula cannot produce a number for the given inputs.
 */
public class FormulaEvaluationException extends RuntimeException {

    private final EvaluationErrorKind kind;
    private final String variableName;

    private FormulaEvaluationException(EvaluationErrorKind kind, String message, String variableName) {
        super(message);
        this.kind = kind;
        this.variableName = variableName;
    }

    public static FormulaEvaluationException unboundVariable(String name) {
        return new FormulaEvaluationException(EvaluationErrorKind.UNBOUND_VARIABLE,
                "No value supplied for input '" + name + "'", name);
    }

    public static FormulaEvaluationException divisionByZero() {
        return new FormulaEvaluationException(EvaluationErrorKind.DIVISION_BY_ZERO,
                "Division by zero", null);
    }

    public EvaluationErrorKind getKind() {
        return kind;
    }

    /**
     * @return The unbound input name, or null for other kinds
     */
    public String getVariableName() {
        return variableName;
    }
}
