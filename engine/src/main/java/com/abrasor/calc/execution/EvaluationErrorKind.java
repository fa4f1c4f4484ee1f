package com.abrasor.calc.execution;

/**
 * Categories of formula evaluation failure.
 */
public enum EvaluationErrorKind {
    /** The formula references an input with no supplied value. */
    UNBOUND_VARIABLE,
    /** The right operand of '/' evaluated to zero. */
    DIVISION_BY_ZERO
}
