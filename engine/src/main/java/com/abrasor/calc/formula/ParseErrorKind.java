package com.abrasor.calc.formula;

/**
 * Categories of formula syntax errors.
 */
public enum ParseErrorKind {
    /** A token appears where the grammar disallows it. */
    UNEXPECTED_TOKEN,
    /** Input ended while an operand or a closing parenthesis was still expected. */
    UNEXPECTED_END_OF_INPUT,
    /** A complete expression is followed by tokens that were not consumed. */
    TRAILING_TOKENS,
    /** A number token does not match {@code [0-9]+(\.[0-9]+)?}. */
    INVALID_NUMBER,
    /** Strict tokenizing met a character outside the formula alphabet. */
    UNRECOGNIZED_CHARACTER
}
