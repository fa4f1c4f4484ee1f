package com.abrasor.calc.serialization;

/**
 * Exception thrown when a persisted formula tree cannot be read.
 */
public class FormulaJsonException extends RuntimeException {

    public FormulaJsonException(String message) {
        super(message);
    }

    public FormulaJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
