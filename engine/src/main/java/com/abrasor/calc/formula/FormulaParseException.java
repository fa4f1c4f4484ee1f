package com.abrasor.calc.formula;

/**
 * Exception thrown when formula text cannot be turned into an expression tree.
 *
 * <p>Parser errors report the index of the offending token in the token
 * sequence; strict tokenizer errors report the character offset in the text.
 */
public class FormulaParseException extends RuntimeException {

    private final ParseErrorKind kind;
    private final FormulaToken token;
    private final int position;

    public FormulaParseException(ParseErrorKind kind, String message, FormulaToken token, int position) {
        super(message + " at position " + position);
        this.kind = kind;
        this.token = token;
        this.position = position;
    }

    public ParseErrorKind getKind() {
        return kind;
    }

    /**
     * @return The offending token, or null when input ended or the error is lexical
     */
    public FormulaToken getToken() {
        return token;
    }

    public int getPosition() {
        return position;
    }
}
