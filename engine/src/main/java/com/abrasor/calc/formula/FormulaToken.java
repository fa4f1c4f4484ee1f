package com.abrasor.calc.formula;

import com.abrasor.calc.formula.ast.Operator;

import java.util.Objects;

/**
 * One lexical unit of a formula. Tokens carry no position; their order in the
 * sequence is the only location information.
 *
 * @param type The token category
 * @param text The source text of the token
 */
public record FormulaToken(TokenType type, String text) {

    private static final FormulaToken LPAREN = new FormulaToken(TokenType.LPAREN, "(");
    private static final FormulaToken RPAREN = new FormulaToken(TokenType.RPAREN, ")");

    public FormulaToken {
        Objects.requireNonNull(type, "Token type cannot be null");
        Objects.requireNonNull(text, "Token text cannot be null");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Token text cannot be empty");
        }
        if (type == TokenType.OPERATOR && (text.length() != 1 || Operator.fromSymbol(text.charAt(0)) == null)) {
            throw new IllegalArgumentException("Not an operator: " + text);
        }
    }

    public static FormulaToken identifier(String name) {
        return new FormulaToken(TokenType.IDENTIFIER, name);
    }

    public static FormulaToken number(String literal) {
        return new FormulaToken(TokenType.NUMBER, literal);
    }

    public static FormulaToken operator(char symbol) {
        return new FormulaToken(TokenType.OPERATOR, String.valueOf(symbol));
    }

    public static FormulaToken lparen() {
        return LPAREN;
    }

    public static FormulaToken rparen() {
        return RPAREN;
    }

    /**
     * @return The operator this token denotes, or null for non-operator tokens
     */
    public Operator operator() {
        return type == TokenType.OPERATOR ? Operator.fromSymbol(text.charAt(0)) : null;
    }

    public boolean isAdditive() {
        Operator op = operator();
        return op != null && op.precedence() == Operator.ADDITIVE;
    }

    public boolean isMultiplicative() {
        Operator op = operator();
        return op != null && op.precedence() == Operator.MULTIPLICATIVE;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
