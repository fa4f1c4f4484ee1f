package com.abrasor.calc.editor;

import com.abrasor.calc.calculator.CalculatorInput;
import com.abrasor.calc.formula.ast.FormulaNode;
import com.abrasor.calc.formula.ast.Operator;

import java.util.Objects;

/**
 * A palette item the formula builder can append to the formula text.
 *
 * @param kind  What the item inserts
 * @param value The text inserted
 * @param label Display text for the palette, may equal the value
 */
public record FormulaElement(Kind kind, String value, String label) {

    public enum Kind {
        /** {@code + - * /} and parentheses */
        OPERATOR,
        NUMBER,
        INPUT
    }

    public FormulaElement {
        Objects.requireNonNull(kind, "Element kind cannot be null");
        Objects.requireNonNull(value, "Element value cannot be null");
        label = label == null ? value : label;
    }

    public static FormulaElement operator(Operator op) {
        String symbol = String.valueOf(op.symbol());
        return new FormulaElement(Kind.OPERATOR, symbol, symbol);
    }

    public static FormulaElement openParen() {
        return new FormulaElement(Kind.OPERATOR, "(", "(");
    }

    public static FormulaElement closeParen() {
        return new FormulaElement(Kind.OPERATOR, ")", ")");
    }

    public static FormulaElement number(String literal) {
        if (!FormulaNode.isNumber(literal)) {
            throw new IllegalArgumentException("Not a numeric literal: " + literal);
        }
        return new FormulaElement(Kind.NUMBER, literal, literal);
    }

    public static FormulaElement input(CalculatorInput input) {
        return new FormulaElement(Kind.INPUT, input.name(), input.label());
    }

    public boolean isOpenParen() {
        return kind == Kind.OPERATOR && "(".equals(value);
    }

    public boolean isCloseParen() {
        return kind == Kind.OPERATOR && ")".equals(value);
    }
}
