package com.abrasor.calc.formula.ast;

/**
 * The four binary arithmetic operators of the formula language.
 */
public enum Operator {
    ADD('+', Operator.ADDITIVE),
    SUBTRACT('-', Operator.ADDITIVE),
    MULTIPLY('*', Operator.MULTIPLICATIVE),
    DIVIDE('/', Operator.MULTIPLICATIVE);

    public static final int ADDITIVE = 1;
    public static final int MULTIPLICATIVE = 2;

    private final char symbol;
    private final int precedence;

    Operator(char symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * @return Binding strength; higher binds tighter
     */
    public int precedence() {
        return precedence;
    }

    /**
     * Plain IEEE arithmetic. Division by zero is not checked here.
     */
    public double apply(double left, double right) {
        return switch (this) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> left / right;
        };
    }

    /**
     * @return The operator for the symbol, or null if it is not one
     */
    public static Operator fromSymbol(char symbol) {
        for (Operator op : values()) {
            if (op.symbol == symbol) {
                return op;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
