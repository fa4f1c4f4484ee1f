package com.abrasor.calc.formula;

/**
 * Lexical categories of formula text.
 */
public enum TokenType {
    IDENTIFIER,     // vw, ae, d_eq
    NUMBER,         // 60, 0.2
    OPERATOR,       // + - * /
    LPAREN,         // (
    RPAREN          // )
}
