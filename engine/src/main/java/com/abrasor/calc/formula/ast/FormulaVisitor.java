package com.abrasor.calc.formula.ast;

/**
 * Visitor over the three formula node shapes.
 *
 * @param <T> The return type of the visitor methods
 */
public interface FormulaVisitor<T> {

    T visitLiteral(FormulaNode.Literal literal);

    T visitVariable(FormulaNode.Variable variable);

    T visitBinaryOp(FormulaNode.BinaryOp binaryOp);
}
