package com.abrasor.calc.formula;

import com.abrasor.calc.formula.ast.FormulaNode;
import com.abrasor.calc.formula.ast.Operator;
import org.eclipse.collections.api.list.ListIterable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Recursive descent parser for calculator formulas.
 *
 * Grammar:
 *
 * <pre>
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := primary (('*' | '/') primary)*
 * primary        := NUMBER | IDENTIFIER | '(' additive ')'
 * </pre>
 *
 * Both operator tiers fold to the left, so {@code a - b - c} is
 * {@code (a - b) - c}. The whole token sequence must be consumed.
 * Identifiers are not checked against declared inputs here.
 */
public final class FormulaParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormulaParser.class);

    private final ListIterable<FormulaToken> tokens;
    private int pos;

    public FormulaParser(ListIterable<FormulaToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parses a token sequence.
     *
     * @return The tree, or empty when there are no tokens (no formula defined)
     * @throws FormulaParseException if the tokens do not form one expression
     */
    public static Optional<FormulaNode> parse(ListIterable<FormulaToken> tokens) {
        return new FormulaParser(tokens).parseFormula();
    }

    public static Optional<FormulaNode> parse(String text) {
        return parse(FormulaLexer.tokenize(text));
    }

    public static Optional<FormulaNode> parse(String text, FormulaSettings settings) {
        return parse(FormulaLexer.tokenize(text, settings));
    }

    public Optional<FormulaNode> parseFormula() {
        if (tokens.isEmpty()) {
            return Optional.empty();
        }

        FormulaNode node;
        if (tokens.size() == 1) {
            node = parsePrimary();
        } else {
            node = parseAdditive();
            if (!isAtEnd()) {
                if (check(TokenType.RPAREN)) {
                    throw error(ParseErrorKind.UNEXPECTED_TOKEN, "Unmatched ')'");
                }
                throw error(ParseErrorKind.TRAILING_TOKENS, "Unexpected " + current() + " after complete expression");
            }
        }

        LOGGER.debug("Parsed {} tokens into {}", tokens.size(), node);
        return Optional.of(node);
    }

    // ==================== Token Helpers ====================

    private boolean isAtEnd() {
        return pos >= tokens.size();
    }

    private FormulaToken current() {
        return isAtEnd() ? null : tokens.get(pos);
    }

    private boolean check(TokenType type) {
        return !isAtEnd() && current().type() == type;
    }

    private FormulaToken advance() {
        FormulaToken token = current();
        pos++;
        return token;
    }

    private void expect(TokenType type, String what) {
        if (isAtEnd()) {
            throw error(ParseErrorKind.UNEXPECTED_END_OF_INPUT, "Expected " + what + " but input ended");
        }
        if (!check(type)) {
            throw error(ParseErrorKind.UNEXPECTED_TOKEN, "Expected " + what + ", got " + current());
        }
        advance();
    }

    private FormulaParseException error(ParseErrorKind kind, String message) {
        return new FormulaParseException(kind, message, current(), pos);
    }

    // ==================== Expressions ====================

    private FormulaNode parseAdditive() {
        FormulaNode left = parseMultiplicative();
        while (!isAtEnd() && current().isAdditive()) {
            Operator op = advance().operator();
            left = new FormulaNode.BinaryOp(left, op, parseMultiplicative());
        }
        return left;
    }

    private FormulaNode parseMultiplicative() {
        FormulaNode left = parsePrimary();
        while (!isAtEnd() && current().isMultiplicative()) {
            Operator op = advance().operator();
            left = new FormulaNode.BinaryOp(left, op, parsePrimary());
        }
        return left;
    }

    private FormulaNode parsePrimary() {
        if (isAtEnd()) {
            throw error(ParseErrorKind.UNEXPECTED_END_OF_INPUT, "Expected number, input or '(' but input ended");
        }

        FormulaToken token = current();
        switch (token.type()) {
            case NUMBER -> {
                if (!FormulaNode.isNumber(token.text())) {
                    throw error(ParseErrorKind.INVALID_NUMBER, "Malformed number '" + token.text() + "'");
                }
                advance();
                return FormulaNode.literal(token.text());
            }
            case IDENTIFIER -> {
                advance();
                return FormulaNode.variable(token.text());
            }
            case LPAREN -> {
                advance();
                FormulaNode inner = parseAdditive();
                expect(TokenType.RPAREN, "')'");
                return inner;
            }
            default -> throw error(ParseErrorKind.UNEXPECTED_TOKEN, "Expected number, input or '(', got " + token);
        }
    }
}
