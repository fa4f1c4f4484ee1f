package com.abrasor.calc.formula;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Formula lexer.
 *
 * Character classes:
 * - letter or '_' starts an identifier, which continues through letters, digits and '_'
 * - digit starts a number, which continues through digits and at most one '.'
 * - '+', '-', '*', '/', '(', ')' are single-character tokens
 * - anything else separates tokens and is dropped (or rejected in strict mode)
 *
 * The lexer does no grammar checking: "3 4" yields two NUMBER tokens.
 */
public final class FormulaLexer {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormulaLexer.class);

    private final String text;
    private final FormulaSettings settings;
    private int pos;
    private char ch;

    public FormulaLexer(String text) {
        this(text, FormulaSettings.defaults());
    }

    public FormulaLexer(String text, FormulaSettings settings) {
        this.text = text == null ? "" : text;
        this.settings = settings;
        this.pos = 0;
        this.ch = pos < this.text.length() ? this.text.charAt(pos) : '\0';
    }

    public static ImmutableList<FormulaToken> tokenize(String text) {
        return new FormulaLexer(text).tokenize();
    }

    public static ImmutableList<FormulaToken> tokenize(String text, FormulaSettings settings) {
        return new FormulaLexer(text, settings).tokenize();
    }

    /**
     * Scans the whole input.
     *
     * @return The tokens in left-to-right order; empty for blank input
     */
    public ImmutableList<FormulaToken> tokenize() {
        MutableList<FormulaToken> tokens = Lists.mutable.empty();
        while (pos < text.length()) {
            if (isIdentifierStart(ch)) {
                tokens.add(scanIdentifier());
            } else if (isDigit(ch)) {
                tokens.add(scanNumber());
            } else {
                FormulaToken token = scanSymbol();
                if (token != null) {
                    tokens.add(token);
                }
            }
        }
        LOGGER.debug("Tokenized {} characters into {} tokens", text.length(), tokens.size());
        return tokens.toImmutable();
    }

    // ==================== Scanning ====================

    private FormulaToken scanIdentifier() {
        int start = pos;
        while (pos < text.length() && isIdentifierPart(ch)) {
            advance();
        }
        return FormulaToken.identifier(text.substring(start, pos));
    }

    private FormulaToken scanNumber() {
        int start = pos;
        while (pos < text.length() && isDigit(ch)) {
            advance();
        }
        if (pos < text.length() && ch == '.') {
            advance(); // .
            while (pos < text.length() && isDigit(ch)) {
                advance();
            }
        }
        return FormulaToken.number(text.substring(start, pos));
    }

    private FormulaToken scanSymbol() {
        char c = ch;
        int at = pos;
        advance();
        return switch (c) {
            case '+', '-', '*', '/' -> FormulaToken.operator(c);
            case '(' -> FormulaToken.lparen();
            case ')' -> FormulaToken.rparen();
            default -> {
                if (settings.strictCharacters() && !Character.isWhitespace(c)) {
                    LOGGER.warn("Rejecting character '{}' at position {}", c, at);
                    throw new FormulaParseException(ParseErrorKind.UNRECOGNIZED_CHARACTER,
                            "Unrecognized character '" + c + "'", null, at);
                }
                yield null;
            }
        };
    }

    // ==================== Helpers ====================

    private void advance() {
        pos++;
        ch = pos < text.length() ? text.charAt(pos) : '\0';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
