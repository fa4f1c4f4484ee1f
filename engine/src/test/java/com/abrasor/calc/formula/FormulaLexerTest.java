package com.abrasor.calc.formula;

import org.eclipse.collections.api.list.ImmutableList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FormulaLexer - formula text to tokens.
 */
@DisplayName("FormulaLexer Tests")
class FormulaLexerTest {

    private static List<FormulaToken> lex(String text) {
        return FormulaLexer.tokenize(text).castToList();
    }

    @Nested
    @DisplayName("Token classes")
    class TokenClasses {

        @Test
        @DisplayName("Calculator formula")
        void testTypicalFormula() {
            assertEquals(List.of(
                    FormulaToken.identifier("vw"),
                    FormulaToken.operator('*'),
                    FormulaToken.identifier("ae"),
                    FormulaToken.operator('/'),
                    FormulaToken.number("60")), lex("vw * ae / 60"));
        }

        @Test
        @DisplayName("Identifiers take letters, digits and underscores after the first character")
        void testIdentifierCharacters() {
            assertEquals(List.of(FormulaToken.identifier("d_eq2"), FormulaToken.identifier("_x")), lex("d_eq2 _x"));
        }

        @Test
        @DisplayName("Digits cannot start an identifier")
        void testDigitThenLetters() {
            assertEquals(List.of(FormulaToken.number("2"), FormulaToken.identifier("ae")), lex("2ae"));
        }

        @Test
        @DisplayName("Decimal numbers")
        void testDecimal() {
            assertEquals(List.of(FormulaToken.number("0.25"), FormulaToken.number("1000")), lex("0.25 1000"));
        }

        @Test
        @DisplayName("A number takes at most one dot")
        void testSecondDotEndsNumber() {
            assertEquals(List.of(FormulaToken.number("1.2"), FormulaToken.number("3")), lex("1.2.3"));
        }

        @Test
        @DisplayName("Trailing dot stays in the number token")
        void testTrailingDot() {
            assertEquals(List.of(FormulaToken.number("3.")), lex("3."));
        }

        @Test
        @DisplayName("Operators and parentheses need no spaces")
        void testNoWhitespace() {
            assertEquals(List.of(
                    FormulaToken.lparen(),
                    FormulaToken.identifier("a"),
                    FormulaToken.operator('+'),
                    FormulaToken.identifier("b"),
                    FormulaToken.rparen(),
                    FormulaToken.operator('-'),
                    FormulaToken.number("2")), lex("(a+b)-2"));
        }
    }

    @Nested
    @DisplayName("Separators")
    class Separators {

        @Test
        @DisplayName("Empty and blank input give no tokens")
        void testBlank() {
            assertTrue(lex("").isEmpty());
            assertTrue(lex("  \t\n ").isEmpty());
            assertTrue(lex(null).isEmpty());
        }

        @Test
        @DisplayName("Unrecognized characters are dropped")
        void testDroppedCharacters() {
            assertEquals(List.of(
                    FormulaToken.identifier("vw"),
                    FormulaToken.operator('*'),
                    FormulaToken.identifier("ae")), lex("vw × * ae ;"));
        }

        @Test
        @DisplayName("A dropped character still separates tokens")
        void testDroppedCharacterSeparates() {
            assertEquals(List.of(FormulaToken.identifier("a"), FormulaToken.identifier("b")), lex("a$b"));
        }

        @Test
        @DisplayName("Grammar is not checked")
        void testAdjacentNumbers() {
            assertEquals(2, lex("3 4").size());
        }
    }

    @Nested
    @DisplayName("Strict mode")
    class StrictMode {

        @Test
        @DisplayName("Rejects the first unrecognized character with its position")
        void testRejects() {
            FormulaParseException e = assertThrows(FormulaParseException.class,
                    () -> FormulaLexer.tokenize("vw % 2", FormulaSettings.strict()));
            assertEquals(ParseErrorKind.UNRECOGNIZED_CHARACTER, e.getKind());
            assertEquals(3, e.getPosition());
            assertNull(e.getToken());
        }

        @Test
        @DisplayName("Whitespace is still allowed")
        void testWhitespaceAllowed() {
            ImmutableList<FormulaToken> tokens = FormulaLexer.tokenize(" vw\t*\nae ", FormulaSettings.strict());
            assertEquals(3, tokens.size());
        }
    }
}
