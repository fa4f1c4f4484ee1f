package com.abrasor.calc.execution;

import com.abrasor.calc.formula.FormulaParser;
import com.abrasor.calc.formula.ast.FormulaNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FormulaEvaluator, run on parsed formulas.
 */
@DisplayName("FormulaEvaluator Tests")
class FormulaEvaluatorTest {

    private static double eval(String formula, Map<String, ? extends Number> values) {
        return FormulaEvaluator.evaluate(FormulaParser.parse(formula).orElseThrow(), values);
    }

    @Nested
    @DisplayName("Arithmetic")
    class Arithmetic {

        @Test
        @DisplayName("Removal rate from workpiece speed and depth of cut")
        void testRemovalRate() {
            assertEquals(0.1, eval("vw * ae / 60", Map.of("vw", 30, "ae", 0.2)), 1e-12);
        }

        @Test
        @DisplayName("Precedence is honored")
        void testPrecedence() {
            assertEquals(7.0, eval("1 + 2 * 3", Map.of()));
            assertEquals(9.0, eval("(1 + 2) * 3", Map.of()));
        }

        @Test
        @DisplayName("Left associativity is honored")
        void testAssociativity() {
            assertEquals(-4.0, eval("1 - 2 - 3", Map.of()));
            assertEquals(2.0, eval("12 / 3 / 2", Map.of()));
            assertEquals(8.0, eval("12 / (3 / 2)", Map.of()));
        }

        @Test
        @DisplayName("Decimal literals")
        void testDecimals() {
            assertEquals(0.75, eval("0.25 * 3", Map.of()), 1e-12);
        }

        @Test
        @DisplayName("Extra bindings are ignored")
        void testExtraBindings() {
            assertEquals(5.0, eval("a", Map.of("a", 5, "b", 99)));
        }

        @Test
        @DisplayName("Results may be negative or fractional")
        void testNegativeResult() {
            assertEquals(-0.5, eval("a - b / c", Map.of("a", 1, "b", 3, "c", 2)));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Zero divisor")
        void testDivisionByZero() {
            FormulaEvaluationException e = assertThrows(FormulaEvaluationException.class,
                    () -> eval("a / (b - b)", Map.of("a", 1, "b", 4)));
            assertEquals(EvaluationErrorKind.DIVISION_BY_ZERO, e.getKind());
            assertNull(e.getVariableName());
        }

        @Test
        @DisplayName("Zero dividend is fine")
        void testZeroDividend() {
            assertEquals(0.0, eval("0 / 5", Map.of()));
        }

        @Test
        @DisplayName("Missing input")
        void testUnboundVariable() {
            FormulaEvaluationException e = assertThrows(FormulaEvaluationException.class,
                    () -> eval("vw * ae", Map.of("vw", 30)));
            assertEquals(EvaluationErrorKind.UNBOUND_VARIABLE, e.getKind());
            assertEquals("ae", e.getVariableName());
            assertTrue(e.getMessage().contains("'ae'"));
        }

        @Test
        @DisplayName("Null value counts as missing")
        void testNullValue() {
            Map<String, Double> values = new HashMap<>();
            values.put("x", null);
            FormulaEvaluationException e = assertThrows(FormulaEvaluationException.class,
                    () -> eval("x + 1", values));
            assertEquals(EvaluationErrorKind.UNBOUND_VARIABLE, e.getKind());
        }

        @Test
        @DisplayName("Left operand fails first")
        void testLeftFirst() {
            FormulaEvaluationException e = assertThrows(FormulaEvaluationException.class,
                    () -> eval("(a / 0) + b", Map.of()));
            assertEquals("a", e.getVariableName());

            FormulaEvaluationException zero = assertThrows(FormulaEvaluationException.class,
                    () -> eval("(1 / 0) + b", Map.of()));
            assertEquals(EvaluationErrorKind.DIVISION_BY_ZERO, zero.getKind());
        }

        @Test
        @DisplayName("Null bindings are treated as empty")
        void testNullBindings() {
            FormulaNode node = FormulaNode.variable("a");
            assertThrows(FormulaEvaluationException.class, () -> FormulaEvaluator.evaluate(node, null));
            assertEquals(2.0, FormulaEvaluator.evaluate(FormulaNode.literal("2"), null));
        }
    }
}
