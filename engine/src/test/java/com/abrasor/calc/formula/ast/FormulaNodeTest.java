package com.abrasor.calc.formula.ast;

import org.eclipse.collections.api.factory.Lists;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.abrasor.calc.formula.ast.FormulaNode.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulaNode Tests")
class FormulaNodeTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Literals accept plain decimal text")
        void testLiteralValues() {
            assertEquals("60", literal("60").value());
            assertEquals("0.25", literal("0.25").value());
        }

        @Test
        @DisplayName("Literals reject malformed numbers")
        void testLiteralRejects() {
            assertThrows(IllegalArgumentException.class, () -> literal("3."));
            assertThrows(IllegalArgumentException.class, () -> literal(".5"));
            assertThrows(IllegalArgumentException.class, () -> literal("-1"));
            assertThrows(IllegalArgumentException.class, () -> literal("1e3"));
            assertThrows(IllegalArgumentException.class, () -> literal(null));
        }

        @Test
        @DisplayName("Variables need a name")
        void testVariableName() {
            assertThrows(NullPointerException.class, () -> variable(null));
            assertThrows(IllegalArgumentException.class, () -> variable(""));
        }

        @Test
        @DisplayName("Variable names must lex as one identifier")
        void testVariableNameShape() {
            assertThrows(IllegalArgumentException.class, () -> variable("60"));
            assertThrows(IllegalArgumentException.class, () -> variable("v-w"));
            assertThrows(IllegalArgumentException.class, () -> variable("2ae"));
            assertThrows(IllegalArgumentException.class, () -> variable("d s", "Diameter"));
            assertEquals("_d2", variable("_d2").name());
        }

        @Test
        @DisplayName("Operations need both operands")
        void testBinaryOpOperands() {
            assertThrows(NullPointerException.class, () -> add(null, literal("1")));
            assertThrows(NullPointerException.class, () -> new BinaryOp(literal("1"), null, literal("2")));
        }
    }

    @Nested
    @DisplayName("Utilities")
    class Utilities {

        @Test
        @DisplayName("Fully parenthesized debug form")
        void testToString() {
            assertEquals("((vw * ae) / 60)", divide(multiply(variable("vw"), variable("ae")), literal("60")).toString());
        }

        @Test
        @DisplayName("Variables are listed once in order of first appearance")
        void testVariables() {
            FormulaNode node = add(multiply(variable("b"), variable("a")), divide(variable("b"), variable("c")));
            assertEquals(Lists.immutable.with("b", "a", "c"), FormulaNode.variables(node));
        }

        @Test
        @DisplayName("A literal has no variables")
        void testNoVariables() {
            assertTrue(FormulaNode.variables(literal("1")).isEmpty());
        }

        @Test
        @DisplayName("Labels do not affect structural comparison")
        void testSameStructure() {
            FormulaNode labelled = multiply(variable("vw", "Workpiece speed"), literal("2"));
            FormulaNode plain = multiply(variable("vw"), literal("2"));
            assertNotEquals(labelled, plain);
            assertTrue(FormulaNode.sameStructure(labelled, plain));
            assertEquals(plain, labelled.withoutLabels());
        }

        @Test
        @DisplayName("Different shapes are not the same structure")
        void testDifferentStructure() {
            assertFalse(FormulaNode.sameStructure(
                    subtract(subtract(variable("a"), variable("b")), variable("c")),
                    subtract(variable("a"), subtract(variable("b"), variable("c")))));
        }

        @Test
        @DisplayName("Unlabelled trees are returned as is")
        void testWithoutLabelsIdentity() {
            FormulaNode plain = add(variable("a"), literal("1"));
            assertSame(plain, plain.withoutLabels());
        }

        @Test
        @DisplayName("Operator lookup by symbol")
        void testOperatorSymbols() {
            assertEquals(Operator.DIVIDE, Operator.fromSymbol('/'));
            assertNull(Operator.fromSymbol('%'));
            assertTrue(Operator.MULTIPLY.precedence() > Operator.SUBTRACT.precedence());
            assertEquals(6.0, Operator.MULTIPLY.apply(2, 3));
        }
    }
}
