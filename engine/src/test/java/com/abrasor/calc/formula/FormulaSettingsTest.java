package com.abrasor.calc.formula;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulaSettings Tests")
class FormulaSettingsTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(FormulaSettings.STRICT_PROPERTY);
    }

    @Test
    @DisplayName("Defaults are lenient")
    void testDefaults() {
        assertFalse(FormulaSettings.defaults().strictCharacters());
        assertTrue(FormulaSettings.strict().strictCharacters());
    }

    @Test
    @DisplayName("System property enables strict mode")
    void testPropertyTrue() {
        System.setProperty(FormulaSettings.STRICT_PROPERTY, "true");
        assertEquals(FormulaSettings.strict(), FormulaSettings.fromEnvironment());
    }

    @Test
    @DisplayName("System property is trimmed and case-insensitive")
    void testPropertyCase() {
        System.setProperty(FormulaSettings.STRICT_PROPERTY, " TRUE ");
        assertTrue(FormulaSettings.fromEnvironment().strictCharacters());
    }

    @Test
    @DisplayName("Anything but true is lenient")
    void testPropertyOther() {
        System.setProperty(FormulaSettings.STRICT_PROPERTY, "yes");
        assertFalse(FormulaSettings.fromEnvironment().strictCharacters());
    }
}
