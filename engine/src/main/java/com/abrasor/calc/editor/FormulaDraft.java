package com.abrasor.calc.editor;

import com.abrasor.calc.calculator.InputCatalog;
import com.abrasor.calc.formula.FormulaParseException;
import com.abrasor.calc.formula.FormulaParser;
import com.abrasor.calc.formula.FormulaSettings;
import com.abrasor.calc.formula.ast.FormulaNode;
import com.abrasor.calc.render.FormulaRenderer;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;
import java.util.Optional;

/**
 * The state of the formula text field after an edit.
 *
 * Every edit yields a new draft from the full text; a draft never changes.
 * "Nothing entered" and "entered but invalid" are different states.
 */
public sealed interface FormulaDraft permits FormulaDraft.Empty, FormulaDraft.Valid, FormulaDraft.Invalid {

    String text();

    /**
     * @return The parsed formula, present only for a valid draft
     */
    default Optional<FormulaNode> formula() {
        return Optional.empty();
    }

    static FormulaDraft of(String text, InputCatalog catalog) {
        return of(text, catalog, FormulaSettings.defaults());
    }

    static FormulaDraft of(String text, InputCatalog catalog, FormulaSettings settings) {
        String source = text == null ? "" : text;
        Optional<FormulaNode> parsed;
        try {
            parsed = FormulaParser.parse(source, settings);
        } catch (FormulaParseException e) {
            return new Invalid(source, e);
        }
        if (parsed.isEmpty()) {
            return new Empty(source);
        }
        FormulaNode formula = catalog.attachLabels(parsed.get());
        return new Valid(source, formula, FormulaRenderer.render(formula), catalog.undeclaredVariables(formula));
    }

    /**
     * No formula entered yet (blank text, or only dropped characters).
     */
    record Empty(String text) implements FormulaDraft {
    }

    /**
     * @param text          The text as typed
     * @param parsed        The tree, labelled from the catalog
     * @param canonicalText The tree rendered back to text
     * @param undeclared    Variables the calculator does not declare
     */
    record Valid(String text, FormulaNode parsed, String canonicalText, ImmutableList<String> undeclared)
            implements FormulaDraft {
        public Valid {
            Objects.requireNonNull(parsed, "Parsed formula cannot be null");
        }

        @Override
        public Optional<FormulaNode> formula() {
            return Optional.of(parsed);
        }

        public boolean referencesOnlyDeclaredInputs() {
            return undeclared.isEmpty();
        }
    }

    /**
     * The text does not parse; the error is shown to the administrator as is.
     */
    record Invalid(String text, FormulaParseException error) implements FormulaDraft {
        public String message() {
            return error.getMessage();
        }
    }
}
