package com.abrasor.calc.editor;

/**
 * Appends palette elements to formula text with the spacing the typed form
 * uses, so a built formula reads like one entered by hand.
 */
public final class FormulaComposer {

    private FormulaComposer() {
    }

    public static String append(String currentText, FormulaElement element) {
        String text = currentText == null ? "" : currentText;
        if (text.isEmpty()) {
            return element.value();
        }

        StringBuilder sb = new StringBuilder(text);
        boolean spaced = text.endsWith(" ") || text.endsWith("(");
        if (element.kind() == FormulaElement.Kind.OPERATOR) {
            if (!element.isOpenParen() && !spaced) {
                sb.append(' ');
            }
            sb.append(element.value());
            if (!element.isOpenParen() && !element.isCloseParen()) {
                sb.append(' ');
            }
        } else {
            if (!spaced) {
                sb.append(' ');
            }
            sb.append(element.value());
        }
        return sb.toString();
    }

    /**
     * Appends each element in turn, starting from empty text.
     */
    public static String compose(FormulaElement... elements) {
        String text = "";
        for (FormulaElement element : elements) {
            text = append(text, element);
        }
        return text;
    }
}
