package com.dtsxarchitect.core.generator.render;

/**
 * Text clean-up shared by the renderers.
 */
public final class LabelText {

    private LabelText() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Removes variable-reference decoration: {@code @[User::Flag] == 1} becomes {@code Flag == 1}.
     *
     * @param expression expression, may be null
     * @return stripped text, empty for null
     */
    public static String stripVariableDecoration(String expression) {
        if (expression == null) {
            return "";
        }
        return expression.replace("@[User::", "").replace("]", "");
    }

    /**
     * Short condition form used on edges and arrows; also shows {@code ==} as {@code =}.
     *
     * @param expression expression, may be null
     * @return condition label
     */
    public static String conditionLabel(String expression) {
        return stripVariableDecoration(expression).replace("==", "=");
    }

    /**
     * Truncates text, appending {@code ...} only when something was cut.
     *
     * @param text text, may be null
     * @param maxLength characters kept
     * @return preview
     */
    public static String preview(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength) + "...";
    }

    /**
     * Collapses all whitespace runs, including newlines, into single spaces.
     *
     * @param text text, may be null
     * @return collapsed and trimmed text
     */
    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().replaceAll("\\s+", " ");
    }

    /**
     * Centers text in a field, padding with spaces; text longer than the field is kept whole.
     *
     * @param text text
     * @param width field width
     * @return centered text
     */
    public static String center(String text, int width) {
        int padding = width - text.length();
        if (padding <= 0) {
            return text;
        }
        int left = padding / 2;
        return " ".repeat(left) + text + " ".repeat(padding - left);
    }
}
