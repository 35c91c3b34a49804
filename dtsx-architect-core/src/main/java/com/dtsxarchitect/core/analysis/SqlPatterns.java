package com.dtsxarchitect.core.analysis;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Pre-compiled patterns for finding object names in SQL text.
 *
 * <p>Every pattern captures a schema-qualified name in group 1, optionally bracketed
 * ({@code [dbo].[Orders]}). Unqualified names are not captured.
 */
public final class SqlPatterns {

    private static final String QUALIFIED_NAME = "(\\[?[\\w.]+\\]?\\.\\[?\\w+\\]?)";

    public static final List<Pattern> TABLE_PATTERNS = List.of(
        compile("FROM\\s+" + QUALIFIED_NAME),
        compile("INTO\\s+" + QUALIFIED_NAME),
        compile("UPDATE\\s+" + QUALIFIED_NAME),
        compile("JOIN\\s+" + QUALIFIED_NAME),
        compile("INSERT\\s+INTO\\s+" + QUALIFIED_NAME)
    );

    public static final Pattern PROCEDURE_PATTERN = compile("EXEC(?:UTE)?\\s+" + QUALIFIED_NAME);

    public static final Pattern FUNCTION_PATTERN = compile("(\\[?[\\w.]+\\]?\\.\\[?fn_\\w+\\]?)\\s*\\(");

    private SqlPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
