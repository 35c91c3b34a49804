package com.dtsxarchitect.core.generator;

/**
 * Configuration for diagram generation.
 *
 * @param direction flowchart direction ({@code TB}, {@code LR}, ...)
 * @param includeStyling whether flowcharts end with the category styling block
 * @param maxDerivedColumns derived-column expressions shown per transform in ASCII data flows
 * @param expressionPreviewLength characters of a derived-column expression shown
 * @param sqlPreviewLength characters of a source SQL command shown
 */
public record GeneratorConfig(
    String direction,
    boolean includeStyling,
    int maxDerivedColumns,
    int expressionPreviewLength,
    int sqlPreviewLength
) {
    public static final String DEFAULT_DIRECTION = "TB";
    public static final int DEFAULT_MAX_DERIVED_COLUMNS = 3;
    public static final int DEFAULT_EXPRESSION_PREVIEW_LENGTH = 40;
    public static final int DEFAULT_SQL_PREVIEW_LENGTH = 50;

    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (direction == null || direction.isBlank()) {
            direction = DEFAULT_DIRECTION;
        }
        if (maxDerivedColumns < 0) {
            maxDerivedColumns = DEFAULT_MAX_DERIVED_COLUMNS;
        }
        if (expressionPreviewLength <= 0) {
            expressionPreviewLength = DEFAULT_EXPRESSION_PREVIEW_LENGTH;
        }
        if (sqlPreviewLength <= 0) {
            sqlPreviewLength = DEFAULT_SQL_PREVIEW_LENGTH;
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(DEFAULT_DIRECTION, true, DEFAULT_MAX_DERIVED_COLUMNS,
            DEFAULT_EXPRESSION_PREVIEW_LENGTH, DEFAULT_SQL_PREVIEW_LENGTH);
    }
}
