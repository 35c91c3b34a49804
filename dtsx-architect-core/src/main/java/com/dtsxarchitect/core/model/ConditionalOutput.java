package com.dtsxarchitect.core.model;

import java.util.Objects;

/**
 * One route of a fan-out component such as a conditional split.
 *
 * @param name output name
 * @param expression row-filter expression
 * @param friendlyExpression human-readable form of the expression
 * @param evaluationOrder evaluation order, {@code null} when absent
 * @param isDefault whether this route receives all unmatched rows
 */
public record ConditionalOutput(
    String name,
    String expression,
    String friendlyExpression,
    Integer evaluationOrder,
    boolean isDefault
) {
    /**
     * Compact constructor with validation.
     */
    public ConditionalOutput {
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Returns the expression to show a reader, preferring the friendly form.
     *
     * @return display expression, or {@code null} when neither form is present
     */
    public String displayExpression() {
        if (friendlyExpression != null && !friendlyExpression.isBlank()) {
            return friendlyExpression;
        }
        return expression;
    }
}
