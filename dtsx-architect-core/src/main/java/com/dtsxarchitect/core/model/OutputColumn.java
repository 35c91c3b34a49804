package com.dtsxarchitect.core.model;

import java.util.Objects;

/**
 * Output column produced by a data-flow component, optionally derived by an expression.
 *
 * @param name column name
 * @param refId column reference id
 * @param dataType data type
 * @param length length, {@code null} when absent
 * @param expression derivation expression, {@code null} for pass-through columns
 * @param description optional description
 */
public record OutputColumn(
    String name,
    String refId,
    String dataType,
    Integer length,
    String expression,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public OutputColumn {
        Objects.requireNonNull(name, "name must not be null");
    }

    public boolean hasExpression() {
        return expression != null && !expression.isBlank();
    }
}
