package com.dtsxarchitect.core.model;

import java.util.Objects;

/**
 * Binding of a SQL statement parameter to a variable.
 *
 * @param parameterName statement parameter name or ordinal
 * @param variableName bound variable, qualified
 * @param direction {@code Input}, {@code Output} or {@code ReturnValue}
 * @param dataType declared data type code, {@code null} when absent
 */
public record ParameterBinding(
    String parameterName,
    String variableName,
    String direction,
    Integer dataType
) {
    /**
     * Compact constructor with validation.
     */
    public ParameterBinding {
        Objects.requireNonNull(parameterName, "parameterName must not be null");
        if (direction == null || direction.isEmpty()) {
            direction = "Input";
        }
    }
}
