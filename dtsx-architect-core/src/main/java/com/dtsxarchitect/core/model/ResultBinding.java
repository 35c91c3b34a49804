package com.dtsxarchitect.core.model;

import java.util.Objects;

/**
 * Binding of a SQL result column to a variable.
 *
 * @param resultName result column name or ordinal
 * @param variableName bound variable, qualified
 */
public record ResultBinding(String resultName, String variableName) {
    /**
     * Compact constructor with validation.
     */
    public ResultBinding {
        Objects.requireNonNull(resultName, "resultName must not be null");
    }
}
