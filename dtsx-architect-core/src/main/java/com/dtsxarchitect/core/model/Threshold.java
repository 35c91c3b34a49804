package com.dtsxarchitect.core.model;

import java.util.Objects;

/**
 * Business threshold inferred from a variable name.
 *
 * @param name variable name
 * @param value variable value
 * @param dataType declared data type code
 * @param description description
 * @param category threshold category ({@code General}, {@code Performance}, {@code Fraud}, ...)
 * @param action action taken when exceeded, {@code null} when unknown
 */
public record Threshold(
    String name,
    String value,
    int dataType,
    String description,
    String category,
    String action
) {
    /**
     * Compact constructor with validation.
     */
    public Threshold {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(category, "category must not be null");
    }
}
