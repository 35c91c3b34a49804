package com.dtsxarchitect.core.model;

import java.util.Objects;

/**
 * Input column consumed by a data-flow component.
 *
 * @param name cached column name
 * @param refId column reference id
 * @param dataType cached data type
 * @param length cached length, {@code null} when absent
 */
public record Column(
    String name,
    String refId,
    String dataType,
    Integer length
) {
    /**
     * Compact constructor with validation.
     */
    public Column {
        Objects.requireNonNull(name, "name must not be null");
    }
}
