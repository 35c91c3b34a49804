package com.dtsxarchitect.core.model;

import java.util.Objects;

/**
 * Package parameter configurable at run time.
 *
 * @param name parameter name
 * @param dtsid unique identifier
 * @param dataType declared type code, see {@link SsisDataType}
 * @param value raw design-time value
 * @param description optional description
 * @param sensitive whether the value is sensitive
 * @param required whether a value must be supplied at execution
 */
public record Parameter(
    String name,
    String dtsid,
    int dataType,
    String value,
    String description,
    boolean sensitive,
    boolean required
) {
    /**
     * Compact constructor with validation.
     */
    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
    }
}
