package com.dtsxarchitect.core.model;

import java.util.Objects;

/**
 * Package or container variable.
 *
 * @param name variable name
 * @param namespace variable namespace (User, System, ...)
 * @param dtsid unique identifier
 * @param dataType declared type code, see {@link SsisDataType}
 * @param value raw value text; its format depends on the type code
 * @param expression optional value expression
 * @param description optional description
 * @param readOnly whether the variable is read-only
 * @param raiseEventOnChange whether a change raises an event
 */
public record Variable(
    String name,
    String namespace,
    String dtsid,
    int dataType,
    String value,
    String expression,
    String description,
    boolean readOnly,
    boolean raiseEventOnChange
) {
    /**
     * Compact constructor with validation.
     */
    public Variable {
        Objects.requireNonNull(name, "name must not be null");
        if (namespace == null) {
            namespace = "User";
        }
    }

    /**
     * Returns the namespace-qualified name, e.g. {@code User::BatchSize}.
     *
     * @return qualified variable name
     */
    public String qualifiedName() {
        return namespace + "::" + name;
    }
}
