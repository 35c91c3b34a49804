package com.dtsxarchitect.core.model;

import java.util.Objects;

/**
 * Task of a kind without a dedicated detail parser.
 *
 * @param name task name
 * @param refId reference id
 * @param dtsid unique identifier
 * @param type executable type
 * @param description optional description
 */
public record GenericTask(
    String name,
    String refId,
    String dtsid,
    String type,
    String description
) implements TaskDescriptor {
    /**
     * Compact constructor with validation.
     */
    public GenericTask {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public String kind() {
        return "Generic";
    }
}
