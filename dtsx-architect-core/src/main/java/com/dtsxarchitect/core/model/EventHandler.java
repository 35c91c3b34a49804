package com.dtsxarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Event handler and the executables it runs.
 *
 * @param name handler name
 * @param refId reference id
 * @param dtsid unique identifier
 * @param eventName handled event ({@code OnError}, {@code OnWarning}, ...)
 * @param tasks handler executables
 * @param constraints precedence constraints local to the handler
 */
public record EventHandler(
    String name,
    String refId,
    String dtsid,
    String eventName,
    List<TaskDescriptor> tasks,
    List<PrecedenceConstraint> constraints
) {
    /**
     * Compact constructor with validation.
     */
    public EventHandler {
        if (name == null) {
            name = "";
        }
        if (eventName == null) {
            eventName = "";
        }
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }
}
