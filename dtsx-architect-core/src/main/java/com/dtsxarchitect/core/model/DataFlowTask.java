package com.dtsxarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Pipeline task owning its components and paths.
 *
 * @param name task name
 * @param refId task reference id
 * @param dtsid unique identifier
 * @param description optional description
 * @param components pipeline components in document order
 * @param paths pipeline paths in document order
 */
public record DataFlowTask(
    String name,
    String refId,
    String dtsid,
    String description,
    List<DataFlowComponent> components,
    List<DataFlowPath> paths
) {
    /**
     * Compact constructor with validation.
     */
    public DataFlowTask {
        Objects.requireNonNull(name, "name must not be null");
        components = components == null ? List.of() : List.copyOf(components);
        paths = paths == null ? List.of() : List.copyOf(paths);
    }

    /**
     * Returns the components of one category, in document order.
     *
     * @param category wanted category
     * @return matching components
     */
    public List<DataFlowComponent> componentsOf(ComponentCategory category) {
        return components.stream()
            .filter(c -> c.category() == category)
            .toList();
    }
}
