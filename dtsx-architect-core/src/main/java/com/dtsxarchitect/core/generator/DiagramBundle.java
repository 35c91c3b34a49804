package com.dtsxarchitect.core.generator;

import java.util.List;
import java.util.Objects;

/**
 * Renderings of one graph: the control flow or a single data-flow task.
 *
 * @param name graph name
 * @param components node display names in order
 * @param edges edges between display names
 * @param flowchart Mermaid flowchart text
 * @param ascii fixed-width text rendering
 */
public record DiagramBundle(
    String name,
    List<String> components,
    List<DiagramEdge> edges,
    String flowchart,
    String ascii
) {
    public DiagramBundle {
        Objects.requireNonNull(name, "name must not be null");
        components = components == null ? List.of() : List.copyOf(components);
        edges = edges == null ? List.of() : List.copyOf(edges);
        Objects.requireNonNull(flowchart, "flowchart must not be null");
        Objects.requireNonNull(ascii, "ascii must not be null");
    }
}
