package com.dtsxarchitect.core.generator;

import java.util.Objects;

/**
 * Edge between two display names.
 *
 * @param source source display name
 * @param destination destination display name
 * @param label edge label, empty when unlabeled
 */
public record DiagramEdge(String source, String destination, String label) {

    public DiagramEdge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        if (label == null) {
            label = "";
        }
    }

    public boolean hasLabel() {
        return !label.isEmpty();
    }
}
