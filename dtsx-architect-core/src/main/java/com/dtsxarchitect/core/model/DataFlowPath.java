package com.dtsxarchitect.core.model;

import java.util.Objects;

/**
 * Edge of a data-flow graph.
 *
 * @param name path name
 * @param refId path reference id
 * @param sourceRef reference string of the producing output
 * @param destinationRef reference string of the consuming input
 */
public record DataFlowPath(
    String name,
    String refId,
    String sourceRef,
    String destinationRef
) {
    /**
     * Compact constructor with validation.
     */
    public DataFlowPath {
        Objects.requireNonNull(name, "name must not be null");
        if (refId == null) {
            refId = "";
        }
        if (sourceRef == null) {
            sourceRef = "";
        }
        if (destinationRef == null) {
            destinationRef = "";
        }
    }
}
