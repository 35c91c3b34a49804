package com.dtsxarchitect.core.generator;

/**
 * Types of diagrams that can be generated for a package.
 */
public enum DiagramType {
    /** Stages and precedence constraints */
    CONTROL_FLOW,

    /** Components and paths of every data-flow task */
    DATA_FLOW,

    /** Stages listed in document order with type, condition and tasks */
    EXECUTION_ORDER,

    /** Routes of conditional splits, lookups and multicasts */
    ROUTING_LOGIC;

    /**
     * File-name friendly form, e.g. {@code control-flow}.
     *
     * @return slug
     */
    public String slug() {
        return name().toLowerCase().replace('_', '-');
    }
}
