package com.dtsxarchitect.core.model;

/**
 * Role of a component within a data-flow pipeline.
 */
public enum ComponentCategory {
    SOURCE("Source"),
    TRANSFORM("Transform"),
    DESTINATION("Destination");

    private final String label;

    ComponentCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Classifies a component by its class identifier.
     *
     * <p>{@code Source} wins over {@code Destination}; anything else is a transform.
     *
     * @param componentClass component class identifier, may be null
     * @return component category
     */
    public static ComponentCategory fromClassId(String componentClass) {
        if (componentClass == null) {
            return TRANSFORM;
        }
        if (componentClass.contains("Source")) {
            return SOURCE;
        }
        if (componentClass.contains("Destination")) {
            return DESTINATION;
        }
        return TRANSFORM;
    }
}
