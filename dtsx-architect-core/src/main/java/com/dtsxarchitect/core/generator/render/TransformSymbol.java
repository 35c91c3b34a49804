package com.dtsxarchitect.core.generator.render;

/**
 * Short markers for transforms in ASCII data-flow diagrams, chosen by class identifier.
 */
public enum TransformSymbol {
    DERIVED_COLUMN("DerivedColumn", "DER"),
    CONDITIONAL_SPLIT("ConditionalSplit", "SPLIT"),
    LOOKUP("Lookup", "LKP"),
    MULTICAST("Multicast", "MCT"),
    ROW_COUNT("RowCount", "RC"),
    DATA_CONVERT("DataConvert", "DCV");

    private static final String GENERIC = "TRF";

    private final String classFragment;
    private final String marker;

    TransformSymbol(String classFragment, String marker) {
        this.classFragment = classFragment;
        this.marker = marker;
    }

    /**
     * Returns the marker for a component class, e.g. {@code {SPLIT}}.
     *
     * @param componentClass component class identifier
     * @return marker in braces; {@code {TRF}} when no fragment matches
     */
    public static String markerFor(String componentClass) {
        String value = componentClass == null ? "" : componentClass;
        for (TransformSymbol symbol : values()) {
            if (value.contains(symbol.classFragment)) {
                return "{" + symbol.marker + "}";
            }
        }
        return "{" + GENERIC + "}";
    }
}
