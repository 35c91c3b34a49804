package com.dtsxarchitect.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Component of a data-flow pipeline.
 *
 * @param name component name
 * @param refId component reference id
 * @param category source, transform or destination
 * @param componentClass full class identifier (e.g. {@code Microsoft.OLEDBSource})
 * @param description optional description
 * @param inputColumns consumed columns
 * @param outputColumns produced columns
 * @param conditionalOutputs routes of a fan-out component, in document order
 * @param connectionManager reference id of the bound connection manager
 * @param sqlCommand raw SQL command
 * @param tableName target or source table ({@code OpenRowset})
 * @param properties free-form component properties
 * @param hasErrorOutput whether the component declares an error output
 */
public record DataFlowComponent(
    String name,
    String refId,
    ComponentCategory category,
    String componentClass,
    String description,
    List<Column> inputColumns,
    List<OutputColumn> outputColumns,
    List<ConditionalOutput> conditionalOutputs,
    String connectionManager,
    String sqlCommand,
    String tableName,
    Map<String, String> properties,
    boolean hasErrorOutput
) {
    /**
     * Compact constructor with validation.
     */
    public DataFlowComponent {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(category, "category must not be null");
        if (refId == null) {
            refId = "";
        }
        if (componentClass == null) {
            componentClass = "";
        }
        inputColumns = inputColumns == null ? List.of() : List.copyOf(inputColumns);
        outputColumns = outputColumns == null ? List.of() : List.copyOf(outputColumns);
        conditionalOutputs = conditionalOutputs == null ? List.of() : List.copyOf(conditionalOutputs);
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * Returns the last dotted segment of the class identifier, e.g. {@code ConditionalSplit}.
     *
     * @return short class name
     */
    public String shortClassName() {
        int dot = componentClass.lastIndexOf('.');
        return dot >= 0 ? componentClass.substring(dot + 1) : componentClass;
    }
}
