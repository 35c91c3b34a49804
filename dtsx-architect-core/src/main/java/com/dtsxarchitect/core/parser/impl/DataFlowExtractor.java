package com.dtsxarchitect.core.parser.impl;

import com.dtsxarchitect.core.model.Column;
import com.dtsxarchitect.core.model.ComponentCategory;
import com.dtsxarchitect.core.model.ConditionalOutput;
import com.dtsxarchitect.core.model.DataFlowComponent;
import com.dtsxarchitect.core.model.DataFlowPath;
import com.dtsxarchitect.core.model.DataFlowTask;
import com.dtsxarchitect.core.model.OutputColumn;
import com.dtsxarchitect.core.model.StageKind;
import com.dtsxarchitect.core.parser.AttributeResolver;
import com.dtsxarchitect.core.parser.XmlElements;
import com.dtsxarchitect.core.parser.base.AbstractExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts every pipeline executable in the package, at any depth, as a data-flow task.
 *
 * <p>Pipeline internals ({@code pipeline/components/component}, {@code paths/path}) carry
 * plain, unprefixed attributes and are read directly.
 */
public class DataFlowExtractor extends AbstractExtractor<List<DataFlowTask>> {

    public DataFlowExtractor(AttributeResolver attributes) {
        super(attributes);
    }

    @Override
    public List<DataFlowTask> extract(Element root) {
        List<DataFlowTask> result = XmlElements.descendants(root, e -> XmlElements.isNamed(e, "Executable")).stream()
            .filter(this::isPipeline)
            .map(this::toTask)
            .toList();
        log.debug("Extracted {} data-flow tasks", result.size());
        return result;
    }

    private boolean isPipeline(Element executable) {
        String marker = attr(executable, "ExecutableType", "") + attr(executable, "CreationName", "");
        return marker.contains(StageKind.DATA_FLOW.marker());
    }

    private DataFlowTask toTask(Element executable) {
        List<DataFlowComponent> components = new ArrayList<>();
        List<DataFlowPath> paths = new ArrayList<>();

        Optional<Element> pipeline = XmlElements.firstDescendant(executable, e -> XmlElements.isNamed(e, "pipeline"));
        pipeline.ifPresent(p -> {
            for (Element container : XmlElements.children(p)) {
                if (XmlElements.isNamed(container, "components")) {
                    XmlElements.childrenNamed(container, "component").forEach(c -> components.add(toComponent(c)));
                } else if (XmlElements.isNamed(container, "paths")) {
                    XmlElements.childrenNamed(container, "path").forEach(path -> paths.add(toPath(path)));
                }
            }
        });

        DataFlowTask task = new DataFlowTask(
            attr(executable, "ObjectName", "Unknown"),
            attr(executable, "refId", ""),
            attr(executable, "DTSID", ""),
            attr(executable, "Description"),
            components,
            paths
        );
        log.debug("Data flow '{}': {} components, {} paths", task.name(), components.size(), paths.size());
        return task;
    }

    private DataFlowComponent toComponent(Element element) {
        String componentClass = plain(element, "componentClassID", "");

        Map<String, String> properties = new LinkedHashMap<>();
        for (Element container : XmlElements.childrenNamed(element, "properties")) {
            for (Element property : XmlElements.childrenNamed(container, "property")) {
                properties.put(plain(property, "name", ""), XmlElements.text(property));
            }
        }

        List<OutputColumn> outputColumns = new ArrayList<>();
        List<ConditionalOutput> conditionalOutputs = new ArrayList<>();
        boolean hasErrorOutput = false;
        for (Element output : grandchildren(element, "outputs", "output")) {
            if ("true".equalsIgnoreCase(plain(output, "isErrorOut", "false"))) {
                hasErrorOutput = true;
            }
            toConditionalOutput(output).ifPresent(conditionalOutputs::add);
            for (Element column : grandchildren(output, "outputColumns", "outputColumn")) {
                outputColumns.add(toOutputColumn(column));
            }
        }

        List<Column> inputColumns = new ArrayList<>();
        for (Element input : grandchildren(element, "inputs", "input")) {
            for (Element column : grandchildren(input, "inputColumns", "inputColumn")) {
                inputColumns.add(new Column(
                    plain(column, "cachedName", ""),
                    plain(column, "refId", ""),
                    plain(column, "cachedDataType", null),
                    AttributeResolver.parseInteger(plain(column, "cachedLength", null), "cachedLength")));
            }
        }

        String connectionManager = grandchildren(element, "connections", "connection").stream()
            .findFirst()
            .map(c -> plain(c, "connectionManagerRefId", null))
            .orElse(null);

        return new DataFlowComponent(
            plain(element, "name", "Unknown"),
            plain(element, "refId", ""),
            ComponentCategory.fromClassId(componentClass),
            componentClass,
            plain(element, "description", null),
            inputColumns,
            outputColumns,
            conditionalOutputs,
            connectionManager,
            properties.get("SqlCommand"),
            properties.get("OpenRowset"),
            properties,
            hasErrorOutput
        );
    }

    /**
     * An output is a route when it carries an expression or is flagged default.
     */
    private Optional<ConditionalOutput> toConditionalOutput(Element output) {
        String expression = null;
        String friendlyExpression = null;
        Integer evaluationOrder = null;
        boolean isDefault = false;
        for (Element property : grandchildren(output, "properties", "property")) {
            String value = XmlElements.text(property);
            switch (plain(property, "name", "")) {
                case "Expression" -> expression = value;
                case "FriendlyExpression" -> friendlyExpression = value;
                case "EvaluationOrder" -> evaluationOrder = AttributeResolver.parseInteger(value, "EvaluationOrder");
                case "IsDefaultOut" -> isDefault = "true".equalsIgnoreCase(value);
                default -> {
                    // not a routing property
                }
            }
        }
        if ((expression == null || expression.isEmpty()) && !isDefault) {
            return Optional.empty();
        }
        return Optional.of(new ConditionalOutput(
            plain(output, "name", ""), expression, friendlyExpression, evaluationOrder, isDefault));
    }

    private OutputColumn toOutputColumn(Element column) {
        String expression = plain(column, "expression", null);
        if (expression == null) {
            expression = grandchildren(column, "properties", "property").stream()
                .filter(p -> "Expression".equals(plain(p, "name", "")))
                .findFirst()
                .map(XmlElements::text)
                .orElse(null);
        }
        return new OutputColumn(
            plain(column, "name", ""),
            plain(column, "refId", ""),
            plain(column, "dataType", null),
            AttributeResolver.parseInteger(plain(column, "length", null), "length"),
            expression,
            plain(column, "description", null)
        );
    }

    private DataFlowPath toPath(Element path) {
        return new DataFlowPath(
            plain(path, "name", ""),
            plain(path, "refId", ""),
            plain(path, "startId", ""),
            plain(path, "endId", "")
        );
    }

    private static List<Element> grandchildren(Element parent, String containerName, String itemName) {
        return XmlElements.childrenNamed(parent, containerName).stream()
            .flatMap(container -> XmlElements.childrenNamed(container, itemName).stream())
            .toList();
    }

    private static String plain(Element element, String name, String defaultValue) {
        return element.hasAttribute(name) ? element.getAttribute(name) : defaultValue;
    }
}
