package com.dtsxarchitect.core.generator.render;

import com.dtsxarchitect.core.generator.GeneratorConfig;
import com.dtsxarchitect.core.graph.ComponentResolver;
import com.dtsxarchitect.core.model.ComponentCategory;
import com.dtsxarchitect.core.model.ConditionalOutput;
import com.dtsxarchitect.core.model.DataFlowComponent;
import com.dtsxarchitect.core.model.DataFlowPath;
import com.dtsxarchitect.core.model.DataFlowTask;
import com.dtsxarchitect.core.model.OutputColumn;

import java.util.List;

/**
 * Draws one data-flow task as sources, transformations and destinations, top to bottom,
 * followed by the list of its paths.
 */
public class AsciiDataFlowRenderer {

    private static final int RULE_WIDTH = 70;
    private static final String UNRESOLVED = "?";

    private final GeneratorConfig config;

    public AsciiDataFlowRenderer(GeneratorConfig config) {
        this.config = config;
    }

    public String render(DataFlowTask task) {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(RULE_WIDTH)).append("\n");
        sb.append(" DATA FLOW: ").append(task.name()).append("\n");
        sb.append("=".repeat(RULE_WIDTH)).append("\n");
        sb.append("\n");

        appendSources(sb, task.componentsOf(ComponentCategory.SOURCE));
        appendTransforms(sb, task.componentsOf(ComponentCategory.TRANSFORM));
        appendDestinations(sb, task.componentsOf(ComponentCategory.DESTINATION));

        ComponentResolver resolver = new ComponentResolver(task);
        sb.append("-".repeat(RULE_WIDTH)).append("\n");
        sb.append("DATA PATHS:\n");
        for (DataFlowPath path : task.paths()) {
            sb.append("    ")
                .append(resolver.resolveName(path.sourceRef()).orElse(UNRESOLVED))
                .append(" --> ")
                .append(resolver.resolveName(path.destinationRef()).orElse(UNRESOLVED))
                .append("\n");
        }
        return sb.toString();
    }

    private void appendSources(StringBuilder sb, List<DataFlowComponent> sources) {
        if (sources.isEmpty()) {
            return;
        }
        sb.append("SOURCES:\n");
        for (DataFlowComponent source : sources) {
            sb.append("    [(").append(source.name()).append(")]\n");
            if (source.sqlCommand() != null && !source.sqlCommand().isBlank()) {
                sb.append("        SQL: ")
                    .append(LabelText.preview(LabelText.collapseWhitespace(source.sqlCommand()), config.sqlPreviewLength()))
                    .append("\n");
            }
        }
        appendArrow(sb);
        sb.append("\n");
    }

    private void appendTransforms(StringBuilder sb, List<DataFlowComponent> transforms) {
        if (transforms.isEmpty()) {
            return;
        }
        sb.append("TRANSFORMATIONS:\n");
        for (int i = 0; i < transforms.size(); i++) {
            DataFlowComponent transform = transforms.get(i);
            sb.append("    ").append(TransformSymbol.markerFor(transform.componentClass()))
                .append(" ").append(transform.name()).append("\n");

            transform.outputColumns().stream()
                .filter(OutputColumn::hasExpression)
                .limit(config.maxDerivedColumns())
                .forEach(column -> sb.append("          -> ").append(column.name()).append(": ")
                    .append(LabelText.preview(column.expression(), config.expressionPreviewLength()))
                    .append("\n"));

            for (ConditionalOutput route : transform.conditionalOutputs()) {
                if (route.isDefault()) {
                    sb.append("          |-> [").append(route.name()).append("]: (Default)\n");
                } else {
                    sb.append("          |-> [").append(route.name()).append("]: ")
                        .append(route.expression()).append("\n");
                }
            }

            if (i < transforms.size() - 1) {
                appendArrow(sb);
            }
        }
        appendArrow(sb);
        sb.append("\n");
    }

    private void appendDestinations(StringBuilder sb, List<DataFlowComponent> destinations) {
        if (destinations.isEmpty()) {
            return;
        }
        sb.append("DESTINATIONS:\n");
        for (DataFlowComponent destination : destinations) {
            String table = destination.tableName() != null ? destination.tableName() : "Unknown Table";
            sb.append("    [[").append(destination.name()).append("]]\n");
            sb.append("        -> ").append(table).append("\n");
        }
        sb.append("\n");
    }

    private static void appendArrow(StringBuilder sb) {
        sb.append("        |\n");
        sb.append("        V\n");
    }
}
