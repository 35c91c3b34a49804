package com.dtsxarchitect.core.generator.render;

import com.dtsxarchitect.core.graph.ComponentResolver;
import com.dtsxarchitect.core.model.ConditionalOutput;
import com.dtsxarchitect.core.model.DataFlowComponent;
import com.dtsxarchitect.core.model.DataFlowPath;
import com.dtsxarchitect.core.model.DataFlowTask;

import java.util.List;
import java.util.Optional;

/**
 * Explains where rows go in every data-flow task: conditional-split routes, lookup
 * match/no-match outputs and multicast fan-out.
 *
 * <p>A path belongs to a component when its source reference contains the route (or
 * component) name and does not resolve to another component.
 */
public class RoutingLogicListing {

    static final String DEFAULT_CONDITION = "DEFAULT (all unmatched rows)";

    private static final int RULE_WIDTH = 70;
    private static final int TASK_RULE_WIDTH = 50;

    public String render(List<DataFlowTask> tasks) {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(RULE_WIDTH)).append("\n");
        sb.append(" DATA ROUTING LOGIC\n");
        sb.append("=".repeat(RULE_WIDTH)).append("\n");
        sb.append("\n");

        for (DataFlowTask task : tasks) {
            ComponentResolver resolver = new ComponentResolver(task);
            sb.append("Data Flow: ").append(task.name()).append("\n");
            sb.append("-".repeat(TASK_RULE_WIDTH)).append("\n");
            sb.append("\n");

            for (DataFlowComponent component : task.components()) {
                if (!component.conditionalOutputs().isEmpty()) {
                    appendRoutes(sb, task, resolver, component);
                }
                if (component.componentClass().contains("Lookup")) {
                    appendLookup(sb, task, resolver, component);
                }
                if (component.componentClass().contains("Multicast")) {
                    appendMulticast(sb, task, resolver, component);
                }
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    private void appendRoutes(StringBuilder sb, DataFlowTask task, ComponentResolver resolver,
                              DataFlowComponent component) {
        sb.append("  Routing Component: ").append(component.name()).append("\n");
        sb.append("  Type: ").append(component.shortClassName()).append("\n");
        sb.append("\n");

        int index = 1;
        for (ConditionalOutput route : component.conditionalOutputs()) {
            sb.append("    Route ").append(index++).append(": ").append(route.name()).append("\n");
            if (route.isDefault()) {
                sb.append("      Condition: ").append(DEFAULT_CONDITION).append("\n");
            } else if (route.displayExpression() != null) {
                sb.append("      Condition: ").append(route.displayExpression()).append("\n");
            }
            for (DataFlowPath path : task.paths()) {
                if (path.sourceRef().contains(route.name()) && ownedBy(path, component, resolver)) {
                    resolver.resolveName(path.destinationRef())
                        .ifPresent(dest -> sb.append("      Destination: ").append(dest).append("\n"));
                }
            }
            sb.append("\n");
        }
    }

    private void appendLookup(StringBuilder sb, DataFlowTask task, ComponentResolver resolver,
                              DataFlowComponent component) {
        sb.append("  Lookup: ").append(component.name()).append("\n");
        sb.append("    Match Output: Rows with matching reference data\n");
        sb.append("    No Match Output: Rows without matching reference data\n");

        for (DataFlowPath path : outgoing(task, resolver, component)) {
            Optional<String> dest = resolver.resolveName(path.destinationRef());
            if (dest.isEmpty()) {
                continue;
            }
            if (isNoMatch(path.name())) {
                sb.append("      -> No Match goes to: ").append(dest.get()).append("\n");
            } else if (path.name().contains("Match")) {
                sb.append("      -> Match goes to: ").append(dest.get()).append("\n");
            }
        }
        sb.append("\n");
    }

    private void appendMulticast(StringBuilder sb, DataFlowTask task, ComponentResolver resolver,
                                 DataFlowComponent component) {
        sb.append("  Multicast: ").append(component.name()).append("\n");
        sb.append("    Sends all rows to multiple destinations:\n");
        for (DataFlowPath path : outgoing(task, resolver, component)) {
            resolver.resolveName(path.destinationRef())
                .ifPresent(dest -> sb.append("      -> ").append(dest).append("\n"));
        }
        sb.append("\n");
    }

    private static List<DataFlowPath> outgoing(DataFlowTask task, ComponentResolver resolver,
                                               DataFlowComponent component) {
        return task.paths().stream()
            .filter(path -> path.sourceRef().contains(component.name()))
            .filter(path -> ownedBy(path, component, resolver))
            .toList();
    }

    private static boolean ownedBy(DataFlowPath path, DataFlowComponent component, ComponentResolver resolver) {
        return resolver.resolve(path.sourceRef()).map(component::equals).orElse(true);
    }

    static boolean isNoMatch(String pathName) {
        return pathName.contains("NoMatch") || pathName.contains("No Match");
    }
}
