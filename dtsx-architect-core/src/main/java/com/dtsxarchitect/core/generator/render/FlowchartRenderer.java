package com.dtsxarchitect.core.generator.render;

import com.dtsxarchitect.core.generator.DiagramEdge;
import com.dtsxarchitect.core.model.ComponentCategory;

import java.util.List;
import java.util.Map;

/**
 * Renders Mermaid flowchart text for a titled set of nodes and edges.
 *
 * <p>Node shape follows the component category: cylinder for sources, subroutine box for
 * destinations, diamond for transforms and a rectangle for uncategorised nodes such as
 * control-flow stages.
 */
public class FlowchartRenderer {

    private static final String INDENT = "    ";
    private static final String NODE_INDENT = "        ";

    private static final List<String> CLASS_DEFS = List.of(
        "classDef source fill:#e1f5fe,stroke:#01579b",
        "classDef destination fill:#e8f5e9,stroke:#1b5e20",
        "classDef transform fill:#fff3e0,stroke:#e65100"
    );

    private final String direction;
    private final boolean includeStyling;

    public FlowchartRenderer(String direction, boolean includeStyling) {
        this.direction = direction;
        this.includeStyling = includeStyling;
    }

    /**
     * Renders a flowchart.
     *
     * @param title diagram and subgraph title
     * @param components node display names
     * @param categories category per display name; names without one are drawn as rectangles
     * @param edges edges between display names
     * @return flowchart text
     */
    public String render(String title,
                         List<String> components,
                         Map<String, ComponentCategory> categories,
                         List<DiagramEdge> edges) {
        NodeIdRegistry ids = new NodeIdRegistry();
        StringBuilder nodes = new StringBuilder();
        for (String component : components) {
            nodes.append(NODE_INDENT).append(node(ids.idFor(component), component, categories.get(component))).append("\n");
        }
        // Components own their sanitized ids; the subgraph takes whatever is left.
        String subgraphId = ids.reserve(title);

        StringBuilder sb = new StringBuilder();
        sb.append("---\n");
        sb.append("title: ").append(escape(title)).append("\n");
        sb.append("---\n");
        sb.append("flowchart ").append(direction).append("\n");
        sb.append(INDENT).append("subgraph ").append(subgraphId)
            .append("[\"").append(escape(title)).append("\"]\n");
        sb.append(nodes);
        sb.append(INDENT).append("end\n");
        sb.append("\n");

        for (DiagramEdge edge : edges) {
            sb.append(INDENT).append(ids.idFor(edge.source()));
            if (edge.hasLabel()) {
                sb.append(" -->|").append(escape(edge.label())).append("| ");
            } else {
                sb.append(" --> ");
            }
            sb.append(ids.idFor(edge.destination())).append("\n");
        }

        if (includeStyling) {
            sb.append("\n");
            sb.append(INDENT).append("%% Styling\n");
            for (String classDef : CLASS_DEFS) {
                sb.append(INDENT).append(classDef).append("\n");
            }
            for (String component : components) {
                ComponentCategory category = categories.get(component);
                if (category != null) {
                    sb.append(INDENT).append("class ").append(ids.idFor(component)).append(" ")
                        .append(category.name().toLowerCase()).append("\n");
                }
            }
        }
        return sb.toString();
    }

    private String node(String id, String name, ComponentCategory category) {
        String label = "\"" + escape(name) + "\"";
        if (category == null) {
            return id + "[" + label + "]";
        }
        return switch (category) {
            case SOURCE -> id + "[(" + label + ")]";
            case DESTINATION -> id + "[[" + label + "]]";
            case TRANSFORM -> id + "{" + label + "}";
        };
    }

    /**
     * Escapes text for use inside Mermaid labels.
     *
     * @param text the text to escape (may be null)
     * @return escaped text, or empty string if input is null
     */
    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "'").replace("\r\n", " ").replace("\n", " ").replace("|", "/");
    }
}
