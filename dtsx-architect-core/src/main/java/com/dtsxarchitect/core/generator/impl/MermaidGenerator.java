package com.dtsxarchitect.core.generator.impl;

import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dtsxarchitect.core.generator.DiagramBundle;
import com.dtsxarchitect.core.generator.DiagramGenerator;
import com.dtsxarchitect.core.generator.DiagramType;
import com.dtsxarchitect.core.generator.GeneratedDiagram;
import com.dtsxarchitect.core.generator.GeneratorConfig;
import com.dtsxarchitect.core.generator.PackageDiagrams;
import com.dtsxarchitect.core.model.DataFlowTask;
import com.dtsxarchitect.core.model.DtsxPackage;

/**
 * Generates Mermaid flowcharts embedded in Markdown.
 *
 * <p>The control flow becomes one flowchart; every data-flow task gets its own section
 * and flowchart. Output renders in GitHub, GitLab and the Mermaid Live Editor.
 *
 * @see <a href="https://mermaid.js.org/">Mermaid Documentation</a>
 */
public class MermaidGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Flowchart Generator";
    private static final String FILE_EXTENSION = "md";

    // Markdown formatting
    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String MARKDOWN_SECTION_PREFIX = "## ";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";

    private static final String NO_DATA_FLOWS = "_No data flow tasks found._\n";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public Set<DiagramType> getSupportedDiagramTypes() {
        return Set.of(DiagramType.CONTROL_FLOW, DiagramType.DATA_FLOW);
    }

    @Override
    public GeneratedDiagram generate(DtsxPackage dtsxPackage, DiagramType type, GeneratorConfig config) {
        Objects.requireNonNull(dtsxPackage, "dtsxPackage must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!getSupportedDiagramTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported diagram type: " + type);
        }

        log.debug("Generating Mermaid diagram for type: {}", type);
        PackageDiagrams diagrams = new PackageDiagrams(config);

        String content = switch (type) {
            case CONTROL_FLOW -> generateControlFlow(dtsxPackage, diagrams);
            case DATA_FLOW -> generateDataFlows(dtsxPackage, diagrams);
            default -> throw new IllegalArgumentException("Unsupported diagram type: " + type);
        };

        log.info("Generated Mermaid diagram: {}", type.slug());
        return new GeneratedDiagram(type.slug(), type, content, getFileExtension());
    }

    private String generateControlFlow(DtsxPackage dtsxPackage, PackageDiagrams diagrams) {
        StringBuilder sb = new StringBuilder();
        sb.append(MARKDOWN_HEADER_PREFIX).append(dtsxPackage.metadata().name()).append(" - Control Flow\n\n");
        appendFlowchart(sb, diagrams.controlFlow(dtsxPackage));
        return sb.toString();
    }

    private String generateDataFlows(DtsxPackage dtsxPackage, PackageDiagrams diagrams) {
        StringBuilder sb = new StringBuilder();
        sb.append(MARKDOWN_HEADER_PREFIX).append(dtsxPackage.metadata().name()).append(" - Data Flows\n\n");
        if (dtsxPackage.dataFlowTasks().isEmpty()) {
            sb.append(NO_DATA_FLOWS);
            return sb.toString();
        }
        for (DataFlowTask task : dtsxPackage.dataFlowTasks()) {
            sb.append(MARKDOWN_SECTION_PREFIX).append(task.name()).append("\n\n");
            appendFlowchart(sb, diagrams.dataFlow(task));
            sb.append("\n");
        }
        return sb.toString();
    }

    private void appendFlowchart(StringBuilder sb, DiagramBundle bundle) {
        sb.append(CODE_BLOCK_START);
        sb.append(bundle.flowchart());
        sb.append(CODE_BLOCK_END);
    }
}
