package com.dtsxarchitect.core.generator.impl;

import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dtsxarchitect.core.generator.DiagramGenerator;
import com.dtsxarchitect.core.generator.DiagramType;
import com.dtsxarchitect.core.generator.GeneratedDiagram;
import com.dtsxarchitect.core.generator.GeneratorConfig;
import com.dtsxarchitect.core.generator.PackageDiagrams;
import com.dtsxarchitect.core.model.DataFlowTask;
import com.dtsxarchitect.core.model.DtsxPackage;

/**
 * Generates fixed-width text diagrams and listings for terminals and plain-text reports.
 */
public class AsciiGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(AsciiGenerator.class);

    private static final String GENERATOR_ID = "ascii";
    private static final String GENERATOR_DISPLAY_NAME = "ASCII Diagram Generator";
    private static final String FILE_EXTENSION = "txt";

    private static final String NO_DATA_FLOWS = "No data flow tasks found.\n";

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
        return Set.of(DiagramType.values());
    }

    @Override
    public GeneratedDiagram generate(DtsxPackage dtsxPackage, DiagramType type, GeneratorConfig config) {
        Objects.requireNonNull(dtsxPackage, "dtsxPackage must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        log.debug("Generating ASCII diagram for type: {}", type);
        PackageDiagrams diagrams = new PackageDiagrams(config);

        String content = switch (type) {
            case CONTROL_FLOW -> diagrams.controlFlow(dtsxPackage).ascii();
            case DATA_FLOW -> generateDataFlows(dtsxPackage, diagrams);
            case EXECUTION_ORDER -> diagrams.executionOrder(dtsxPackage);
            case ROUTING_LOGIC -> diagrams.routingLogic(dtsxPackage);
        };

        log.info("Generated ASCII diagram: {}", type.slug());
        return new GeneratedDiagram(type.slug(), type, content, getFileExtension());
    }

    private String generateDataFlows(DtsxPackage dtsxPackage, PackageDiagrams diagrams) {
        if (dtsxPackage.dataFlowTasks().isEmpty()) {
            return NO_DATA_FLOWS;
        }
        StringBuilder sb = new StringBuilder();
        for (DataFlowTask task : dtsxPackage.dataFlowTasks()) {
            sb.append(diagrams.dataFlow(task).ascii()).append("\n");
        }
        return sb.toString();
    }
}
