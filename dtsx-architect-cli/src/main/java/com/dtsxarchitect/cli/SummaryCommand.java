package com.dtsxarchitect.cli;

import com.dtsxarchitect.core.config.AnalyzerConfig;
import com.dtsxarchitect.core.model.ComponentCategory;
import com.dtsxarchitect.core.model.ConnectionManager;
import com.dtsxarchitect.core.model.ControlFlowStage;
import com.dtsxarchitect.core.model.DataFlowTask;
import com.dtsxarchitect.core.model.DtsxPackage;
import com.dtsxarchitect.core.model.PackageMetadata;
import picocli.CommandLine.Command;

import java.io.PrintWriter;

/**
 * Command that prints a short package summary: metadata, entity counts, stages,
 * data-flow component counts and connections.
 */
@Command(
    name = "summary",
    description = "Show a brief package summary",
    mixinStandardHelpOptions = true
)
public class SummaryCommand extends PackageCommand {

    private static final int WIDTH = 60;

    @Override
    protected int execute(DtsxPackage dtsxPackage, AnalyzerConfig config) {
        PrintWriter out = out();
        PackageMetadata metadata = dtsxPackage.metadata();

        out.println("=".repeat(WIDTH));
        out.println(" PACKAGE SUMMARY: " + metadata.name());
        out.println("=".repeat(WIDTH));
        out.println();
        out.println("  Created:     " + orNa(metadata.creationDate()));
        out.println("  Creator:     " + orNa(metadata.creatorName()));
        out.println("  Version:     " + orNa(metadata.versionBuild()));
        out.println();
        out.println("  COMPONENTS:");
        out.printf("    Connection Managers:  %d%n", dtsxPackage.connectionManagers().size());
        out.printf("    Variables:            %d%n", dtsxPackage.variables().size());
        out.printf("    Parameters:           %d%n", dtsxPackage.parameters().size());
        out.printf("    Control Flow Stages:  %d%n", dtsxPackage.controlFlowStages().size());
        out.printf("    Data Flow Tasks:      %d%n", dtsxPackage.dataFlowTasks().size());
        out.printf("    Database Objects:     %d%n", dtsxPackage.databaseObjects().size());
        out.printf("    Thresholds:           %d%n", dtsxPackage.thresholds().size());
        out.printf("    Alerts:               %d%n", dtsxPackage.alerts().size());
        out.println();

        if (!dtsxPackage.controlFlowStages().isEmpty()) {
            out.println("  CONTROL FLOW STAGES:");
            for (ControlFlowStage stage : dtsxPackage.controlFlowStages()) {
                String conditional = stage.hasCondition() ? " [Conditional]" : "";
                out.printf("    %d. %s (%s)%s%n", stage.order(), stage.name(), stage.stageType(), conditional);
            }
            out.println();
        }

        if (!dtsxPackage.dataFlowTasks().isEmpty()) {
            out.println("  DATA FLOW TASKS:");
            for (DataFlowTask task : dtsxPackage.dataFlowTasks()) {
                out.println("    - " + task.name());
                out.printf("      Sources: %d, Transforms: %d, Destinations: %d%n",
                    task.componentsOf(ComponentCategory.SOURCE).size(),
                    task.componentsOf(ComponentCategory.TRANSFORM).size(),
                    task.componentsOf(ComponentCategory.DESTINATION).size());
            }
            out.println();
        }

        if (!dtsxPackage.connectionManagers().isEmpty()) {
            out.println("  CONNECTIONS:");
            for (ConnectionManager connection : dtsxPackage.connectionManagers()) {
                String database = connection.database() != null && !connection.database().isEmpty()
                    ? " -> " + connection.database()
                    : "";
                out.println("    - " + connection.name() + " (" + connection.connectionType() + ")" + database);
            }
            out.println();
        }
        out.flush();
        return 0;
    }

    private static String orNa(String value) {
        return value == null || value.isEmpty() ? "N/A" : value;
    }
}
