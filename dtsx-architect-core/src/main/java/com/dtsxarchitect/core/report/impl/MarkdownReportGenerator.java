package com.dtsxarchitect.core.report.impl;

import com.dtsxarchitect.core.generator.DiagramBundle;
import com.dtsxarchitect.core.generator.GeneratorConfig;
import com.dtsxarchitect.core.generator.PackageDiagrams;
import com.dtsxarchitect.core.generator.render.LabelText;
import com.dtsxarchitect.core.model.Alert;
import com.dtsxarchitect.core.model.ComponentCategory;
import com.dtsxarchitect.core.model.ConditionalOutput;
import com.dtsxarchitect.core.model.ConnectionManager;
import com.dtsxarchitect.core.model.ControlFlowStage;
import com.dtsxarchitect.core.model.DataFlowComponent;
import com.dtsxarchitect.core.model.DataFlowTask;
import com.dtsxarchitect.core.model.DatabaseObject;
import com.dtsxarchitect.core.model.DatabaseObjectType;
import com.dtsxarchitect.core.model.DtsxPackage;
import com.dtsxarchitect.core.model.ErrorHandlingStrategy;
import com.dtsxarchitect.core.model.EventHandler;
import com.dtsxarchitect.core.model.OutputColumn;
import com.dtsxarchitect.core.model.PackageMetadata;
import com.dtsxarchitect.core.model.Parameter;
import com.dtsxarchitect.core.model.SqlTask;
import com.dtsxarchitect.core.model.TaskDescriptor;
import com.dtsxarchitect.core.model.Threshold;
import com.dtsxarchitect.core.model.Variable;
import com.dtsxarchitect.core.report.ReportFormat;
import com.dtsxarchitect.core.report.ReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

import static com.dtsxarchitect.core.report.impl.ReportText.hasText;
import static com.dtsxarchitect.core.report.impl.ReportText.orNa;

/**
 * Markdown report with a table of contents, tables for configuration and inventory,
 * and Mermaid flowcharts whose ASCII renderings sit in collapsible blocks.
 */
public class MarkdownReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(MarkdownReportGenerator.class);

    private static final String CODE_FENCE = "```";
    private static final int VALUE_PREVIEW = 50;
    private static final int SQL_PREVIEW = 200;
    private static final int RECIPIENTS_PREVIEW = 30;

    private static final List<String> TABLE_OF_CONTENTS = List.of(
        "Package Configuration",
        "Control Flow Stages",
        "Data Flow Transformations",
        "Error Handling Strategy",
        "Database Objects",
        "Data Flow Diagrams",
        "Critical Thresholds and Alerts");

    private final Clock clock;

    public MarkdownReportGenerator() {
        this(Clock.systemDefaultZone());
    }

    public MarkdownReportGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.MARKDOWN;
    }

    @Override
    public String generate(DtsxPackage dtsxPackage, GeneratorConfig config) {
        Objects.requireNonNull(dtsxPackage, "dtsxPackage must not be null");
        Objects.requireNonNull(config, "config must not be null");

        StringBuilder md = new StringBuilder();
        md.append("# DTSX Package Analysis: ").append(dtsxPackage.metadata().name()).append("\n\n");
        md.append("*Generated on: ").append(ReportText.timestamp(clock)).append("*\n\n");

        md.append("## Table of Contents\n\n");
        for (int i = 0; i < TABLE_OF_CONTENTS.size(); i++) {
            String title = TABLE_OF_CONTENTS.get(i);
            md.append(i + 1).append(". [").append(title).append("](#").append(anchor(title)).append(")\n");
        }
        md.append('\n');

        appendConfiguration(md, dtsxPackage);
        appendControlFlow(md, dtsxPackage);
        appendDataFlow(md, dtsxPackage);
        appendErrorHandling(md, dtsxPackage.errorHandling());
        appendDatabaseObjects(md, dtsxPackage.databaseObjects());
        appendDiagrams(md, dtsxPackage, new PackageDiagrams(config));
        appendThresholdsAndAlerts(md, dtsxPackage);

        log.info("Generated Markdown report for '{}'", dtsxPackage.metadata().name());
        return md.toString();
    }

    /**
     * GitHub-style heading anchor: lowercase, blanks to hyphens, punctuation dropped.
     */
    static String anchor(String title) {
        return title.toLowerCase().replaceAll("[^a-z0-9 -]", "").replace(' ', '-');
    }

    private static String cell(String value) {
        if (value == null || value.isEmpty()) {
            return ReportText.NOT_AVAILABLE;
        }
        return LabelText.collapseWhitespace(value).replace("|", "\\|");
    }

    private static void row(StringBuilder md, String... cells) {
        md.append("| ").append(String.join(" | ", cells)).append(" |\n");
    }

    private static void tableHeader(StringBuilder md, String... headers) {
        row(md, headers);
        md.append('|');
        for (String header : headers) {
            md.append("-".repeat(header.length() + 2)).append('|');
        }
        md.append('\n');
    }

    private void appendConfiguration(StringBuilder md, DtsxPackage dtsxPackage) {
        PackageMetadata metadata = dtsxPackage.metadata();
        md.append("## Package Configuration\n\n");
        md.append("### Metadata\n\n");
        tableHeader(md, "Property", "Value");
        row(md, "Package Name", cell(metadata.name()));
        row(md, "DTSID", cell(metadata.dtsid()));
        row(md, "Creation Date", cell(metadata.creationDate()));
        row(md, "Creator", cell(metadata.creatorName()));
        row(md, "Version", cell(metadata.versionBuild()));
        row(md, "Format Version", cell(metadata.packageFormatVersion()));
        md.append('\n');

        md.append("### Connection Managers\n\n");
        tableHeader(md, "Name", "Type", "Server", "Database");
        for (ConnectionManager connection : dtsxPackage.connectionManagers()) {
            row(md, cell(connection.name()), cell(connection.connectionType()),
                cell(connection.server()), cell(connection.database()));
        }
        md.append('\n');

        md.append("### Package Variables\n\n");
        tableHeader(md, "Name", "Namespace", "Data Type", "Value");
        for (Variable variable : dtsxPackage.variables()) {
            row(md, cell(variable.name()), cell(variable.namespace()), String.valueOf(variable.dataType()),
                cell(LabelText.preview(variable.value(), VALUE_PREVIEW)));
        }
        md.append('\n');

        if (!dtsxPackage.parameters().isEmpty()) {
            md.append("### Package Parameters\n\n");
            tableHeader(md, "Name", "Data Type", "Value", "Sensitive");
            for (Parameter parameter : dtsxPackage.parameters()) {
                row(md, cell(parameter.name()), String.valueOf(parameter.dataType()), cell(parameter.value()),
                    ReportText.yesNo(parameter.sensitive()));
            }
            md.append('\n');
        }
    }

    private void appendControlFlow(StringBuilder md, DtsxPackage dtsxPackage) {
        md.append("## Control Flow Stages\n\n");
        md.append("### Execution Order\n\n");
        for (ControlFlowStage stage : dtsxPackage.controlFlowStages()) {
            md.append("#### Stage ").append(stage.order()).append(": ").append(stage.name()).append("\n\n");
            md.append("- **Type:** ").append(stage.stageType()).append('\n');
            if (hasText(stage.description())) {
                md.append("- **Description:** ").append(stage.description()).append('\n');
            }
            if (stage.hasCondition()) {
                md.append("- **Condition:** `").append(stage.condition()).append("`\n");
            }
            if (!stage.precedenceFrom().isEmpty()) {
                md.append("- **Executes After:** ").append(ReportText.stageNames(stage.precedenceFrom())).append('\n');
            }
            if (stage.detail() instanceof SqlTask sqlTask && sqlTask.hasSql()) {
                md.append("- **SQL:** `").append(sqlPreview(sqlTask)).append("`\n");
            }

            if (!stage.tasks().isEmpty()) {
                md.append("\n**Tasks:**\n\n");
                for (TaskDescriptor task : stage.tasks()) {
                    md.append("- **").append(task.name()).append("** (").append(orNa(task.type())).append(")\n");
                    if (hasText(task.description())) {
                        md.append("  - ").append(task.description()).append('\n');
                    }
                    if (task instanceof SqlTask sqlTask && sqlTask.hasSql()) {
                        md.append("  - SQL: `").append(sqlPreview(sqlTask)).append("`\n");
                    }
                }
            }
            md.append('\n');
        }
    }

    private static String sqlPreview(SqlTask task) {
        return LabelText.preview(LabelText.collapseWhitespace(task.sqlStatement()), SQL_PREVIEW).replace("`", "'");
    }

    private void appendDataFlow(StringBuilder md, DtsxPackage dtsxPackage) {
        md.append("## Data Flow Transformations\n\n");
        for (DataFlowTask task : dtsxPackage.dataFlowTasks()) {
            md.append("### ").append(task.name()).append("\n\n");
            if (hasText(task.description())) {
                md.append('*').append(task.description()).append("*\n\n");
            }

            md.append("#### Components\n\n");
            tableHeader(md, "Component", "Type", "Class", "Description");
            for (DataFlowComponent component : task.components()) {
                String description = LabelText.preview(component.description(), VALUE_PREVIEW);
                row(md, cell(component.name()), component.category().label(), cell(component.shortClassName()),
                    description.isEmpty() ? "" : cell(description));
            }
            md.append('\n');

            md.append("#### Transformation Details\n\n");
            for (DataFlowComponent component : task.componentsOf(ComponentCategory.TRANSFORM)) {
                appendTransform(md, component);
            }
            md.append('\n');
        }
    }

    private void appendTransform(StringBuilder md, DataFlowComponent component) {
        md.append("**").append(component.name()).append("** (").append(component.shortClassName()).append(")\n\n");

        if (!component.outputColumns().isEmpty()) {
            md.append("Derived/Output Columns:\n\n");
            for (OutputColumn column : component.outputColumns()) {
                md.append("- `").append(column.name()).append('`');
                if (column.hasExpression()) {
                    md.append(": `").append(column.expression()).append('`');
                }
                md.append('\n');
            }
            md.append('\n');
        }

        if (!component.conditionalOutputs().isEmpty()) {
            md.append("Routing Conditions:\n\n");
            for (ConditionalOutput route : component.conditionalOutputs()) {
                md.append("- `").append(route.name()).append("`: ");
                if (route.isDefault()) {
                    md.append("Default (unmatched rows)");
                } else {
                    md.append('`').append(orNa(route.displayExpression())).append('`');
                }
                md.append('\n');
            }
            md.append('\n');
        }
    }

    private void appendErrorHandling(StringBuilder md, ErrorHandlingStrategy strategy) {
        md.append("## Error Handling Strategy\n\n");
        md.append("**Logging Mode:** ").append(ReportText.orDefault(strategy.loggingMode(), "Default")).append("\n\n");
        md.append("**Fail Package on Failure:** ").append(ReportText.yesNo(strategy.failPackageOnFailure()))
            .append("  \n");
        md.append("**Max Error Count:** ").append(strategy.maxErrorCount()).append("\n\n");

        if (!strategy.loggedEvents().isEmpty()) {
            md.append("**Logged Events:**\n\n");
            for (String event : strategy.loggedEvents()) {
                md.append("- ").append(event).append('\n');
            }
            md.append('\n');
        }

        if (!strategy.eventHandlers().isEmpty()) {
            md.append("### Event Handlers\n\n");
            for (EventHandler handler : strategy.eventHandlers()) {
                md.append("#### ").append(handler.eventName()).append("\n\n");
                for (TaskDescriptor task : handler.tasks()) {
                    md.append("- **").append(task.name()).append("**: ").append(orNa(task.description())).append('\n');
                }
                md.append('\n');
            }
        }
    }

    private void appendDatabaseObjects(StringBuilder md, List<DatabaseObject> objects) {
        md.append("## Database Objects\n\n");
        appendObjectTable(md, "Tables", objects, DatabaseObjectType.TABLE, true);
        appendObjectTable(md, "Stored Procedures", objects, DatabaseObjectType.STORED_PROCEDURE, false);
        appendObjectTable(md, "Functions", objects, DatabaseObjectType.FUNCTION, false);
    }

    private void appendObjectTable(StringBuilder md, String title, List<DatabaseObject> objects,
                                   DatabaseObjectType type, boolean alwaysShown) {
        List<DatabaseObject> matching = objects.stream().filter(object -> object.type() == type).toList();
        if (matching.isEmpty() && !alwaysShown) {
            return;
        }
        md.append("### ").append(title).append("\n\n");
        tableHeader(md, "Schema", "Name", "Usage");
        for (DatabaseObject object : matching) {
            row(md, cell(object.schema()), cell(object.name()), cell(object.usage()));
        }
        md.append('\n');
    }

    private void appendDiagrams(StringBuilder md, DtsxPackage dtsxPackage, PackageDiagrams diagrams) {
        md.append("## Data Flow Diagrams\n\n");
        for (DiagramBundle bundle : diagrams.all(dtsxPackage)) {
            md.append("### ").append(bundle.name()).append("\n\n");
            md.append(CODE_FENCE).append("mermaid\n");
            md.append(bundle.flowchart());
            md.append(CODE_FENCE).append("\n\n");

            md.append("<details>\n");
            md.append("<summary>ASCII Diagram</summary>\n\n");
            md.append(CODE_FENCE).append('\n');
            md.append(bundle.ascii()).append('\n');
            md.append(CODE_FENCE).append('\n');
            md.append("</details>\n\n");
        }

        md.append("### Execution Order Diagram\n\n");
        md.append(CODE_FENCE).append('\n');
        md.append(diagrams.executionOrder(dtsxPackage)).append('\n');
        md.append(CODE_FENCE).append("\n\n");

        md.append("### Data Routing Logic\n\n");
        md.append(CODE_FENCE).append('\n');
        md.append(diagrams.routingLogic(dtsxPackage)).append('\n');
        md.append(CODE_FENCE).append("\n\n");
    }

    private void appendThresholdsAndAlerts(StringBuilder md, DtsxPackage dtsxPackage) {
        md.append("## Critical Thresholds and Alerts\n\n");
        md.append("### Thresholds\n\n");
        tableHeader(md, "Name", "Value", "Category", "Data Type");
        for (Threshold threshold : dtsxPackage.thresholds()) {
            row(md, cell(threshold.name()), cell(threshold.value()), cell(threshold.category()),
                String.valueOf(threshold.dataType()));
        }
        md.append('\n');

        if (!dtsxPackage.alerts().isEmpty()) {
            md.append("### Alerts\n\n");
            tableHeader(md, "Name", "Type", "Category", "Priority", "Recipients");
            for (Alert alert : dtsxPackage.alerts()) {
                row(md, cell(alert.name()), cell(alert.alertType()), cell(alert.category()), cell(alert.priority()),
                    cell(LabelText.preview(alert.recipients(), RECIPIENTS_PREVIEW)));
            }
            md.append('\n');
        }
    }
}
