package com.dtsxarchitect.core.report.impl;

import com.dtsxarchitect.core.generator.GeneratorConfig;
import com.dtsxarchitect.core.generator.PackageDiagrams;
import com.dtsxarchitect.core.generator.render.LabelText;
import com.dtsxarchitect.core.graph.ComponentResolver;
import com.dtsxarchitect.core.model.Alert;
import com.dtsxarchitect.core.model.ComponentCategory;
import com.dtsxarchitect.core.model.ConditionalOutput;
import com.dtsxarchitect.core.model.ConnectionManager;
import com.dtsxarchitect.core.model.ControlFlowStage;
import com.dtsxarchitect.core.model.DataFlowComponent;
import com.dtsxarchitect.core.model.DataFlowPath;
import com.dtsxarchitect.core.model.DataFlowTask;
import com.dtsxarchitect.core.model.DatabaseObject;
import com.dtsxarchitect.core.model.DatabaseObjectType;
import com.dtsxarchitect.core.model.DtsxPackage;
import com.dtsxarchitect.core.model.ErrorHandlingStrategy;
import com.dtsxarchitect.core.model.EventHandler;
import com.dtsxarchitect.core.model.OutputColumn;
import com.dtsxarchitect.core.model.PackageMetadata;
import com.dtsxarchitect.core.model.Parameter;
import com.dtsxarchitect.core.model.SendMailTask;
import com.dtsxarchitect.core.model.SqlTask;
import com.dtsxarchitect.core.model.TaskDescriptor;
import com.dtsxarchitect.core.model.Threshold;
import com.dtsxarchitect.core.model.Variable;
import com.dtsxarchitect.core.report.ReportFormat;
import com.dtsxarchitect.core.report.ReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.dtsxarchitect.core.report.impl.ReportText.hasText;
import static com.dtsxarchitect.core.report.impl.ReportText.orNa;
import static com.dtsxarchitect.core.report.impl.ReportText.pad;

/**
 * Plain-text report: a banner followed by seven numbered sections.
 *
 * <ol>
 *   <li>Package configuration</li>
 *   <li>Control flow stages in execution order</li>
 *   <li>Data flow transformations and routing logic</li>
 *   <li>Error handling strategy</li>
 *   <li>Database objects</li>
 *   <li>Diagrams (ASCII control flow, data flows, execution order, routing logic)</li>
 *   <li>Critical thresholds and alerts</li>
 * </ol>
 */
public class TextReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(TextReportGenerator.class);

    private static final int WIDTH = 80;
    private static final int SQL_PREVIEW = 100;
    private static final int SOURCE_SQL_PREVIEW = 200;
    private static final int DERIVED_PREVIEW = 60;

    private final Clock clock;

    public TextReportGenerator() {
        this(Clock.systemDefaultZone());
    }

    public TextReportGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.TEXT;
    }

    @Override
    public String generate(DtsxPackage dtsxPackage, GeneratorConfig config) {
        Objects.requireNonNull(dtsxPackage, "dtsxPackage must not be null");
        Objects.requireNonNull(config, "config must not be null");

        List<String> sections = new ArrayList<>();
        sections.add(header(dtsxPackage.metadata()));
        sections.add(packageConfiguration(dtsxPackage));
        sections.add(controlFlow(dtsxPackage));
        sections.add(dataFlow(dtsxPackage));
        sections.add(errorHandling(dtsxPackage.errorHandling()));
        sections.add(databaseObjects(dtsxPackage.databaseObjects()));
        sections.add(diagrams(dtsxPackage, new PackageDiagrams(config)));
        sections.add(thresholdsAndAlerts(dtsxPackage));

        log.info("Generated text report for '{}'", dtsxPackage.metadata().name());
        return String.join("\n\n", sections);
    }

    private String header(PackageMetadata metadata) {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(WIDTH)).append('\n');
        sb.append(LabelText.center(" DTSX PACKAGE ANALYSIS REPORT ", WIDTH)).append('\n');
        sb.append("=".repeat(WIDTH)).append('\n');
        sb.append(pad(" Package: " + metadata.name(), WIDTH)).append('\n');
        sb.append(pad(" Generated: " + ReportText.timestamp(clock), WIDTH)).append('\n');
        sb.append("=".repeat(WIDTH));
        return sb.toString();
    }

    private static void sectionTitle(StringBuilder sb, String title) {
        sb.append("=".repeat(WIDTH)).append('\n');
        sb.append(' ').append(title).append('\n');
        sb.append("=".repeat(WIDTH)).append('\n');
    }

    private static void subTitle(StringBuilder sb, String title, int ruleWidth) {
        sb.append('\n').append(title).append('\n');
        sb.append("-".repeat(ruleWidth)).append('\n');
    }

    private String packageConfiguration(DtsxPackage dtsxPackage) {
        PackageMetadata metadata = dtsxPackage.metadata();
        StringBuilder sb = new StringBuilder();
        sectionTitle(sb, "1. PACKAGE CONFIGURATION");

        subTitle(sb, "1.1 METADATA", 40);
        sb.append("  Package Name:        ").append(metadata.name()).append('\n');
        sb.append("  DTSID:               ").append(orNa(metadata.dtsid())).append('\n');
        sb.append("  Creation Date:       ").append(orNa(metadata.creationDate())).append('\n');
        sb.append("  Creator:             ").append(orNa(metadata.creatorName())).append('\n');
        sb.append("  Creator Computer:    ").append(orNa(metadata.creatorComputer())).append('\n');
        sb.append("  Version Build:       ").append(orNa(metadata.versionBuild())).append('\n');
        sb.append("  Package Format:      ").append(orNa(metadata.packageFormatVersion())).append('\n');
        sb.append("  Last Modified Ver:   ").append(orNa(metadata.lastModifiedVersion())).append('\n');
        if (hasText(metadata.description())) {
            sb.append("  Description:         ").append(metadata.description()).append('\n');
        }

        subTitle(sb, "1.2 CONNECTION MANAGERS", 40);
        int index = 1;
        for (ConnectionManager connection : dtsxPackage.connectionManagers()) {
            sb.append("\n  [").append(index++).append("] ").append(connection.name()).append('\n');
            sb.append("      Type:       ").append(connection.connectionType()).append('\n');
            sb.append("      Server:     ").append(orNa(connection.server())).append('\n');
            sb.append("      Database:   ").append(orNa(connection.database())).append('\n');
            sb.append("      Provider:   ").append(orNa(connection.provider())).append('\n');
        }

        subTitle(sb, "1.3 PACKAGE VARIABLES", 40);
        sb.append("  ").append(pad("Name", 30)).append(' ').append(pad("Namespace", 10)).append(' ')
            .append(pad("Type", 6)).append(' ').append("Value").append('\n');
        sb.append("  ").append("-".repeat(30)).append(' ').append("-".repeat(10)).append(' ')
            .append("-".repeat(6)).append(' ').append("-".repeat(30)).append('\n');
        for (Variable variable : dtsxPackage.variables()) {
            String value = hasText(variable.value()) ? truncate(variable.value(), 30) : ReportText.NOT_AVAILABLE;
            sb.append("  ").append(pad(variable.name(), 30)).append(' ').append(pad(variable.namespace(), 10))
                .append(' ').append(pad(String.valueOf(variable.dataType()), 6)).append(' ').append(value)
                .append('\n');
        }

        if (!dtsxPackage.parameters().isEmpty()) {
            subTitle(sb, "1.4 PACKAGE PARAMETERS", 40);
            sb.append("  ").append(pad("Name", 25)).append(' ').append(pad("Type", 6)).append(' ')
                .append(pad("Sensitive", 10)).append(' ').append("Value").append('\n');
            sb.append("  ").append("-".repeat(25)).append(' ').append("-".repeat(6)).append(' ')
                .append("-".repeat(10)).append(' ').append("-".repeat(30)).append('\n');
            for (Parameter parameter : dtsxPackage.parameters()) {
                String value = hasText(parameter.value()) ? truncate(parameter.value(), 30) : ReportText.NOT_AVAILABLE;
                sb.append("  ").append(pad(parameter.name(), 25)).append(' ')
                    .append(pad(String.valueOf(parameter.dataType()), 6)).append(' ')
                    .append(pad(ReportText.yesNo(parameter.sensitive()), 10)).append(' ').append(value).append('\n');
            }
        }
        return stripTrailingNewline(sb);
    }

    private String controlFlow(DtsxPackage dtsxPackage) {
        StringBuilder sb = new StringBuilder();
        sectionTitle(sb, "2. CONTROL FLOW STAGES (EXECUTION ORDER)");

        for (ControlFlowStage stage : dtsxPackage.controlFlowStages()) {
            sb.append('\n').append("=".repeat(60)).append('\n');
            sb.append("STAGE ").append(stage.order()).append(": ").append(stage.name()).append('\n');
            sb.append("=".repeat(60)).append('\n');
            sb.append("  Type:        ").append(stage.stageType()).append('\n');
            if (hasText(stage.description())) {
                sb.append("  Description: ").append(stage.description()).append('\n');
            }
            if (stage.hasCondition()) {
                sb.append("  Condition:   ").append(stage.condition()).append('\n');
            }
            if (!stage.precedenceFrom().isEmpty()) {
                sb.append("  Executes After: ").append(ReportText.stageNames(stage.precedenceFrom())).append('\n');
            }
            if (stage.detail() != null) {
                appendTaskSpecifics(sb, stage.detail(), "  ");
            }

            if (!stage.tasks().isEmpty()) {
                sb.append("\n  TASKS (").append(stage.tasks().size()).append(" total):\n");
                sb.append("  ").append("-".repeat(50)).append('\n');
                int index = 1;
                for (TaskDescriptor task : stage.tasks()) {
                    sb.append("\n    [").append(index++).append("] ").append(task.name()).append('\n');
                    sb.append("        Type: ").append(orDefault(task.type())).append('\n');
                    if (hasText(task.description())) {
                        sb.append("        Desc: ").append(task.description()).append('\n');
                    }
                    appendTaskSpecifics(sb, task, "        ");
                }
            }
        }
        return stripTrailingNewline(sb);
    }

    private void appendTaskSpecifics(StringBuilder sb, TaskDescriptor task, String indent) {
        if (task instanceof SqlTask sqlTask && sqlTask.hasSql()) {
            String sql = LabelText.preview(LabelText.collapseWhitespace(sqlTask.sqlStatement()), SQL_PREVIEW);
            sb.append(indent).append("SQL:  ").append(sql).append('\n');
        } else if (task instanceof SendMailTask mailTask && hasText(mailTask.to())) {
            sb.append(indent).append("To:   ").append(mailTask.to()).append('\n');
        }
    }

    private String dataFlow(DtsxPackage dtsxPackage) {
        StringBuilder sb = new StringBuilder();
        sectionTitle(sb, "3. DATA FLOW TRANSFORMATIONS AND ROUTING LOGIC");

        for (DataFlowTask task : dtsxPackage.dataFlowTasks()) {
            List<DataFlowComponent> sources = task.componentsOf(ComponentCategory.SOURCE);
            List<DataFlowComponent> transforms = task.componentsOf(ComponentCategory.TRANSFORM);
            List<DataFlowComponent> destinations = task.componentsOf(ComponentCategory.DESTINATION);

            sb.append('\n').append("=".repeat(70)).append('\n');
            sb.append("DATA FLOW TASK: ").append(task.name()).append('\n');
            sb.append("=".repeat(70)).append('\n');
            if (hasText(task.description())) {
                sb.append("Description: ").append(task.description()).append('\n');
            }

            sb.append("\nComponent Summary:\n");
            sb.append("  Sources:        ").append(sources.size()).append('\n');
            sb.append("  Transforms:     ").append(transforms.size()).append('\n');
            sb.append("  Destinations:   ").append(destinations.size()).append('\n');

            if (!sources.isEmpty()) {
                subTitle(sb, "3.1 SOURCES", 50);
                for (DataFlowComponent source : sources) {
                    sb.append("\n  [").append(source.name()).append("]\n");
                    sb.append("    Class: ").append(source.componentClass()).append('\n');
                    if (hasText(source.connectionManager())) {
                        sb.append("    Connection: ").append(source.connectionManager()).append('\n');
                    }
                    if (hasText(source.sqlCommand())) {
                        sb.append("    SQL: ")
                            .append(LabelText.preview(LabelText.collapseWhitespace(source.sqlCommand()), SOURCE_SQL_PREVIEW))
                            .append('\n');
                    }
                    if (hasText(source.tableName())) {
                        sb.append("    Table: ").append(source.tableName()).append('\n');
                    }
                }
            }

            if (!transforms.isEmpty()) {
                subTitle(sb, "3.2 TRANSFORMATIONS", 50);
                for (DataFlowComponent transform : transforms) {
                    appendTransform(sb, transform);
                }
            }

            if (!destinations.isEmpty()) {
                subTitle(sb, "3.3 DESTINATIONS", 50);
                for (DataFlowComponent destination : destinations) {
                    sb.append("\n  [").append(destination.name()).append("]\n");
                    sb.append("    Class: ").append(destination.componentClass()).append('\n');
                    if (hasText(destination.tableName())) {
                        sb.append("    Table: ").append(destination.tableName()).append('\n');
                    }
                    if (hasText(destination.connectionManager())) {
                        sb.append("    Connection: ").append(destination.connectionManager()).append('\n');
                    }
                    if (destination.hasErrorOutput()) {
                        sb.append("    Has Error Output: Yes\n");
                    }
                }
            }

            subTitle(sb, "3.4 DATA PATHS", 50);
            ComponentResolver resolver = new ComponentResolver(task);
            for (DataFlowPath path : task.paths()) {
                sb.append("  ").append(path.name()).append('\n');
                sb.append("    From: ").append(resolver.resolveName(path.sourceRef()).orElse("?")).append('\n');
                sb.append("    To:   ").append(resolver.resolveName(path.destinationRef()).orElse("?")).append('\n');
            }
        }
        return stripTrailingNewline(sb);
    }

    private void appendTransform(StringBuilder sb, DataFlowComponent transform) {
        sb.append("\n  [").append(transform.name()).append("]\n");
        sb.append("    Class: ").append(transform.componentClass()).append('\n');
        if (hasText(transform.description())) {
            sb.append("    Description: ").append(transform.description()).append('\n');
        }

        List<OutputColumn> derived = transform.outputColumns().stream().filter(OutputColumn::hasExpression).toList();
        if (!derived.isEmpty()) {
            sb.append("    Derived Columns:\n");
            for (OutputColumn column : derived) {
                sb.append("      - ").append(column.name()).append(": ")
                    .append(LabelText.preview(column.expression(), DERIVED_PREVIEW)).append('\n');
            }
        }

        if (!transform.conditionalOutputs().isEmpty()) {
            sb.append("    Routing Logic:\n");
            for (ConditionalOutput route : transform.conditionalOutputs()) {
                String condition = route.isDefault()
                    ? "DEFAULT (unmatched rows)"
                    : orDefault(route.displayExpression());
                sb.append("      - ").append(route.name()).append(": ").append(condition).append('\n');
            }
        }
    }

    private String errorHandling(ErrorHandlingStrategy strategy) {
        StringBuilder sb = new StringBuilder();
        sectionTitle(sb, "4. ERROR HANDLING STRATEGY");

        subTitle(sb, "4.1 LOGGING CONFIGURATION", 50);
        sb.append("  Logging Mode: ").append(ReportText.orDefault(strategy.loggingMode(), "Default")).append('\n');
        sb.append("  Fail on Failure: ").append(ReportText.yesNo(strategy.failPackageOnFailure())).append('\n');
        sb.append("  Max Error Count: ").append(strategy.maxErrorCount()).append('\n');

        if (!strategy.loggedEvents().isEmpty()) {
            sb.append("\n  Logged Events:\n");
            for (String event : strategy.loggedEvents()) {
                sb.append("    - ").append(event).append('\n');
            }
        }

        if (!strategy.eventHandlers().isEmpty()) {
            subTitle(sb, "4.2 EVENT HANDLERS", 50);
            for (EventHandler handler : strategy.eventHandlers()) {
                sb.append("\n  [").append(handler.eventName()).append("]\n");
                sb.append("    Tasks:\n");
                for (TaskDescriptor task : handler.tasks()) {
                    sb.append("      - ").append(task.name()).append('\n');
                    if (hasText(task.description())) {
                        sb.append("        ").append(task.description()).append('\n');
                    }
                    if (task instanceof SendMailTask mailTask && hasText(mailTask.to())) {
                        sb.append("        Recipients: ").append(mailTask.to()).append('\n');
                    }
                }
            }
        }
        return stripTrailingNewline(sb);
    }

    private String databaseObjects(List<DatabaseObject> objects) {
        StringBuilder sb = new StringBuilder();
        sectionTitle(sb, "5. DATABASE OBJECTS");

        List<DatabaseObject> tables = ofType(objects, DatabaseObjectType.TABLE);
        List<DatabaseObject> procedures = ofType(objects, DatabaseObjectType.STORED_PROCEDURE);
        List<DatabaseObject> functions = ofType(objects, DatabaseObjectType.FUNCTION);

        appendObjectTable(sb, "5.1 TABLES", tables);
        if (!procedures.isEmpty()) {
            appendObjectTable(sb, "5.2 STORED PROCEDURES", procedures);
        }
        if (!functions.isEmpty()) {
            appendObjectTable(sb, "5.3 FUNCTIONS", functions);
        }
        return stripTrailingNewline(sb);
    }

    private static List<DatabaseObject> ofType(List<DatabaseObject> objects, DatabaseObjectType type) {
        return objects.stream().filter(object -> object.type() == type).toList();
    }

    private void appendObjectTable(StringBuilder sb, String title, List<DatabaseObject> objects) {
        subTitle(sb, title + " (" + objects.size() + " found)", 50);
        sb.append("  ").append(pad("Schema", 15)).append(' ').append(pad("Name", 35)).append(' ')
            .append("Usage").append('\n');
        sb.append("  ").append("-".repeat(15)).append(' ').append("-".repeat(35)).append(' ')
            .append("-".repeat(15)).append('\n');
        for (DatabaseObject object : objects) {
            sb.append("  ").append(pad(object.schema(), 15)).append(' ').append(pad(object.name(), 35))
                .append(' ').append(orDefault(object.usage())).append('\n');
        }
    }

    private String diagrams(DtsxPackage dtsxPackage, PackageDiagrams diagrams) {
        StringBuilder sb = new StringBuilder();
        sectionTitle(sb, "6. DATA FLOW DIAGRAMS");
        sb.append(diagrams.controlFlow(dtsxPackage).ascii()).append('\n');
        for (DataFlowTask task : dtsxPackage.dataFlowTasks()) {
            sb.append(diagrams.dataFlow(task).ascii()).append('\n');
        }
        sb.append(diagrams.executionOrder(dtsxPackage)).append('\n');
        sb.append(diagrams.routingLogic(dtsxPackage));
        return stripTrailingNewline(sb);
    }

    private String thresholdsAndAlerts(DtsxPackage dtsxPackage) {
        StringBuilder sb = new StringBuilder();
        sectionTitle(sb, "7. CRITICAL THRESHOLDS AND ALERTS");

        subTitle(sb, "7.1 THRESHOLDS (" + dtsxPackage.thresholds().size() + " found)", 60);
        sb.append("  ").append(pad("Name", 30)).append(' ').append(pad("Value", 15)).append(' ')
            .append("Category").append('\n');
        sb.append("  ").append("-".repeat(30)).append(' ').append("-".repeat(15)).append(' ')
            .append("-".repeat(15)).append('\n');
        for (Threshold threshold : dtsxPackage.thresholds()) {
            String value = hasText(threshold.value()) ? truncate(threshold.value(), 15) : ReportText.NOT_AVAILABLE;
            sb.append("  ").append(pad(threshold.name(), 30)).append(' ').append(pad(value, 15)).append(' ')
                .append(threshold.category()).append('\n');
        }

        if (!dtsxPackage.alerts().isEmpty()) {
            subTitle(sb, "7.2 ALERTS (" + dtsxPackage.alerts().size() + " found)", 60);
            sb.append("  ").append(pad("Name", 30)).append(' ').append(pad("Type", 15)).append(' ')
                .append(pad("Priority", 10)).append(' ').append("Category").append('\n');
            sb.append("  ").append("-".repeat(30)).append(' ').append("-".repeat(15)).append(' ')
                .append("-".repeat(10)).append(' ').append("-".repeat(10)).append('\n');
            for (Alert alert : dtsxPackage.alerts()) {
                sb.append("  ").append(pad(alert.name(), 30)).append(' ').append(pad(alert.alertType(), 15))
                    .append(' ').append(pad(orDefault(alert.priority()), 10)).append(' ')
                    .append(orDefault(alert.category())).append('\n');
                if (hasText(alert.recipients())) {
                    sb.append("    Recipients: ").append(alert.recipients()).append('\n');
                }
            }
        }
        return stripTrailingNewline(sb);
    }

    private static String truncate(String value, int length) {
        return value.length() <= length ? value : value.substring(0, length);
    }

    private static String orDefault(String value) {
        return ReportText.orDefault(value, "Unknown");
    }

    private static String stripTrailingNewline(StringBuilder sb) {
        int end = sb.length();
        while (end > 0 && sb.charAt(end - 1) == '\n') {
            end--;
        }
        return sb.substring(0, end);
    }
}
