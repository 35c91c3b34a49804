package com.dtsxarchitect.core.report.impl;

import com.dtsxarchitect.core.generator.GeneratorConfig;
import com.dtsxarchitect.core.model.Alert;
import com.dtsxarchitect.core.model.ConditionalOutput;
import com.dtsxarchitect.core.model.ConnectionManager;
import com.dtsxarchitect.core.model.ControlFlowStage;
import com.dtsxarchitect.core.model.DataFlowComponent;
import com.dtsxarchitect.core.model.DataFlowPath;
import com.dtsxarchitect.core.model.DataFlowTask;
import com.dtsxarchitect.core.model.DatabaseObject;
import com.dtsxarchitect.core.model.DtsxPackage;
import com.dtsxarchitect.core.model.ErrorHandlingStrategy;
import com.dtsxarchitect.core.model.EventHandler;
import com.dtsxarchitect.core.model.OutputColumn;
import com.dtsxarchitect.core.model.PackageMetadata;
import com.dtsxarchitect.core.model.Parameter;
import com.dtsxarchitect.core.model.ParameterBinding;
import com.dtsxarchitect.core.model.ResultBinding;
import com.dtsxarchitect.core.model.SendMailTask;
import com.dtsxarchitect.core.model.SqlTask;
import com.dtsxarchitect.core.model.TaskDescriptor;
import com.dtsxarchitect.core.model.Threshold;
import com.dtsxarchitect.core.model.Variable;
import com.dtsxarchitect.core.report.ReportFormat;
import com.dtsxarchitect.core.report.ReportGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Pretty-printed JSON report of the parsed package.
 *
 * <p>The document is assembled as a Jackson tree so field order and names stay stable
 * regardless of the model's accessor names. Task descriptors carry a {@code kind} tag
 * ({@code Generic}, {@code SqlTask} or {@code SendMailTask}) and only their own fields.
 */
public class JsonReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonReportGenerator.class);

    private final ObjectMapper mapper;

    public JsonReportGenerator() {
        this(new ObjectMapper());
    }

    public JsonReportGenerator(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.JSON;
    }

    @Override
    public String generate(DtsxPackage dtsxPackage, GeneratorConfig config) {
        Objects.requireNonNull(dtsxPackage, "dtsxPackage must not be null");
        Objects.requireNonNull(config, "config must not be null");

        ObjectNode root = toJson(dtsxPackage);
        try {
            String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
            log.info("Generated JSON report for '{}'", dtsxPackage.metadata().name());
            return json;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report for " + dtsxPackage.metadata().name(), e);
        }
    }

    /**
     * Builds the report tree.
     *
     * @param dtsxPackage parsed package
     * @return root node
     */
    public ObjectNode toJson(DtsxPackage dtsxPackage) {
        ObjectNode root = mapper.createObjectNode();
        root.set("metadata", metadata(dtsxPackage.metadata()));

        ArrayNode connections = root.putArray("connectionManagers");
        for (ConnectionManager connection : dtsxPackage.connectionManagers()) {
            ObjectNode node = connections.addObject();
            node.put("name", connection.name());
            node.put("type", connection.connectionType());
            node.put("server", connection.server());
            node.put("database", connection.database());
            node.put("provider", connection.provider());
        }

        ArrayNode variables = root.putArray("variables");
        for (Variable variable : dtsxPackage.variables()) {
            ObjectNode node = variables.addObject();
            node.put("name", variable.name());
            node.put("namespace", variable.namespace());
            node.put("dataType", variable.dataType());
            node.put("value", variable.value());
            node.put("expression", variable.expression());
            node.put("readOnly", variable.readOnly());
        }

        ArrayNode parameters = root.putArray("parameters");
        for (Parameter parameter : dtsxPackage.parameters()) {
            ObjectNode node = parameters.addObject();
            node.put("name", parameter.name());
            node.put("dataType", parameter.dataType());
            node.put("value", parameter.value());
            node.put("sensitive", parameter.sensitive());
            node.put("required", parameter.required());
        }

        ArrayNode stages = root.putArray("controlFlowStages");
        for (ControlFlowStage stage : dtsxPackage.controlFlowStages()) {
            stages.add(stage(stage));
        }

        ArrayNode dataFlows = root.putArray("dataFlowTasks");
        for (DataFlowTask task : dtsxPackage.dataFlowTasks()) {
            dataFlows.add(dataFlow(task));
        }

        root.set("errorHandling", errorHandling(dtsxPackage.errorHandling()));

        ArrayNode objects = root.putArray("databaseObjects");
        for (DatabaseObject object : dtsxPackage.databaseObjects()) {
            ObjectNode node = objects.addObject();
            node.put("name", object.name());
            node.put("type", object.type().label());
            node.put("schema", object.schema());
            node.put("database", object.database());
            node.put("usage", object.usage());
        }

        ArrayNode thresholds = root.putArray("thresholds");
        for (Threshold threshold : dtsxPackage.thresholds()) {
            ObjectNode node = thresholds.addObject();
            node.put("name", threshold.name());
            node.put("value", threshold.value());
            node.put("category", threshold.category());
            node.put("dataType", threshold.dataType());
        }

        ArrayNode alerts = root.putArray("alerts");
        for (Alert alert : dtsxPackage.alerts()) {
            ObjectNode node = alerts.addObject();
            node.put("name", alert.name());
            node.put("type", alert.alertType());
            node.put("category", alert.category());
            node.put("priority", alert.priority());
            node.put("recipients", alert.recipients());
            node.put("condition", alert.condition());
        }
        return root;
    }

    private ObjectNode metadata(PackageMetadata metadata) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", metadata.name());
        node.put("dtsid", metadata.dtsid());
        node.put("creationDate", metadata.creationDate());
        node.put("creatorName", metadata.creatorName());
        node.put("creatorComputer", metadata.creatorComputer());
        node.put("versionBuild", metadata.versionBuild());
        node.put("packageFormatVersion", metadata.packageFormatVersion());
        node.put("description", metadata.description());
        return node;
    }

    private ObjectNode stage(ControlFlowStage stage) {
        ObjectNode node = mapper.createObjectNode();
        node.put("order", stage.order());
        node.put("name", stage.name());
        node.put("type", stage.stageType());
        node.put("description", stage.description());
        node.put("condition", stage.condition());
        stringArray(node.putArray("precedenceFrom"), stage.precedenceFrom());
        stringArray(node.putArray("precedenceTo"), stage.precedenceTo());
        if (stage.detail() != null) {
            node.set("detail", task(stage.detail()));
        }
        ArrayNode tasks = node.putArray("tasks");
        for (TaskDescriptor task : stage.tasks()) {
            tasks.add(task(task));
        }
        return node;
    }

    ObjectNode task(TaskDescriptor task) {
        ObjectNode node = mapper.createObjectNode();
        node.put("kind", task.kind());
        node.put("name", task.name());
        node.put("type", task.type());
        node.put("description", task.description());
        if (task instanceof SqlTask sqlTask) {
            node.put("connection", sqlTask.connection());
            node.put("sqlStatement", sqlTask.sqlStatement());
            node.put("resultSetType", sqlTask.resultSetType());
            ArrayNode bindings = node.putArray("parameterBindings");
            for (ParameterBinding binding : sqlTask.parameterBindings()) {
                ObjectNode bindingNode = bindings.addObject();
                bindingNode.put("parameterName", binding.parameterName());
                bindingNode.put("variableName", binding.variableName());
                bindingNode.put("direction", binding.direction());
                bindingNode.put("dataType", binding.dataType());
            }
            ArrayNode results = node.putArray("resultBindings");
            for (ResultBinding binding : sqlTask.resultBindings()) {
                ObjectNode bindingNode = results.addObject();
                bindingNode.put("resultName", binding.resultName());
                bindingNode.put("variableName", binding.variableName());
            }
        } else if (task instanceof SendMailTask mailTask) {
            node.put("smtpConnection", mailTask.smtpConnection());
            node.put("from", mailTask.from());
            node.put("to", mailTask.to());
            node.put("cc", mailTask.cc());
            node.put("bcc", mailTask.bcc());
            node.put("subject", mailTask.subject());
            node.put("messageSource", mailTask.messageSource());
            node.put("priority", mailTask.priority());
        }
        return node;
    }

    private ObjectNode dataFlow(DataFlowTask task) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", task.name());
        node.put("description", task.description());

        ArrayNode components = node.putArray("components");
        for (DataFlowComponent component : task.components()) {
            ObjectNode componentNode = components.addObject();
            componentNode.put("name", component.name());
            componentNode.put("type", component.category().label());
            componentNode.put("class", component.componentClass());
            componentNode.put("connection", component.connectionManager());
            componentNode.put("sqlCommand", component.sqlCommand());
            componentNode.put("tableName", component.tableName());
            componentNode.put("hasErrorOutput", component.hasErrorOutput());

            ArrayNode columns = componentNode.putArray("outputColumns");
            for (OutputColumn column : component.outputColumns()) {
                ObjectNode columnNode = columns.addObject();
                columnNode.put("name", column.name());
                columnNode.put("expression", column.expression());
            }

            ArrayNode routes = componentNode.putArray("conditionalOutputs");
            for (ConditionalOutput route : component.conditionalOutputs()) {
                ObjectNode routeNode = routes.addObject();
                routeNode.put("name", route.name());
                routeNode.put("expression", route.expression());
                routeNode.put("friendlyExpression", route.friendlyExpression());
                routeNode.put("evaluationOrder", route.evaluationOrder());
                routeNode.put("isDefault", route.isDefault());
            }
        }

        ArrayNode paths = node.putArray("paths");
        for (DataFlowPath path : task.paths()) {
            ObjectNode pathNode = paths.addObject();
            pathNode.put("name", path.name());
            pathNode.put("source", path.sourceRef());
            pathNode.put("destination", path.destinationRef());
        }
        return node;
    }

    private ObjectNode errorHandling(ErrorHandlingStrategy strategy) {
        ObjectNode node = mapper.createObjectNode();
        node.put("loggingMode", strategy.loggingMode());
        node.put("failPackageOnFailure", strategy.failPackageOnFailure());
        node.put("maxErrorCount", strategy.maxErrorCount());
        stringArray(node.putArray("loggedEvents"), strategy.loggedEvents());

        ArrayNode handlers = node.putArray("eventHandlers");
        for (EventHandler handler : strategy.eventHandlers()) {
            ObjectNode handlerNode = handlers.addObject();
            handlerNode.put("eventName", handler.eventName());
            ArrayNode tasks = handlerNode.putArray("tasks");
            for (TaskDescriptor task : handler.tasks()) {
                tasks.add(task(task));
            }
        }
        return node;
    }

    private static void stringArray(ArrayNode array, List<String> values) {
        values.forEach(array::add);
    }
}
