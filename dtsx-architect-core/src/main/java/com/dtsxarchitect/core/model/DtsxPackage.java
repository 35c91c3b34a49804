package com.dtsxarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Root aggregate of a parsed package. Built once per parse and never mutated.
 *
 * @param metadata package metadata
 * @param annotations designer annotations
 * @param connectionManagers connection managers
 * @param variables package variables
 * @param parameters package parameters
 * @param controlFlowStages linked control-flow stages in document order
 * @param dataFlowTasks data-flow tasks in document order
 * @param precedenceConstraints raw top-level precedence constraints
 * @param errorHandling event handlers and logging configuration
 * @param databaseObjects mined database objects
 * @param thresholds inferred thresholds
 * @param alerts inferred alerts
 */
public record DtsxPackage(
    PackageMetadata metadata,
    List<Annotation> annotations,
    List<ConnectionManager> connectionManagers,
    List<Variable> variables,
    List<Parameter> parameters,
    List<ControlFlowStage> controlFlowStages,
    List<DataFlowTask> dataFlowTasks,
    List<PrecedenceConstraint> precedenceConstraints,
    ErrorHandlingStrategy errorHandling,
    List<DatabaseObject> databaseObjects,
    List<Threshold> thresholds,
    List<Alert> alerts
) {
    /**
     * Compact constructor with validation.
     */
    public DtsxPackage {
        Objects.requireNonNull(metadata, "metadata must not be null");
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
        connectionManagers = connectionManagers == null ? List.of() : List.copyOf(connectionManagers);
        variables = variables == null ? List.of() : List.copyOf(variables);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        controlFlowStages = controlFlowStages == null ? List.of() : List.copyOf(controlFlowStages);
        dataFlowTasks = dataFlowTasks == null ? List.of() : List.copyOf(dataFlowTasks);
        precedenceConstraints = precedenceConstraints == null ? List.of() : List.copyOf(precedenceConstraints);
        if (errorHandling == null) {
            errorHandling = ErrorHandlingStrategy.empty();
        }
        databaseObjects = databaseObjects == null ? List.of() : List.copyOf(databaseObjects);
        thresholds = thresholds == null ? List.of() : List.copyOf(thresholds);
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
    }

    /**
     * Finds a connection manager by reference id, DTSID or name.
     *
     * @param reference connection reference
     * @return connection manager, or {@code null} if none matches
     */
    public ConnectionManager findConnection(String reference) {
        if (reference == null) {
            return null;
        }
        for (ConnectionManager cm : connectionManagers) {
            if (reference.equals(cm.refId()) || reference.equals(cm.dtsid()) || reference.equals(cm.name())) {
                return cm;
            }
        }
        return null;
    }
}
