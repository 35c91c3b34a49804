package com.dtsxarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Execute-SQL task.
 *
 * @param name task name
 * @param refId reference id
 * @param dtsid unique identifier
 * @param type executable type
 * @param description optional description
 * @param connection connection manager id
 * @param sqlStatement SQL statement source
 * @param resultSetType result set type
 * @param parameterBindings parameter bindings in document order
 * @param resultBindings result bindings in document order
 */
public record SqlTask(
    String name,
    String refId,
    String dtsid,
    String type,
    String description,
    String connection,
    String sqlStatement,
    String resultSetType,
    List<ParameterBinding> parameterBindings,
    List<ResultBinding> resultBindings
) implements TaskDescriptor {
    /**
     * Compact constructor with validation.
     */
    public SqlTask {
        Objects.requireNonNull(name, "name must not be null");
        parameterBindings = parameterBindings == null ? List.of() : List.copyOf(parameterBindings);
        resultBindings = resultBindings == null ? List.of() : List.copyOf(resultBindings);
    }

    @Override
    public String kind() {
        return "SqlTask";
    }

    public boolean hasSql() {
        return sqlStatement != null && !sqlStatement.isBlank();
    }
}
