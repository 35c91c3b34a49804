package com.dtsxarchitect.core.analysis;

import com.dtsxarchitect.core.model.ConnectionManager;
import com.dtsxarchitect.core.model.ControlFlowStage;
import com.dtsxarchitect.core.model.DataFlowComponent;
import com.dtsxarchitect.core.model.DataFlowTask;
import com.dtsxarchitect.core.model.DatabaseObject;
import com.dtsxarchitect.core.model.DatabaseObjectType;
import com.dtsxarchitect.core.model.SqlTask;
import com.dtsxarchitect.core.model.TaskDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort scan of SQL text for tables, stored procedures and functions.
 *
 * <p>Sources, in order: direct table names of data-flow components, statements of SQL
 * tasks (stage details and nested tasks), then SQL commands of data-flow components.
 * Objects are deduplicated by {@link DatabaseObject#key()}; the first occurrence wins.
 */
public class DatabaseObjectMiner {

    private static final Logger log = LoggerFactory.getLogger(DatabaseObjectMiner.class);

    private static final String TASK_USAGE = "Task";
    private static final String EXECUTE_USAGE = "Execute";
    private static final String REFERENCE_USAGE = "Reference";

    /**
     * Mines database objects.
     *
     * @param stages linked control-flow stages
     * @param dataFlowTasks data-flow tasks
     * @param connections connection managers, used to resolve database names
     * @return deduplicated objects in discovery order
     */
    public List<DatabaseObject> mine(List<ControlFlowStage> stages,
                                     List<DataFlowTask> dataFlowTasks,
                                     List<ConnectionManager> connections) {
        Map<String, DatabaseObject> found = new LinkedHashMap<>();
        List<SqlSource> taskStatements = new ArrayList<>();
        List<SqlSource> componentStatements = new ArrayList<>();

        for (DataFlowTask task : dataFlowTasks) {
            for (DataFlowComponent component : task.components()) {
                String usage = component.category().label();
                String database = databaseOf(component.connectionManager(), connections);
                if (component.sqlCommand() != null && !component.sqlCommand().isBlank()) {
                    componentStatements.add(new SqlSource(component.sqlCommand(), usage, component.connectionManager(), database));
                }
                if (component.tableName() != null && !component.tableName().isBlank()) {
                    QualifiedName name = QualifiedName.parse(component.tableName());
                    add(found, new DatabaseObject(name.name(), DatabaseObjectType.TABLE, name.schema(),
                        name.database() != null ? name.database() : database, component.connectionManager(), usage));
                }
            }
        }

        for (ControlFlowStage stage : stages) {
            List<TaskDescriptor> descriptors = new ArrayList<>();
            if (stage.detail() != null) {
                descriptors.add(stage.detail());
            }
            descriptors.addAll(stage.tasks());
            for (TaskDescriptor descriptor : descriptors) {
                if (descriptor instanceof SqlTask sqlTask && sqlTask.hasSql()) {
                    taskStatements.add(new SqlSource(sqlTask.sqlStatement(), TASK_USAGE, sqlTask.connection(),
                        databaseOf(sqlTask.connection(), connections)));
                }
            }
        }

        List<SqlSource> statements = new ArrayList<>(taskStatements);
        statements.addAll(componentStatements);
        for (SqlSource statement : statements) {
            scan(statement, found);
        }
        log.debug("Mined {} database objects from {} SQL statements", found.size(), statements.size());
        return List.copyOf(found.values());
    }

    /**
     * Scans one SQL text, without connection context.
     *
     * @param sql SQL text
     * @param usage usage recorded for tables
     * @return objects found in the text
     */
    public List<DatabaseObject> scan(String sql, String usage) {
        Map<String, DatabaseObject> found = new LinkedHashMap<>();
        scan(new SqlSource(sql, usage, null, null), found);
        return List.copyOf(found.values());
    }

    private void scan(SqlSource source, Map<String, DatabaseObject> found) {
        for (Pattern pattern : SqlPatterns.TABLE_PATTERNS) {
            collect(pattern, source, DatabaseObjectType.TABLE, source.usage(), found);
        }
        collect(SqlPatterns.PROCEDURE_PATTERN, source, DatabaseObjectType.STORED_PROCEDURE, EXECUTE_USAGE, found);
        collect(SqlPatterns.FUNCTION_PATTERN, source, DatabaseObjectType.FUNCTION, REFERENCE_USAGE, found);
    }

    private void collect(Pattern pattern, SqlSource source, DatabaseObjectType type, String usage,
                         Map<String, DatabaseObject> found) {
        Matcher matcher = pattern.matcher(source.sql());
        while (matcher.find()) {
            QualifiedName name = QualifiedName.parse(matcher.group(1));
            String database = name.database() != null ? name.database() : source.database();
            add(found, new DatabaseObject(name.name(), type, name.schema(), database, source.connection(), usage));
        }
    }

    private static void add(Map<String, DatabaseObject> found, DatabaseObject object) {
        found.putIfAbsent(object.key(), object);
    }

    private static String databaseOf(String connection, List<ConnectionManager> connections) {
        if (connection == null) {
            return null;
        }
        for (ConnectionManager cm : connections) {
            if (connection.equals(cm.refId()) || connection.equals(cm.dtsid()) || connection.equals(cm.name())) {
                return cm.database();
            }
        }
        return null;
    }

    private record SqlSource(String sql, String usage, String connection, String database) {
    }
}
