package com.dtsxarchitect.core.parser.task;

import com.dtsxarchitect.core.model.ParameterBinding;
import com.dtsxarchitect.core.model.ResultBinding;
import com.dtsxarchitect.core.model.SqlTask;
import com.dtsxarchitect.core.model.TaskDescriptor;
import com.dtsxarchitect.core.parser.AttributeResolver;
import com.dtsxarchitect.core.parser.XmlElements;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads {@code SqlTaskData}: connection, statement, result set type and variable bindings.
 */
public class SqlTaskDetailParser implements TaskDetailParser {

    private final AttributeResolver attributes;

    public SqlTaskDetailParser(AttributeResolver sqlTaskAttributes) {
        this.attributes = sqlTaskAttributes;
    }

    @Override
    public String marker() {
        return "ExecuteSQLTask";
    }

    @Override
    public TaskDescriptor parse(Element executable, TaskHeader header) {
        Optional<Element> data = XmlElements.firstDescendant(executable,
            e -> XmlElements.nameContains(e, "SqlTaskData"));

        List<ParameterBinding> parameterBindings = new ArrayList<>();
        List<ResultBinding> resultBindings = new ArrayList<>();
        data.ifPresent(taskData -> {
            for (Element binding : XmlElements.descendants(taskData)) {
                if (XmlElements.nameContains(binding, "ParameterBinding")) {
                    parameterBindings.add(new ParameterBinding(
                        attributes.resolve(binding, "ParameterName", ""),
                        attributes.resolve(binding, "DtsVariableName"),
                        attributes.resolve(binding, "ParameterDirection"),
                        attributes.resolveInteger(binding, "DataType")));
                } else if (XmlElements.nameContains(binding, "ResultBinding")) {
                    resultBindings.add(new ResultBinding(
                        attributes.resolve(binding, "ResultName", ""),
                        attributes.resolve(binding, "DtsVariableName")));
                }
            }
        });

        Element taskData = data.orElse(null);
        return new SqlTask(
            header.name(),
            header.refId(),
            header.dtsid(),
            header.type(),
            header.description(),
            attributes.resolve(taskData, "Connection"),
            attributes.resolve(taskData, "SqlStatementSource"),
            attributes.resolve(taskData, "ResultSetType"),
            parameterBindings,
            resultBindings
        );
    }
}
