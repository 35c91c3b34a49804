package com.dtsxarchitect.core.parser.task;

import com.dtsxarchitect.core.model.GenericTask;
import com.dtsxarchitect.core.model.TaskDescriptor;
import com.dtsxarchitect.core.parser.AttributeResolver;
import com.dtsxarchitect.core.parser.XmlElements;
import com.dtsxarchitect.core.parser.base.AbstractExtractor;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Builds task descriptors, dispatching to the first {@link TaskDetailParser} whose marker
 * occurs in the executable type or creation name. Tasks of other kinds become
 * {@link GenericTask}s.
 */
public class TaskDescriptorExtractor extends AbstractExtractor<TaskDescriptor> {

    private final List<TaskDetailParser> detailParsers;

    public TaskDescriptorExtractor(AttributeResolver attributes, List<TaskDetailParser> detailParsers) {
        super(attributes);
        this.detailParsers = List.copyOf(detailParsers);
    }

    /**
     * Describes a single task executable.
     *
     * @param executable {@code Executable} element
     * @return descriptor of the matching variant
     */
    @Override
    public TaskDescriptor extract(Element executable) {
        TaskHeader header = header(executable);
        for (TaskDetailParser parser : detailParsers) {
            if (parser.supports(header)) {
                log.debug("Task '{}' parsed as {}", header.name(), parser.marker());
                return parser.parse(executable, header);
            }
        }
        return new GenericTask(header.name(), header.refId(), header.dtsid(), header.type(), header.description());
    }

    /**
     * Describes the executables nested directly in a container's {@code Executables} children.
     *
     * @param container container executable
     * @return descriptors in document order
     */
    public List<TaskDescriptor> extractChildren(Element container) {
        return XmlElements.children(container, e -> XmlElements.nameContains(e, "Executables")).stream()
            .flatMap(group -> XmlElements.childrenNamed(group, "Executable").stream())
            .map(this::extract)
            .toList();
    }

    private TaskHeader header(Element executable) {
        String executableType = attr(executable, "ExecutableType", "");
        String creationName = attr(executable, "CreationName", "");
        return new TaskHeader(
            attr(executable, "ObjectName", "Unknown"),
            attr(executable, "refId", ""),
            attr(executable, "DTSID", ""),
            executableType.isEmpty() ? creationName : executableType,
            attr(executable, "Description"),
            executableType + creationName
        );
    }
}
