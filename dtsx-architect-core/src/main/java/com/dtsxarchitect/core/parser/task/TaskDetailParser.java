package com.dtsxarchitect.core.parser.task;

import com.dtsxarchitect.core.model.TaskDescriptor;
import org.w3c.dom.Element;

/**
 * Parses the kind-specific data of one task kind.
 *
 * <p>New task kinds are supported by adding an implementation with its own marker and
 * its own {@link TaskDescriptor} variant.
 */
public interface TaskDetailParser {

    /**
     * Marker that must occur in the executable type or creation name, e.g. {@code ExecuteSQLTask}.
     *
     * @return marker string
     */
    String marker();

    /**
     * Returns true if this parser handles the task described by the header.
     *
     * @param header task header
     * @return true if the marker matches
     */
    default boolean supports(TaskHeader header) {
        return header.marker().contains(marker());
    }

    /**
     * Builds the descriptor for a task executable.
     *
     * @param executable task executable element
     * @param header shared fields already read
     * @return task descriptor
     */
    TaskDescriptor parse(Element executable, TaskHeader header);
}
