package com.dtsxarchitect.core.parser.task;

import java.util.Objects;

/**
 * Fields shared by every task descriptor, read before a kind-specific parser runs.
 *
 * @param name task name
 * @param refId reference id
 * @param dtsid unique identifier
 * @param type executable type, or creation name when the type is absent
 * @param description optional description
 * @param marker executable type followed by creation name, used for kind dispatch
 */
public record TaskHeader(String name, String refId, String dtsid, String type, String description, String marker) {

    public TaskHeader {
        Objects.requireNonNull(name, "name must not be null");
        if (marker == null) {
            marker = "";
        }
    }
}
