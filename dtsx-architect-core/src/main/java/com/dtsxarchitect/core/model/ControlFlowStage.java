package com.dtsxarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Top-level control-flow unit.
 *
 * <p>{@code order} is the document encounter order starting at 1. It is a display order,
 * not an execution guarantee; see {@code TopologicalOrder} for a precedence-aware order.
 *
 * @param order display order, unique within a package
 * @param name stage name
 * @param refId reference id of the stage executable
 * @param stageType stage type (see {@link StageKind#classify(String, String)})
 * @param description optional description
 * @param detail descriptor of the stage executable itself
 * @param tasks descriptors of executables nested in the stage
 * @param precedenceFrom references of predecessor stages
 * @param precedenceTo references of successor stages
 * @param condition guard expression inherited from an incoming constraint
 */
public record ControlFlowStage(
    int order,
    String name,
    String refId,
    String stageType,
    String description,
    TaskDescriptor detail,
    List<TaskDescriptor> tasks,
    List<String> precedenceFrom,
    List<String> precedenceTo,
    String condition
) {
    /**
     * Compact constructor with validation.
     */
    public ControlFlowStage {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(stageType, "stageType must not be null");
        if (refId == null) {
            refId = "";
        }
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        precedenceFrom = precedenceFrom == null ? List.of() : List.copyOf(precedenceFrom);
        precedenceTo = precedenceTo == null ? List.of() : List.copyOf(precedenceTo);
    }

    public boolean hasCondition() {
        return condition != null && !condition.isEmpty();
    }

    /**
     * Returns a copy carrying the given links and condition.
     *
     * @param from predecessor references
     * @param to successor references
     * @param newCondition inherited condition
     * @return linked stage
     */
    public ControlFlowStage withLinks(List<String> from, List<String> to, String newCondition) {
        return new ControlFlowStage(order, name, refId, stageType, description, detail, tasks, from, to, newCondition);
    }
}
