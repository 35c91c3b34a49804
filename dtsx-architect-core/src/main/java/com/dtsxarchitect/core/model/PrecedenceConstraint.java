package com.dtsxarchitect.core.model;

/**
 * Directed edge between two executables gating on an outcome and/or an expression.
 *
 * <p>{@code fromRef} and {@code toRef} are reference strings whose final path segment
 * conventionally names the referenced executable.
 *
 * @param name constraint name
 * @param refId constraint reference id
 * @param dtsid unique identifier
 * @param fromRef reference of the source executable
 * @param toRef reference of the target executable
 * @param value outcome value (0 success, 1 failure, 2 completion)
 * @param logicalAnd whether multiple incoming constraints are AND-ed
 * @param expression optional guard expression
 * @param evalOp evaluation operator code, {@code null} when absent
 */
public record PrecedenceConstraint(
    String name,
    String refId,
    String dtsid,
    String fromRef,
    String toRef,
    int value,
    boolean logicalAnd,
    String expression,
    Integer evalOp
) {
    /**
     * Compact constructor with validation.
     */
    public PrecedenceConstraint {
        if (name == null) {
            name = "";
        }
        if (fromRef == null) {
            fromRef = "";
        }
        if (toRef == null) {
            toRef = "";
        }
    }

    public ConstraintOutcome outcome() {
        return ConstraintOutcome.fromValue(value);
    }

    public boolean hasExpression() {
        return expression != null && !expression.isEmpty();
    }
}
