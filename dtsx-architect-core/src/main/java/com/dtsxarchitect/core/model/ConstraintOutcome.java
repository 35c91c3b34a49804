package com.dtsxarchitect.core.model;

/**
 * Execution outcome a precedence constraint waits for.
 */
public enum ConstraintOutcome {
    /** Value 0 */
    SUCCESS,

    /** Value 1 */
    FAILURE,

    /** Value 2, regardless of success or failure */
    COMPLETION;

    /**
     * Maps the numeric constraint value; unknown values are treated as success.
     *
     * @param value document value
     * @return outcome
     */
    public static ConstraintOutcome fromValue(int value) {
        return switch (value) {
            case 1 -> FAILURE;
            case 2 -> COMPLETION;
            default -> SUCCESS;
        };
    }
}
