package com.dtsxarchitect.core.model;

/**
 * Well-known control-flow stage kinds. Executables of any other kind keep their raw
 * executable type as the stage type string.
 */
public enum StageKind {
    SEQUENCE("Sequence", "SEQUENCE"),
    DATA_FLOW("DataFlow", "Pipeline"),
    SQL_TASK("SqlTask", "ExecuteSQLTask"),
    SEND_MAIL_TASK("SendMailTask", "SendMailTask");

    /** Stage type used when an executable declares neither type nor creation name. */
    public static final String UNKNOWN = "Unknown";

    private final String label;
    private final String marker;

    StageKind(String label, String marker) {
        this.label = label;
        this.marker = marker;
    }

    public String label() {
        return label;
    }

    public String marker() {
        return marker;
    }

    /**
     * Derives the stage type string from an executable's type and creation name.
     *
     * @param executableType executable type attribute, may be null
     * @param creationName creation name attribute, may be null
     * @return well-known label, else the executable type, else the creation name, else {@value #UNKNOWN}
     */
    public static String classify(String executableType, String creationName) {
        String combined = (executableType == null ? "" : executableType)
            + (creationName == null ? "" : creationName);
        for (StageKind kind : values()) {
            if (combined.contains(kind.marker)) {
                return kind.label;
            }
        }
        if (executableType != null && !executableType.isEmpty()) {
            return executableType;
        }
        if (creationName != null && !creationName.isEmpty()) {
            return creationName;
        }
        return UNKNOWN;
    }

    /**
     * Returns whether the given stage type string denotes this kind.
     *
     * @param stageType stage type string
     * @return true if it is this kind's label
     */
    public boolean matches(String stageType) {
        return label.equals(stageType);
    }
}
