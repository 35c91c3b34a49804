package com.dtsxarchitect.core.model;

/**
 * Kind of database object referenced by SQL text.
 */
public enum DatabaseObjectType {
    TABLE("Table", ""),
    STORED_PROCEDURE("StoredProcedure", "proc:"),
    FUNCTION("Function", "func:");

    private final String label;
    private final String keyPrefix;

    DatabaseObjectType(String label, String keyPrefix) {
        this.label = label;
        this.keyPrefix = keyPrefix;
    }

    public String label() {
        return label;
    }

    public String keyPrefix() {
        return keyPrefix;
    }
}
