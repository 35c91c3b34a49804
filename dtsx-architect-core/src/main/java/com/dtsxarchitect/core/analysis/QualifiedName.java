package com.dtsxarchitect.core.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Object name split into database, schema and object parts.
 *
 * @param database database part of a three-part name, else {@code null}
 * @param schema schema part
 * @param name object part
 */
record QualifiedName(String database, String schema, String name) {

    static final String DEFAULT_SCHEMA = "dbo";

    /**
     * Parses {@code name}, {@code schema.name} or {@code db.schema.name}, brackets optional.
     * Unqualified names get the {@value #DEFAULT_SCHEMA} schema.
     *
     * @param raw raw name text
     * @return parsed name
     */
    static QualifiedName parse(String raw) {
        List<String> parts = new ArrayList<>();
        for (String part : raw.trim().split("\\.")) {
            String cleaned = part.replace("[", "").replace("]", "").trim();
            if (!cleaned.isEmpty()) {
                parts.add(cleaned);
            }
        }
        int size = parts.size();
        if (size == 0) {
            return new QualifiedName(null, DEFAULT_SCHEMA, raw.trim());
        }
        if (size == 1) {
            return new QualifiedName(null, DEFAULT_SCHEMA, parts.get(0));
        }
        String database = size >= 3 ? parts.get(size - 3) : null;
        return new QualifiedName(database, parts.get(size - 2), parts.get(size - 1));
    }
}
