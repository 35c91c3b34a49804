package com.dtsxarchitect.core.model;

import java.util.Objects;

/**
 * Database object mined from SQL text.
 *
 * @param name object name without schema
 * @param type object kind
 * @param schema schema name
 * @param database database name, {@code null} when unknown
 * @param connection connection the SQL runs against, {@code null} when unknown
 * @param usage how the object is used ({@code Task}, {@code Source}, {@code Execute}, ...)
 */
public record DatabaseObject(
    String name,
    DatabaseObjectType type,
    String schema,
    String database,
    String connection,
    String usage
) {
    /**
     * Compact constructor with validation.
     */
    public DatabaseObject {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
    }

    public String qualifiedName() {
        return schema + "." + name;
    }

    /**
     * Deduplication key: {@code schema.name} for tables, prefixed otherwise.
     *
     * @return key
     */
    public String key() {
        return type.keyPrefix() + qualifiedName();
    }
}
