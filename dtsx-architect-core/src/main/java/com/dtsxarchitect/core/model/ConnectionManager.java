package com.dtsxarchitect.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Connection manager declared by a package.
 *
 * <p>{@code server}, {@code database} and {@code provider} are derived from the raw
 * connection string on a best-effort basis and may each be {@code null}.
 *
 * @param name connection manager name
 * @param refId reference id used by tasks and components
 * @param dtsid unique identifier
 * @param connectionType connection kind (OLEDB, FLATFILE, SMTP, ...)
 * @param connectionString raw connection string
 * @param server derived server name
 * @param database derived database name
 * @param provider derived provider name
 * @param description optional description
 * @param properties remaining attributes of the connection definition
 */
public record ConnectionManager(
    String name,
    String refId,
    String dtsid,
    String connectionType,
    String connectionString,
    String server,
    String database,
    String provider,
    String description,
    Map<String, String> properties
) {
    /**
     * Compact constructor with validation.
     */
    public ConnectionManager {
        Objects.requireNonNull(name, "name must not be null");
        if (connectionType == null) {
            connectionType = "Unknown";
        }
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }
}
