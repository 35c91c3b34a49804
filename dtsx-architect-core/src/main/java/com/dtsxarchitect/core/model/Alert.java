package com.dtsxarchitect.core.model;

import java.util.Objects;

/**
 * Notification sent by the package.
 *
 * @param name mail task name
 * @param alertType triggering event or {@code Completion}
 * @param condition condition text, {@code null} when unknown
 * @param recipients recipients
 * @param priority {@code High} or {@code Normal}
 * @param category {@code Error}, {@code Warning} or {@code Notification}
 */
public record Alert(
    String name,
    String alertType,
    String condition,
    String recipients,
    String priority,
    String category
) {
    /**
     * Compact constructor with validation.
     */
    public Alert {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(alertType, "alertType must not be null");
    }
}
