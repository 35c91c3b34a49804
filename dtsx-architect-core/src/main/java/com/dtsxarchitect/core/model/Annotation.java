package com.dtsxarchitect.core.model;

/**
 * Designer annotation attached to a package.
 *
 * @param refId annotation reference id
 * @param description optional description
 * @param tag optional tag
 * @param text annotation text
 * @param creationDate optional creation timestamp
 */
public record Annotation(
    String refId,
    String description,
    String tag,
    String text,
    String creationDate
) {
    /**
     * Compact constructor with validation.
     */
    public Annotation {
        if (refId == null) {
            refId = "";
        }
    }
}
