package com.dtsxarchitect.core.renderer;

import java.util.Objects;

/**
 * A single generated artifact, such as a report or a diagram listing.
 *
 * @param relativePath path relative to the render destination (e.g. "Orders_report.md")
 * @param content file content
 * @param contentType MIME type of the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public static final String TEXT = "text/plain";
    public static final String MARKDOWN = "text/markdown";
    public static final String JSON = "application/json";

    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
        if (contentType == null) {
            contentType = TEXT;
        }
    }

    public static GeneratedFile text(String relativePath, String content) {
        return new GeneratedFile(relativePath, content, TEXT);
    }

    public static GeneratedFile markdown(String relativePath, String content) {
        return new GeneratedFile(relativePath, content, MARKDOWN);
    }

    /**
     * Picks the content type from the file extension of {@code relativePath}.
     *
     * @param relativePath destination path
     * @param content file content
     * @return generated file
     */
    public static GeneratedFile of(String relativePath, String content) {
        String lower = relativePath.toLowerCase();
        if (lower.endsWith(".md")) {
            return new GeneratedFile(relativePath, content, MARKDOWN);
        }
        if (lower.endsWith(".json")) {
            return new GeneratedFile(relativePath, content, JSON);
        }
        return new GeneratedFile(relativePath, content, TEXT);
    }
}
