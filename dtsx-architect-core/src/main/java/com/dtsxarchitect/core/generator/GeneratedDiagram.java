package com.dtsxarchitect.core.generator;

import java.util.Objects;

/**
 * Represents a generated diagram.
 *
 * @param name diagram name
 * @param type diagram type
 * @param content diagram content (Markdown with Mermaid blocks, plain text, ...)
 * @param fileExtension file extension for this content
 */
public record GeneratedDiagram(
    String name,
    DiagramType type,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedDiagram {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * Returns the file name this diagram is written to, e.g. {@code control-flow.md}.
     *
     * @return file name
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}
