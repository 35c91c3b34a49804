package com.dtsxarchitect.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Ordered collection of files handed to a renderer.
 *
 * @param files generated files in render order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static GeneratedOutput of(GeneratedFile... files) {
        return new GeneratedOutput(List.of(files));
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
