package com.dtsxarchitect.core.renderer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Base class for renderer tests.
 *
 * <p>Provides a temporary output directory, a default {@link RenderContext} pointing at it
 * and helpers for reading what was written.
 */
public abstract class RendererTestBase {

    @TempDir
    protected Path tempDir;

    protected RenderContext context;

    @BeforeEach
    void setUpContext() {
        context = new RenderContext(tempDir.toString(), Map.of());
    }

    protected GeneratedOutput createGeneratedOutput(List<GeneratedFile> files) {
        return new GeneratedOutput(files);
    }

    /**
     * Creates a RenderContext with custom settings.
     *
     * @param outputDirectory output directory path
     * @param settings custom settings map
     * @return RenderContext instance
     */
    protected RenderContext createContext(String outputDirectory, Map<String, String> settings) {
        return new RenderContext(outputDirectory, settings);
    }

    /**
     * Reads a file from the temp directory.
     *
     * @param relativePath path relative to tempDir
     * @return file content
     * @throws IOException if file cannot be read
     */
    protected String readFile(String relativePath) throws IOException {
        return Files.readString(tempDir.resolve(relativePath));
    }

    protected boolean fileExists(String relativePath) {
        return Files.exists(tempDir.resolve(relativePath));
    }
}
