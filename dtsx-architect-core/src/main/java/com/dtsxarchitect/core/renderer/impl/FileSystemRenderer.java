package com.dtsxarchitect.core.renderer.impl;

import com.dtsxarchitect.core.renderer.GeneratedFile;
import com.dtsxarchitect.core.renderer.GeneratedOutput;
import com.dtsxarchitect.core.renderer.OutputRenderer;
import com.dtsxarchitect.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes generated files below the context's output directory.
 *
 * <p>Parent directories are created as needed and existing files are overwritten.
 * A relative path that escapes the output directory is rejected.
 *
 * <pre>{@code
 * new FileSystemRenderer().render(
 *     GeneratedOutput.of(GeneratedFile.of("Orders_report.json", json)),
 *     new RenderContext("./reports", Map.of()));
 * // Creates: ./reports/Orders_report.json
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory()).toAbsolutePath().normalize();
        log.info("Writing {} file(s) to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path target = outputDir.resolve(file.relativePath()).normalize();
        if (!target.startsWith(outputDir)) {
            throw new IllegalStateException("Refusing to write outside the output directory: " + file.relativePath());
        }

        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, file.content(), StandardCharsets.UTF_8);
            log.info("Wrote {} ({} chars)", target, file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
