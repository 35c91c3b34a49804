package com.dtsxarchitect.core.renderer.impl;

import com.dtsxarchitect.core.renderer.GeneratedFile;
import com.dtsxarchitect.core.renderer.GeneratedOutput;
import com.dtsxarchitect.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private StringWriter buffer;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        buffer = new StringWriter();
        renderer = new ConsoleRenderer(new PrintWriter(buffer));
    }

    @Test
    void render_withDefaults_printsContentOnly() {
        renderer.render(GeneratedOutput.of(GeneratedFile.text("r.txt", "REPORT")), new RenderContext(".", Map.of()));

        assertThat(buffer.toString()).isEqualTo("REPORT" + System.lineSeparator());
    }

    @Test
    void render_withHeaders_numbersFilesAndSeparatesThem() {
        // Given
        GeneratedOutput output = GeneratedOutput.of(
            GeneratedFile.text("a.txt", "A"),
            GeneratedFile.markdown("b.md", "B"));
        RenderContext context = new RenderContext(".", Map.of(
            "console.showHeaders", "true",
            "console.separator", "="));

        // When
        renderer.render(output, context);

        // Then
        assertThat(buffer.toString())
            .contains("File 1/2: a.txt")
            .contains("Type: text/markdown")
            .contains("=".repeat(80))
            .doesNotContain("\u001B[");
    }

    @Test
    void render_withColors_wrapsHeaderInAnsiCodes() {
        RenderContext context = new RenderContext(".", Map.of(
            "console.showHeaders", "true",
            "console.colors", "true"));

        renderer.render(GeneratedOutput.of(GeneratedFile.text("a.txt", "A")), context);

        assertThat(buffer.toString()).contains("\u001B[1m\u001B[36mFile 1/1: a.txt\u001B[0m");
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }
}
