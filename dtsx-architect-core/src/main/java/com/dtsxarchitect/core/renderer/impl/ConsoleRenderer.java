package com.dtsxarchitect.core.renderer.impl;

import com.dtsxarchitect.core.renderer.GeneratedFile;
import com.dtsxarchitect.core.renderer.GeneratedOutput;
import com.dtsxarchitect.core.renderer.OutputRenderer;
import com.dtsxarchitect.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.Objects;

/**
 * Prints generated files to a {@link PrintStream} or {@link PrintWriter}, standard output
 * by default.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.showHeaders} - print a "File n/m: path" header before each
 *       file ("true"/"false", default: "false")</li>
 *   <li>{@code console.colors} - ANSI colors for headers and separators (default: "false")</li>
 *   <li>{@code console.separator} - separator repeated between files (default: "-")</li>
 * </ul>
 *
 * <p>With default settings only the file contents are printed, one after another,
 * so a single report renders exactly as generated.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String DEFAULT_SEPARATOR = "-";
    private static final int SEPARATOR_WIDTH = 80;

    private final PrintWriter out;

    /**
     * Creates a renderer printing to {@link System#out}.
     *
     * <p>Used by {@link java.util.ServiceLoader}.
     */
    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this(new PrintWriter(Objects.requireNonNull(out, "out must not be null"), true));
    }

    public ConsoleRenderer(PrintWriter out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean showHeaders = context.getFlag("console.showHeaders", false);
        boolean useColors = context.getFlag("console.colors", false);
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);

        log.debug("Printing {} file(s) to console (headers: {}, colors: {})",
            output.files().size(), showHeaders, useColors);

        int total = output.files().size();
        for (int i = 0; i < total; i++) {
            GeneratedFile file = output.files().get(i);
            if (showHeaders) {
                printHeader(file, i + 1, total, useColors);
            }
            out.println(file.content());

            if (i < total - 1) {
                out.println();
                printSeparator(separator, useColors);
                out.println();
            }
        }
        out.flush();
    }

    private void printHeader(GeneratedFile file, int index, int total, boolean useColors) {
        String pathColor = useColors ? ANSI_BOLD + ANSI_CYAN : "";
        String metaColor = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";

        out.println(pathColor + "File " + index + "/" + total + ": " + file.relativePath() + reset);
        out.println(metaColor + "Type: " + file.contentType() + reset);
        out.println();
    }

    private void printSeparator(String separator, boolean useColors) {
        String color = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";
        String unit = separator.isEmpty() ? DEFAULT_SEPARATOR : separator;
        int repeat = Math.max(1, SEPARATOR_WIDTH / unit.length());
        out.println(color + unit.repeat(repeat) + reset);
    }
}
