package com.dtsxarchitect.core.renderer;

/**
 * Writes generated reports and diagrams to a destination.
 *
 * <p>Renderers are discovered through {@link java.util.ServiceLoader}; register
 * implementations in
 * {@code META-INF/services/com.dtsxarchitect.core.renderer.OutputRenderer}.
 *
 * <pre>{@code
 * OutputRenderer renderer = new FileSystemRenderer();
 * renderer.render(
 *     new GeneratedOutput(List.of(GeneratedFile.markdown("Orders_report.md", report))),
 *     new RenderContext("./reports", Map.of()));
 * }</pre>
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns the lowercase identifier used on the command line and in listings,
     * for example {@code filesystem} or {@code console}.
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders every file of the output.
     *
     * @param output files to render
     * @param context destination and renderer settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
