package com.dtsxarchitect.cli;

import com.dtsxarchitect.core.generator.DiagramGenerator;
import com.dtsxarchitect.core.renderer.OutputRenderer;
import com.dtsxarchitect.core.report.ReportGenerator;
import com.dtsxarchitect.core.report.ReportGenerators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available diagram generators, report formats or renderers.
 *
 * <p>Discovers implementations via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * dtsx-architect list generators
 * dtsx-architect list formats
 * dtsx-architect list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available generators, report formats or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: generators, formats or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "generators", "generator" -> listGenerators();
            case "formats", "format" -> listFormats();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: generators, formats, or renderers", type);
                spec.commandLine().getErr().println("✗ Unknown type: " + type + ". Use: generators, formats, or renderers");
                yield 1;
            }
        };
    }

    private int listGenerators() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Diagram Generators:");
        out.println();

        for (DiagramGenerator generator : ServiceLoader.load(DiagramGenerator.class)) {
            out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            out.printf("    File Extension: .%s%n", generator.getFileExtension());
            out.printf("    Diagram Types: %s%n", generator.getSupportedDiagramTypes());
            out.println();
        }
        out.flush();
        return 0;
    }

    private int listFormats() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Report Formats:");
        out.println();

        for (ReportGenerator generator : ReportGenerators.all()) {
            out.printf("  • %s (ID: %s)%n", generator.getFormat().contentType(), generator.getId());
            out.printf("    File Extension: .%s%n", generator.getFormat().fileExtension());
            out.println();
        }
        out.flush();
        return 0;
    }

    private int listRenderers() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Renderers:");
        out.println();

        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            out.printf("  • %s (%s)%n", renderer.getId(), renderer.getClass().getSimpleName());
        }
        out.flush();
        return 0;
    }
}
