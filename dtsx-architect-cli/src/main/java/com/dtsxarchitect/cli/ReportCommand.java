package com.dtsxarchitect.cli;

import com.dtsxarchitect.core.config.AnalyzerConfig;
import com.dtsxarchitect.core.generator.GeneratorConfig;
import com.dtsxarchitect.core.model.DtsxPackage;
import com.dtsxarchitect.core.renderer.GeneratedFile;
import com.dtsxarchitect.core.renderer.GeneratedOutput;
import com.dtsxarchitect.core.renderer.RenderContext;
import com.dtsxarchitect.core.renderer.impl.ConsoleRenderer;
import com.dtsxarchitect.core.renderer.impl.FileSystemRenderer;
import com.dtsxarchitect.core.report.ReportFormat;
import com.dtsxarchitect.core.report.ReportGenerator;
import com.dtsxarchitect.core.report.ReportGenerators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command that generates the full package report.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print the text report
 * dtsx-architect report package.dtsx
 *
 * # Save as Markdown (extension added when missing)
 * dtsx-architect report package.dtsx -f markdown -o report
 *
 * # Save every format as <PackageName>_report.{txt,md,json}
 * dtsx-architect report package.dtsx --all-formats -d ./reports
 * }</pre>
 */
@Command(
    name = "report",
    description = "Generate the package report (text, markdown or json)",
    mixinStandardHelpOptions = true
)
public class ReportCommand extends PackageCommand {

    private static final Logger log = LoggerFactory.getLogger(ReportCommand.class);

    @Option(names = {"-f", "--format"}, description = "Output format: text, markdown (md) or json")
    private String format;

    @Option(names = {"-o", "--output"}, description = "Output file (prints to stdout if not specified)")
    private Path outputFile;

    @Option(names = {"--all-formats"}, description = "Write the report in every configured format")
    private boolean allFormats;

    @Option(names = {"-d", "--output-dir"}, description = "Output directory for --all-formats")
    private Path outputDir;

    @Override
    protected int execute(DtsxPackage dtsxPackage, AnalyzerConfig config) {
        GeneratorConfig generatorConfig = config.toGeneratorConfig();

        if (allFormats) {
            return writeAllFormats(dtsxPackage, config, generatorConfig);
        }

        ReportFormat reportFormat = resolveFormat(format, config.report().defaultFormat());
        String report = ReportGenerators.forFormat(reportFormat).generate(dtsxPackage, generatorConfig);

        if (outputFile == null) {
            new ConsoleRenderer(out()).render(
                GeneratedOutput.of(new GeneratedFile("report", report, reportFormat.contentType())),
                new RenderContext(".", Map.of()));
            return 0;
        }

        Path target = withExtension(outputFile, reportFormat);
        write(target, report, reportFormat);
        out().println("Report saved to: " + target);
        return 0;
    }

    private int writeAllFormats(DtsxPackage dtsxPackage, AnalyzerConfig config, GeneratorConfig generatorConfig) {
        Path directory = outputDir != null ? outputDir : Path.of(config.report().outputDirectory());

        Set<ReportFormat> formats = new LinkedHashSet<>();
        for (String name : config.report().formats()) {
            Optional<ReportFormat> parsed = ReportFormat.find(name);
            if (parsed.isPresent()) {
                formats.add(parsed.get());
            } else {
                log.warn("Ignoring unknown report format in configuration: {}", name);
            }
        }

        List<GeneratedFile> files = new ArrayList<>();
        for (ReportFormat reportFormat : formats) {
            ReportGenerator generator = ReportGenerators.forFormat(reportFormat);
            String fileName = ReportGenerators.fileName(dtsxPackage.metadata().name(), reportFormat);
            files.add(new GeneratedFile(fileName, generator.generate(dtsxPackage, generatorConfig),
                reportFormat.contentType()));
        }

        new FileSystemRenderer().render(new GeneratedOutput(files), new RenderContext(directory.toString(), Map.of()));
        for (GeneratedFile file : files) {
            out().println("Report saved to: " + directory.resolve(file.relativePath()));
        }
        return 0;
    }

    private void write(Path target, String report, ReportFormat reportFormat) {
        Path absolute = target.toAbsolutePath();
        Path parent = absolute.getParent();
        new FileSystemRenderer().render(
            GeneratedOutput.of(new GeneratedFile(absolute.getFileName().toString(), report, reportFormat.contentType())),
            new RenderContext(parent == null ? "." : parent.toString(), Map.of()));
    }

    /**
     * Parses the requested format; unknown input falls back to the configured default.
     */
    static ReportFormat resolveFormat(String requested, String configuredDefault) {
        ReportFormat fallback = ReportFormat.find(configuredDefault).orElse(ReportFormat.TEXT);
        if (requested == null) {
            return fallback;
        }
        Optional<ReportFormat> parsed = ReportFormat.find(requested);
        if (parsed.isEmpty()) {
            log.warn("Unknown report format '{}', using {}", requested, fallback.id());
            return fallback;
        }
        return parsed.get();
    }

    /**
     * Appends the format's extension when the file name has none.
     */
    static Path withExtension(Path file, ReportFormat reportFormat) {
        String name = file.getFileName().toString();
        if (name.lastIndexOf('.') > 0) {
            return file;
        }
        return file.resolveSibling(name + "." + reportFormat.fileExtension());
    }
}
