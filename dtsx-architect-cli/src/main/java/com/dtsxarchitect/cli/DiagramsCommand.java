package com.dtsxarchitect.cli;

import com.dtsxarchitect.core.config.AnalyzerConfig;
import com.dtsxarchitect.core.generator.DiagramBundle;
import com.dtsxarchitect.core.generator.DiagramGenerator;
import com.dtsxarchitect.core.generator.DiagramType;
import com.dtsxarchitect.core.generator.GeneratedDiagram;
import com.dtsxarchitect.core.generator.GeneratorConfig;
import com.dtsxarchitect.core.generator.PackageDiagrams;
import com.dtsxarchitect.core.model.DataFlowTask;
import com.dtsxarchitect.core.model.DtsxPackage;
import com.dtsxarchitect.core.renderer.GeneratedFile;
import com.dtsxarchitect.core.renderer.GeneratedOutput;
import com.dtsxarchitect.core.renderer.RenderContext;
import com.dtsxarchitect.core.renderer.impl.FileSystemRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Command that produces only the diagrams of a package.
 *
 * <p>Without {@code --mermaid} it prints the ASCII control flow, every data flow, the
 * execution order and the routing logic. With {@code --mermaid} it prints one Mermaid
 * flowchart per graph. With {@code -o} the diagrams are written to files instead,
 * one per diagram type.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * dtsx-architect diagrams package.dtsx
 * dtsx-architect diagrams package.dtsx --mermaid -o ./diagrams
 * }</pre>
 */
@Command(
    name = "diagrams",
    description = "Generate control-flow and data-flow diagrams only",
    mixinStandardHelpOptions = true
)
public class DiagramsCommand extends PackageCommand {

    private static final Logger log = LoggerFactory.getLogger(DiagramsCommand.class);

    private static final String MERMAID_GENERATOR = "mermaid";
    private static final String ASCII_GENERATOR = "ascii";

    @Option(names = {"--mermaid"}, description = "Output Mermaid flowcharts instead of ASCII diagrams")
    private boolean mermaid;

    @Option(names = {"-o", "--output"}, description = "Output directory (prints to stdout if not specified)")
    private Path outputDir;

    @Override
    protected int execute(DtsxPackage dtsxPackage, AnalyzerConfig config) {
        GeneratorConfig generatorConfig = config.toGeneratorConfig();

        if (outputDir != null) {
            return writeDiagrams(dtsxPackage, generatorConfig);
        }

        PackageDiagrams diagrams = new PackageDiagrams(generatorConfig);
        PrintWriter out = out();
        if (mermaid) {
            for (DiagramBundle bundle : diagrams.all(dtsxPackage)) {
                out.println();
                out.println("### " + bundle.name());
                out.println();
                out.print(bundle.flowchart());
            }
        } else {
            out.println(diagrams.controlFlow(dtsxPackage).ascii());
            for (DataFlowTask task : dtsxPackage.dataFlowTasks()) {
                out.println(diagrams.dataFlow(task).ascii());
            }
            out.println(diagrams.executionOrder(dtsxPackage));
            out.println(diagrams.routingLogic(dtsxPackage));
        }
        out.flush();
        return 0;
    }

    private int writeDiagrams(DtsxPackage dtsxPackage, GeneratorConfig generatorConfig) {
        DiagramGenerator generator = findGenerator(mermaid ? MERMAID_GENERATOR : ASCII_GENERATOR);

        List<GeneratedFile> files = new ArrayList<>();
        for (DiagramType type : DiagramType.values()) {
            if (!generator.getSupportedDiagramTypes().contains(type)) {
                continue;
            }
            GeneratedDiagram diagram = generator.generate(dtsxPackage, type, generatorConfig);
            files.add(GeneratedFile.of(diagram.fileName(), diagram.content()));
        }
        log.info("Generated {} diagram file(s) with {}", files.size(), generator.getId());

        new FileSystemRenderer().render(new GeneratedOutput(files), new RenderContext(outputDir.toString(), Map.of()));
        for (GeneratedFile file : files) {
            out().println("Diagram saved to: " + outputDir.resolve(file.relativePath()));
        }
        return 0;
    }

    private static DiagramGenerator findGenerator(String id) {
        for (DiagramGenerator generator : ServiceLoader.load(DiagramGenerator.class)) {
            if (generator.getId().equals(id)) {
                return generator;
            }
        }
        throw new IllegalStateException("No diagram generator registered with id " + id);
    }
}
