package com.dtsxarchitect.cli;

import com.dtsxarchitect.core.config.AnalyzerConfig;
import com.dtsxarchitect.core.config.ConfigLoader;
import com.dtsxarchitect.core.model.DtsxPackage;
import com.dtsxarchitect.core.parser.DtsxPackageParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Base for commands that operate on one package file.
 *
 * <p>Validates the input file, loads the configuration, parses the package and hands
 * it to {@link #execute(DtsxPackage, AnalyzerConfig)}. Every failure is caught here,
 * logged, reported as one line on stderr and turned into exit code 1.
 */
public abstract class PackageCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PackageCommand.class);

    private static final String DTSX_EXTENSION = ".dtsx";

    @Spec
    protected CommandSpec spec;

    @Parameters(index = "0", description = "Path to the DTSX package file")
    protected Path dtsxFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: dtsx-architect.yaml when present)"
    )
    protected Path configPath;

    @Override
    public Integer call() {
        String commandName = spec.name();
        try {
            if (!Files.isRegularFile(dtsxFile)) {
                log.error("File not found: {}", dtsxFile);
                err().println("✗ File not found: " + dtsxFile);
                return 1;
            }
            if (!dtsxFile.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(DTSX_EXTENSION)) {
                log.warn("File does not have {} extension: {}", DTSX_EXTENSION, dtsxFile);
            }

            AnalyzerConfig config = ConfigLoader.loadOrDefaults(configPath);
            DtsxPackage dtsxPackage = new DtsxPackageParser(config.toNamespaces()).parse(dtsxFile);
            return execute(dtsxPackage, config);
        } catch (Exception e) {
            log.error("{} failed for {}", commandName, dtsxFile, e);
            err().println("✗ " + commandName + " failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Runs the command on a parsed package.
     *
     * @param dtsxPackage parsed package
     * @param config effective configuration
     * @return exit code
     * @throws Exception on any failure; reported by {@link #call()}
     */
    protected abstract int execute(DtsxPackage dtsxPackage, AnalyzerConfig config) throws Exception;

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
