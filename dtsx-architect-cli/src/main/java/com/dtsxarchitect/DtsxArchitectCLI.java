package com.dtsxarchitect;

import ch.qos.logback.classic.Level;
import com.dtsxarchitect.cli.DiagramsCommand;
import com.dtsxarchitect.cli.ListCommand;
import com.dtsxarchitect.cli.ReportCommand;
import com.dtsxarchitect.cli.SummaryCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * Main CLI entry point for dtsx-architect.
 *
 * <p>dtsx-architect parses SSIS packages (.dtsx) and produces analysis reports and
 * control-flow and data-flow diagrams.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code report} - Full package report as text, Markdown or JSON</li>
 *   <li>{@code diagrams} - ASCII or Mermaid diagrams only</li>
 *   <li>{@code summary} - Short package summary</li>
 *   <li>{@code list} - List available generators, report formats or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * dtsx-architect report LoadCustomers.dtsx
 * dtsx-architect report LoadCustomers.dtsx -f markdown -o report.md
 * dtsx-architect report LoadCustomers.dtsx --all-formats -d ./reports
 * dtsx-architect -v diagrams LoadCustomers.dtsx --mermaid
 * }</pre>
 */
@Command(
    name = "dtsx-architect",
    mixinStandardHelpOptions = true,
    version = "dtsx-architect 1.0.0-SNAPSHOT",
    description = "Parse and analyze DTSX (SSIS) packages",
    subcommands = {
        ReportCommand.class,
        DiagramsCommand.class,
        SummaryCommand.class,
        ListCommand.class
    }
)
public class DtsxArchitectCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DtsxArchitectCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println("dtsx-architect - DTSX package analyzer");
        out.println("Version: 1.0.0-SNAPSHOT");
        out.println();
        out.println("Use 'dtsx-architect --help' to see available commands");
        out.println("Use 'dtsx-architect <command> --help' for command-specific help");
    }

    /**
     * Applies the global logging options, then runs the most specific command given.
     *
     * @param parseResult parsed command line
     * @return exit code
     */
    private int executionStrategy(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        if (!(LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME) instanceof ch.qos.logback.classic.Logger root)) {
            log.debug("Logback is not the active SLF4J binding, leaving log levels unchanged");
            return;
        }

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the fully configured command line.
     *
     * @return command line ready to execute
     */
    public static CommandLine commandLine() {
        DtsxArchitectCLI cli = new DtsxArchitectCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
