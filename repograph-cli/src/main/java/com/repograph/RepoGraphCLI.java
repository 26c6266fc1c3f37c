package com.repograph;

import ch.qos.logback.classic.Level;
import com.repograph.cli.AnalyzeCommand;
import com.repograph.cli.ListCommand;
import com.repograph.cli.QueryCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Main CLI entry point for RepoGraph.
 *
 * <p>RepoGraph scans a source tree, resolves the import, include and use statements of nine
 * language syntaxes to files of the same tree, and prints the resulting file relationship
 * graph.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Build and export the relationship graph</li>
 *   <li>{@code query} - Show the dependencies and dependents of one file</li>
 *   <li>{@code list} - List supported languages or exporters</li>
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
 * # Analyze current directory, JSON on stdout
 * repograph analyze
 *
 * # Mermaid diagram of a Python project, written to a file
 * repograph -v analyze ../service -f mermaid -o graph.md --language python
 *
 * # Who imports this file?
 * repograph query . --file src/utils.ts --direction in
 * }</pre>
 */
@Command(
    name = "repograph",
    mixinStandardHelpOptions = true,
    version = "RepoGraph 1.0.0-SNAPSHOT",
    description = "Cross-language file dependency resolver",
    subcommands = {
        AnalyzeCommand.class,
        QueryCommand.class,
        ListCommand.class
    }
)
public class RepoGraphCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RepoGraphCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("RepoGraph - Cross-language file dependency resolver");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'repograph --help' to see available commands");
        System.out.println("Use 'repograph <command> --help' for command-specific help");
    }

    /**
     * Applies the global logging options, then runs the most specific command.
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
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with the logging-aware execution strategy.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        RepoGraphCLI cli = new RepoGraphCLI();
        return new CommandLine(cli)
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
