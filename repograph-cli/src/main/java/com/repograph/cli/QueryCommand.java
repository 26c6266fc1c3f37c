package com.repograph.cli;

import com.repograph.core.config.RepoGraphConfig;
import com.repograph.core.export.impl.TextGraphExporter;
import com.repograph.core.model.Relationship;
import com.repograph.core.model.RelationshipGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to show the relationships of a single file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Files src/index.ts depends on
 * repograph query . --file src/index.ts --direction out
 *
 * # Files depending on src/utils.ts
 * repograph query . --file src/utils.ts --direction in
 * }</pre>
 */
@Command(
    name = "query",
    description = "Show what one file depends on and what depends on it",
    mixinStandardHelpOptions = true
)
public class QueryCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(QueryCommand.class);

    /**
     * Which edges of the file to show.
     */
    public enum Direction { IN, OUT, BOTH }

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"--file"},
        required = true,
        description = "Repository-relative path of the file, e.g. src/index.ts"
    )
    private String file;

    @Option(
        names = {"-d", "--direction"},
        description = "in, out or both (default: ${DEFAULT-VALUE})",
        defaultValue = "both"
    )
    private Direction direction;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: repograph.yaml in the project directory)"
    )
    private Path configPath;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            RepoGraphConfig config = AnalysisRunner.loadConfiguration(projectPath, configPath);
            RelationshipGraph graph = AnalysisRunner.run(
                projectPath, config, AnalysisRunner.options(config, null, List.of()));

            String normalized = file.replace('\\', '/');
            List<Relationship> matches = switch (direction) {
                case IN -> graph.incoming(normalized);
                case OUT -> graph.outgoing(normalized);
                case BOTH -> graph.connectedTo(normalized);
            };
            log.debug("{} relationships for {} ({})", matches.size(), normalized, direction);

            if (matches.isEmpty()) {
                out.println("No relationships found for " + normalized);
            } else {
                matches.forEach(rel -> out.println(TextGraphExporter.format(rel)));
            }
            out.flush();
            return 0;

        } catch (Exception e) {
            log.error("Query failed", e);
            err.println("✗ Query failed: " + e.getMessage());
            return 1;
        }
    }
}
