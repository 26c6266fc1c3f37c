package com.repograph.cli;

import com.repograph.core.config.RepoGraphConfig;
import com.repograph.core.export.GraphExporter;
import com.repograph.core.graph.AnalysisOptions;
import com.repograph.core.model.RelationshipGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to analyze a directory and export its relationship graph.
 *
 * <p>Orchestrates the full pipeline:
 * <ol>
 *   <li>Load {@code repograph.yaml} (or the file given with {@code --config})</li>
 *   <li>Scan the directory into a file tree</li>
 *   <li>Index the tree and build the relationship graph</li>
 *   <li>Export the graph with the selected exporter to stdout or a file</li>
 * </ol>
 *
 * <p>Command-line options override the configuration file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * repograph analyze
 * repograph analyze /path/to/repo -f mermaid -o graph.md
 * repograph analyze . -p 4 --language javascript --language python
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze a directory and export its file relationship graph",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: repograph.yaml in the project directory)"
    )
    private Path configPath;

    @Option(
        names = {"-f", "--format"},
        description = "Export format: json, mermaid or text (overrides config)"
    )
    private String format;

    @Option(
        names = {"-o", "--output"},
        description = "Output file (overrides config; default: standard output)"
    )
    private Path outputFile;

    @Option(
        names = {"-p", "--parallelism"},
        description = "Worker threads (overrides config)"
    )
    private Integer parallelism;

    @Option(
        names = {"--language"},
        description = "Language family to analyze, repeatable: javascript, python, java, go, c-family, rust, swift"
    )
    private List<String> languages = new ArrayList<>();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            log.info("Starting analysis of: {}", projectPath.toAbsolutePath());

            RepoGraphConfig config = AnalysisRunner.loadConfiguration(projectPath, configPath);
            String exporterId = format != null ? format : config.output().format();
            Optional<GraphExporter> exporter = findExporter(exporterId);
            if (exporter.isEmpty()) {
                log.error("Unknown format: {}", exporterId);
                err.println("✗ Unknown format: " + exporterId + ". Use 'repograph list exporters'.");
                return 1;
            }

            AnalysisOptions options = AnalysisRunner.options(config, parallelism, languages);
            RelationshipGraph graph = AnalysisRunner.run(projectPath, config, options);
            String document = exporter.get().export(graph);

            Path target = outputFile != null
                ? outputFile
                : config.output().file() != null ? projectPath.resolve(config.output().file()) : null;
            if (target == null) {
                out.print(document);
                out.flush();
            } else {
                Path parent = target.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(target, document, StandardCharsets.UTF_8);
                err.println("✓ Wrote " + graph.size() + " relationships to " + target);
            }
            return 0;

        } catch (Exception e) {
            log.error("Analysis failed", e);
            err.println("✗ Analysis failed: " + e.getMessage());
            return 1;
        }
    }

    static Optional<GraphExporter> findExporter(String id) {
        for (GraphExporter exporter : ServiceLoader.load(GraphExporter.class)) {
            if (exporter.getId().equalsIgnoreCase(id)) {
                return Optional.of(exporter);
            }
        }
        return Optional.empty();
    }
}
