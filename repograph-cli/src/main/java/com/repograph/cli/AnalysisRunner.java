package com.repograph.cli;

import com.repograph.core.config.ConfigLoader;
import com.repograph.core.config.RepoGraphConfig;
import com.repograph.core.graph.AnalysisOptions;
import com.repograph.core.graph.RelationshipGraphBuilder;
import com.repograph.core.index.FileIndex;
import com.repograph.core.model.DirectoryNode;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RelationshipGraph;
import com.repograph.core.scan.FileSystemScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Shared pipeline of the commands: configuration, scan, index, analysis.
 */
final class AnalysisRunner {

    private static final Logger log = LoggerFactory.getLogger(AnalysisRunner.class);

    private AnalysisRunner() {
    }

    /**
     * Loads the configuration for a project directory.
     *
     * @param projectPath scanned directory
     * @param configPath explicit configuration file, null for {@code repograph.yaml} in the project
     * @return configuration, defaults when absent
     */
    static RepoGraphConfig loadConfiguration(Path projectPath, Path configPath) {
        Path path = configPath == null
            ? projectPath.resolve(ConfigLoader.DEFAULT_FILE_NAME)
            : configPath.isAbsolute() ? configPath : projectPath.resolve(configPath);
        log.debug("Loading configuration from: {}", path);
        return ConfigLoader.load(path);
    }

    /**
     * Merges command-line overrides into the configured analysis options.
     *
     * @param config loaded configuration
     * @param parallelism thread override, null keeps the configured value
     * @param languages family ids override, empty keeps the configured list
     * @return analysis options
     * @throws IllegalArgumentException if a language id is unknown
     */
    static AnalysisOptions options(RepoGraphConfig config, Integer parallelism, List<String> languages) {
        AnalysisOptions options = config.analysis().toOptions();
        if (parallelism != null) {
            options = options.withParallelism(parallelism);
        }
        if (languages != null && !languages.isEmpty()) {
            Set<LanguageFamily> families = EnumSet.noneOf(LanguageFamily.class);
            for (String language : languages) {
                families.add(LanguageFamily.fromId(language));
            }
            options = options.withFamilies(families);
        }
        return options;
    }

    /**
     * Scans the project and builds its relationship graph.
     *
     * @param projectPath directory to analyze
     * @param config configuration
     * @param options analysis options
     * @return relationship graph
     * @throws IOException if the directory cannot be scanned
     */
    static RelationshipGraph run(Path projectPath, RepoGraphConfig config, AnalysisOptions options) throws IOException {
        DirectoryNode tree = new FileSystemScanner(config.scan()).scan(projectPath);
        FileIndex index = FileIndex.build(tree);
        log.info("Indexed {} files", index.size());
        return new RelationshipGraphBuilder().analyze(index, options);
    }
}
