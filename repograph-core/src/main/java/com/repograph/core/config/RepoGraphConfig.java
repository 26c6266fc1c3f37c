package com.repograph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.repograph.core.graph.AnalysisOptions;
import com.repograph.core.model.LanguageFamily;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Root configuration for repograph runs.
 *
 * <p>Loaded from {@code repograph.yaml} in the scanned directory. Every section is optional;
 * a missing section or key takes its default value.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "my-repo"
 *
 * analysis:
 *   parallelism: 4
 *   languages: [javascript, python]
 *
 * scan:
 *   maxFileSize: 10485760
 *   ignoredDirectories: [.git, node_modules, target]
 *   ignoredFiles: [.DS_Store]
 *
 * output:
 *   format: mermaid
 *   file: "docs/relationships.md"
 * }</pre>
 *
 * @param project project metadata
 * @param analysis analysis settings
 * @param scan file-system scan settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepoGraphConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("analysis") AnalysisConfig analysis,
    @JsonProperty("scan") ScanConfig scan,
    @JsonProperty("output") OutputConfig output
) {
    public RepoGraphConfig {
        if (project == null) {
            project = new ProjectInfo(null);
        }
        if (analysis == null) {
            analysis = new AnalysisConfig(null, null);
        }
        if (scan == null) {
            scan = ScanConfig.defaults();
        }
        if (output == null) {
            output = new OutputConfig(null, null);
        }
    }

    /**
     * Creates the default configuration: every language, single-threaded, the standard
     * ignore lists and JSON output on stdout.
     *
     * @return default configuration
     */
    public static RepoGraphConfig defaults() {
        return new RepoGraphConfig(null, null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name, defaults to the scanned directory's name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name
    ) {}

    /**
     * Analysis settings.
     *
     * @param parallelism worker threads (default 1)
     * @param languages language family ids to analyze, e.g. {@code c-family}; empty = all
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisConfig(
        @JsonProperty("parallelism") Integer parallelism,
        @JsonProperty("languages") List<String> languages
    ) {
        public AnalysisConfig {
            if (parallelism == null || parallelism < 1) {
                parallelism = 1;
            }
            languages = languages == null ? List.of() : List.copyOf(languages);
        }

        /**
         * Converts the settings into analysis options.
         *
         * @return analysis options
         * @throws IllegalArgumentException if a language id is unknown
         */
        public AnalysisOptions toOptions() {
            Set<LanguageFamily> families = EnumSet.noneOf(LanguageFamily.class);
            for (String language : languages) {
                families.add(LanguageFamily.fromId(language));
            }
            return new AnalysisOptions(parallelism, families);
        }
    }

    /**
     * File-system scan settings.
     *
     * @param maxFileSize largest file, in bytes, whose content is read (default 10 MiB)
     * @param ignoredDirectories directory names never descended into
     * @param ignoredFiles file names never indexed
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScanConfig(
        @JsonProperty("maxFileSize") Long maxFileSize,
        @JsonProperty("ignoredDirectories") List<String> ignoredDirectories,
        @JsonProperty("ignoredFiles") List<String> ignoredFiles
    ) {
        public static final long DEFAULT_MAX_FILE_SIZE = 10L * 1024 * 1024;

        public static final List<String> DEFAULT_IGNORED_DIRECTORIES = List.of(
            ".git", "node_modules", ".vscode", ".idea", "dist", "build", "out", "coverage",
            ".next", ".nuxt", "target", "bin", "obj", "__pycache__", ".pytest_cache", "venv", "vendor"
        );

        public static final List<String> DEFAULT_IGNORED_FILES = List.of(
            ".DS_Store", "Thumbs.db", ".gitignore", ".npmrc", ".eslintcache"
        );

        public ScanConfig {
            if (maxFileSize == null || maxFileSize < 0) {
                maxFileSize = DEFAULT_MAX_FILE_SIZE;
            }
            ignoredDirectories = ignoredDirectories == null ? DEFAULT_IGNORED_DIRECTORIES : List.copyOf(ignoredDirectories);
            ignoredFiles = ignoredFiles == null ? DEFAULT_IGNORED_FILES : List.copyOf(ignoredFiles);
        }

        public static ScanConfig defaults() {
            return new ScanConfig(null, null, null);
        }
    }

    /**
     * Output settings.
     *
     * @param format exporter id: {@code json}, {@code mermaid} or {@code text} (default json)
     * @param file output file; null writes to standard output
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("format") String format,
        @JsonProperty("file") String file
    ) {
        public static final String DEFAULT_FORMAT = "json";

        public OutputConfig {
            if (format == null || format.isBlank()) {
                format = DEFAULT_FORMAT;
            }
        }
    }
}
