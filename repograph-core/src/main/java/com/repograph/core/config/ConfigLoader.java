package com.repograph.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading repograph configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code repograph.yaml} into {@link RepoGraphConfig} records.
 * If the file is missing or invalid, returns {@link RepoGraphConfig#defaults()}; loading
 * never throws.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RepoGraphConfig config = ConfigLoader.load(root.resolve(ConfigLoader.DEFAULT_FILE_NAME));
 * AnalysisOptions options = config.analysis().toOptions();
 * }</pre>
 */
public final class ConfigLoader {

    /**
     * Configuration file looked up in the scanned directory.
     */
    public static final String DEFAULT_FILE_NAME = "repograph.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code repograph.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static RepoGraphConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.info("Configuration file not found: {}. Using defaults.", configPath);
            return RepoGraphConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return RepoGraphConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            RepoGraphConfig config = YAML_MAPPER.readValue(configPath.toFile(), RepoGraphConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return RepoGraphConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return RepoGraphConfig.defaults();
        }
    }
}
