package com.dtsxarchitect.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link AnalyzerConfig} from {@code dtsx-architect.yaml}.
 *
 * <p>Configuration is optional. A missing, unreadable or invalid file is reported
 * as a warning and {@link AnalyzerConfig#defaults()} is returned; loading never throws.
 *
 * <pre>{@code
 * AnalyzerConfig config = ConfigLoader.load(Paths.get("dtsx-architect.yaml"));
 * DtsxPackageParser parser = new DtsxPackageParser(config.toNamespaces());
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to the YAML file
     * @return loaded configuration or defaults if unavailable
     */
    public static AnalyzerConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return AnalyzerConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return AnalyzerConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            AnalyzerConfig config = YAML_MAPPER.readValue(configPath.toFile(), AnalyzerConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return AnalyzerConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return AnalyzerConfig.defaults();
        }
    }

    /**
     * Loads the given file when present, otherwise {@code dtsx-architect.yaml} from
     * the working directory when that exists, otherwise the defaults without a warning.
     *
     * @param configPath explicit path, or null
     * @return configuration
     */
    public static AnalyzerConfig loadOrDefaults(Path configPath) {
        if (configPath != null) {
            return load(configPath);
        }
        Path implicit = Path.of(AnalyzerConfig.DEFAULT_FILE_NAME);
        if (Files.isRegularFile(implicit)) {
            return load(implicit);
        }
        log.debug("No {} in working directory, using defaults", AnalyzerConfig.DEFAULT_FILE_NAME);
        return AnalyzerConfig.defaults();
    }
}
