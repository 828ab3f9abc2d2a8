package com.codeauditor.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Utility for loading Code Auditor configuration.
 *
 * <p>Uses Jackson to deserialize {@code auditor.yaml} into {@link AuditorConfig} records,
 * then applies environment overrides:
 * <ul>
 *   <li>{@code AUDITOR_DB_PATH} - database file location</li>
 *   <li>{@code AUDITOR_DB_ECHO} - log SQL statements ({@code 1}, {@code true}, {@code yes}, {@code on})</li>
 * </ul>
 * A missing or invalid file never fails the command: defaults are used instead.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AuditorConfig config = ConfigLoader.load(Paths.get("auditor.yaml"));
 * Path db = config.database().effectivePath();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String ENV_DB_PATH = "AUDITOR_DB_PATH";
    public static final String ENV_DB_ECHO = "AUDITOR_DB_ECHO";

    private static final Set<String> TRUTHY = Set.of("1", "true", "yes", "on");

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file and applies process environment overrides.
     *
     * @param configPath path to {@code auditor.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static AuditorConfig load(Path configPath) {
        return load(configPath, System.getenv());
    }

    /**
     * Loads configuration from a YAML file and applies overrides from the given environment.
     *
     * @param configPath path to {@code auditor.yaml}, may be {@code null}
     * @param environment environment variables
     * @return loaded configuration or defaults if unavailable
     */
    public static AuditorConfig load(Path configPath, Map<String, String> environment) {
        return applyEnvironment(readFile(configPath), environment);
    }

    private static AuditorConfig readFile(Path configPath) {
        if (configPath == null) {
            return AuditorConfig.defaults();
        }

        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return AuditorConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return AuditorConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            AuditorConfig config = YAML_MAPPER.readValue(configPath.toFile(), AuditorConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return AuditorConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return AuditorConfig.defaults();
        }
    }

    /**
     * Applies {@code AUDITOR_DB_PATH} and {@code AUDITOR_DB_ECHO} on top of a loaded configuration.
     *
     * @param config loaded configuration
     * @param environment environment variables
     * @return configuration with overrides applied
     */
    static AuditorConfig applyEnvironment(AuditorConfig config, Map<String, String> environment) {
        String pathOverride = environment.get(ENV_DB_PATH);
        String echoOverride = environment.get(ENV_DB_ECHO);
        if (isBlank(pathOverride) && isBlank(echoOverride)) {
            return config;
        }

        AuditorConfig.DatabaseConfig current = config.database();
        String path = isBlank(pathOverride) ? current.path() : pathOverride;
        Boolean echo = isBlank(echoOverride)
            ? current.echo()
            : TRUTHY.contains(echoOverride.trim().toLowerCase(Locale.ROOT));

        log.debug("Environment overrides applied: path={}, echo={}", path, echo);
        return config.withDatabase(new AuditorConfig.DatabaseConfig(path, echo));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
