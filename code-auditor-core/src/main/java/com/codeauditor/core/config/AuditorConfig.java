package com.codeauditor.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root configuration for Code Auditor.
 *
 * <p>Loaded from {@code auditor.yaml}. Every section is optional; accessors named
 * {@code effective*} fall back to the built-in defaults when a value is missing.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * database:
 *   path: out/auditor.sqlite3
 *   echo: false
 *
 * audit:
 *   jobs: 4
 *   timeoutSeconds: 300
 *
 * tools:
 *   eslint:
 *     executable: /opt/node_tools/node_modules/.bin/eslint
 *     extraArgs: ["--max-warnings", "500"]
 *
 * converter:
 *   deadCodeMinConfidence: 50
 *
 * reporting:
 *   countMetricsAsIssues: false
 * }</pre>
 *
 * @param database database location and SQL echo
 * @param audit orchestration defaults
 * @param tools per-tool executable overrides, keyed by tool id
 * @param converter conversion thresholds
 * @param reporting summary and export settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditorConfig(
    @JsonProperty("database") DatabaseConfig database,
    @JsonProperty("audit") AuditConfig audit,
    @JsonProperty("tools") Map<String, ToolSettings> tools,
    @JsonProperty("converter") ConverterConfig converter,
    @JsonProperty("reporting") ReportingConfig reporting
) {
    public static final String DEFAULT_DB_PATH = "out/auditor.sqlite3";
    public static final int DEFAULT_JOBS = 4;
    public static final int DEFAULT_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_DEAD_CODE_MIN_CONFIDENCE = 50;

    /**
     * Directories never treated as projects in workspace mode.
     */
    public static final Set<String> DEFAULT_EXCLUDED_DIRECTORIES = Set.of(
        ".git", ".hg", ".svn",
        "node_modules",
        ".venv", "venv",
        "__pycache__", ".mypy_cache", ".pytest_cache", ".ruff_cache", ".tox",
        "dist", "build"
    );

    public AuditorConfig {
        if (database == null) {
            database = new DatabaseConfig(null, null);
        }
        if (audit == null) {
            audit = new AuditConfig(null, null, null);
        }
        if (tools == null) {
            tools = Map.of();
        }
        if (converter == null) {
            converter = new ConverterConfig(null);
        }
        if (reporting == null) {
            reporting = new ReportingConfig(null);
        }
    }

    /**
     * Creates a configuration where every value is the built-in default.
     *
     * @return default configuration
     */
    public static AuditorConfig defaults() {
        return new AuditorConfig(null, null, null, null, null);
    }

    /**
     * Returns the settings for one tool, or empty settings if none are configured.
     *
     * @param toolId tool identifier
     * @return tool settings, never {@code null}
     */
    public ToolSettings toolSettings(String toolId) {
        ToolSettings settings = tools.get(toolId);
        return settings != null ? settings : ToolSettings.empty();
    }

    /**
     * Returns a copy with the database section replaced.
     */
    public AuditorConfig withDatabase(DatabaseConfig newDatabase) {
        return new AuditorConfig(newDatabase, audit, tools, converter, reporting);
    }

    /**
     * Database settings.
     *
     * @param path SQLite file location, relative paths resolve against the working directory
     * @param echo log every SQL statement when true
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DatabaseConfig(
        @JsonProperty("path") String path,
        @JsonProperty("echo") Boolean echo
    ) {
        public Path effectivePath() {
            String value = path == null || path.isBlank() ? DEFAULT_DB_PATH : path;
            Path resolved = Paths.get(value);
            return resolved.isAbsolute() ? resolved : resolved.toAbsolutePath();
        }

        public boolean effectiveEcho() {
            return Boolean.TRUE.equals(echo);
        }
    }

    /**
     * Orchestration defaults, each overridable from the command line.
     *
     * @param jobs maximum parallel tool invocations per project
     * @param timeoutSeconds wall-clock budget per invocation
     * @param excludedDirectories workspace-mode denylist, replaces the default when set
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AuditConfig(
        @JsonProperty("jobs") Integer jobs,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
        @JsonProperty("excludedDirectories") List<String> excludedDirectories
    ) {
        public int effectiveJobs() {
            return jobs != null && jobs > 0 ? jobs : DEFAULT_JOBS;
        }

        public Duration effectiveTimeout() {
            int seconds = timeoutSeconds != null && timeoutSeconds > 0 ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
            return Duration.ofSeconds(seconds);
        }

        public Set<String> effectiveExcludedDirectories() {
            if (excludedDirectories == null || excludedDirectories.isEmpty()) {
                return DEFAULT_EXCLUDED_DIRECTORIES;
            }
            return Set.copyOf(excludedDirectories);
        }
    }

    /**
     * Per-tool launch settings.
     *
     * @param executable binary to run instead of the tool's default name
     * @param extraArgs arguments appended to the built command line
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ToolSettings(
        @JsonProperty("executable") String executable,
        @JsonProperty("extraArgs") List<String> extraArgs
    ) {
        public ToolSettings {
            extraArgs = extraArgs == null ? List.of() : List.copyOf(extraArgs);
        }

        public static ToolSettings empty() {
            return new ToolSettings(null, List.of());
        }

        public String executableOr(String defaultExecutable) {
            return executable == null || executable.isBlank() ? defaultExecutable : executable;
        }
    }

    /**
     * Conversion thresholds.
     *
     * @param deadCodeMinConfidence dead-code findings below this confidence are dropped
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConverterConfig(
        @JsonProperty("deadCodeMinConfidence") Integer deadCodeMinConfidence
    ) {
        public int effectiveDeadCodeMinConfidence() {
            return deadCodeMinConfidence != null ? deadCodeMinConfidence : DEFAULT_DEAD_CODE_MIN_CONFIDENCE;
        }
    }

    /**
     * Reporting settings.
     *
     * @param countMetricsAsIssues whether complexity rows count toward issue totals and exports
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReportingConfig(
        @JsonProperty("countMetricsAsIssues") Boolean countMetricsAsIssues
    ) {
        public boolean effectiveCountMetricsAsIssues() {
            return Boolean.TRUE.equals(countMetricsAsIssues);
        }
    }
}
