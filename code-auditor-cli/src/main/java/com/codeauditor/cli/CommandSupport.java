package com.codeauditor.cli;

import com.codeauditor.core.config.AuditorConfig;
import com.codeauditor.core.config.ConfigLoader;
import com.codeauditor.core.store.AuditDatabase;
import org.slf4j.Logger;

import java.nio.file.Path;

/**
 * Helpers shared by the subcommands: configuration loading, database opening and error reporting.
 */
final class CommandSupport {

    static final String DEFAULT_CONFIG = "auditor.yaml";

    private CommandSupport() {
    }

    static AuditorConfig loadConfiguration(Path configPath, Logger log) {
        log.debug("Loading configuration from: {}", configPath.toAbsolutePath());
        return ConfigLoader.load(configPath);
    }

    /**
     * Opens the configured database and makes sure the schema exists.
     */
    static AuditDatabase openDatabase(AuditorConfig config) {
        AuditDatabase database = AuditDatabase.open(
            config.database().effectivePath(), config.database().effectiveEcho());
        try {
            database.initializeSchema();
        } catch (RuntimeException e) {
            database.close();
            throw e;
        }
        return database;
    }

    /**
     * Logs a fatal error and prints a one-line message to stderr.
     *
     * @return exit code 1
     */
    static int fail(Logger log, String action, Exception e) {
        log.error("{} failed", action, e);
        System.err.println("✗ " + action + " failed: " + e.getMessage());
        if (log.isDebugEnabled()) {
            e.printStackTrace();
        }
        return 1;
    }
}
