package com.codeauditor.cli;

import com.codeauditor.core.config.AuditorConfig;
import com.codeauditor.core.store.AuditDatabase;
import com.codeauditor.core.store.PersistenceException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to create the database and its tables.
 *
 * <p>Safe to run repeatedly; existing tables and rows are kept.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * code-auditor seed-db
 * AUDITOR_DB_PATH=/tmp/audit.db code-auditor seed-db
 * }</pre>
 */
@Command(
    name = "seed-db",
    description = "Create the database schema",
    mixinStandardHelpOptions = true
)
public class SeedDbCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SeedDbCommand.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: auditor.yaml)"
    )
    private Path configPath = Paths.get(CommandSupport.DEFAULT_CONFIG);

    @Override
    public Integer call() {
        AuditorConfig config = CommandSupport.loadConfiguration(configPath, log);
        try (AuditDatabase database = CommandSupport.openDatabase(config)) {
            System.out.println("✓ Database ready: " + database.path());
            return 0;
        } catch (PersistenceException e) {
            return CommandSupport.fail(log, "Database setup", e);
        }
    }
}
