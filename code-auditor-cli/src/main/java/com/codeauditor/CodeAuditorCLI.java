package com.codeauditor;

import com.codeauditor.cli.AuditCommand;
import com.codeauditor.cli.ExportCommand;
import com.codeauditor.cli.ListCommand;
import com.codeauditor.cli.RunToolCommand;
import com.codeauditor.cli.SeedDbCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for Code Auditor.
 *
 * <p>Code Auditor runs static-analysis tools against a source tree, normalizes
 * their findings and stores them in a local SQLite database.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code seed-db} - Create the database schema</li>
 *   <li>{@code run-tool} - Run one analyzer and print its raw result</li>
 *   <li>{@code audit} - Run analyzers and persist their findings</li>
 *   <li>{@code export} - Write stored findings to JSON</li>
 *   <li>{@code list} - List available analyzers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Create the database
 * code-auditor seed-db
 *
 * # Audit a project with two tools
 * code-auditor audit ./my-service --tool bandit --tool mypy
 *
 * # Audit every project in a workspace, stopping at the first failure
 * code-auditor -v audit ./workspace --multi --stop-on-error
 * }</pre>
 */
@Command(
    name = "code-auditor",
    mixinStandardHelpOptions = true,
    version = "Code Auditor 1.0.0-SNAPSHOT",
    description = "Runs static-analysis tools and stores normalized findings",
    subcommands = {
        SeedDbCommand.class,
        RunToolCommand.class,
        AuditCommand.class,
        ExportCommand.class,
        ListCommand.class
    }
)
public class CodeAuditorCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodeAuditorCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("Code Auditor - Static analysis runner and findings store");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'code-auditor --help' to see available commands");
        System.out.println("Use 'code-auditor <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured: verbose={}, quiet={}", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line. Global options are applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        CodeAuditorCLI cli = new CodeAuditorCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
