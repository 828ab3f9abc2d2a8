package com.codeauditor.cli;

import com.codeauditor.core.audit.AuditRequest;
import com.codeauditor.core.audit.AuditSummary;
import com.codeauditor.core.audit.InvocationState;
import com.codeauditor.core.audit.Orchestrator;
import com.codeauditor.core.audit.ToolOutcome;
import com.codeauditor.core.config.AuditorConfig;
import com.codeauditor.core.config.ConfigurationException;
import com.codeauditor.core.convert.ResultConverter;
import com.codeauditor.core.registry.ToolRegistry;
import com.codeauditor.core.store.AuditDatabase;
import com.codeauditor.core.store.PersistenceException;
import com.codeauditor.core.store.PersistenceGateway;
import com.codeauditor.core.tool.ProcessExecutor;
import com.codeauditor.core.tool.ToolRunner;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to audit a project (or every project in a workspace) and persist the findings.
 *
 * <p>Tool failures are reported in the summary but do not change the exit status;
 * only invalid input and storage errors do.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # All tools against the current directory
 * code-auditor audit .
 *
 * # Selected tools, two at a time
 * code-auditor audit ./my-service --tool bandit,mypy --jobs 2
 *
 * # Every project in a workspace, stop at the first failure
 * code-auditor audit ./workspace --multi --stop-on-error
 * }</pre>
 */
@Command(
    name = "audit",
    description = "Run analyzers against a project and persist their findings",
    mixinStandardHelpOptions = true
)
public class AuditCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AuditCommand.class);

    @Parameters(
        index = "0",
        description = "Project directory or file (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-t", "--tool"},
        split = ",",
        description = "Tool to run, repeatable or comma-separated (default: all)"
    )
    private List<String> tools = new ArrayList<>();

    @Option(names = {"-j", "--jobs"}, description = "Parallel tool invocations (default: from configuration)")
    private Integer jobs;

    @Option(names = {"--timeout"}, description = "Timeout per tool in seconds (default: from configuration)")
    private Integer timeoutSeconds;

    @Option(names = {"--stop-on-error"}, description = "Cancel tools not yet started after the first failure")
    private boolean stopOnError;

    @Option(names = {"--multi"}, description = "Treat each subdirectory as a separate project")
    private boolean multi;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: auditor.yaml)"
    )
    private Path configPath = Paths.get(CommandSupport.DEFAULT_CONFIG);

    @Override
    public Integer call() {
        log.info("Starting audit of: {}", projectPath.toAbsolutePath());
        System.out.println("Auditing: " + projectPath.toAbsolutePath());
        System.out.println();

        try {
            AuditorConfig config = CommandSupport.loadConfiguration(configPath, log);
            ToolRegistry registry = ToolRegistry.defaults(config);
            registry.requireKnown(tools);

            AuditRequest request = new AuditRequest(
                projectPath,
                tools,
                jobs != null ? jobs : config.audit().effectiveJobs(),
                multi,
                stopOnError,
                timeoutSeconds != null && timeoutSeconds > 0
                    ? Duration.ofSeconds(timeoutSeconds)
                    : config.audit().effectiveTimeout()
            );

            try (AuditDatabase database = CommandSupport.openDatabase(config)) {
                Orchestrator orchestrator = new Orchestrator(
                    registry,
                    new ToolRunner(registry, new ProcessExecutor()),
                    new ResultConverter(registry),
                    new PersistenceGateway(database),
                    config
                );
                AuditSummary summary = orchestrator.audit(request);
                printSummary(summary);
            }
            return 0;
        } catch (ConfigurationException e) {
            return CommandSupport.fail(log, "Audit", e);
        } catch (PersistenceException e) {
            return CommandSupport.fail(log, "Database", e);
        }
    }

    private void printSummary(AuditSummary summary) {
        String currentProject = null;
        for (ToolOutcome outcome : summary.outcomes()) {
            if (multi && !outcome.project().equals(currentProject)) {
                currentProject = outcome.project();
                System.out.println("Project: " + currentProject);
            }
            System.out.println("  " + symbol(outcome) + " " + describe(outcome));
        }

        System.out.println();
        System.out.printf("Findings: %d submitted, %d new%n",
            summary.outcomes().stream().mapToInt(ToolOutcome::submitted).sum(), summary.newlyPersistedTotal());
        System.out.printf("Issues: %d%s%n", summary.issueTotal(),
            summary.countMetricsAsIssues() ? " (including complexity metrics)" : "");
        if (!summary.failures().isEmpty()) {
            System.out.println("Failed tools: " + summary.failures().size());
        }
        if (summary.stopped()) {
            System.out.println("Stopped after first failure; cancelled: " + summary.cancelled().size());
        }
        System.out.println();
        System.out.println("✓ Audit complete");
    }

    private static String symbol(ToolOutcome outcome) {
        if (outcome.state() == InvocationState.CANCELLED) {
            return "-";
        }
        return outcome.failed() ? "✗" : "✓";
    }

    private static String describe(ToolOutcome outcome) {
        StringBuilder line = new StringBuilder()
            .append(outcome.toolId())
            .append(" [").append(outcome.state()).append("]");
        if (outcome.exitCode() != null) {
            line.append(" exit ").append(outcome.exitCode());
        }
        if (outcome.state() != InvocationState.CANCELLED) {
            line.append(": ").append(outcome.submitted()).append(" findings, ")
                .append(outcome.newlyPersisted()).append(" new");
        }
        if (outcome.summary() != null) {
            line.append(" (").append(outcome.summary()).append(")");
        }
        return line.toString();
    }
}
