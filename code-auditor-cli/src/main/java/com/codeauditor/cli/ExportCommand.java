package com.codeauditor.cli;

import com.codeauditor.core.config.AuditorConfig;
import com.codeauditor.core.config.ConfigurationException;
import com.codeauditor.core.store.AuditDatabase;
import com.codeauditor.core.store.FindingExporter;
import com.codeauditor.core.store.FindingExporter.ExportReport;
import com.codeauditor.core.store.FindingQueries;
import com.codeauditor.core.store.PersistenceException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to export stored findings to {@code findings.json}, one file per project root.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * code-auditor export --output-path ./results
 * code-auditor export -o ./results --root my-service --include-metrics
 * }</pre>
 */
@Command(
    name = "export",
    description = "Export stored findings to JSON",
    mixinStandardHelpOptions = true
)
public class ExportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @Option(names = {"-o", "--output-path"}, description = "Output directory (default: out/export)")
    private Path outputPath = Paths.get("out", "export");

    @Option(names = {"--root"}, description = "Only export this project root")
    private String root;

    @Option(
        names = {"--include-metrics"},
        description = "Include complexity metrics (default: reporting.countMetricsAsIssues)"
    )
    private Boolean includeMetrics;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: auditor.yaml)"
    )
    private Path configPath = Paths.get(CommandSupport.DEFAULT_CONFIG);

    @Override
    public Integer call() {
        AuditorConfig config = CommandSupport.loadConfiguration(configPath, log);
        boolean metrics = includeMetrics != null
            ? includeMetrics
            : config.reporting().effectiveCountMetricsAsIssues();

        try (AuditDatabase database = CommandSupport.openDatabase(config)) {
            ExportReport report = new FindingExporter(new FindingQueries(database))
                .export(outputPath, root, metrics);

            if (report.files().isEmpty()) {
                System.out.println("No findings to export" + (root != null ? " for root '" + root + "'" : ""));
                return 0;
            }
            for (Map.Entry<String, Integer> entry : report.findingsPerRoot().entrySet()) {
                System.out.println("  ✓ " + entry.getKey() + ": " + entry.getValue() + " findings");
            }
            System.out.println();
            System.out.println("✓ Exported " + report.total() + " findings to " + outputPath.toAbsolutePath());
            return 0;
        } catch (ConfigurationException | PersistenceException e) {
            return CommandSupport.fail(log, "Export", e);
        } catch (IOException e) {
            return CommandSupport.fail(log, "Writing export", e);
        }
    }
}
