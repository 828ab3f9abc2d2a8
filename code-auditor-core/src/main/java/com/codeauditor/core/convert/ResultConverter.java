package com.codeauditor.core.convert;

import com.codeauditor.core.model.ConversionResult;
import com.codeauditor.core.model.ScanMetadata;
import com.codeauditor.core.model.ToolRunResult;
import com.codeauditor.core.registry.ToolBinding;
import com.codeauditor.core.registry.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches a tool run to its registered parser.
 *
 * <p>Completed runs go through the parser. A completed run whose exit code the
 * tool declares a failure keeps its findings and gets an {@code exit N} note.
 * Timed-out and launch-failed runs bypass parsing entirely.
 */
public class ResultConverter {

    private static final Logger log = LoggerFactory.getLogger(ResultConverter.class);

    private static final int MAX_STDERR_SUMMARY = 200;

    private final ToolRegistry registry;

    public ResultConverter(ToolRegistry registry) {
        this.registry = registry;
    }

    /**
     * Converts a run into a scan row and its findings.
     *
     * @param toolId registered tool identifier
     * @param run tool run
     * @return scan row and findings, empty for non-completed runs
     * @throws com.codeauditor.core.config.ConfigurationException if the tool is not registered
     */
    public ConversionResult convert(String toolId, ToolRunResult run) {
        ToolBinding binding = registry.binding(toolId);
        if (!run.isCompleted()) {
            return recordWithoutFindings(toolId, run);
        }

        ConversionResult result = binding.parser().convert(run);
        if (binding.tool().isFailureExit(run.exitCode())) {
            String note = "exit " + run.exitCode() + firstLine(run.stderr());
            log.debug("{}: failure exit recorded: {}", toolId, note);
            return new ConversionResult(result.scan().withFailure(note), result.rows());
        }
        return result;
    }

    /**
     * Builds the scan row for a run that never produced parseable output.
     *
     * @param toolId registered tool identifier
     * @param run timed-out or launch-failed run
     * @return scan row with a failure summary and no findings
     */
    public ConversionResult recordWithoutFindings(String toolId, ToolRunResult run) {
        ToolBinding binding = registry.binding(toolId);
        ScanMetadata scan = ScanMetadata.fromRun(run, binding.tool().getKind());
        String summary = switch (run.status()) {
            case TIMED_OUT -> "timed out after " + run.durationMs() + " ms";
            case LAUNCH_FAILED -> "launch failed" + firstLine(run.stderr());
            case COMPLETED -> "no output";
        };
        return ConversionResult.withoutFindings(scan.withFailure(summary));
    }

    private static String firstLine(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String line = text.strip().lines().findFirst().orElse("");
        if (line.length() > MAX_STDERR_SUMMARY) {
            line = line.substring(0, MAX_STDERR_SUMMARY) + "...";
        }
        return ": " + line;
    }
}
