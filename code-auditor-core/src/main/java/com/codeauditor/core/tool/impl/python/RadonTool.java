package com.codeauditor.core.tool.impl.python;

import com.codeauditor.core.config.AuditorConfig.ToolSettings;
import com.codeauditor.core.model.RunStatus;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.model.ToolRunResult;
import com.codeauditor.core.tool.AbstractAnalyzerTool;
import com.codeauditor.core.tool.ProcessExecutor;
import com.codeauditor.core.tool.ToolInvocation;
import com.codeauditor.core.util.FileUtils;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Metrics aggregator wrapper running the four radon suites: {@code cc}, {@code mi}, {@code hal} and {@code raw}.
 *
 * <p>The suites share one deadline and are combined into a single run whose parsed
 * JSON is shaped as:
 * <pre>{@code
 * { "cc": {...}, "mi": {...}, "hal": {...}, "raw": {...} }
 * }</pre>
 * A suite that completes without JSON output is left out of the payload. If any
 * suite times out or cannot be launched, the combined run takes that status and
 * the remaining suites are not started.
 */
public class RadonTool extends AbstractAnalyzerTool {

    public static final String TOOL_ID = "radon";

    private static final Logger log = LoggerFactory.getLogger(RadonTool.class);

    /**
     * Suites in execution order; also the keys of the combined payload.
     */
    public static final List<String> CATEGORIES = List.of("cc", "mi", "hal", "raw");

    public RadonTool(ToolSettings settings) {
        super(settings);
    }

    @Override
    public String getId() {
        return TOOL_ID;
    }

    @Override
    public String getDisplayName() {
        return "Radon Metrics";
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.COMPLEXITY;
    }

    @Override
    protected String defaultExecutable() {
        return "radon";
    }

    @Override
    protected List<String> arguments(Path target, Path workingDirectory) {
        return categoryArguments("cc", target, workingDirectory);
    }

    @Override
    protected boolean producesJson() {
        return true;
    }

    @Override
    public ToolRunResult run(ProcessExecutor executor, Path target, Duration timeout) {
        Path absoluteTarget = target.toAbsolutePath().normalize();
        Path workingDirectory = FileUtils.workingDirectoryFor(absoluteTarget);
        String cwd = workingDirectory.toString();
        List<String> combinedCommand = List.of(executable(), "{" + String.join(",", CATEGORIES) + "}", "-j", ".");

        long deadline = System.currentTimeMillis() + timeout.toMillis();
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        long totalDuration = 0;
        int maxExitCode = 0;

        for (String category : CATEGORIES) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return ToolRunResult.timedOut(TOOL_ID, combinedCommand, cwd, timeout.toMillis(),
                    stdout.toString(), stderr + "\n[TIMEOUT before radon " + category + "]");
            }

            List<String> command = new ArrayList<>();
            command.add(executable());
            command.addAll(categoryArguments(category, absoluteTarget, workingDirectory));
            command.addAll(settings.extraArgs());

            ToolRunResult run = executor.execute(TOOL_ID,
                ToolInvocation.of(command, workingDirectory, true), Duration.ofMillis(remaining));

            append(stdout, run.stdout());
            append(stderr, run.stderr());
            totalDuration += run.durationMs();

            if (run.status() != RunStatus.COMPLETED) {
                return new ToolRunResult(TOOL_ID, combinedCommand, cwd, run.status(), run.exitCode(),
                    Math.min(totalDuration, timeout.toMillis()), stdout.toString(), stderr.toString(), null);
            }

            maxExitCode = Math.max(maxExitCode, run.exitCode());
            if (run.parsedJson() != null) {
                payload.set(category, run.parsedJson());
            } else {
                log.warn("radon {} produced no JSON output", category);
            }
        }

        return ToolRunResult.completed(TOOL_ID, combinedCommand, cwd, maxExitCode,
            Math.min(totalDuration, timeout.toMillis()), stdout.toString(), stderr.toString(), payload);
    }

    private static List<String> categoryArguments(String category, Path target, Path workingDirectory) {
        String scope = target.equals(workingDirectory) ? "." : target.toString();
        if ("cc".equals(category)) {
            return List.of("cc", "-s", "-j", scope);
        }
        return List.of(category, "-j", scope);
    }

    private static void append(StringBuilder buffer, String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        if (buffer.length() > 0) {
            buffer.append("\n\n");
        }
        buffer.append(text);
    }
}
