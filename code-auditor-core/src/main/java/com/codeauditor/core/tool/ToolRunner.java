package com.codeauditor.core.tool;

import com.codeauditor.core.model.ToolRunResult;
import com.codeauditor.core.registry.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Executes one registered analyzer against one target as a bounded subprocess.
 *
 * <p>A single call is a single attempt; retry policy belongs to the caller.
 */
public class ToolRunner {

    private static final Logger log = LoggerFactory.getLogger(ToolRunner.class);

    private final ToolRegistry registry;
    private final ProcessExecutor executor;

    public ToolRunner(ToolRegistry registry, ProcessExecutor executor) {
        this.registry = registry;
        this.executor = executor;
    }

    /**
     * Runs a tool.
     *
     * @param toolId registered tool identifier
     * @param target file or directory to analyze
     * @param timeout wall-clock budget
     * @return run result
     * @throws com.codeauditor.core.config.ConfigurationException if the tool is not registered
     */
    public ToolRunResult run(String toolId, Path target, Duration timeout) {
        AnalyzerTool tool = registry.binding(toolId).tool();
        log.info("Running {} on {}", tool.getDisplayName(), target);
        ToolRunResult result = tool.run(executor, target, timeout);
        log.info("{} finished: status={}, exit={}, {} ms",
            toolId, result.status(), result.exitCode(), result.durationMs());
        return result;
    }

    /**
     * Returns true if a run counts as a failure for stop-on-error purposes.
     *
     * @param result run result
     * @return true for launch failures, timeouts and failure exit codes
     */
    public boolean isFailure(ToolRunResult result) {
        if (!result.isCompleted()) {
            return true;
        }
        return registry.binding(result.toolId()).tool().isFailureExit(result.exitCode());
    }
}
