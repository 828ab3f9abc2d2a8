package com.codeauditor.core.tool;

import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.model.ToolRunResult;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Capability interface implemented once per analyzer: produce a {@link ToolRunResult} for a target.
 *
 * <p>Implementations know how to build their own command line and which exit codes
 * mean the tool itself failed (as opposed to "issues were found", which many
 * analyzers also signal through a nonzero exit).
 *
 * @see ToolRunner
 */
public interface AnalyzerTool {

    /**
     * Returns the unique tool identifier (e.g., "bandit", "eslint").
     *
     * @return tool identifier
     */
    String getId();

    /**
     * Returns a human-readable name for CLI output.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the kind of findings this tool produces.
     *
     * @return tool kind
     */
    ToolKind getKind();

    /**
     * Runs the analyzer once against a target. No retries.
     *
     * @param executor process executor
     * @param target file or directory to analyze
     * @param timeout wall-clock budget for the whole invocation
     * @return run result
     */
    ToolRunResult run(ProcessExecutor executor, Path target, Duration timeout);

    /**
     * Returns true if a completed run with this exit code means the tool failed.
     *
     * @param exitCode process exit code
     * @return true when the exit code signals a tool failure
     */
    default boolean isFailureExit(int exitCode) {
        return exitCode != 0;
    }
}
