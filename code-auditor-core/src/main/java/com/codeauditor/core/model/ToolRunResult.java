package com.codeauditor.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * Ephemeral record of one analyzer execution.
 *
 * <p>The runner reports exit codes verbatim; only {@link #status()} tells a
 * completed run apart from a timeout or a launch failure. Runs that never
 * produced a real exit code carry one of the negative sentinels below.
 *
 * @param toolId registered tool identifier
 * @param command invoked command line
 * @param workingDirectory absolute working directory of the process
 * @param status terminal state
 * @param exitCode process exit code, or a sentinel for non-completed runs
 * @param durationMs wall-clock duration in milliseconds
 * @param stdout captured standard output
 * @param stderr captured standard error
 * @param parsedJson parsed JSON payload, or {@code null} if absent or unparseable
 */
public record ToolRunResult(
    String toolId,
    List<String> command,
    String workingDirectory,
    RunStatus status,
    int exitCode,
    long durationMs,
    String stdout,
    String stderr,
    JsonNode parsedJson
) {
    /** Exit code reported when the process could not be started. */
    public static final int LAUNCH_FAILED_EXIT_CODE = -1;

    /** Exit code reported when the process was killed on timeout. */
    public static final int TIMED_OUT_EXIT_CODE = -2;

    public ToolRunResult {
        Objects.requireNonNull(toolId, "toolId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        command = command == null ? List.of() : List.copyOf(command);
        if (workingDirectory == null) {
            workingDirectory = "";
        }
        if (stdout == null) {
            stdout = "";
        }
        if (stderr == null) {
            stderr = "";
        }
        if (durationMs < 0) {
            durationMs = 0;
        }
    }

    /**
     * Creates the result of a process that exited on its own.
     */
    public static ToolRunResult completed(String toolId, List<String> command, String workingDirectory,
                                          int exitCode, long durationMs, String stdout, String stderr,
                                          JsonNode parsedJson) {
        return new ToolRunResult(toolId, command, workingDirectory, RunStatus.COMPLETED,
            exitCode, durationMs, stdout, stderr, parsedJson);
    }

    /**
     * Creates the result of a process killed after exceeding its timeout.
     */
    public static ToolRunResult timedOut(String toolId, List<String> command, String workingDirectory,
                                         long durationMs, String stdout, String stderr) {
        return new ToolRunResult(toolId, command, workingDirectory, RunStatus.TIMED_OUT,
            TIMED_OUT_EXIT_CODE, durationMs, stdout, stderr, null);
    }

    /**
     * Creates the result of a process that could not be started.
     */
    public static ToolRunResult launchFailed(String toolId, List<String> command, String workingDirectory,
                                             long durationMs, String error) {
        return new ToolRunResult(toolId, command, workingDirectory, RunStatus.LAUNCH_FAILED,
            LAUNCH_FAILED_EXIT_CODE, durationMs, "", error, null);
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }
}
