package com.codeauditor.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One persisted row per (tool, target) invocation.
 *
 * <p>Written once and never updated. Repeated scans of the same code append new
 * scan rows while their findings collapse onto the rows already stored.
 *
 * @param toolId registered tool identifier
 * @param kind tool kind
 * @param projectRoot absolute path of the analyzed project
 * @param scanTimestamp when the scan row was created
 * @param command invoked command line
 * @param workingDirectory process working directory
 * @param exitCode exit code or sentinel
 * @param durationMs wall-clock duration in milliseconds
 * @param status terminal run state
 * @param skippedRecords raw records the converter could not turn into findings
 * @param failureSummary human-readable failure description, or {@code null}
 */
public record ScanMetadata(
    String toolId,
    ToolKind kind,
    String projectRoot,
    Instant scanTimestamp,
    List<String> command,
    String workingDirectory,
    int exitCode,
    long durationMs,
    RunStatus status,
    int skippedRecords,
    String failureSummary
) {
    public ScanMetadata {
        Objects.requireNonNull(toolId, "toolId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (scanTimestamp == null) {
            scanTimestamp = Instant.now();
        }
        command = command == null ? List.of() : List.copyOf(command);
        if (projectRoot == null) {
            projectRoot = "";
        }
        if (workingDirectory == null) {
            workingDirectory = "";
        }
    }

    /**
     * Builds the scan row for a run, before any conversion notes are attached.
     *
     * @param run tool run result
     * @param kind tool kind
     * @return scan metadata without failure summary
     */
    public static ScanMetadata fromRun(ToolRunResult run, ToolKind kind) {
        return new ScanMetadata(
            run.toolId(),
            kind,
            run.workingDirectory(),
            Instant.now(),
            run.command(),
            run.workingDirectory(),
            run.exitCode(),
            run.durationMs(),
            run.status(),
            0,
            null
        );
    }

    public ScanMetadata withSkippedRecords(int skipped) {
        return new ScanMetadata(toolId, kind, projectRoot, scanTimestamp, command, workingDirectory,
            exitCode, durationMs, status, skipped, failureSummary);
    }

    /**
     * Returns a copy with the given failure note appended to any existing summary.
     *
     * @param summary failure description
     * @return updated scan metadata
     */
    public ScanMetadata withFailure(String summary) {
        String merged = failureSummary == null || failureSummary.isBlank()
            ? summary
            : failureSummary + "; " + summary;
        return new ScanMetadata(toolId, kind, projectRoot, scanTimestamp, command, workingDirectory,
            exitCode, durationMs, status, skippedRecords, merged);
    }

    public boolean hasFailure() {
        return failureSummary != null && !failureSummary.isBlank();
    }
}
