package com.codeauditor.core.audit;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Parameters of one audit.
 *
 * @param root project directory, or the workspace directory in multi mode
 * @param toolIds tools to run; empty means every registered tool
 * @param jobs maximum parallel invocations per project
 * @param multi treat each immediate subdirectory of {@code root} as a project
 * @param stopOnError cancel invocations not yet started after the first failure
 * @param timeout wall-clock budget per invocation
 */
public record AuditRequest(
    Path root,
    List<String> toolIds,
    int jobs,
    boolean multi,
    boolean stopOnError,
    Duration timeout
) {
    public AuditRequest {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        toolIds = toolIds == null ? List.of() : List.copyOf(toolIds);
        if (jobs < 1) {
            jobs = 1;
        }
    }
}
