package com.codeauditor.core.audit;

import com.codeauditor.core.model.ToolKind;

/**
 * Final record of one (tool, project) invocation.
 *
 * @param project project label
 * @param toolId tool identifier
 * @param kind tool kind
 * @param state terminal invocation state
 * @param exitCode process exit code or sentinel, {@code null} if never launched
 * @param failed whether the invocation counts as a failure
 * @param submitted findings handed to persistence
 * @param newlyPersisted findings actually inserted
 * @param summary failure summary, or {@code null}
 */
public record ToolOutcome(
    String project,
    String toolId,
    ToolKind kind,
    InvocationState state,
    Integer exitCode,
    boolean failed,
    int submitted,
    int newlyPersisted,
    String summary
) {
    static ToolOutcome cancelled(String project, String toolId, ToolKind kind) {
        return new ToolOutcome(project, toolId, kind, InvocationState.CANCELLED, null, false, 0, 0,
            "cancelled after an earlier failure");
    }
}
