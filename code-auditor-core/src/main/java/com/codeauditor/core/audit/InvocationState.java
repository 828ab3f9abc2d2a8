package com.codeauditor.core.audit;

import com.codeauditor.core.model.RunStatus;

/**
 * Lifecycle of one (tool, project) invocation within an audit.
 *
 * <p>{@code PENDING -> RUNNING -> COMPLETED | TIMED_OUT | LAUNCH_FAILED}, or
 * {@code PENDING -> CANCELLED} when stop-on-error fires before the invocation starts.
 */
public enum InvocationState {
    PENDING,
    RUNNING,
    COMPLETED,
    TIMED_OUT,
    LAUNCH_FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    static InvocationState of(RunStatus status) {
        return switch (status) {
            case COMPLETED -> COMPLETED;
            case TIMED_OUT -> TIMED_OUT;
            case LAUNCH_FAILED -> LAUNCH_FAILED;
        };
    }
}
