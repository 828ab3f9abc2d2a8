package com.codeauditor.core.model;

/**
 * Terminal state of a single analyzer subprocess.
 */
public enum RunStatus {
    /** Process exited within the timeout, with any exit code. */
    COMPLETED,
    /** Process was forcibly destroyed after exceeding its timeout. */
    TIMED_OUT,
    /** Binary was missing or the process could not be started. */
    LAUNCH_FAILED
}
