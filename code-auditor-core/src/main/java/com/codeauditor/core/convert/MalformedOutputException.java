package com.codeauditor.core.convert;

/**
 * Signals that a tool's output did not have the expected top-level shape.
 *
 * <p>Caught by {@link AbstractFindingParser} and turned into a parse note on the scan row.
 */
public class MalformedOutputException extends Exception {

    public MalformedOutputException(String message) {
        super(message);
    }
}
