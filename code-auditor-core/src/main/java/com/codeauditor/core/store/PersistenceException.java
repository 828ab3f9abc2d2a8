package com.codeauditor.core.store;

/**
 * Raised when a database operation fails. Any open transaction has already been rolled back.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
