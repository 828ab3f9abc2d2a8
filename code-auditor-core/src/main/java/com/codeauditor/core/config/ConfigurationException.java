package com.codeauditor.core.config;

/**
 * Raised for invalid audit input: an unknown tool identifier or an unusable target path.
 *
 * <p>Always raised before any analyzer process is launched and aborts the whole audit.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
