package com.casesentinel.core.config;

/**
 * Raised when alert configuration is invalid or cannot answer a question a
 * detector asks of it (for example, no threshold for a window). Never
 * recovered from by substituting a default.
 *
 * @since 1.0.0
 */
public class ConfigurationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
