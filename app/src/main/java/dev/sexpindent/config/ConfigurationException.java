package dev.sexpindent.config;

/**
 * Invalid option value detected while configuring indentation. Never raised while computing a column.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
