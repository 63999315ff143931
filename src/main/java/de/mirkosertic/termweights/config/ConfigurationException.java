package de.mirkosertic.termweights.config;

/**
 * A required input is missing or a configuration value is unusable. Always fatal.
 */
public class ConfigurationException extends Exception {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
