package tech.terrareg.platform.config;

/**
 * Startup configuration is invalid. Boot is aborted.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
