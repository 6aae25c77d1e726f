package net.spookly.kvproxy.config;

/**
 * Raised when configuration cannot be loaded or fails validation.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
