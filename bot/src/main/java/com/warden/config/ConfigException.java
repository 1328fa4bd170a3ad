package com.warden.config;

/**
 * Thrown when configuration values are missing, malformed or out of range.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
