package com.example.standupbot.exception;

import lombok.Getter;

/**
 * Exception for missing or malformed engine configuration.
 * Raised while the application starts, which aborts the startup.
 */
@Getter
public class ConfigurationException extends RuntimeException {

    private final String property;

    public ConfigurationException(String property, String message) {
        super(String.format("Invalid configuration '%s': %s", property, message));
        this.property = property;
    }

    public ConfigurationException(String property, String message, Exception cause) {
        super(String.format("Invalid configuration '%s': %s", property, message), cause);
        this.property = property;
    }
}
