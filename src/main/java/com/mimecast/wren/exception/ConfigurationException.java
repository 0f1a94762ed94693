package com.mimecast.wren.exception;

/**
 * Invalid or incomplete settings, fatal at startup.
 */
public class ConfigurationException extends Exception {

    /**
     * Constructs a new ConfigurationException instance.
     *
     * @param message Error message.
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructs a new ConfigurationException instance with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
