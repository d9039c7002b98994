package com.tactics.exception;

/**
 * Malformed scenario or armory data. Raised at load time, before any episode starts.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
