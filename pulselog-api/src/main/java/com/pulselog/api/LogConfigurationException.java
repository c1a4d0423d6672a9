package com.pulselog.api;

/**
 * Thrown while building a logger from bad configuration: empty or invalid
 * pattern, unsupported receiver, unknown level, rotation limits out of range or
 * an output file that cannot be opened. No logger is returned when this is
 * thrown.
 */
public class LogConfigurationException extends RuntimeException {

    public LogConfigurationException(String message) {
        super(message);
    }

    public LogConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
