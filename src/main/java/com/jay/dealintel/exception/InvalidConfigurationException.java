package com.jay.dealintel.exception;

/**
 * Raised when scoring weights, stage names or category values cannot be used as given.
 * Callers get this immediately; nothing downstream falls back to a default.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
