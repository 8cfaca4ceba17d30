package com.agenttrader.core.exception;

/**
 * Caller contract violation, such as a risk tolerance outside [0, 1].
 * Fatal to the whole cycle.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
