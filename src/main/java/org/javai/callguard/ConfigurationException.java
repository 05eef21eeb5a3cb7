package org.javai.callguard;

/**
 * Thrown synchronously when a component is built with settings it cannot work with,
 * for example a concurrency limit below one.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
