package org.neuralchilli.qrun.config;

/**
 * Thrown when a task configuration file cannot be read or does not describe a valid task set.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
