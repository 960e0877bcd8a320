package org.netpreserve.archivescope.config;

/**
 * Configuration that can't be loaded or doesn't make sense. Reported once at startup.
 */
public class ConfigException extends Exception {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
