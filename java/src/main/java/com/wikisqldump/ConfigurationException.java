package com.wikisqldump;

/**
 * Invalid or contradictory run configuration, detected before any parsing.
 */
public class ConfigurationException extends DumpConversionException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
