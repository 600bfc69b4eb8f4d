package io.synthtools.matcher;

/**
 * A RuntimeException that indicates a malformed selection rule or target configuration.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String msg) {
        super(msg);
    }

    public ConfigurationException(String msg, Throwable cause) {
        super(msg, cause);
    }

}
