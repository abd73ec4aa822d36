package com.viffx.Slr.Config;

/**
 * Thrown when a settings file cannot be read or holds a value of the wrong kind.
 */
public class SettingsException extends RuntimeException {
    public SettingsException(String message) {
        super(message);
    }

    public SettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
