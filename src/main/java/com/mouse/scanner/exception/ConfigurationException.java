package com.mouse.scanner.exception;

/**
 * Invalid scanner settings. Thrown during startup so the application fails before the first scan.
 */
public class ConfigurationException extends RuntimeException{
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable e) {
        super(message, e);
    }
}
