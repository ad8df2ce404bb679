package com.archiver.core.exception;

/**
 * Thrown at startup when the archiver configuration is missing or invalid.
 */
public class ConfigurationException extends ArchiverException {
    
    public static final String ERROR_CODE = "CONFIGURATION_ERROR";
    
    public ConfigurationException(String message) {
        super(ERROR_CODE, message);
    }
    
    public ConfigurationException(String property, String reason) {
        super(ERROR_CODE, String.format("Invalid archiver configuration: %s - %s", property, reason));
    }
}
