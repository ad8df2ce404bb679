package com.archiver.core.exception;

/**
 * Base exception for all archiver errors.
 */
public class ArchiverException extends RuntimeException {
    
    private final String errorCode;
    
    public ArchiverException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public ArchiverException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
