package com.archiver.core.exception;

/**
 * Thrown when the archive store cannot be reached, either because the
 * transient retry budget ran out or because the failure is not retryable.
 * Re-delivering the batch is safe.
 */
public class StoreUnavailableException extends ArchiverException {
    
    public static final String ERROR_CODE = "STORE_UNAVAILABLE";
    
    public StoreUnavailableException(String message) {
        super(ERROR_CODE, message);
    }
    
    public StoreUnavailableException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
