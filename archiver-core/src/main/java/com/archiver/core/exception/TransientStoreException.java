package com.archiver.core.exception;

/**
 * Thrown by an archive store for failures worth retrying: timeouts,
 * throttling, dropped connections.
 */
public class TransientStoreException extends ArchiverException {
    
    public static final String ERROR_CODE = "STORE_TRANSIENT";
    
    public TransientStoreException(String operation, String storageKey, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Transient failure during %s of %s: %s",
            operation, storageKey, cause != null ? cause.getMessage() : "unknown"
        ), cause);
    }
}
