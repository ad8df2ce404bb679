package com.archiver.core.exception;

/**
 * Thrown when a week archive is not found.
 */
public class NotFoundException extends ArchiverException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
