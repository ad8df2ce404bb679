package com.archiver.core.exception;

/**
 * Thrown when a stored archive document cannot be read or written.
 * A week whose stored document is unreadable is never overwritten.
 */
public class ArchiveFormatException extends ArchiverException {
    
    public static final String ERROR_CODE = "ARCHIVE_FORMAT_INVALID";
    
    public ArchiveFormatException(String message) {
        super(ERROR_CODE, message);
    }
    
    public ArchiveFormatException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
