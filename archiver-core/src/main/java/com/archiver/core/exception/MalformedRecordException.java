package com.archiver.core.exception;

/**
 * Thrown when a raw audit record cannot be minimally parsed.
 * The record is skipped and counted; the rest of the batch continues.
 */
public class MalformedRecordException extends ArchiverException {
    
    public static final String ERROR_CODE = "MALFORMED_RECORD";
    
    public MalformedRecordException(String reason) {
        super(ERROR_CODE, "Malformed audit record: " + reason);
    }
    
    public MalformedRecordException(String reason, Throwable cause) {
        super(ERROR_CODE, "Malformed audit record: " + reason, cause);
    }
}
