package com.archiver.core.exception;

/**
 * Thrown when relevant events could not be forwarded to the event sink.
 * The weekly archives are unaffected.
 */
public class EventSinkException extends ArchiverException {

    public static final String ERROR_CODE = "EVENT_SINK_FAILED";

    public EventSinkException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
