package com.archiver.core.exception;

/**
 * Thrown by an archive store when a conditional write finds a version
 * other than the expected one.
 */
public class VersionConflictException extends ArchiverException {
    
    public static final String ERROR_CODE = "VERSION_CONFLICT";
    
    public VersionConflictException(String storageKey, String expectedVersion, String actualVersion) {
        super(ERROR_CODE, String.format(
            "Version conflict on %s: expected version %s, actual version %s",
            storageKey, describe(expectedVersion), describe(actualVersion)
        ));
    }
    
    public VersionConflictException(String storageKey, String expectedVersion, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Version conflict on %s: expected version %s",
            storageKey, describe(expectedVersion)
        ), cause);
    }
    
    private static String describe(String version) {
        return version == null ? "<absent>" : version;
    }
}
