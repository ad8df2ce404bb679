package com.archiver.core.exception;

import com.archiver.core.model.WeekKey;

/**
 * Thrown when a week merge keeps losing the conditional write race
 * and its conflict retries are exhausted.
 */
public class MergeConflictException extends ArchiverException {
    
    public static final String ERROR_CODE = "MERGE_CONFLICT";
    
    private final WeekKey week;
    private final int attempts;
    
    public MergeConflictException(WeekKey week, int attempts, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Merge of week %s abandoned after %d conflicting attempts",
            week, attempts
        ), cause);
        this.week = week;
        this.attempts = attempts;
    }
    
    public WeekKey getWeek() {
        return week;
    }
    
    public int getAttempts() {
        return attempts;
    }
}
