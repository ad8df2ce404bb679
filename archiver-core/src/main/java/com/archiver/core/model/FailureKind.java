package com.archiver.core.model;

/**
 * Why a week of a batch was not merged.
 */
public enum FailureKind {
    MERGE_CONFLICT,
    STORE_UNAVAILABLE,
    ARCHIVE_FORMAT_INVALID,
    DEADLINE_EXCEEDED
}
