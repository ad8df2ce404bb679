package com.archiver.core.model;

/**
 * Per-week result of a batch.
 */
public record WeekOutcome(
    WeekKey week,
    Status status,
    int eventCount,
    int appliedCount,
    int totalCount,
    FailureKind failureKind,
    String message
) {
    public enum Status {
        /** New events were written. */
        MERGED,
        /** Every event was already archived; nothing written. */
        UNCHANGED,
        FAILED,
        /** The batch deadline passed before this week was reached. */
        NOT_ATTEMPTED
    }

    public static WeekOutcome merged(MergeResult result, int eventCount) {
        return new WeekOutcome(
            result.week(),
            result.changed() ? Status.MERGED : Status.UNCHANGED,
            eventCount,
            result.appliedCount(),
            result.totalCount(),
            null,
            null
        );
    }

    public static WeekOutcome failed(WeekKey week, int eventCount, FailureKind kind, String message) {
        return new WeekOutcome(week, Status.FAILED, eventCount, 0, 0, kind, message);
    }

    public static WeekOutcome notAttempted(WeekKey week, int eventCount) {
        return new WeekOutcome(week, Status.NOT_ATTEMPTED, eventCount, 0, 0,
            FailureKind.DEADLINE_EXCEEDED, "Batch deadline reached before week was merged");
    }

    public boolean isSuccess() {
        return status == Status.MERGED || status == Status.UNCHANGED;
    }
}
