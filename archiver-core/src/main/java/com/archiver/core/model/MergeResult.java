package com.archiver.core.model;

/**
 * Outcome of merging new events into one week archive.
 *
 * @param appliedCount events newly added to the archive
 * @param totalCount events in the archive after the merge
 * @param attempts fetch-merge-write cycles it took
 */
public record MergeResult(
    WeekKey week,
    int appliedCount,
    int totalCount,
    Summary summary,
    int attempts
) {
    public boolean changed() {
        return appliedCount > 0;
    }
}
