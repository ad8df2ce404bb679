package com.archiver.core.model;

import java.time.Instant;
import java.util.Comparator;

/**
 * Directory entry for one stored week archive.
 */
public record ArchiveListing(
    WeekKey week,
    String storageKey,
    Instant lastModified,
    long sizeBytes
) {
    /**
     * Orders by modification time; ties go to the later week.
     */
    public static final Comparator<ArchiveListing> BY_MODIFICATION =
        Comparator.comparing(ArchiveListing::lastModified).thenComparing(ArchiveListing::week);
}
