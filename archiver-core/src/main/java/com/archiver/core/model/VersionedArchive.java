package com.archiver.core.model;

import java.time.Instant;

/**
 * A week archive as fetched from the store, with the opaque version token
 * that a conditional write must present.
 */
public record VersionedArchive(
    WeekArchive archive,
    String version,
    Instant lastModified
) {}
