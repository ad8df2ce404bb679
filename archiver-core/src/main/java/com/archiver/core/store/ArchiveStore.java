package com.archiver.core.store;

import com.archiver.core.model.ArchiveListing;
import com.archiver.core.model.VersionedArchive;
import com.archiver.core.model.WeekArchive;
import com.archiver.core.model.WeekKey;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for week archives, one object per week.
 * Supports optimistic locking via an opaque version token.
 *
 * Implementations must make putIfVersion atomic: of two writers presenting the
 * same expected version, at most one succeeds.
 */
public interface ArchiveStore {

    /**
     * Fetch the archive of a week with its current version token.
     *
     * @param week The week
     * @return The archive if the week has been written
     * @throws com.archiver.core.exception.TransientStoreException on retryable I/O failure
     * @throws com.archiver.core.exception.ArchiveFormatException if the stored document is unreadable
     * @throws com.archiver.core.exception.StoreUnavailableException on non-retryable store failure
     */
    Optional<VersionedArchive> get(WeekKey week);

    /**
     * Write the archive of a week only if the stored version still equals
     * expectedVersion. A null expectedVersion means "only if absent".
     *
     * @param week The week
     * @param archive The new archive content
     * @param expectedVersion The version returned by the fetch this write is based on
     * @throws com.archiver.core.exception.VersionConflictException if the version doesn't match
     * @throws com.archiver.core.exception.TransientStoreException on retryable I/O failure
     * @throws com.archiver.core.exception.StoreUnavailableException on non-retryable store failure
     */
    void putIfVersion(WeekKey week, WeekArchive archive, String expectedVersion);

    /**
     * List all stored week archives, ordered by week.
     */
    List<ArchiveListing> list();

    /**
     * Find the most recently modified week archive. Ties go to the later week.
     */
    default Optional<ArchiveListing> findLatest() {
        return list().stream().max(ArchiveListing.BY_MODIFICATION);
    }

    /**
     * Storage key under which a week is addressable by external tooling.
     */
    String storageKey(WeekKey week);
}
