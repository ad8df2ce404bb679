package com.archiver.engine.service;

import com.archiver.core.model.ArchiveListing;
import com.archiver.core.model.BatchResult;
import com.archiver.core.model.RawAuditRecord;
import com.archiver.core.model.Summary;
import com.archiver.core.model.WeekArchive;
import com.archiver.core.model.WeekKey;

import java.util.List;

/**
 * Entry point of the archiver: batch ingestion plus the read-only query surface.
 */
public interface ArchiveService {

    /**
     * Archive a batch of already decoded records.
     * Safe to re-deliver: events already archived are skipped.
     *
     * @param records The delivered records, relevant or not
     * @return Per-week outcome of the batch
     */
    BatchResult ingest(List<RawAuditRecord> records);

    /**
     * Archive a delivered log document (<code>{"Records": [...]}</code>, optionally gzip-compressed).
     *
     * @param document The raw log bytes
     * @return Per-week outcome of the batch
     * @throws com.archiver.core.exception.MalformedRecordException if the document is not a record list
     */
    BatchResult ingestLog(byte[] document);

    /**
     * List all archived weeks, oldest first.
     */
    List<ArchiveListing> listWeeks();

    /**
     * Fetch one week archive.
     *
     * @throws com.archiver.core.exception.NotFoundException if the week has never been written
     */
    WeekArchive getArchive(WeekKey week);

    /**
     * Fetch the summary of one week.
     *
     * @throws com.archiver.core.exception.NotFoundException if the week has never been written
     */
    Summary getSummary(WeekKey week);

    /**
     * Fetch the most recently modified week archive.
     *
     * @throws com.archiver.core.exception.NotFoundException if nothing has been archived yet
     */
    WeekArchive getLatest();
}
