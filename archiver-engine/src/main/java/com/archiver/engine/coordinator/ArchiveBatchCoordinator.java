package com.archiver.engine.coordinator;

import com.archiver.core.exception.ArchiveFormatException;
import com.archiver.core.exception.EventSinkException;
import com.archiver.core.exception.MalformedRecordException;
import com.archiver.core.exception.MergeConflictException;
import com.archiver.core.exception.NotFoundException;
import com.archiver.core.exception.StoreUnavailableException;
import com.archiver.core.exception.TransientStoreException;
import com.archiver.core.model.ArchiveListing;
import com.archiver.core.model.BatchResult;
import com.archiver.core.model.CanonicalEvent;
import com.archiver.core.model.FailureKind;
import com.archiver.core.model.MergeResult;
import com.archiver.core.model.RawAuditRecord;
import com.archiver.core.model.Summary;
import com.archiver.core.model.VersionedArchive;
import com.archiver.core.model.WeekArchive;
import com.archiver.core.model.WeekKey;
import com.archiver.core.model.WeekOutcome;
import com.archiver.core.sink.EventSink;
import com.archiver.core.store.ArchiveStore;
import com.archiver.engine.codec.CloudTrailLogDecoder;
import com.archiver.engine.filter.RelevanceFilter;
import com.archiver.engine.logging.LoggingContext;
import com.archiver.engine.merge.ArchiveMergeEngine;
import com.archiver.engine.metrics.ArchiverMetrics;
import com.archiver.engine.normalize.EventNormalizer;
import com.archiver.engine.service.ArchiveService;
import com.archiver.engine.week.WeekKeyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Runs one delivered batch through the pipeline:
 * filter, normalize, forward to the event sink, partition by week,
 * then one merge per week in week order.
 *
 * Weeks succeed or fail independently. Weeks not reached before the batch deadline
 * are reported as not attempted; weeks merged before it stay committed.
 */
public class ArchiveBatchCoordinator implements ArchiveService {

    private static final Logger log = LoggerFactory.getLogger(ArchiveBatchCoordinator.class);

    private final String monitoredResource;
    private final CloudTrailLogDecoder decoder;
    private final RelevanceFilter filter;
    private final EventNormalizer normalizer;
    private final WeekKeyResolver weekKeyResolver;
    private final ArchiveMergeEngine mergeEngine;
    private final ArchiveStore store;
    private final EventSink eventSink;
    private final Clock clock;
    private final Duration batchDeadline;
    private final ArchiverMetrics metrics;

    public ArchiveBatchCoordinator(
            String monitoredResource,
            CloudTrailLogDecoder decoder,
            RelevanceFilter filter,
            EventNormalizer normalizer,
            WeekKeyResolver weekKeyResolver,
            ArchiveMergeEngine mergeEngine,
            ArchiveStore store,
            EventSink eventSink,
            Clock clock,
            Duration batchDeadline,
            ArchiverMetrics metrics) {
        this.monitoredResource = monitoredResource;
        this.decoder = decoder;
        this.filter = filter;
        this.normalizer = normalizer;
        this.weekKeyResolver = weekKeyResolver;
        this.mergeEngine = mergeEngine;
        this.store = store;
        this.eventSink = eventSink;
        this.clock = clock;
        this.batchDeadline = batchDeadline;
        this.metrics = metrics;
    }

    // ========== Ingestion ==========

    @Override
    public BatchResult ingest(List<RawAuditRecord> records) {
        return process(records, 0);
    }

    @Override
    public BatchResult ingestLog(byte[] document) {
        CloudTrailLogDecoder.DecodedLog decoded = decoder.decode(document);
        return process(decoded.records(), decoded.malformedCount());
    }

    private BatchResult process(List<RawAuditRecord> records, int malformedBeforeDecode) {
        String batchId = LoggingContext.newBatchId();
        Instant deadline = clock.instant().plus(batchDeadline);
        metrics.batchStarted();

        try (LoggingContext ctx = LoggingContext.forBatch(batchId, monitoredResource)) {
            int total = records.size() + malformedBeforeDecode;
            int malformed = malformedBeforeDecode;
            int filteredOut = 0;
            int relevant = 0;

            List<CanonicalEvent> relevantEvents = new ArrayList<>();
            SortedMap<WeekKey, List<CanonicalEvent>> byWeek = new TreeMap<>();
            for (RawAuditRecord record : records) {
                try {
                    if (record == null) {
                        throw new MalformedRecordException("null record");
                    }
                    if (!filter.isRelevant(record, monitoredResource)) {
                        filteredOut++;
                        continue;
                    }
                    decoder.requireMinimal(record);
                    CanonicalEvent event = normalizer.normalize(record);
                    WeekKey week = weekKeyResolver.weekKey(event);
                    byWeek.computeIfAbsent(week, w -> new ArrayList<>()).add(event);
                    relevantEvents.add(event);
                    relevant++;
                } catch (MalformedRecordException e) {
                    malformed++;
                    log.warn("Skipping malformed record: {}", e.getMessage());
                }
            }

            metrics.recordsReceived(total);
            metrics.recordsFiltered(filteredOut);
            metrics.recordsMalformed(malformed);
            forward(relevantEvents);

            List<WeekOutcome> outcomes = new ArrayList<>();
            int merged = 0;
            int duplicates = 0;
            for (Map.Entry<WeekKey, List<CanonicalEvent>> entry : byWeek.entrySet()) {
                WeekKey week = entry.getKey();
                List<CanonicalEvent> events = entry.getValue();

                if (!clock.instant().isBefore(deadline)) {
                    log.warn("Batch deadline reached, week {} not attempted ({} events)", week, events.size());
                    metrics.weekFailed(FailureKind.DEADLINE_EXCEEDED);
                    outcomes.add(WeekOutcome.notAttempted(week, events.size()));
                    continue;
                }

                WeekOutcome outcome = mergeWeek(week, events);
                if (outcome.isSuccess()) {
                    merged += outcome.appliedCount();
                    duplicates += events.size() - outcome.appliedCount();
                }
                outcomes.add(outcome);
            }

            metrics.eventsApplied(merged);
            metrics.duplicatesSkipped(duplicates);

            BatchResult result = new BatchResult(
                batchId, total, malformed, filteredOut, relevant, merged, duplicates, outcomes);
            log.info("Batch {} done: {} records, {} relevant, {} filtered, {} malformed, {} merged, "
                    + "{} duplicates, {}/{} weeks ok",
                batchId, total, relevant, filteredOut, malformed, merged, duplicates,
                outcomes.size() - result.failedWeeks().size(), outcomes.size());
            return result;
        } finally {
            metrics.batchFinished();
        }
    }

    private void forward(List<CanonicalEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        try {
            eventSink.publish(events);
            metrics.eventsForwarded(events.size());
        } catch (EventSinkException e) {
            log.warn("Event forwarding failed, archiving continues: {}", e.getMessage(), e);
            metrics.sinkFailure();
        }
    }

    private WeekOutcome mergeWeek(WeekKey week, List<CanonicalEvent> events) {
        Instant start = clock.instant();
        try (LoggingContext ctx = LoggingContext.forWeek(week)) {
            WeekOutcome outcome;
            try {
                MergeResult result = mergeEngine.merge(week, events);
                outcome = WeekOutcome.merged(result, events.size());
            } catch (MergeConflictException e) {
                outcome = failed(week, events, FailureKind.MERGE_CONFLICT, e);
            } catch (StoreUnavailableException e) {
                outcome = failed(week, events, FailureKind.STORE_UNAVAILABLE, e);
            } catch (ArchiveFormatException e) {
                outcome = failed(week, events, FailureKind.ARCHIVE_FORMAT_INVALID, e);
            }
            metrics.mergeCompleted(outcome.status(), Duration.between(start, clock.instant()));
            return outcome;
        }
    }

    private WeekOutcome failed(WeekKey week, List<CanonicalEvent> events, FailureKind kind, RuntimeException e) {
        log.error("Week {} failed ({}): {}", week, kind, e.getMessage(), e);
        metrics.weekFailed(kind);
        return WeekOutcome.failed(week, events.size(), kind, e.getMessage());
    }

    // ========== Queries ==========

    @Override
    public List<ArchiveListing> listWeeks() {
        return readStore("list", store::list);
    }

    @Override
    public WeekArchive getArchive(WeekKey week) {
        return readStore("get", () -> store.get(week))
            .map(VersionedArchive::archive)
            .orElseThrow(() -> new NotFoundException("WeekArchive", week.toString()));
    }

    @Override
    public Summary getSummary(WeekKey week) {
        return getArchive(week).summary();
    }

    @Override
    public WeekArchive getLatest() {
        ArchiveListing latest = readStore("list", store::findLatest)
            .orElseThrow(() -> new NotFoundException("WeekArchive", "latest"));
        return getArchive(latest.week());
    }

    private <T> T readStore(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (TransientStoreException e) {
            throw new StoreUnavailableException("Archive store " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
