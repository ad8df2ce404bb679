package com.archiver.engine.merge;

import com.archiver.core.exception.MergeConflictException;
import com.archiver.core.exception.StoreUnavailableException;
import com.archiver.core.exception.TransientStoreException;
import com.archiver.core.exception.VersionConflictException;
import com.archiver.core.model.CanonicalEvent;
import com.archiver.core.model.MergeResult;
import com.archiver.core.model.RetryPolicy;
import com.archiver.core.model.VersionedArchive;
import com.archiver.core.model.WeekArchive;
import com.archiver.core.model.WeekKey;
import com.archiver.core.store.ArchiveStore;
import com.archiver.engine.logging.LoggingContext;
import com.archiver.engine.metrics.ArchiverMetrics;
import com.archiver.engine.summary.SummaryAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Merges new events into a week archive with optimistic concurrency.
 *
 * One merge is a fetch-dedupe-write cycle:
 * 1. fetch the stored archive and its version (absent means empty, no version)
 * 2. keep the events whose request id is not archived yet
 * 3. nothing new: done, no write
 * 4. otherwise recompute the summary over the union and write conditioned on the fetched version
 *
 * A lost write race restarts the cycle from the fetch, bounded by the conflict policy.
 * Transient store failures are retried in place, bounded by the transient policy.
 *
 * Holds no mutable state: concurrent merges, in this process or others, coordinate
 * only through the store's conditional write.
 */
public class ArchiveMergeEngine {

    private static final Logger log = LoggerFactory.getLogger(ArchiveMergeEngine.class);

    private final ArchiveStore store;
    private final SummaryAggregator aggregator;
    private final Clock clock;
    private final RetryPolicy conflictPolicy;
    private final RetryPolicy transientPolicy;
    private final Sleeper sleeper;
    private final ArchiverMetrics metrics;

    public ArchiveMergeEngine(ArchiveStore store, SummaryAggregator aggregator, Clock clock) {
        this(store, aggregator, clock, RetryPolicy.conflictDefault(), RetryPolicy.transientDefault(),
            Sleeper.THREAD, new ArchiverMetrics());
    }

    public ArchiveMergeEngine(
            ArchiveStore store,
            SummaryAggregator aggregator,
            Clock clock,
            RetryPolicy conflictPolicy,
            RetryPolicy transientPolicy,
            Sleeper sleeper,
            ArchiverMetrics metrics) {
        this.store = store;
        this.aggregator = aggregator;
        this.clock = clock;
        this.conflictPolicy = conflictPolicy;
        this.transientPolicy = transientPolicy;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * Merge events into the archive of a week. Events already archived, and repeats
     * within newEvents, are skipped; their stored copy wins.
     *
     * @param week The week every event belongs to
     * @param newEvents Canonical events of that week
     * @return What was applied
     * @throws MergeConflictException if every conflict retry lost the write race
     * @throws StoreUnavailableException if the store stayed unreachable
     * @throws com.archiver.core.exception.ArchiveFormatException if the stored archive is unreadable
     */
    public MergeResult merge(WeekKey week, Collection<CanonicalEvent> newEvents) {
        int attempt = 0;
        while (true) {
            attempt++;
            LoggingContext.setAttempt(attempt);

            Optional<VersionedArchive> current = withTransientRetry("get", week, () -> store.get(week));
            WeekArchive archive = current.map(VersionedArchive::archive).orElseGet(() -> WeekArchive.empty(week));
            String expectedVersion = current.map(VersionedArchive::version).orElse(null);

            Map<String, CanonicalEvent> toAdd = new LinkedHashMap<>();
            for (CanonicalEvent event : newEvents) {
                if (!archive.contains(event.requestId())) {
                    toAdd.putIfAbsent(event.requestId(), event);
                }
            }

            if (toAdd.isEmpty()) {
                log.debug("Week {} already holds all {} events, nothing to write", week, newEvents.size());
                return new MergeResult(week, 0, archive.size(), archive.summary(), attempt);
            }

            Map<String, CanonicalEvent> merged = new HashMap<>(archive.events());
            merged.putAll(toAdd);
            WeekArchive updated = new WeekArchive(week, merged, aggregator.aggregate(merged.values()), clock.instant());

            try {
                withTransientRetry("put", week, () -> {
                    store.putIfVersion(week, updated, expectedVersion);
                    return null;
                });
                log.info("Merged {} new events into week {} ({} total, attempt {})",
                    toAdd.size(), week, merged.size(), attempt);
                return new MergeResult(week, toAdd.size(), merged.size(), updated.summary(), attempt);
            } catch (VersionConflictException e) {
                metrics.mergeConflict();
                if (!conflictPolicy.hasMoreAttempts(attempt)) {
                    throw new MergeConflictException(week, attempt, e);
                }
                Duration backoff = conflictPolicy.computeBackoff(attempt);
                log.warn("Lost write race on week {} (attempt {}/{}), refetching in {}ms",
                    week, attempt, conflictPolicy.maxAttempts(), backoff.toMillis());
                pause(backoff, week);
            }
        }
    }

    private <T> T withTransientRetry(String operation, WeekKey week, Supplier<T> call) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.get();
            } catch (TransientStoreException e) {
                if (!transientPolicy.hasMoreAttempts(attempt)) {
                    throw new StoreUnavailableException(String.format(
                        "Store %s of week %s failed after %d attempts", operation, week, attempt), e);
                }
                metrics.transientRetry(operation);
                Duration backoff = transientPolicy.computeBackoff(attempt);
                log.warn("Transient store failure during {} of week {} (attempt {}/{}), retrying in {}ms: {}",
                    operation, week, attempt, transientPolicy.maxAttempts(), backoff.toMillis(), e.getMessage());
                pause(backoff, week);
            }
        }
    }

    private void pause(Duration backoff, WeekKey week) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while merging week " + week, e);
        }
    }
}
