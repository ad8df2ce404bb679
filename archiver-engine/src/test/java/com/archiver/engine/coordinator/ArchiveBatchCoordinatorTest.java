package com.archiver.engine.coordinator;

import com.archiver.core.exception.EventSinkException;
import com.archiver.core.exception.MalformedRecordException;
import com.archiver.core.exception.NotFoundException;
import com.archiver.core.model.BatchResult;
import com.archiver.core.model.CanonicalEvent;
import com.archiver.core.model.FailureKind;
import com.archiver.core.model.OperationCategory;
import com.archiver.core.model.RawAuditRecord;
import com.archiver.core.model.RetryPolicy;
import com.archiver.core.model.WeekArchive;
import com.archiver.core.model.WeekKey;
import com.archiver.core.model.WeekOutcome;
import com.archiver.core.sink.EventSink;
import com.archiver.engine.codec.ArchiveDocumentCodec;
import com.archiver.engine.codec.CloudTrailLogDecoder;
import com.archiver.engine.filter.RelevanceFilter;
import com.archiver.engine.merge.ArchiveMergeEngine;
import com.archiver.engine.metrics.ArchiverMetrics;
import com.archiver.engine.normalize.EventNormalizer;
import com.archiver.engine.persistence.InMemoryArchiveStore;
import com.archiver.engine.summary.SummaryAggregator;
import com.archiver.engine.test.AuditRecords;
import com.archiver.engine.test.FailureInjectingArchiveStore;
import com.archiver.engine.test.TimeController;
import com.archiver.engine.week.MissingTimestampPolicy;
import com.archiver.engine.week.WeekKeyResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end batch scenarios over the in-memory store.
 */
class ArchiveBatchCoordinatorTest {

    private static final WeekKey W24 = new WeekKey(2024, 24);
    private static final WeekKey W25 = new WeekKey(2024, 25);

    private final ObjectMapper mapper = new ObjectMapper();
    private TimeController clock;
    private InMemoryArchiveStore backingStore;
    private FailureInjectingArchiveStore store;
    private ArchiverMetrics metrics;
    private List<CanonicalEvent> forwarded;
    private EventSink eventSink;

    @BeforeEach
    void setUp() {
        clock = new TimeController(Instant.parse("2024-06-19T12:00:00Z"));
        backingStore = new InMemoryArchiveStore(new ArchiveDocumentCodec(mapper), clock);
        store = new FailureInjectingArchiveStore(backingStore);
        metrics = new ArchiverMetrics();
        metrics.bindTo(new SimpleMeterRegistry());
        forwarded = new ArrayList<>();
        eventSink = forwarded::addAll;
    }

    @Test
    void ingest_shouldArchiveDuplicateDeliveryOnce() {
        ArchiveBatchCoordinator coordinator = coordinator(MissingTimestampPolicy.CURRENT_WEEK, Duration.ofMinutes(4));

        BatchResult result = coordinator.ingest(List.of(
            AuditRecords.s3("A", "GetObject", "2024-06-18T10:00:00Z"),
            AuditRecords.s3("A", "GetObject", "2024-06-18T10:00:00Z"),
            AuditRecords.s3("B", "GetObject", "2024-06-18T10:05:00Z")));

        assertThat(result.isComplete()).isTrue();
        assertThat(result.relevantCount()).isEqualTo(3);
        assertThat(result.mergedCount()).isEqualTo(2);
        assertThat(result.duplicateCount()).isEqualTo(1);

        WeekArchive archive = coordinator.getArchive(W25);
        assertThat(archive.events()).containsOnlyKeys("A", "B");
        assertThat(archive.summary().countOf(OperationCategory.READ)).isEqualTo(2L);
        assertThat(archive.summary().totalEvents()).isEqualTo(2L);
    }

    @Test
    void ingest_shouldCountFilteredAndMalformedRecords() {
        ArchiveBatchCoordinator coordinator = coordinator(MissingTimestampPolicy.CURRENT_WEEK, Duration.ofMinutes(4));

        BatchResult result = coordinator.ingest(Arrays.asList(
            AuditRecords.s3("A", "GetObject", "2024-06-18T10:00:00Z"),
            AuditRecords.s3("B", "GetObject", "2024-06-18T10:00:00Z", "orders-archive", "alice"),
            AuditRecords.fromSource("C", "kms.amazonaws.com"),
            AuditRecords.withoutIds("PutObject"),
            null));

        assertThat(result.totalRecords()).isEqualTo(5);
        assertThat(result.relevantCount()).isEqualTo(1);
        assertThat(result.filteredOutCount()).isEqualTo(2);
        assertThat(result.malformedCount()).isEqualTo(2);
        assertThat(result.mergedCount()).isEqualTo(1);
        assertThat(metrics.registry().counter("archiver.records.malformed").count()).isEqualTo(2.0);
    }

    @Test
    void ingest_shouldPartitionByWeekInWeekOrder() {
        ArchiveBatchCoordinator coordinator = coordinator(MissingTimestampPolicy.CURRENT_WEEK, Duration.ofMinutes(4));

        BatchResult result = coordinator.ingest(List.of(
            AuditRecords.s3("late", "PutObject", "2024-06-18T10:00:00Z"),
            AuditRecords.s3("early", "DeleteObject", "2024-06-12T10:00:00Z")));

        assertThat(result.weeks()).extracting(WeekOutcome::week).containsExactly(W24, W25);
        assertThat(result.weeks()).extracting(WeekOutcome::status)
            .containsOnly(WeekOutcome.Status.MERGED);
        assertThat(coordinator.getArchive(W24).events()).containsOnlyKeys("early");
        assertThat(coordinator.getArchive(W25).events()).containsOnlyKeys("late");
    }

    @Test
    void ingest_shouldFileUndatedEventInCurrentWeekAndDeduplicateOnRedelivery() {
        ArchiveBatchCoordinator coordinator = coordinator(MissingTimestampPolicy.CURRENT_WEEK, Duration.ofMinutes(4));
        RawAuditRecord undated = AuditRecords.s3("U", "GetObject", "not-a-time");

        BatchResult first = coordinator.ingest(List.of(undated));
        BatchResult second = coordinator.ingest(List.of(undated));

        assertThat(first.weeks()).extracting(WeekOutcome::week).containsExactly(W25);
        assertThat(second.mergedCount()).isZero();
        assertThat(second.duplicateCount()).isEqualTo(1);
        assertThat(second.weeks().get(0).status()).isEqualTo(WeekOutcome.Status.UNCHANGED);
        assertThat(coordinator.getArchive(W25).events()).containsOnlyKeys("U");
    }

    @Test
    void ingest_shouldTreatUndatedRecordAsMalformedUnderRejectPolicy() {
        ArchiveBatchCoordinator coordinator = coordinator(MissingTimestampPolicy.REJECT, Duration.ofMinutes(4));

        BatchResult result = coordinator.ingest(List.of(AuditRecords.s3("U", "GetObject", null)));

        assertThat(result.malformedCount()).isEqualTo(1);
        assertThat(result.weeks()).isEmpty();
        assertThat(backingStore.list()).isEmpty();
    }

    @Test
    void ingest_shouldReportFailedWeekWithoutFailingOthers() {
        ArchiveBatchCoordinator coordinator = coordinator(MissingTimestampPolicy.CURRENT_WEEK, Duration.ofMinutes(4));
        backingStore.overwriteRaw(W24, "{corrupt".getBytes(StandardCharsets.UTF_8));

        BatchResult result = coordinator.ingest(List.of(
            AuditRecords.s3("early", "GetObject", "2024-06-12T10:00:00Z"),
            AuditRecords.s3("late", "GetObject", "2024-06-18T10:00:00Z")));

        assertThat(result.isComplete()).isFalse();
        assertThat(result.failedWeeks()).singleElement().satisfies(outcome -> {
            assertThat(outcome.week()).isEqualTo(W24);
            assertThat(outcome.failureKind()).isEqualTo(FailureKind.ARCHIVE_FORMAT_INVALID);
        });
        assertThat(backingStore.rawDocument(W24).orElseThrow())
            .isEqualTo("{corrupt".getBytes(StandardCharsets.UTF_8));
        assertThat(coordinator.getArchive(W25).events()).containsOnlyKeys("late");
        assertThat(result.mergedCount()).isEqualTo(1);
    }

    @Test
    void ingest_shouldReportStoreOutagePerWeek() {
        ArchiveBatchCoordinator coordinator = coordinator(MissingTimestampPolicy.CURRENT_WEEK, Duration.ofMinutes(4));
        store.failNextGets(100);

        BatchResult result = coordinator.ingest(List.of(AuditRecords.s3("A", "GetObject", "2024-06-18T10:00:00Z")));

        assertThat(result.weeks()).singleElement().satisfies(outcome -> {
            assertThat(outcome.status()).isEqualTo(WeekOutcome.Status.FAILED);
            assertThat(outcome.failureKind()).isEqualTo(FailureKind.STORE_UNAVAILABLE);
            assertThat(outcome.eventCount()).isEqualTo(1);
        });
    }

    @Test
    void ingest_shouldMarkWeeksPastDeadlineAsNotAttempted() {
        ArchiveBatchCoordinator coordinator = coordinator(MissingTimestampPolicy.CURRENT_WEEK, Duration.ofMinutes(4));
        clock.advanceOnEveryRead(Duration.ofMinutes(3));

        BatchResult result = coordinator.ingest(List.of(
            AuditRecords.s3("w23", "GetObject", "2024-06-05T10:00:00Z"),
            AuditRecords.s3("w24", "GetObject", "2024-06-12T10:00:00Z"),
            AuditRecords.s3("w25", "GetObject", "2024-06-18T10:00:00Z")));

        assertThat(result.weeks().get(0).status()).isEqualTo(WeekOutcome.Status.MERGED);
        assertThat(result.weeks().subList(1, 3)).allSatisfy(outcome -> {
            assertThat(outcome.status()).isEqualTo(WeekOutcome.Status.NOT_ATTEMPTED);
            assertThat(outcome.failureKind()).isEqualTo(FailureKind.DEADLINE_EXCEEDED);
        });
        assertThat(backingStore.list()).extracting(l -> l.week()).containsExactly(new WeekKey(2024, 23));
    }

    @Test
    void ingest_shouldForwardRelevantEventsToSink() {
        ArchiveBatchCoordinator coordinator = coordinator(MissingTimestampPolicy.CURRENT_WEEK, Duration.ofMinutes(4));

        coordinator.ingest(List.of(
            AuditRecords.s3("A", "GetObject", "2024-06-18T10:00:00Z"),
            AuditRecords.s3("B", "GetObject", "2024-06-18T10:00:00Z", "orders-archive", "alice"),
            AuditRecords.s3("C", "PutObject", "2024-06-12T10:00:00Z")));

        assertThat(forwarded).extracting(CanonicalEvent::requestId).containsExactlyInAnyOrder("A", "C");
        assertThat(metrics.registry().counter("archiver.events.forwarded").count()).isEqualTo(2.0);
    }

    @Test
    void ingest_shouldKeepArchivingWhenSinkFails() {
        eventSink = events -> {
            throw new EventSinkException("log group unavailable", new IllegalStateException("down"));
        };
        ArchiveBatchCoordinator coordinator = coordinator(MissingTimestampPolicy.CURRENT_WEEK, Duration.ofMinutes(4));

        BatchResult result = coordinator.ingest(List.of(AuditRecords.s3("A", "GetObject", "2024-06-18T10:00:00Z")));

        assertThat(result.isComplete()).isTrue();
        assertThat(result.mergedCount()).isEqualTo(1);
        assertThat(coordinator.getArchive(W25).events()).containsOnlyKeys("A");
        assertThat(metrics.registry().counter("archiver.sink.failures").count()).isEqualTo(1.0);
        assertThat(metrics.registry().counter("archiver.events.forwarded").count()).isZero();
    }

    @Test
    void ingestLog_shouldDecodeDocumentAndCountBrokenEntries() {
        ArchiveBatchCoordinator coordinator = coordinator(MissingTimestampPolicy.CURRENT_WEEK, Duration.ofMinutes(4));
        String log = """
            {"Records": [
              {"eventSource": "s3.amazonaws.com", "eventName": "PutObject", "eventTime": "2024-06-18T10:00:00Z",
               "requestID": "L1", "requestParameters": {"bucketName": "orders", "key": "a.json"}},
              {"eventSource": "s3.amazonaws.com", "eventName": "GetObject"},
              42
            ]}
            """;

        BatchResult result = coordinator.ingestLog(log.getBytes(StandardCharsets.UTF_8));

        assertThat(result.totalRecords()).isEqualTo(3);
        assertThat(result.malformedCount()).isEqualTo(2);
        assertThat(result.mergedCount()).isEqualTo(1);
        assertThat(coordinator.getSummary(W25).countOf(OperationCategory.WRITE)).isEqualTo(1L);
    }

    @Test
    void ingestLog_shouldRejectDocumentThatIsNotARecordList() {
        ArchiveBatchCoordinator coordinator = coordinator(MissingTimestampPolicy.CURRENT_WEEK, Duration.ofMinutes(4));

        assertThatThrownBy(() -> coordinator.ingestLog("{\"foo\": 1}".getBytes(StandardCharsets.UTF_8)))
            .isInstanceOf(MalformedRecordException.class);
    }

    @Test
    void queries_shouldListWeeksAndFindLatest() {
        ArchiveBatchCoordinator coordinator = coordinator(MissingTimestampPolicy.CURRENT_WEEK, Duration.ofMinutes(4));
        coordinator.ingest(List.of(AuditRecords.s3("late", "GetObject", "2024-06-18T10:00:00Z")));
        clock.advance(Duration.ofMinutes(1));
        coordinator.ingest(List.of(AuditRecords.s3("early", "GetObject", "2024-06-12T10:00:00Z")));

        assertThat(coordinator.listWeeks()).extracting(l -> l.week()).containsExactly(W24, W25);
        assertThat(coordinator.getLatest().week()).isEqualTo(W24);
        assertThatThrownBy(() -> coordinator.getArchive(new WeekKey(2023, 1)))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void getLatest_shouldFailWhenNothingArchived() {
        ArchiveBatchCoordinator coordinator = coordinator(MissingTimestampPolicy.CURRENT_WEEK, Duration.ofMinutes(4));

        assertThatThrownBy(coordinator::getLatest).isInstanceOf(NotFoundException.class);
    }

    private ArchiveBatchCoordinator coordinator(MissingTimestampPolicy policy, Duration deadline) {
        ArchiveMergeEngine engine = new ArchiveMergeEngine(
            store, new SummaryAggregator(), clock,
            RetryPolicy.conflictDefault(), RetryPolicy.transientDefault(), duration -> { }, metrics);
        return new ArchiveBatchCoordinator(
            AuditRecords.BUCKET,
            new CloudTrailLogDecoder(mapper),
            new RelevanceFilter(),
            new EventNormalizer(),
            new WeekKeyResolver(clock, policy),
            engine,
            store,
            eventSink,
            clock,
            deadline,
            metrics);
    }
}
