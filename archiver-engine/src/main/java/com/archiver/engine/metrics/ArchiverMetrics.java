package com.archiver.engine.metrics;

import com.archiver.core.model.FailureKind;
import com.archiver.core.model.WeekOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the archiver.
 *
 * Metrics exposed:
 * - Records received, filtered out and malformed
 * - Events applied and duplicates skipped
 * - Events forwarded and forwarding failures
 * - Merge conflicts and transient retries
 * - Week failures by kind
 * - Per-week merge duration
 */
@Component
public class ArchiverMetrics implements MeterBinder {

    public static final String RECORDS_RECEIVED = "archiver.records.received";
    public static final String RECORDS_FILTERED = "archiver.records.filtered";
    public static final String RECORDS_MALFORMED = "archiver.records.malformed";

    public static final String EVENTS_APPLIED = "archiver.events.applied";
    public static final String EVENTS_DUPLICATE = "archiver.events.duplicate";

    public static final String EVENTS_FORWARDED = "archiver.events.forwarded";
    public static final String SINK_FAILURES = "archiver.sink.failures";

    public static final String MERGE_CONFLICTS = "archiver.merge.conflicts";
    public static final String TRANSIENT_RETRIES = "archiver.store.transient_retries";
    public static final String WEEK_FAILURES = "archiver.week.failures";
    public static final String MERGE_DURATION = "archiver.merge.duration";
    public static final String BATCHES_IN_FLIGHT = "archiver.batches.in_flight";

    // Unbound instances (plain unit tests) record into a private registry
    private volatile MeterRegistry registry = new SimpleMeterRegistry();

    private final AtomicInteger batchesInFlight = new AtomicInteger(0);

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(BATCHES_IN_FLIGHT, batchesInFlight, AtomicInteger::get)
            .description("Batches currently being processed")
            .register(registry);
    }

    // ========== Batch Metrics ==========

    public void batchStarted() {
        batchesInFlight.incrementAndGet();
    }

    public void batchFinished() {
        batchesInFlight.decrementAndGet();
    }

    public void recordsReceived(int count) {
        counter(RECORDS_RECEIVED, "Audit records delivered").increment(count);
    }

    public void recordsFiltered(int count) {
        counter(RECORDS_FILTERED, "Records not about the monitored resource").increment(count);
    }

    public void recordsMalformed(int count) {
        counter(RECORDS_MALFORMED, "Records skipped as malformed").increment(count);
    }

    // ========== Merge Metrics ==========

    public void eventsApplied(int count) {
        counter(EVENTS_APPLIED, "Events newly written to week archives").increment(count);
    }

    public void duplicatesSkipped(int count) {
        counter(EVENTS_DUPLICATE, "Events already present in their week archive").increment(count);
    }

    public void eventsForwarded(int count) {
        counter(EVENTS_FORWARDED, "Events forwarded to the event sink").increment(count);
    }

    public void sinkFailure() {
        counter(SINK_FAILURES, "Batches whose events could not be forwarded").increment();
    }

    public void mergeConflict() {
        counter(MERGE_CONFLICTS, "Conditional writes that lost to a concurrent writer").increment();
    }

    public void transientRetry(String operation) {
        Counter.builder(TRANSIENT_RETRIES)
            .tag("operation", operation)
            .description("Store operations retried after a transient failure")
            .register(registry)
            .increment();
    }

    public void weekFailed(FailureKind kind) {
        Counter.builder(WEEK_FAILURES)
            .tag("kind", kind.name())
            .description("Week merges that did not complete")
            .register(registry)
            .increment();
    }

    public void mergeCompleted(WeekOutcome.Status status, Duration duration) {
        Timer.builder(MERGE_DURATION)
            .tag("outcome", status.name().toLowerCase())
            .description("Per-week merge duration")
            .register(registry)
            .record(duration);
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name)
            .description(description)
            .register(registry);
    }
}
