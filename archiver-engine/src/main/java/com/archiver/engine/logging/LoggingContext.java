package com.archiver.engine.logging;

import com.archiver.core.model.WeekKey;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helper so every log line of a batch carries its correlation keys.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forBatch(batchId, resource)) {
 *     try (var weekCtx = LoggingContext.forWeek(week)) {
 *         log.info("Merging week"); // includes batchId, resource, week
 *     }
 * }
 * </pre>
 *
 * Closing a week context removes only the week-level keys.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String BATCH_ID = "batchId";
    public static final String RESOURCE = "resource";
    public static final String WEEK = "week";
    public static final String ATTEMPT = "attempt";

    private final String[] keys;

    private LoggingContext(String... keys) {
        this.keys = keys;
    }

    /**
     * Context for a whole batch.
     */
    public static LoggingContext forBatch(String batchId, String resource) {
        if (batchId != null) {
            MDC.put(BATCH_ID, batchId);
        }
        if (resource != null) {
            MDC.put(RESOURCE, resource);
        }
        return new LoggingContext(BATCH_ID, RESOURCE);
    }

    /**
     * Context for the merge of a single week within a batch.
     */
    public static LoggingContext forWeek(WeekKey week) {
        if (week != null) {
            MDC.put(WEEK, week.toString());
        }
        return new LoggingContext(WEEK, ATTEMPT);
    }

    public static void setAttempt(int attempt) {
        MDC.put(ATTEMPT, String.valueOf(attempt));
    }

    public static String newBatchId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
    }
}
