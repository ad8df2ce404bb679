package com.archiver.engine.normalize;

import com.archiver.core.model.CanonicalEvent;
import com.archiver.core.model.RawAuditRecord;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Converts raw audit records into canonical events.
 *
 * Total: never throws for a non-null record. Missing fields become defaults
 * ("Unknown" actor, empty strings, no error), an unparsable event time becomes
 * a null timestamp.
 */
public class EventNormalizer {

    static final String UNKNOWN = "Unknown";

    public CanonicalEvent normalize(RawAuditRecord record) {
        String eventName = record.eventName() != null ? record.eventName() : "";
        RawAuditRecord.UserIdentity identity = record.userIdentity();

        CanonicalEvent.Actor actor = new CanonicalEvent.Actor(
            identity != null ? firstNonBlank(identity.type()) : UNKNOWN,
            resolveActorName(identity),
            record.sourceIpAddress(),
            record.userAgent()
        );

        Set<String> arns = new LinkedHashSet<>();
        for (RawAuditRecord.ResourceRef resource : record.resources()) {
            if (resource != null && resource.arn() != null && !resource.arn().isEmpty()) {
                arns.add(resource.arn());
            }
        }

        CanonicalEvent.Target target = new CanonicalEvent.Target(
            record.requestParameter("bucketName"),
            record.requestParameter("key"),
            arns
        );

        String requestId = record.dedupKey();

        return new CanonicalEvent(
            requestId != null ? requestId : "",
            parseTimestamp(record.eventTime()),
            OperationClassifier.classify(eventName),
            eventName,
            actor,
            target,
            record.awsRegion(),
            emptyToNull(record.errorCode()),
            emptyToNull(record.errorMessage())
        );
    }

    /**
     * First non-blank of user name, principal id, ARN; otherwise "Unknown".
     */
    static String resolveActorName(RawAuditRecord.UserIdentity identity) {
        if (identity == null) {
            return UNKNOWN;
        }
        return firstNonBlank(identity.userName(), identity.principalId(), identity.arn());
    }

    /**
     * Parse an ISO-8601 event time carrying "Z" or a numeric offset.
     *
     * @return the instant, or null when absent or unparsable
     */
    public static Instant parseTimestamp(String eventTime) {
        if (eventTime == null || eventTime.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(eventTime.trim()).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return UNKNOWN;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
