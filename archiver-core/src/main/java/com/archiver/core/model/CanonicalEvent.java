package com.archiver.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Normalized, classified representation of one audited operation.
 * 
 * Identity: requestId. Two events with the same requestId describe the same
 * physical operation and are never both counted.
 * 
 * Invariants:
 * - requestId, operationCategory, rawEventName, actor and target are non-null
 * - timestamp is null only when the source time was missing or unparsable
 * - errorCode == null means the operation succeeded
 */
public record CanonicalEvent(
    String requestId,
    Instant timestamp,
    OperationCategory operationCategory,
    String rawEventName,
    Actor actor,
    Target target,
    String region,
    String errorCode,
    String errorMessage
) {
    public CanonicalEvent {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(operationCategory, "operationCategory");
        Objects.requireNonNull(rawEventName, "rawEventName");
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(target, "target");
        region = region != null ? region : "";
    }

    /**
     * Who performed the operation.
     */
    public record Actor(String type, String name, String sourceIp, String userAgent) {
        public Actor {
            type = type != null ? type : "Unknown";
            name = name != null ? name : "Unknown";
            sourceIp = sourceIp != null ? sourceIp : "";
            userAgent = userAgent != null ? userAgent : "";
        }
    }

    /**
     * What the operation touched.
     */
    public record Target(String resourceName, String objectKey, Set<String> referencedArns) {
        public Target {
            resourceName = resourceName != null ? resourceName : "";
            objectKey = objectKey != null ? objectKey : "";
            referencedArns = referencedArns != null ? Set.copyOf(referencedArns) : Set.of();
        }
    }

    public boolean isError() {
        return errorCode != null && !errorCode.isEmpty();
    }

    /**
     * Label used when ranking operations: the category name, or the raw
     * event name for unclassified events.
     */
    public String operationLabel() {
        return operationCategory == OperationCategory.OTHER ? rawEventName : operationCategory.name();
    }
}
