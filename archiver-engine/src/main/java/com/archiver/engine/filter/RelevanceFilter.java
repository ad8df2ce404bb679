package com.archiver.engine.filter;

import com.archiver.core.exception.ConfigurationException;
import com.archiver.core.model.RawAuditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a raw audit record is about the monitored resource.
 *
 * A record from the configured audit source is relevant when any of:
 * - its request parameters name the resource (exact match)
 * - a referenced resource ARN is the resource itself or an object inside it
 * - its response elements name the resource (exact match)
 *
 * Records from any other source are rejected before field inspection.
 * Stateless and thread-safe.
 */
public class RelevanceFilter {

    private static final Logger log = LoggerFactory.getLogger(RelevanceFilter.class);

    public static final String DEFAULT_EVENT_SOURCE = "s3.amazonaws.com";
    public static final String ARN_PREFIX = "arn:aws:s3:::";
    static final String BUCKET_NAME_FIELD = "bucketName";
    private static final char PATH_SEPARATOR = '/';

    private final String eventSource;

    public RelevanceFilter() {
        this(DEFAULT_EVENT_SOURCE);
    }

    public RelevanceFilter(String eventSource) {
        if (eventSource == null || eventSource.isBlank()) {
            throw new ConfigurationException("archiver.event-source", "cannot be empty");
        }
        this.eventSource = eventSource;
    }

    /**
     * Check whether a record pertains to the monitored resource.
     *
     * @param record The raw audit record
     * @param monitoredResource Name of the monitored resource (bucket)
     * @return true if the record should be archived
     */
    public boolean isRelevant(RawAuditRecord record, String monitoredResource) {
        if (!eventSource.equals(record.eventSource())) {
            log.debug("Rejected record {} from source {}", record.dedupKey(), record.eventSource());
            return false;
        }

        if (monitoredResource.equals(record.requestParameter(BUCKET_NAME_FIELD))) {
            return true;
        }

        for (RawAuditRecord.ResourceRef resource : record.resources()) {
            if (resource != null && denotesResource(resource.arn(), monitoredResource)) {
                return true;
            }
        }

        return monitoredResource.equals(record.responseElement(BUCKET_NAME_FIELD));
    }

    /**
     * An identifier denotes resource R if it is R or lies in R's namespace
     * (R followed by the path separator). Both the bare name and the ARN form count.
     */
    static boolean denotesResource(String identifier, String resource) {
        if (identifier == null || identifier.isEmpty()) {
            return false;
        }
        return withinNamespace(identifier, resource)
            || withinNamespace(identifier, ARN_PREFIX + resource);
    }

    private static boolean withinNamespace(String identifier, String namespace) {
        if (!identifier.startsWith(namespace)) {
            return false;
        }
        return identifier.length() == namespace.length()
            || identifier.charAt(namespace.length()) == PATH_SEPARATOR;
    }
}
