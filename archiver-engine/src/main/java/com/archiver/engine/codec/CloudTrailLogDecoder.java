package com.archiver.engine.codec;

import com.archiver.core.exception.MalformedRecordException;
import com.archiver.core.model.RawAuditRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Splits a delivered audit log document into raw records.
 *
 * Accepts the CloudTrail layout <code>{"Records": [...]}</code> or a bare JSON array,
 * plain or gzip-compressed. Entries that cannot be bound to a record, or that carry
 * no request or event id, are counted as malformed and left out.
 */
public class CloudTrailLogDecoder {

    private static final Logger log = LoggerFactory.getLogger(CloudTrailLogDecoder.class);

    static final String RECORDS_FIELD = "Records";
    private static final int GZIP_MAGIC_1 = 0x1f;
    private static final int GZIP_MAGIC_2 = 0x8b;

    private final ObjectMapper objectMapper;

    public CloudTrailLogDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Records of a log document plus the number of entries that were skipped.
     */
    public record DecodedLog(List<RawAuditRecord> records, int malformedCount) {
        public DecodedLog {
            records = List.copyOf(records);
        }

        public int totalCount() {
            return records.size() + malformedCount;
        }
    }

    /**
     * @throws MalformedRecordException if the document as a whole is not a record list
     */
    public DecodedLog decode(byte[] document) {
        JsonNode root = readDocument(document);
        JsonNode entries = root.isArray() ? root : root.path(RECORDS_FIELD);
        if (!entries.isArray()) {
            throw new MalformedRecordException("log document has no " + RECORDS_FIELD + " array");
        }

        List<RawAuditRecord> records = new ArrayList<>();
        int malformed = 0;
        int index = 0;
        for (JsonNode entry : entries) {
            try {
                records.add(bind(entry));
            } catch (MalformedRecordException e) {
                malformed++;
                log.warn("Skipping log entry {}: {}", index, e.getMessage());
            }
            index++;
        }
        return new DecodedLog(records, malformed);
    }

    /**
     * Check that a record carries enough to be archived: an id to deduplicate by.
     *
     * @throws MalformedRecordException if neither request id nor event id is present
     */
    public void requireMinimal(RawAuditRecord record) {
        if (record == null) {
            throw new MalformedRecordException("null record");
        }
        if (record.dedupKey() == null) {
            throw new MalformedRecordException("record has neither requestID nor eventID");
        }
    }

    private RawAuditRecord bind(JsonNode entry) {
        if (!entry.isObject()) {
            throw new MalformedRecordException("entry is not a JSON object");
        }
        RawAuditRecord record;
        try {
            record = objectMapper.treeToValue(entry, RawAuditRecord.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedRecordException("entry does not match the record layout", e);
        }
        requireMinimal(record);
        return record;
    }

    private JsonNode readDocument(byte[] document) {
        if (document == null || document.length == 0) {
            throw new MalformedRecordException("empty log document");
        }
        try (InputStream in = isGzip(document)
                ? new GZIPInputStream(new ByteArrayInputStream(document))
                : new ByteArrayInputStream(document)) {
            JsonNode root = objectMapper.readTree(in);
            if (root == null || root.isMissingNode()) {
                throw new MalformedRecordException("empty log document");
            }
            return root;
        } catch (IOException e) {
            throw new MalformedRecordException("log document is not readable JSON", e);
        }
    }

    private static boolean isGzip(byte[] document) {
        return document.length >= 2
            && (document[0] & 0xff) == GZIP_MAGIC_1
            && (document[1] & 0xff) == GZIP_MAGIC_2;
    }
}
