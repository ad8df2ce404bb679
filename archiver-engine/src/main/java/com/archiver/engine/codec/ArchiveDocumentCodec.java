package com.archiver.engine.codec;

import com.archiver.core.exception.ArchiveFormatException;
import com.archiver.core.model.CanonicalEvent;
import com.archiver.core.model.OperationCategory;
import com.archiver.core.model.Summary;
import com.archiver.core.model.WeekArchive;
import com.archiver.core.model.WeekKey;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads and writes the week archive document read by external query tooling.
 *
 * Layout (field names are a published contract):
 * <pre>
 * {
 *   "week": "2024-W25",
 *   "generated_at": "2024-06-20T10:00:00Z",
 *   "total_events": 2,
 *   "summary": { "total_events", "error_count", "operation_counts", "top_operations",
 *                "top_users", "top_source_ips", "unique_users", "unique_ips" },
 *   "events": [ { "timestamp", "operation", "event_name",
 *                 "who": {...}, "what": {...}, "how": {...}, "response": {...} } ]
 * }
 * </pre>
 * Events are written in timestamp order (missing timestamps last), then by request id,
 * so equal archives encode to identical bytes.
 */
public class ArchiveDocumentCodec {

    private static final Comparator<CanonicalEvent> EVENT_ORDER = Comparator
        .comparing(CanonicalEvent::timestamp, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(CanonicalEvent::requestId);

    private final ObjectMapper objectMapper;

    public ArchiveDocumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ========== Encoding ==========

    public byte[] encode(WeekArchive archive) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(toTree(archive));
        } catch (JsonProcessingException e) {
            throw new ArchiveFormatException("Failed to encode archive for week " + archive.week(), e);
        }
    }

    public ObjectNode toTree(WeekArchive archive) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("week", archive.week().toString());
        root.put("generated_at", archive.generatedAt() != null ? archive.generatedAt().toString() : "");
        root.put("total_events", archive.size());
        root.set("summary", summaryToTree(archive.summary()));

        ArrayNode events = root.putArray("events");
        archive.events().values().stream()
            .sorted(EVENT_ORDER)
            .forEachOrdered(event -> events.add(eventToTree(event)));
        return root;
    }

    public ObjectNode summaryToTree(Summary summary) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("total_events", summary.totalEvents());
        node.put("error_count", summary.errorCount());

        ObjectNode categories = node.putObject("operation_counts");
        summary.operationCounts().forEach((category, count) -> categories.put(category.name(), count));

        putRanking(node.putObject("top_operations"), summary.topOperations());
        putRanking(node.putObject("top_users"), summary.topActors());
        putRanking(node.putObject("top_source_ips"), summary.topSourceIps());
        node.put("unique_users", summary.uniqueActors());
        node.put("unique_ips", summary.uniqueIps());
        return node;
    }

    private ObjectNode eventToTree(CanonicalEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("timestamp", event.timestamp() != null ? event.timestamp().toString() : "");
        node.put("operation", event.operationCategory().name());
        node.put("event_name", event.rawEventName());

        ObjectNode who = node.putObject("who");
        who.put("user_type", event.actor().type());
        who.put("user_name", event.actor().name());
        who.put("source_ip", event.actor().sourceIp());

        ObjectNode what = node.putObject("what");
        ArrayNode resources = what.putArray("resources");
        new TreeSet<>(event.target().referencedArns()).forEach(resources::add);
        what.put("bucket", event.target().resourceName());
        what.put("key", event.target().objectKey());

        ObjectNode how = node.putObject("how");
        how.put("user_agent", event.actor().userAgent());
        how.put("request_id", event.requestId());
        how.put("aws_region", event.region());

        ObjectNode response = node.putObject("response");
        response.put("error_code", event.errorCode() != null ? event.errorCode() : "");
        response.put("error_message", event.errorMessage() != null ? event.errorMessage() : "");
        return node;
    }

    private static void putRanking(ObjectNode target, Map<String, Long> ranking) {
        ranking.forEach(target::put);
    }

    // ========== Decoding ==========

    public WeekArchive decode(byte[] document) {
        JsonNode root = decodeTree(document);
        if (root == null || !root.isObject()) {
            throw new ArchiveFormatException("Archive document must be a JSON object");
        }

        WeekKey week;
        try {
            week = WeekKey.parse(root.path("week").asText(null));
        } catch (IllegalArgumentException e) {
            throw new ArchiveFormatException("Archive document has an invalid week", e);
        }

        JsonNode eventsNode = root.path("events");
        if (!eventsNode.isArray()) {
            throw new ArchiveFormatException("Archive document for " + week + " has no events array");
        }

        Map<String, CanonicalEvent> events = new HashMap<>();
        for (JsonNode eventNode : eventsNode) {
            CanonicalEvent event = treeToEvent(eventNode, week);
            events.put(event.requestId(), event);
        }

        return new WeekArchive(
            week,
            events,
            treeToSummary(root.path("summary")),
            parseInstant(root.path("generated_at").asText(""), week)
        );
    }

    private CanonicalEvent treeToEvent(JsonNode node, WeekKey week) {
        JsonNode who = node.path("who");
        JsonNode what = node.path("what");
        JsonNode how = node.path("how");
        JsonNode response = node.path("response");

        String requestId = how.path("request_id").asText("");
        if (requestId.isEmpty()) {
            throw new ArchiveFormatException("Archive " + week + " contains an event without request_id");
        }

        OperationCategory category;
        try {
            category = OperationCategory.valueOf(node.path("operation").asText("OTHER"));
        } catch (IllegalArgumentException e) {
            category = OperationCategory.OTHER;
        }

        Set<String> resources = new TreeSet<>();
        what.path("resources").forEach(arn -> resources.add(arn.asText()));

        return new CanonicalEvent(
            requestId,
            parseInstant(node.path("timestamp").asText(""), week),
            category,
            node.path("event_name").asText(""),
            new CanonicalEvent.Actor(
                who.path("user_type").asText(null),
                who.path("user_name").asText(null),
                who.path("source_ip").asText(null),
                how.path("user_agent").asText(null)
            ),
            new CanonicalEvent.Target(
                what.path("bucket").asText(null),
                what.path("key").asText(null),
                resources
            ),
            how.path("aws_region").asText(null),
            blankToNull(response.path("error_code").asText("")),
            blankToNull(response.path("error_message").asText(""))
        );
    }

    private Summary treeToSummary(JsonNode node) {
        if (!node.isObject()) {
            return Summary.empty();
        }
        Map<OperationCategory, Long> categories = new EnumMap<>(OperationCategory.class);
        for (OperationCategory category : OperationCategory.values()) {
            categories.put(category, node.path("operation_counts").path(category.name()).asLong(0));
        }
        return new Summary(
            node.path("total_events").asLong(0),
            node.path("error_count").asLong(0),
            categories,
            readRanking(node.path("top_operations")),
            readRanking(node.path("top_users")),
            readRanking(node.path("top_source_ips")),
            node.path("unique_users").asLong(0),
            node.path("unique_ips").asLong(0)
        );
    }

    private static Map<String, Long> readRanking(JsonNode node) {
        Map<String, Long> ranking = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            ranking.put(field.getKey(), field.getValue().asLong());
        }
        return ranking;
    }

    private static Instant parseInstant(String text, WeekKey week) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new ArchiveFormatException("Archive " + week + " has an invalid timestamp: " + text, e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * One event as a compact single-line document, in the same layout as inside an archive.
     */
    public String encodeEvent(CanonicalEvent event) {
        try {
            return objectMapper.writeValueAsString(eventToTree(event));
        } catch (JsonProcessingException e) {
            throw new ArchiveFormatException("Failed to encode event " + event.requestId(), e);
        }
    }

    private JsonNode decodeTree(byte[] document) {
        try {
            return objectMapper.readTree(document);
        } catch (IOException e) {
            throw new ArchiveFormatException("Archive document is not valid JSON", e);
        }
    }
}
