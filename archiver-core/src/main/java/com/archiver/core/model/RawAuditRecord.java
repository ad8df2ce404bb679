package com.archiver.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * A single audit record as delivered by the audit source (CloudTrail record layout).
 * Externally produced; every field may be absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawAuditRecord(
    @JsonProperty("eventVersion") String eventVersion,
    @JsonProperty("eventSource") String eventSource,
    @JsonProperty("eventName") String eventName,
    @JsonProperty("eventTime") String eventTime,
    @JsonProperty("awsRegion") String awsRegion,
    @JsonProperty("sourceIPAddress") String sourceIpAddress,
    @JsonProperty("userAgent") String userAgent,
    @JsonProperty("userIdentity") UserIdentity userIdentity,
    @JsonProperty("requestParameters") JsonNode requestParameters,
    @JsonProperty("responseElements") JsonNode responseElements,
    @JsonProperty("errorCode") String errorCode,
    @JsonProperty("errorMessage") String errorMessage,
    @JsonProperty("resources") List<ResourceRef> resources,
    @JsonProperty("requestID") String requestId,
    @JsonProperty("eventID") String eventId
) {
    public RawAuditRecord {
        resources = resources != null
            ? resources.stream().filter(Objects::nonNull).toList()
            : List.of();
    }

    /**
     * Identity of the caller that performed the operation.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UserIdentity(
        @JsonProperty("type") String type,
        @JsonProperty("principalId") String principalId,
        @JsonProperty("arn") String arn,
        @JsonProperty("accountId") String accountId,
        @JsonProperty("userName") String userName
    ) {}

    /**
     * A resource referenced by the operation.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResourceRef(
        @JsonProperty("ARN") @JsonAlias("arn") String arn,
        @JsonProperty("type") String type,
        @JsonProperty("accountId") String accountId
    ) {}

    /**
     * Read a text field from the request parameters.
     *
     * @return the value, or null when absent or not textual
     */
    public String requestParameter(String name) {
        return textField(requestParameters, name);
    }

    /**
     * Read a text field from the response elements.
     *
     * @return the value, or null when absent or not textual
     */
    public String responseElement(String name) {
        return textField(responseElements, name);
    }

    /**
     * The key used to recognize redelivered copies of this record:
     * the request id, falling back to the event id.
     *
     * @return the key, or null when the record carries neither
     */
    public String dedupKey() {
        if (requestId != null && !requestId.isBlank()) {
            return requestId;
        }
        if (eventId != null && !eventId.isBlank()) {
            return eventId;
        }
        return null;
    }

    private static String textField(JsonNode node, String name) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(name);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
