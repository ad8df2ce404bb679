package com.archiver.engine.sink;

import com.archiver.core.exception.EventSinkException;
import com.archiver.core.model.CanonicalEvent;
import com.archiver.core.sink.EventSink;
import com.archiver.engine.codec.ArchiveDocumentCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogStreamRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.InputLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceAlreadyExistsException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Forwards each relevant event as one line to a CloudWatch Logs group.
 *
 * One stream per UTC day, named <code>yyyy/MM/dd/s3-access</code>, created on first use.
 * Events carry the forwarding time as their log timestamp and are sent in
 * chunks within the PutLogEvents limits.
 */
public class CloudWatchLogsEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(CloudWatchLogsEventSink.class);

    private static final DateTimeFormatter STREAM_DAY = DateTimeFormatter.ofPattern("yyyy/MM/dd")
        .withZone(ZoneOffset.UTC);
    static final String STREAM_SUFFIX = "/s3-access";

    static final int MAX_EVENTS_PER_CALL = 10_000;
    static final int MAX_BYTES_PER_CALL = 1_048_576;
    private static final int EVENT_OVERHEAD_BYTES = 26;

    private final CloudWatchLogsClient client;
    private final String logGroup;
    private final ArchiveDocumentCodec codec;
    private final Clock clock;
    private final Set<String> knownStreams = ConcurrentHashMap.newKeySet();

    public CloudWatchLogsEventSink(
            CloudWatchLogsClient client,
            String logGroup,
            ArchiveDocumentCodec codec,
            Clock clock) {
        this.client = client;
        this.logGroup = logGroup;
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public void publish(List<CanonicalEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        long now = clock.millis();
        String stream = STREAM_DAY.format(clock.instant()) + STREAM_SUFFIX;

        try {
            ensureStream(stream);
            List<InputLogEvent> chunk = new ArrayList<>();
            int chunkBytes = 0;
            for (CanonicalEvent event : events) {
                String message = codec.encodeEvent(event);
                int size = message.getBytes(StandardCharsets.UTF_8).length + EVENT_OVERHEAD_BYTES;
                if (chunk.size() == MAX_EVENTS_PER_CALL || chunkBytes + size > MAX_BYTES_PER_CALL) {
                    send(stream, chunk);
                    chunk = new ArrayList<>();
                    chunkBytes = 0;
                }
                chunk.add(InputLogEvent.builder().timestamp(now).message(message).build());
                chunkBytes += size;
            }
            send(stream, chunk);
        } catch (SdkException e) {
            throw new EventSinkException(String.format(
                "Forwarding %d events to %s/%s failed: %s", events.size(), logGroup, stream, e.getMessage()), e);
        }
        log.debug("Forwarded {} events to {}/{}", events.size(), logGroup, stream);
    }

    private void ensureStream(String stream) {
        if (knownStreams.contains(stream)) {
            return;
        }
        try {
            client.createLogStream(CreateLogStreamRequest.builder()
                .logGroupName(logGroup)
                .logStreamName(stream)
                .build());
            log.info("Created log stream {}/{}", logGroup, stream);
        } catch (ResourceAlreadyExistsException e) {
            log.debug("Log stream {}/{} already exists", logGroup, stream);
        }
        knownStreams.add(stream);
    }

    private void send(String stream, List<InputLogEvent> chunk) {
        if (chunk.isEmpty()) {
            return;
        }
        client.putLogEvents(PutLogEventsRequest.builder()
            .logGroupName(logGroup)
            .logStreamName(stream)
            .logEvents(chunk)
            .build());
    }
}
