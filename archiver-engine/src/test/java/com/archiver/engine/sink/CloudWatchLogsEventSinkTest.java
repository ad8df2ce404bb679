package com.archiver.engine.sink;

import com.archiver.core.exception.EventSinkException;
import com.archiver.core.model.CanonicalEvent;
import com.archiver.engine.codec.ArchiveDocumentCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.CloudWatchLogsException;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogStreamRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogStreamResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.InputLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceAlreadyExistsException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.archiver.engine.test.Events.event;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CloudWatchLogsEventSinkTest {

    private static final String LOG_GROUP = "/audit/s3-access";
    private static final Instant NOW = Instant.parse("2024-06-19T12:00:00Z");

    @Mock
    private CloudWatchLogsClient client;

    private final ArchiveDocumentCodec codec = new ArchiveDocumentCodec(new ObjectMapper());
    private CloudWatchLogsEventSink sink;

    @BeforeEach
    void setUp() {
        sink = new CloudWatchLogsEventSink(client, LOG_GROUP, codec, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void publish_shouldWriteEachEventToDailyStream() {
        CanonicalEvent first = event("r1", "GetObject", "2024-06-18T10:00:00Z");
        CanonicalEvent second = event("r2", "PutObject", "2024-06-18T10:05:00Z");
        ArgumentCaptor<CreateLogStreamRequest> create = ArgumentCaptor.forClass(CreateLogStreamRequest.class);
        ArgumentCaptor<PutLogEventsRequest> put = ArgumentCaptor.forClass(PutLogEventsRequest.class);
        when(client.createLogStream(create.capture())).thenReturn(CreateLogStreamResponse.builder().build());
        when(client.putLogEvents(put.capture())).thenReturn(PutLogEventsResponse.builder().build());

        sink.publish(List.of(first, second));

        assertThat(create.getValue().logGroupName()).isEqualTo(LOG_GROUP);
        assertThat(create.getValue().logStreamName()).isEqualTo("2024/06/19/s3-access");
        assertThat(put.getValue().logStreamName()).isEqualTo("2024/06/19/s3-access");
        assertThat(put.getValue().logEvents())
            .extracting(InputLogEvent::message)
            .containsExactly(codec.encodeEvent(first), codec.encodeEvent(second));
        assertThat(put.getValue().logEvents())
            .extracting(InputLogEvent::timestamp)
            .containsOnly(NOW.toEpochMilli());
    }

    @Test
    void publish_shouldCreateStreamOnlyOnce() {
        when(client.createLogStream(any(CreateLogStreamRequest.class)))
            .thenReturn(CreateLogStreamResponse.builder().build());
        when(client.putLogEvents(any(PutLogEventsRequest.class))).thenReturn(PutLogEventsResponse.builder().build());

        sink.publish(List.of(event("r1", "GetObject", "2024-06-18T10:00:00Z")));
        sink.publish(List.of(event("r2", "GetObject", "2024-06-18T10:00:00Z")));

        verify(client, times(1)).createLogStream(any(CreateLogStreamRequest.class));
        verify(client, times(2)).putLogEvents(any(PutLogEventsRequest.class));
    }

    @Test
    void publish_shouldUseExistingStream() {
        when(client.createLogStream(any(CreateLogStreamRequest.class)))
            .thenThrow(ResourceAlreadyExistsException.builder().message("exists").build());
        when(client.putLogEvents(any(PutLogEventsRequest.class))).thenReturn(PutLogEventsResponse.builder().build());

        sink.publish(List.of(event("r1", "GetObject", "2024-06-18T10:00:00Z")));

        verify(client).putLogEvents(any(PutLogEventsRequest.class));
    }

    @Test
    void publish_shouldSplitBatchAtEventLimit() {
        List<CanonicalEvent> events = new ArrayList<>();
        for (int i = 0; i <= CloudWatchLogsEventSink.MAX_EVENTS_PER_CALL; i++) {
            events.add(event("r" + i, "GetObject", "2024-06-18T10:00:00Z"));
        }
        ArgumentCaptor<PutLogEventsRequest> put = ArgumentCaptor.forClass(PutLogEventsRequest.class);
        when(client.createLogStream(any(CreateLogStreamRequest.class)))
            .thenReturn(CreateLogStreamResponse.builder().build());
        when(client.putLogEvents(put.capture())).thenReturn(PutLogEventsResponse.builder().build());

        sink.publish(events);

        assertThat(put.getAllValues()).hasSize(2);
        assertThat(put.getAllValues().get(0).logEvents()).hasSize(CloudWatchLogsEventSink.MAX_EVENTS_PER_CALL);
        assertThat(put.getAllValues().get(1).logEvents()).hasSize(1);
    }

    @Test
    void publish_shouldWrapServiceFailure() {
        when(client.createLogStream(any(CreateLogStreamRequest.class)))
            .thenReturn(CreateLogStreamResponse.builder().build());
        when(client.putLogEvents(any(PutLogEventsRequest.class)))
            .thenThrow(CloudWatchLogsException.builder().message("throttled").build());

        assertThatThrownBy(() -> sink.publish(List.of(event("r1", "GetObject", "2024-06-18T10:00:00Z"))))
            .isInstanceOf(EventSinkException.class)
            .hasMessageContaining(LOG_GROUP)
            .hasMessageContaining("throttled");
    }

    @Test
    void publish_shouldSkipEmptyBatch() {
        sink.publish(List.of());

        verifyNoInteractions(client);
    }
}
