package com.archiver.engine.config;

import com.archiver.core.sink.EventSink;
import com.archiver.engine.codec.ArchiveDocumentCodec;
import com.archiver.engine.sink.CloudWatchLogsEventSink;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClientBuilder;

import java.net.URI;
import java.time.Clock;

/**
 * Selects the event sink by {@code archiver.sink.type}: none (default) or cloudwatch.
 */
@Configuration
public class SinkConfiguration {

    private static final String SINK_TYPE = "archiver.sink.type";

    @Configuration
    @ConditionalOnProperty(name = SINK_TYPE, havingValue = "none", matchIfMissing = true)
    static class NoSinkConfiguration {

        @Bean
        public EventSink eventSink() {
            return EventSink.NONE;
        }
    }

    @Configuration
    @ConditionalOnProperty(name = SINK_TYPE, havingValue = "cloudwatch")
    static class CloudWatchSinkConfiguration {

        @Bean(destroyMethod = "close")
        public CloudWatchLogsClient cloudWatchLogsClient(ArchiverProperties properties) {
            ArchiverProperties.CloudWatchProperties cloudwatch = properties.getSink().getCloudwatch();
            CloudWatchLogsClientBuilder builder = CloudWatchLogsClient.builder()
                .region(Region.of(cloudwatch.getRegion()));
            if (cloudwatch.getEndpoint() != null && !cloudwatch.getEndpoint().isBlank()) {
                builder.endpointOverride(URI.create(cloudwatch.getEndpoint()));
            }
            return builder.build();
        }

        @Bean
        public EventSink eventSink(
                CloudWatchLogsClient cloudWatchLogsClient,
                ArchiveDocumentCodec codec,
                Clock clock,
                ArchiverProperties properties) {
            return new CloudWatchLogsEventSink(
                cloudWatchLogsClient,
                properties.getSink().getCloudwatch().getLogGroup(),
                codec,
                clock);
        }
    }
}
