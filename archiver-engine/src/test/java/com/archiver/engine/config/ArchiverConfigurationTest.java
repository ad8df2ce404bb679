package com.archiver.engine.config;

import com.archiver.core.exception.ConfigurationException;
import com.archiver.core.model.BatchResult;
import com.archiver.core.sink.EventSink;
import com.archiver.core.store.ArchiveStore;
import com.archiver.engine.health.ArchiveStoreHealthIndicator;
import com.archiver.engine.metrics.ArchiverMetrics;
import com.archiver.engine.metrics.MetricsConfiguration;
import com.archiver.engine.persistence.InMemoryArchiveStore;
import com.archiver.engine.service.ArchiveService;
import com.archiver.engine.sink.CloudWatchLogsEventSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * Starts the engine wiring the way the application does and runs a batch through it.
 */
class ArchiverConfigurationTest {

    private static final String LOG = """
        {"Records": [
          {"eventSource": "s3.amazonaws.com", "eventName": "PutObject", "eventTime": "2024-06-18T10:00:00Z",
           "requestID": "ctx-1", "requestParameters": {"bucketName": "orders", "key": "a.json"}},
          {"eventSource": "s3.amazonaws.com", "eventName": "GetObject", "eventTime": "2024-06-18T10:01:00Z",
           "requestID": "ctx-2", "resources": "oops"}
        ]}
        """;

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(
            ArchiverConfiguration.class,
            StoreConfiguration.class,
            SinkConfiguration.class,
            MetricsConfiguration.class,
            ArchiverMetrics.class,
            ArchiveStoreHealthIndicator.class)
        .withBean(ObjectMapper.class, ObjectMapper::new);

    @Test
    void context_shouldIngestThroughWiredPipeline() {
        runner.withPropertyValues(
                "archiver.monitored-resource=orders",
                "archiver.retry.transient-failure.max-attempts=7")
            .run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context).getBean(ArchiveStore.class).isInstanceOf(InMemoryArchiveStore.class);
                assertThat(context).getBean(EventSink.class).isSameAs(EventSink.NONE);
                assertThat(context.getBean(ArchiverProperties.class).getRetry().getTransientFailure().getMaxAttempts())
                    .isEqualTo(7);

                ArchiveService service = context.getBean(ArchiveService.class);
                BatchResult result = service.ingestLog(LOG.getBytes(StandardCharsets.UTF_8));

                assertThat(result.totalRecords()).isEqualTo(2);
                assertThat(result.malformedCount()).isEqualTo(1);
                assertThat(result.mergedCount()).isEqualTo(1);
                assertThat(result.isComplete()).isTrue();
                assertThat(service.getArchive(result.weeks().get(0).week()).events()).containsOnlyKeys("ctx-1");
                assertThat(context.getBean(ArchiveStoreHealthIndicator.class).health().getStatus())
                    .isEqualTo(Status.UP);
            });
    }

    @Test
    void context_shouldSelectCloudWatchSink() {
        runner.withPropertyValues(
                "archiver.monitored-resource=orders",
                "archiver.sink.type=cloudwatch",
                "archiver.sink.cloudwatch.log-group=/audit/s3-access",
                "archiver.sink.cloudwatch.region=us-east-1")
            .run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context).getBean(EventSink.class).isInstanceOf(CloudWatchLogsEventSink.class);
            });
    }

    @Test
    void context_shouldFailStartupWithoutMonitoredResource() {
        runner.withPropertyValues("archiver.monitored-resource= ")
            .run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure())
                    .hasRootCauseInstanceOf(ConfigurationException.class)
                    .hasStackTraceContaining("archiver.monitored-resource");
            });
    }
}
