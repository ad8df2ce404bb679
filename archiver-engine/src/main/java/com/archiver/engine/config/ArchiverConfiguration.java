package com.archiver.engine.config;

import com.archiver.core.sink.EventSink;
import com.archiver.core.store.ArchiveStore;
import com.archiver.engine.codec.ArchiveDocumentCodec;
import com.archiver.engine.codec.CloudTrailLogDecoder;
import com.archiver.engine.coordinator.ArchiveBatchCoordinator;
import com.archiver.engine.filter.RelevanceFilter;
import com.archiver.engine.merge.ArchiveMergeEngine;
import com.archiver.engine.merge.Sleeper;
import com.archiver.engine.metrics.ArchiverMetrics;
import com.archiver.engine.normalize.EventNormalizer;
import com.archiver.engine.service.ArchiveService;
import com.archiver.engine.summary.SummaryAggregator;
import com.archiver.engine.week.WeekKeyResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the archiving pipeline from {@link ArchiverProperties}.
 * The archive store comes from {@link StoreConfiguration}, the event sink from
 * {@link SinkConfiguration}.
 */
@Configuration
@EnableConfigurationProperties(ArchiverProperties.class)
public class ArchiverConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ArchiverConfiguration.class);

    private final ArchiverProperties properties;

    public ArchiverConfiguration(ArchiverProperties properties) {
        properties.validate();
        this.properties = properties;
        log.info("Archiving events of {} from {} into the {} store",
            properties.getMonitoredResource(), properties.getEventSource(), properties.getStore().getType());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ArchiveDocumentCodec archiveDocumentCodec(ObjectMapper objectMapper) {
        return new ArchiveDocumentCodec(objectMapper);
    }

    @Bean
    public CloudTrailLogDecoder cloudTrailLogDecoder(ObjectMapper objectMapper) {
        return new CloudTrailLogDecoder(objectMapper);
    }

    @Bean
    public RelevanceFilter relevanceFilter() {
        return new RelevanceFilter(properties.getEventSource());
    }

    @Bean
    public EventNormalizer eventNormalizer() {
        return new EventNormalizer();
    }

    @Bean
    public WeekKeyResolver weekKeyResolver(Clock clock) {
        return new WeekKeyResolver(clock, properties.getWeek().getMissingTimestampPolicy());
    }

    @Bean
    public SummaryAggregator summaryAggregator() {
        return new SummaryAggregator(properties.getSummary().getTopN());
    }

    @Bean
    public ArchiveMergeEngine archiveMergeEngine(
            ArchiveStore store,
            SummaryAggregator aggregator,
            Clock clock,
            ArchiverMetrics metrics) {
        return new ArchiveMergeEngine(
            store,
            aggregator,
            clock,
            properties.getRetry().getConflict().toPolicy("archiver.retry.conflict"),
            properties.getRetry().getTransientFailure().toPolicy("archiver.retry.transient-failure"),
            Sleeper.THREAD,
            metrics
        );
    }

    @Bean
    public ArchiveService archiveService(
            CloudTrailLogDecoder decoder,
            RelevanceFilter filter,
            EventNormalizer normalizer,
            WeekKeyResolver weekKeyResolver,
            ArchiveMergeEngine mergeEngine,
            ArchiveStore store,
            EventSink eventSink,
            Clock clock,
            ArchiverMetrics metrics) {
        return new ArchiveBatchCoordinator(
            properties.getMonitoredResource(),
            decoder,
            filter,
            normalizer,
            weekKeyResolver,
            mergeEngine,
            store,
            eventSink,
            clock,
            properties.getBatch().getDeadline(),
            metrics
        );
    }
}
