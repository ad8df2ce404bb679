package com.archiver.engine.config;

import com.archiver.core.store.ArchiveStore;
import com.archiver.engine.codec.ArchiveDocumentCodec;
import com.archiver.engine.persistence.InMemoryArchiveStore;
import com.archiver.engine.persistence.jdbc.JdbcArchiveStore;
import com.archiver.engine.persistence.s3.S3ArchiveStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import javax.sql.DataSource;
import java.net.URI;
import java.time.Clock;

/**
 * Selects the archive store by {@code archiver.store.type}: memory (default), jdbc or s3.
 */
@Configuration
public class StoreConfiguration {

    private static final String STORE_TYPE = "archiver.store.type";

    @Configuration
    @ConditionalOnProperty(name = STORE_TYPE, havingValue = "memory", matchIfMissing = true)
    static class InMemoryStoreConfiguration {

        @Bean
        public ArchiveStore archiveStore(ArchiveDocumentCodec codec, Clock clock, ArchiverProperties properties) {
            return new InMemoryArchiveStore(codec, clock, properties.getStore().getKeyPrefix());
        }
    }

    @Configuration
    @ConditionalOnProperty(name = STORE_TYPE, havingValue = "jdbc")
    static class JdbcStoreConfiguration {

        @Bean
        public DataSource archiveDataSource(ArchiverProperties properties) {
            ArchiverProperties.JdbcProperties jdbc = properties.getStore().getJdbc();
            return DataSourceBuilder.create()
                .url(jdbc.getUrl())
                .username(jdbc.getUsername())
                .password(jdbc.getPassword())
                .build();
        }

        @Bean
        public JdbcTemplate archiveJdbcTemplate(DataSource archiveDataSource) {
            return new JdbcTemplate(archiveDataSource);
        }

        @Bean
        public ArchiveStore archiveStore(
                JdbcTemplate archiveJdbcTemplate,
                ArchiveDocumentCodec codec,
                Clock clock,
                ArchiverProperties properties) {
            JdbcArchiveStore store = new JdbcArchiveStore(
                archiveJdbcTemplate, codec, clock, properties.getStore().getKeyPrefix());
            if (properties.getStore().getJdbc().isInitializeSchema()) {
                store.createSchema();
            }
            return store;
        }
    }

    @Configuration
    @ConditionalOnProperty(name = STORE_TYPE, havingValue = "s3")
    static class S3StoreConfiguration {

        @Bean(destroyMethod = "close")
        public S3Client s3Client(ArchiverProperties properties) {
            ArchiverProperties.S3Properties s3 = properties.getStore().getS3();
            S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(s3.getRegion()))
                .forcePathStyle(s3.isPathStyleAccess());
            if (s3.getEndpoint() != null && !s3.getEndpoint().isBlank()) {
                builder.endpointOverride(URI.create(s3.getEndpoint()));
            }
            return builder.build();
        }

        @Bean
        public ArchiveStore archiveStore(S3Client s3Client, ArchiveDocumentCodec codec, ArchiverProperties properties) {
            return new S3ArchiveStore(
                s3Client,
                properties.getStore().getS3().getBucket(),
                properties.getStore().getKeyPrefix(),
                codec);
        }
    }
}
