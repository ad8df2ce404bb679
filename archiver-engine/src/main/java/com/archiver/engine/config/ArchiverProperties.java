package com.archiver.engine.config;

import com.archiver.core.exception.ConfigurationException;
import com.archiver.core.model.RetryPolicy;
import com.archiver.engine.filter.RelevanceFilter;
import com.archiver.engine.persistence.ArchiveKeys;
import com.archiver.engine.summary.SummaryAggregator;
import com.archiver.engine.week.MissingTimestampPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Archiver settings bound from the {@code archiver.*} namespace.
 * {@link #validate()} runs at startup; any violation is a ConfigurationException.
 */
@ConfigurationProperties(prefix = "archiver")
public class ArchiverProperties {

    /**
     * Name of the bucket whose audit events are archived. Required.
     */
    private String monitoredResource;

    /**
     * Audit source whose records are considered at all.
     */
    private String eventSource = RelevanceFilter.DEFAULT_EVENT_SOURCE;

    private SummaryProperties summary = new SummaryProperties();
    private WeekProperties week = new WeekProperties();
    private BatchProperties batch = new BatchProperties();
    private RetryProperties retry = new RetryProperties();
    private StoreProperties store = new StoreProperties();
    private SinkProperties sink = new SinkProperties();

    public void validate() {
        if (monitoredResource == null || monitoredResource.isBlank()) {
            throw new ConfigurationException("archiver.monitored-resource", "is required");
        }
        if (eventSource == null || eventSource.isBlank()) {
            throw new ConfigurationException("archiver.event-source", "cannot be empty");
        }
        if (summary.getTopN() < 1) {
            throw new ConfigurationException("archiver.summary.top-n", "must be >= 1");
        }
        if (week.getMissingTimestampPolicy() == null) {
            throw new ConfigurationException("archiver.week.missing-timestamp-policy", "is required");
        }
        if (batch.getDeadline() == null || batch.getDeadline().isNegative() || batch.getDeadline().isZero()) {
            throw new ConfigurationException("archiver.batch.deadline", "must be a positive duration");
        }
        retry.getConflict().toPolicy("archiver.retry.conflict");
        retry.getTransientFailure().toPolicy("archiver.retry.transient-failure");
        store.validate();
        sink.validate();
    }

    public String getMonitoredResource() {
        return monitoredResource;
    }

    public void setMonitoredResource(String monitoredResource) {
        this.monitoredResource = monitoredResource;
    }

    public String getEventSource() {
        return eventSource;
    }

    public void setEventSource(String eventSource) {
        this.eventSource = eventSource;
    }

    public SummaryProperties getSummary() {
        return summary;
    }

    public void setSummary(SummaryProperties summary) {
        this.summary = summary;
    }

    public WeekProperties getWeek() {
        return week;
    }

    public void setWeek(WeekProperties week) {
        this.week = week;
    }

    public BatchProperties getBatch() {
        return batch;
    }

    public void setBatch(BatchProperties batch) {
        this.batch = batch;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryProperties retry) {
        this.retry = retry;
    }

    public StoreProperties getStore() {
        return store;
    }

    public void setStore(StoreProperties store) {
        this.store = store;
    }

    public SinkProperties getSink() {
        return sink;
    }

    public void setSink(SinkProperties sink) {
        this.sink = sink;
    }

    public static class SummaryProperties {
        private int topN = SummaryAggregator.DEFAULT_TOP_N;

        public int getTopN() {
            return topN;
        }

        public void setTopN(int topN) {
            this.topN = topN;
        }
    }

    public static class WeekProperties {
        private MissingTimestampPolicy missingTimestampPolicy = MissingTimestampPolicy.CURRENT_WEEK;

        public MissingTimestampPolicy getMissingTimestampPolicy() {
            return missingTimestampPolicy;
        }

        public void setMissingTimestampPolicy(MissingTimestampPolicy missingTimestampPolicy) {
            this.missingTimestampPolicy = missingTimestampPolicy;
        }
    }

    public static class BatchProperties {
        /**
         * Overall time budget of one batch; weeks not reached in time are not attempted.
         */
        private Duration deadline = Duration.ofSeconds(270);

        public Duration getDeadline() {
            return deadline;
        }

        public void setDeadline(Duration deadline) {
            this.deadline = deadline;
        }
    }

    public static class RetryProperties {
        private PolicyProperties conflict = PolicyProperties.of(RetryPolicy.conflictDefault());
        private PolicyProperties transientFailure = PolicyProperties.of(RetryPolicy.transientDefault());

        public PolicyProperties getConflict() {
            return conflict;
        }

        public void setConflict(PolicyProperties conflict) {
            this.conflict = conflict;
        }

        public PolicyProperties getTransientFailure() {
            return transientFailure;
        }

        public void setTransientFailure(PolicyProperties transientFailure) {
            this.transientFailure = transientFailure;
        }
    }

    public static class PolicyProperties {
        private int maxAttempts;
        private Duration initialBackoff;
        private Duration maxBackoff;
        private double multiplier;
        private double jitter;

        static PolicyProperties of(RetryPolicy policy) {
            PolicyProperties properties = new PolicyProperties();
            properties.maxAttempts = policy.maxAttempts();
            properties.initialBackoff = policy.initialBackoff();
            properties.maxBackoff = policy.maxBackoff();
            properties.multiplier = policy.backoffMultiplier();
            properties.jitter = policy.jitterFactor();
            return properties;
        }

        /**
         * @param property Property path, for error messages
         */
        public RetryPolicy toPolicy(String property) {
            try {
                return RetryPolicy.builder()
                    .maxAttempts(maxAttempts)
                    .initialBackoff(initialBackoff)
                    .maxBackoff(maxBackoff)
                    .backoffMultiplier(multiplier)
                    .jitterFactor(jitter)
                    .build();
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(property, e.getMessage());
            }
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    public static class StoreProperties {
        private StoreType type = StoreType.MEMORY;
        private String keyPrefix = ArchiveKeys.DEFAULT_PREFIX;
        private JdbcProperties jdbc = new JdbcProperties();
        private S3Properties s3 = new S3Properties();

        void validate() {
            if (type == null) {
                throw new ConfigurationException("archiver.store.type", "is required (memory, jdbc or s3)");
            }
            if (keyPrefix == null) {
                throw new ConfigurationException("archiver.store.key-prefix", "cannot be null");
            }
            if (type == StoreType.JDBC && isBlank(jdbc.getUrl())) {
                throw new ConfigurationException("archiver.store.jdbc.url", "is required for the jdbc store");
            }
            if (type == StoreType.S3 && isBlank(s3.getBucket())) {
                throw new ConfigurationException("archiver.store.s3.bucket", "is required for the s3 store");
            }
            if (type == StoreType.S3 && isBlank(s3.getRegion())) {
                throw new ConfigurationException("archiver.store.s3.region", "is required for the s3 store");
            }
        }

        public StoreType getType() {
            return type;
        }

        public void setType(StoreType type) {
            this.type = type;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public JdbcProperties getJdbc() {
            return jdbc;
        }

        public void setJdbc(JdbcProperties jdbc) {
            this.jdbc = jdbc;
        }

        public S3Properties getS3() {
            return s3;
        }

        public void setS3(S3Properties s3) {
            this.s3 = s3;
        }
    }

    public enum StoreType {
        MEMORY,
        JDBC,
        S3
    }

    public static class JdbcProperties {
        private String url;
        private String username;
        private String password;
        private boolean initializeSchema = true;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }
    }

    public static class S3Properties {
        private String bucket;
        private String region;
        /**
         * Optional endpoint override, for S3-compatible stores.
         */
        private String endpoint;
        private boolean pathStyleAccess;

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public boolean isPathStyleAccess() {
            return pathStyleAccess;
        }

        public void setPathStyleAccess(boolean pathStyleAccess) {
            this.pathStyleAccess = pathStyleAccess;
        }
    }

    /**
     * Where relevant events are forwarded besides the weekly archives.
     */
    public static class SinkProperties {
        private SinkType type = SinkType.NONE;
        private CloudWatchProperties cloudwatch = new CloudWatchProperties();

        void validate() {
            if (type == null) {
                throw new ConfigurationException("archiver.sink.type", "is required (none or cloudwatch)");
            }
            if (type == SinkType.CLOUDWATCH && isBlank(cloudwatch.getLogGroup())) {
                throw new ConfigurationException("archiver.sink.cloudwatch.log-group", "is required for the cloudwatch sink");
            }
            if (type == SinkType.CLOUDWATCH && isBlank(cloudwatch.getRegion())) {
                throw new ConfigurationException("archiver.sink.cloudwatch.region", "is required for the cloudwatch sink");
            }
        }

        public SinkType getType() {
            return type;
        }

        public void setType(SinkType type) {
            this.type = type;
        }

        public CloudWatchProperties getCloudwatch() {
            return cloudwatch;
        }

        public void setCloudwatch(CloudWatchProperties cloudwatch) {
            this.cloudwatch = cloudwatch;
        }
    }

    public enum SinkType {
        NONE,
        CLOUDWATCH
    }

    public static class CloudWatchProperties {
        private String logGroup;
        private String region;
        private String endpoint;

        public String getLogGroup() {
            return logGroup;
        }

        public void setLogGroup(String logGroup) {
            this.logGroup = logGroup;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
