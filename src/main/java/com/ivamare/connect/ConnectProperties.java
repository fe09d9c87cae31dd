package com.ivamare.connect;

import com.ivamare.connect.codec.SubjectNameStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for the Connect bridge.
 *
 * <p>Example configuration:
 * <pre>
 * connect:
 *   enabled: true
 *   source-name: openerp-connect
 *   command-topic: fineract.commands
 *   events-topic: fineract.events
 *   default-tenant-id: default
 *   schema:
 *     cache-ttl: 1h
 *     refresh-interval: 6h
 *   schema-registry:
 *     url: http://localhost:8081
 *   producer:
 *     bootstrap-servers: localhost:9092
 *   consumer:
 *     bootstrap-servers: localhost:9092
 *     group-id: openerp-connect-consumer
 *     auto-start: true
 *   cleanup:
 *     stale-pending-threshold: 10m
 * </pre>
 */
@ConfigurationProperties(prefix = "connect")
public class ConnectProperties {

    /**
     * Enable/disable the bridge auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Value written to the envelope "source" field.
     */
    private String sourceName = "openerp-connect";

    /**
     * Default topic for outbound commands.
     */
    private String commandTopic = "fineract.commands";

    /**
     * Topic carrying inbound business events.
     */
    private String eventsTopic = "fineract.events";

    /**
     * Dead letter topic, consumed as well when dlq-consumer-enabled is set.
     */
    private String dlqTopic;

    private boolean dlqConsumerEnabled = false;

    /**
     * Tenant used when an emission rule has no tenant override.
     */
    private String defaultTenantId = "default";

    /**
     * Store a JSON snapshot of the payload on the message log after success.
     */
    private boolean logPayloadOnSuccess = false;

    /**
     * Register the envelope schema with the registry on first use.
     */
    private boolean autoRegisterSchemas = true;

    /**
     * Subject naming for the envelope schema.
     */
    private SubjectNameStrategy subjectNameStrategy = SubjectNameStrategy.RECORD_NAME;

    private SchemaProperties schema = new SchemaProperties();

    private SchemaRegistryProperties schemaRegistry = new SchemaRegistryProperties();

    private ProducerProperties producer = new ProducerProperties();

    private ConsumerProperties consumer = new ConsumerProperties();

    private SecurityProperties security = new SecurityProperties();

    private JobsProperties jobs = new JobsProperties();

    private CleanupProperties cleanup = new CleanupProperties();

    private CorrelationProperties correlation = new CorrelationProperties();

    private MaintenanceProperties maintenance = new MaintenanceProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSourceName() {
        return sourceName;
    }

    public void setSourceName(String sourceName) {
        this.sourceName = sourceName;
    }

    public String getCommandTopic() {
        return commandTopic;
    }

    public void setCommandTopic(String commandTopic) {
        this.commandTopic = commandTopic;
    }

    public String getEventsTopic() {
        return eventsTopic;
    }

    public void setEventsTopic(String eventsTopic) {
        this.eventsTopic = eventsTopic;
    }

    public String getDlqTopic() {
        return dlqTopic;
    }

    public void setDlqTopic(String dlqTopic) {
        this.dlqTopic = dlqTopic;
    }

    public boolean isDlqConsumerEnabled() {
        return dlqConsumerEnabled;
    }

    public void setDlqConsumerEnabled(boolean dlqConsumerEnabled) {
        this.dlqConsumerEnabled = dlqConsumerEnabled;
    }

    public String getDefaultTenantId() {
        return defaultTenantId;
    }

    public void setDefaultTenantId(String defaultTenantId) {
        this.defaultTenantId = defaultTenantId;
    }

    public boolean isLogPayloadOnSuccess() {
        return logPayloadOnSuccess;
    }

    public void setLogPayloadOnSuccess(boolean logPayloadOnSuccess) {
        this.logPayloadOnSuccess = logPayloadOnSuccess;
    }

    public boolean isAutoRegisterSchemas() {
        return autoRegisterSchemas;
    }

    public void setAutoRegisterSchemas(boolean autoRegisterSchemas) {
        this.autoRegisterSchemas = autoRegisterSchemas;
    }

    public SubjectNameStrategy getSubjectNameStrategy() {
        return subjectNameStrategy;
    }

    public void setSubjectNameStrategy(SubjectNameStrategy subjectNameStrategy) {
        this.subjectNameStrategy = subjectNameStrategy;
    }

    public SchemaProperties getSchema() {
        return schema;
    }

    public void setSchema(SchemaProperties schema) {
        this.schema = schema;
    }

    public SchemaRegistryProperties getSchemaRegistry() {
        return schemaRegistry;
    }

    public void setSchemaRegistry(SchemaRegistryProperties schemaRegistry) {
        this.schemaRegistry = schemaRegistry;
    }

    public ProducerProperties getProducer() {
        return producer;
    }

    public void setProducer(ProducerProperties producer) {
        this.producer = producer;
    }

    public ConsumerProperties getConsumer() {
        return consumer;
    }

    public void setConsumer(ConsumerProperties consumer) {
        this.consumer = consumer;
    }

    public SecurityProperties getSecurity() {
        return security;
    }

    public void setSecurity(SecurityProperties security) {
        this.security = security;
    }

    public JobsProperties getJobs() {
        return jobs;
    }

    public void setJobs(JobsProperties jobs) {
        this.jobs = jobs;
    }

    public CleanupProperties getCleanup() {
        return cleanup;
    }

    public void setCleanup(CleanupProperties cleanup) {
        this.cleanup = cleanup;
    }

    public CorrelationProperties getCorrelation() {
        return correlation;
    }

    public void setCorrelation(CorrelationProperties correlation) {
        this.correlation = correlation;
    }

    public MaintenanceProperties getMaintenance() {
        return maintenance;
    }

    public void setMaintenance(MaintenanceProperties maintenance) {
        this.maintenance = maintenance;
    }

    /**
     * Topics the consumer subscribes to.
     *
     * @return events topic, plus the DLQ topic when enabled
     */
    public List<String> consumerTopics() {
        if (dlqConsumerEnabled && dlqTopic != null && !dlqTopic.isBlank()) {
            return List.of(eventsTopic, dlqTopic);
        }
        return List.of(eventsTopic);
    }

    /**
     * Schema cache configuration.
     */
    public static class SchemaProperties {

        /**
         * Time-to-live of tier-1 (in-memory) schema entries.
         */
        private Duration cacheTtl = Duration.ofHours(1);

        /**
         * Interval of the refresh sweep that re-warms tier 1 from the registry.
         */
        private Duration refreshInterval = Duration.ofHours(6);

        /**
         * Upper bound of tier-1 entries.
         */
        private long maximumSize = 1000;

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }

        public Duration getRefreshInterval() {
            return refreshInterval;
        }

        public void setRefreshInterval(Duration refreshInterval) {
            this.refreshInterval = refreshInterval;
        }

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }
    }

    /**
     * Schema registry connection.
     */
    public static class SchemaRegistryProperties {

        private String url = "http://localhost:8081";

        private String username;

        private String password;

        private Duration timeout = Duration.ofSeconds(10);

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

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public boolean hasCredentials() {
            return username != null && !username.isBlank() && password != null && !password.isBlank();
        }
    }

    /**
     * Kafka producer configuration.
     */
    public static class ProducerProperties {

        private String bootstrapServers = "localhost:9092";

        private String acks = "all";

        private int retries = 3;

        private int lingerMs = 5;

        private boolean enableIdempotence = true;

        /**
         * Maximum time to wait for a delivery acknowledgment.
         */
        private Duration deliveryTimeout = Duration.ofSeconds(30);

        public String getBootstrapServers() {
            return bootstrapServers;
        }

        public void setBootstrapServers(String bootstrapServers) {
            this.bootstrapServers = bootstrapServers;
        }

        public String getAcks() {
            return acks;
        }

        public void setAcks(String acks) {
            this.acks = acks;
        }

        public int getRetries() {
            return retries;
        }

        public void setRetries(int retries) {
            this.retries = retries;
        }

        public int getLingerMs() {
            return lingerMs;
        }

        public void setLingerMs(int lingerMs) {
            this.lingerMs = lingerMs;
        }

        public boolean isEnableIdempotence() {
            return enableIdempotence;
        }

        public void setEnableIdempotence(boolean enableIdempotence) {
            this.enableIdempotence = enableIdempotence;
        }

        public Duration getDeliveryTimeout() {
            return deliveryTimeout;
        }

        public void setDeliveryTimeout(Duration deliveryTimeout) {
            this.deliveryTimeout = deliveryTimeout;
        }
    }

    /**
     * Kafka consumer configuration.
     */
    public static class ConsumerProperties {

        private boolean enabled = true;

        private String bootstrapServers = "localhost:9092";

        private String groupId = "openerp-connect-consumer";

        private String autoOffsetReset = "earliest";

        private int sessionTimeoutMs = 30000;

        private int maxPollIntervalMs = 300000;

        /**
         * Upper bound of a single poll; also bounds shutdown latency.
         */
        private Duration pollTimeout = Duration.ofSeconds(1);

        /**
         * Start the consumer loop on application ready.
         */
        private boolean autoStart = false;

        /**
         * Stop after this many messages (0 = unlimited).
         */
        private int maxMessages = 0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBootstrapServers() {
            return bootstrapServers;
        }

        public void setBootstrapServers(String bootstrapServers) {
            this.bootstrapServers = bootstrapServers;
        }

        public String getGroupId() {
            return groupId;
        }

        public void setGroupId(String groupId) {
            this.groupId = groupId;
        }

        public String getAutoOffsetReset() {
            return autoOffsetReset;
        }

        public void setAutoOffsetReset(String autoOffsetReset) {
            this.autoOffsetReset = autoOffsetReset;
        }

        public int getSessionTimeoutMs() {
            return sessionTimeoutMs;
        }

        public void setSessionTimeoutMs(int sessionTimeoutMs) {
            this.sessionTimeoutMs = sessionTimeoutMs;
        }

        public int getMaxPollIntervalMs() {
            return maxPollIntervalMs;
        }

        public void setMaxPollIntervalMs(int maxPollIntervalMs) {
            this.maxPollIntervalMs = maxPollIntervalMs;
        }

        public Duration getPollTimeout() {
            return pollTimeout;
        }

        public void setPollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public int getMaxMessages() {
            return maxMessages;
        }

        public void setMaxMessages(int maxMessages) {
            this.maxMessages = maxMessages;
        }
    }

    /**
     * Broker security, applied to both producer and consumer.
     */
    public static class SecurityProperties {

        private String protocol = "PLAINTEXT";

        private String saslMechanism;

        private String saslUsername;

        private String saslPassword;

        private String sslTruststoreLocation;

        private String sslTruststorePassword;

        private String sslKeystoreLocation;

        private String sslKeystorePassword;

        public String getProtocol() {
            return protocol;
        }

        public void setProtocol(String protocol) {
            this.protocol = protocol;
        }

        public String getSaslMechanism() {
            return saslMechanism;
        }

        public void setSaslMechanism(String saslMechanism) {
            this.saslMechanism = saslMechanism;
        }

        public String getSaslUsername() {
            return saslUsername;
        }

        public void setSaslUsername(String saslUsername) {
            this.saslUsername = saslUsername;
        }

        public String getSaslPassword() {
            return saslPassword;
        }

        public void setSaslPassword(String saslPassword) {
            this.saslPassword = saslPassword;
        }

        public String getSslTruststoreLocation() {
            return sslTruststoreLocation;
        }

        public void setSslTruststoreLocation(String sslTruststoreLocation) {
            this.sslTruststoreLocation = sslTruststoreLocation;
        }

        public String getSslTruststorePassword() {
            return sslTruststorePassword;
        }

        public void setSslTruststorePassword(String sslTruststorePassword) {
            this.sslTruststorePassword = sslTruststorePassword;
        }

        public String getSslKeystoreLocation() {
            return sslKeystoreLocation;
        }

        public void setSslKeystoreLocation(String sslKeystoreLocation) {
            this.sslKeystoreLocation = sslKeystoreLocation;
        }

        public String getSslKeystorePassword() {
            return sslKeystorePassword;
        }

        public void setSslKeystorePassword(String sslKeystorePassword) {
            this.sslKeystorePassword = sslKeystorePassword;
        }

        public boolean isSasl() {
            return protocol != null && protocol.contains("SASL");
        }

        public boolean isSsl() {
            return protocol != null && protocol.contains("SSL");
        }
    }

    /**
     * In-process deferred job executor.
     */
    public static class JobsProperties {

        /**
         * Number of concurrent job threads.
         */
        private int concurrency = 4;

        private String defaultQueue = "default";

        /**
         * Maximum attempts per job, including the first one.
         */
        private int maxAttempts = 3;

        /**
         * Backoff schedule in seconds for each retry.
         */
        private List<Integer> backoffSchedule = List.of(10, 60, 300);

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public String getDefaultQueue() {
            return defaultQueue;
        }

        public void setDefaultQueue(String defaultQueue) {
            this.defaultQueue = defaultQueue;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public List<Integer> getBackoffSchedule() {
            return backoffSchedule;
        }

        public void setBackoffSchedule(List<Integer> backoffSchedule) {
            this.backoffSchedule = backoffSchedule;
        }
    }

    /**
     * Message log retention and stale entry handling.
     */
    public static class CleanupProperties {

        /**
         * Terminal log entries older than this are deleted.
         */
        private Duration logRetention = Duration.ofDays(30);

        /**
         * A Pending entry older than this is considered abandoned by its worker.
         */
        private Duration stalePendingThreshold = Duration.ofMinutes(10);

        /**
         * Stale produced entries are re-enqueued until their retry count reaches this value.
         */
        private int maxProduceRetries = 5;

        public Duration getLogRetention() {
            return logRetention;
        }

        public void setLogRetention(Duration logRetention) {
            this.logRetention = logRetention;
        }

        public Duration getStalePendingThreshold() {
            return stalePendingThreshold;
        }

        public void setStalePendingThreshold(Duration stalePendingThreshold) {
            this.stalePendingThreshold = stalePendingThreshold;
        }

        public int getMaxProduceRetries() {
            return maxProduceRetries;
        }

        public void setMaxProduceRetries(int maxProduceRetries) {
            this.maxProduceRetries = maxProduceRetries;
        }
    }

    /**
     * Produced/consumed message correlation.
     */
    public static class CorrelationProperties {

        private boolean enabled = true;

        /**
         * Payload field holding the shared business key.
         */
        private String businessKeyField = "externalId";

        /**
         * Pending correlation tasks held before new ones are dropped.
         */
        private int queueCapacity = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBusinessKeyField() {
            return businessKeyField;
        }

        public void setBusinessKeyField(String businessKeyField) {
            this.businessKeyField = businessKeyField;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    /**
     * Scheduled maintenance (log cleanup, schema refresh).
     */
    public static class MaintenanceProperties {

        private boolean enabled = false;

        /**
         * Interval between message log cleanup runs.
         */
        private Duration cleanupInterval = Duration.ofDays(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getCleanupInterval() {
            return cleanupInterval;
        }

        public void setCleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
        }
    }
}
