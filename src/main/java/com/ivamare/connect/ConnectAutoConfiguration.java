package com.ivamare.connect;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.connect.codec.EnvelopeCodec;
import com.ivamare.connect.codec.InnerPayloadCodec;
import com.ivamare.connect.consumer.ConsumerLoop;
import com.ivamare.connect.consumer.MessageProcessor;
import com.ivamare.connect.correlation.CorrelationService;
import com.ivamare.connect.document.DocumentStore;
import com.ivamare.connect.expression.Evaluator;
import com.ivamare.connect.expression.SpelEvaluator;
import com.ivamare.connect.handler.ActionDispatcher;
import com.ivamare.connect.handler.DefaultEventHandlerRegistry;
import com.ivamare.connect.handler.DocumentActionJob;
import com.ivamare.connect.handler.EventHandlerRegistry;
import com.ivamare.connect.job.DefaultJobHandlerRegistry;
import com.ivamare.connect.job.ExecutorJobScheduler;
import com.ivamare.connect.job.JobHandlerRegistry;
import com.ivamare.connect.job.JobScheduler;
import com.ivamare.connect.job.RetryPolicy;
import com.ivamare.connect.kafka.BrokerConsumer;
import com.ivamare.connect.kafka.BrokerProbe;
import com.ivamare.connect.kafka.BrokerProducer;
import com.ivamare.connect.kafka.KafkaBrokerConsumer;
import com.ivamare.connect.kafka.KafkaBrokerProbe;
import com.ivamare.connect.kafka.KafkaBrokerProducer;
import com.ivamare.connect.kafka.KafkaClientConfigs;
import com.ivamare.connect.log.JdbcMessageLogRepository;
import com.ivamare.connect.log.MessageLogRepository;
import com.ivamare.connect.maintenance.MessageLogCleanup;
import com.ivamare.connect.maintenance.SchemaRefreshTask;
import com.ivamare.connect.mapping.DefaultMethodRegistry;
import com.ivamare.connect.mapping.FieldMappingResolver;
import com.ivamare.connect.mapping.MethodRegistry;
import com.ivamare.connect.producer.DocumentEventPublisher;
import com.ivamare.connect.producer.ManualProduceService;
import com.ivamare.connect.producer.ProduceMessageJob;
import com.ivamare.connect.producer.ProducerPipeline;
import com.ivamare.connect.registry.RestSchemaRegistryClient;
import com.ivamare.connect.registry.SchemaRegistryClient;
import com.ivamare.connect.rule.DefaultRuleRegistry;
import com.ivamare.connect.rule.RuleMatchingEngine;
import com.ivamare.connect.rule.RuleRegistry;
import com.ivamare.connect.schema.CaffeineSchemaTier;
import com.ivamare.connect.schema.JdbcSchemaStore;
import com.ivamare.connect.schema.RegistrySchemaTier;
import com.ivamare.connect.schema.SchemaResolver;
import com.ivamare.connect.schema.SchemaStore;
import com.ivamare.connect.schema.StoreSchemaTier;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.client.RestClient;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Auto-configuration for the connect bridge.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Expression evaluator, mapping method registry and field mapping resolver</li>
 *   <li>Schema registry client and the three-tier schema resolver</li>
 *   <li>Envelope and inner payload codecs</li>
 *   <li>Broker producer, consumer and probe</li>
 *   <li>Message log repository</li>
 *   <li>Job scheduler, rule and handler registries</li>
 *   <li>Producer pipeline and document event publisher, when a {@link DocumentStore} bean exists</li>
 *   <li>Consumer loop and correlation service</li>
 *   <li>Maintenance tasks</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * connect.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {
    DataSourceAutoConfiguration.class,
    JdbcTemplateAutoConfiguration.class,
    DataSourceTransactionManagerAutoConfiguration.class
})
@ConditionalOnClass({JdbcTemplate.class, KafkaProducer.class})
@ConditionalOnProperty(prefix = "connect", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ConnectProperties.class)
public class ConnectAutoConfiguration {

    // --- Object Mapper and Clock ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper connectObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock connectClock() {
        return Clock.systemDefaultZone();
    }

    // --- Expressions and Mapping ---

    @Bean
    @ConditionalOnMissingBean
    public Evaluator connectEvaluator() {
        return new SpelEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public static MethodRegistry connectMethodRegistry() {
        return new DefaultMethodRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public FieldMappingResolver fieldMappingResolver(Evaluator evaluator, MethodRegistry methodRegistry) {
        return new FieldMappingResolver(evaluator, methodRegistry);
    }

    // --- Schema Registry and Schemas ---

    @Bean
    @ConditionalOnMissingBean
    public SchemaRegistryClient schemaRegistryClient(ConnectProperties properties, ObjectMapper objectMapper) {
        ConnectProperties.SchemaRegistryProperties registry = properties.getSchemaRegistry();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(registry.getTimeout());
        requestFactory.setReadTimeout(registry.getTimeout());

        RestClient.Builder builder = RestClient.builder()
            .baseUrl(registry.getUrl())
            .requestFactory(requestFactory);
        if (registry.hasCredentials()) {
            builder.defaultHeaders(headers -> headers.setBasicAuth(registry.getUsername(), registry.getPassword()));
        }
        builder.defaultHeader(HttpHeaders.USER_AGENT, properties.getSourceName());

        return new RestSchemaRegistryClient(builder.build(), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchemaStore schemaStore(
            JdbcTemplate jdbcTemplate,
            DataSource dataSource,
            ObjectProvider<PlatformTransactionManager> transactionManager,
            ObjectMapper objectMapper) {
        PlatformTransactionManager txManager =
            transactionManager.getIfAvailable(() -> new DataSourceTransactionManager(dataSource));
        return new JdbcSchemaStore(jdbcTemplate, new TransactionTemplate(txManager), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchemaResolver schemaResolver(
            ConnectProperties properties,
            SchemaStore schemaStore,
            SchemaRegistryClient registryClient) {
        ConnectProperties.SchemaProperties schema = properties.getSchema();
        return new SchemaResolver(List.of(
            new CaffeineSchemaTier(schema.getCacheTtl(), schema.getMaximumSize()),
            new StoreSchemaTier(schemaStore),
            new RegistrySchemaTier(registryClient)
        ));
    }

    // --- Codecs ---

    @Bean
    @ConditionalOnMissingBean
    public InnerPayloadCodec innerPayloadCodec() {
        return new InnerPayloadCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvelopeCodec envelopeCodec(ConnectProperties properties, SchemaRegistryClient registryClient) {
        return new EnvelopeCodec(registryClient, properties.getSubjectNameStrategy(), properties.isAutoRegisterSchemas());
    }

    // --- Broker ---

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public BrokerProducer brokerProducer(ConnectProperties properties) {
        return new KafkaBrokerProducer(
            new KafkaProducer<>(KafkaClientConfigs.producerConfig(properties)),
            properties.getProducer().getDeliveryTimeout()
        );
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "connect.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
    public BrokerConsumer brokerConsumer(ConnectProperties properties) {
        return new KafkaBrokerConsumer(new KafkaConsumer<>(KafkaClientConfigs.consumerConfig(properties)));
    }

    @Bean
    @ConditionalOnMissingBean
    public BrokerProbe brokerProbe(ConnectProperties properties) {
        return new KafkaBrokerProbe(KafkaClientConfigs.adminConfig(properties));
    }

    // --- Message Log ---

    @Bean
    @ConditionalOnMissingBean
    public MessageLogRepository messageLogRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcMessageLogRepository(jdbcTemplate, objectMapper);
    }

    // --- Jobs ---

    @Bean
    @ConditionalOnMissingBean
    public static JobHandlerRegistry connectJobHandlerRegistry() {
        return new DefaultJobHandlerRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy connectRetryPolicy(ConnectProperties properties) {
        return new RetryPolicy(
            properties.getJobs().getMaxAttempts(),
            properties.getJobs().getBackoffSchedule()
        );
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(JobScheduler.class)
    public ExecutorJobScheduler connectJobScheduler(
            JobHandlerRegistry jobHandlerRegistry,
            RetryPolicy retryPolicy,
            ConnectProperties properties) {
        return new ExecutorJobScheduler(
            jobHandlerRegistry,
            retryPolicy,
            properties.getJobs().getDefaultQueue(),
            properties.getJobs().getConcurrency()
        );
    }

    // --- Rules and Handlers ---

    @Bean
    @ConditionalOnMissingBean
    public RuleRegistry ruleRegistry(Evaluator evaluator) {
        return new DefaultRuleRegistry(evaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleMatchingEngine ruleMatchingEngine(RuleRegistry ruleRegistry, Evaluator evaluator) {
        return new RuleMatchingEngine(ruleRegistry, evaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventHandlerRegistry eventHandlerRegistry(Evaluator evaluator) {
        return new DefaultEventHandlerRegistry(evaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionDispatcher actionDispatcher(JobScheduler jobScheduler) {
        return new ActionDispatcher(jobScheduler);
    }

    // --- Producer ---

    @Bean
    @ConditionalOnMissingBean
    public DocumentEventPublisher documentEventPublisher(
            RuleMatchingEngine matchingEngine,
            JobScheduler jobScheduler,
            ConnectProperties properties) {
        return new DocumentEventPublisher(matchingEngine, jobScheduler, properties);
    }

    @Bean
    @ConditionalOnBean(DocumentStore.class)
    @ConditionalOnMissingBean
    public ProducerPipeline producerPipeline(
            RuleRegistry ruleRegistry,
            DocumentStore documentStore,
            FieldMappingResolver mappingResolver,
            SchemaResolver schemaResolver,
            InnerPayloadCodec innerCodec,
            EnvelopeCodec envelopeCodec,
            BrokerProducer brokerProducer,
            MessageLogRepository messageLog,
            ConnectProperties properties,
            ObjectMapper objectMapper,
            Clock clock) {
        return new ProducerPipeline(ruleRegistry, documentStore, mappingResolver, schemaResolver,
            innerCodec, envelopeCodec, brokerProducer, messageLog, properties, objectMapper, clock);
    }

    @Bean
    @ConditionalOnBean(DocumentStore.class)
    @ConditionalOnMissingBean
    public ProduceMessageJob produceMessageJob(ProducerPipeline pipeline) {
        return new ProduceMessageJob(pipeline);
    }

    @Bean
    @ConditionalOnBean(DocumentStore.class)
    @ConditionalOnMissingBean
    public ManualProduceService manualProduceService(ProducerPipeline pipeline) {
        return new ManualProduceService(pipeline);
    }

    @Bean
    @ConditionalOnBean(DocumentStore.class)
    @ConditionalOnMissingBean
    public DocumentActionJob documentActionJob(DocumentStore documentStore) {
        return new DocumentActionJob(documentStore);
    }

    // --- Consumer ---

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public CorrelationService correlationService(MessageLogRepository messageLog, ConnectProperties properties) {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
            1, 1, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(properties.getCorrelation().getQueueCapacity()),
            runnable -> {
                Thread thread = new Thread(runnable, "connect-correlation");
                thread.setDaemon(true);
                return thread;
            });
        return new CorrelationService(messageLog, executor, properties.getCorrelation().getBusinessKeyField());
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageProcessor messageProcessor(
            EnvelopeCodec envelopeCodec,
            InnerPayloadCodec innerCodec,
            SchemaResolver schemaResolver,
            EventHandlerRegistry handlerRegistry,
            ActionDispatcher actionDispatcher,
            Evaluator evaluator,
            MessageLogRepository messageLog,
            CorrelationService correlationService,
            ConnectProperties properties,
            ObjectMapper objectMapper,
            Clock clock) {
        return new MessageProcessor(envelopeCodec, innerCodec, schemaResolver, handlerRegistry,
            actionDispatcher, evaluator, messageLog, correlationService, properties, objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "connect.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ConsumerLoop consumerLoop(BrokerConsumer brokerConsumer, MessageProcessor processor,
                                     ConnectProperties properties) {
        return new ConsumerLoop(
            brokerConsumer,
            processor,
            properties.consumerTopics(),
            properties.getConsumer().getPollTimeout(),
            properties.getConsumer().getMaxMessages()
        );
    }

    // --- Maintenance ---

    @Bean
    @ConditionalOnMissingBean
    public MessageLogCleanup messageLogCleanup(
            MessageLogRepository messageLog,
            JobScheduler jobScheduler,
            ConnectProperties properties,
            Clock clock) {
        return new MessageLogCleanup(messageLog, jobScheduler, properties, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchemaRefreshTask schemaRefreshTask(SchemaResolver schemaResolver) {
        return new SchemaRefreshTask(schemaResolver);
    }
}
