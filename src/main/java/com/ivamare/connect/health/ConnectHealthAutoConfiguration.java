package com.ivamare.connect.health;

import com.ivamare.connect.ConnectAutoConfiguration;
import com.ivamare.connect.ConnectProperties;
import com.ivamare.connect.consumer.ConsumerLoop;
import com.ivamare.connect.kafka.BrokerProbe;
import com.ivamare.connect.log.MessageLogRepository;
import com.ivamare.connect.registry.SchemaRegistryClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration for connect health indicators.
 */
@AutoConfiguration(after = ConnectAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnProperty(prefix = "connect", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ConnectHealthAutoConfiguration {

    @Bean
    @ConditionalOnBean(BrokerProbe.class)
    @ConditionalOnMissingBean(BrokerHealthIndicator.class)
    public BrokerHealthIndicator brokerHealthIndicator(BrokerProbe probe, ConnectProperties properties) {
        return new BrokerHealthIndicator(
            probe,
            properties.getProducer().getBootstrapServers(),
            properties.getSchemaRegistry().getTimeout()
        );
    }

    @Bean
    @ConditionalOnBean(SchemaRegistryClient.class)
    @ConditionalOnMissingBean(SchemaRegistryHealthIndicator.class)
    public SchemaRegistryHealthIndicator schemaRegistryHealthIndicator(
            SchemaRegistryClient registryClient, ConnectProperties properties) {
        return new SchemaRegistryHealthIndicator(registryClient, properties.getSchemaRegistry().getUrl());
    }

    @Bean
    @ConditionalOnBean(ConsumerLoop.class)
    @ConditionalOnMissingBean(ConsumerHealthIndicator.class)
    public ConsumerHealthIndicator consumerHealthIndicator(ConsumerLoop consumerLoop) {
        return new ConsumerHealthIndicator(consumerLoop);
    }

    @Bean
    @ConditionalOnBean(MessageLogRepository.class)
    @ConditionalOnMissingBean(MessageLogHealthIndicator.class)
    public MessageLogHealthIndicator messageLogHealthIndicator(
            MessageLogRepository messageLog, ObjectProvider<DataSource> dataSource, Clock connectClock) {
        return new MessageLogHealthIndicator(messageLog, dataSource.getIfAvailable(), connectClock);
    }
}
