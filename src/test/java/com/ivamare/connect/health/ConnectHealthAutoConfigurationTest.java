package com.ivamare.connect.health;

import com.ivamare.connect.ConnectProperties;
import com.ivamare.connect.consumer.ConsumerLoop;
import com.ivamare.connect.kafka.BrokerProbe;
import com.ivamare.connect.log.MessageLogRepository;
import com.ivamare.connect.registry.SchemaRegistryClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("ConnectHealthAutoConfiguration")
class ConnectHealthAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(ConnectHealthAutoConfiguration.class))
        .withUserConfiguration(MockConnectConfig.class);

    @Test
    @DisplayName("should create indicators for the configured components")
    void shouldCreateIndicators() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(BrokerHealthIndicator.class);
            assertThat(context).hasSingleBean(SchemaRegistryHealthIndicator.class);
            assertThat(context).hasSingleBean(MessageLogHealthIndicator.class);
            assertThat(context).doesNotHaveBean(ConsumerHealthIndicator.class);
        });
    }

    @Test
    @DisplayName("should create the consumer indicator when a consumer loop exists")
    void shouldCreateConsumerIndicator() {
        contextRunner
            .withUserConfiguration(ConsumerConfig.class)
            .run(context -> assertThat(context).hasSingleBean(ConsumerHealthIndicator.class));
    }

    @Test
    @DisplayName("should not create indicators when disabled")
    void shouldNotCreateIndicatorsWhenDisabled() {
        contextRunner
            .withPropertyValues("connect.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(BrokerHealthIndicator.class);
                assertThat(context).doesNotHaveBean(MessageLogHealthIndicator.class);
            });
    }

    @Configuration
    static class MockConnectConfig {
        @Bean
        public ConnectProperties connectProperties() {
            return new ConnectProperties();
        }

        @Bean
        public BrokerProbe brokerProbe() {
            return mock(BrokerProbe.class);
        }

        @Bean
        public SchemaRegistryClient schemaRegistryClient() {
            return mock(SchemaRegistryClient.class);
        }

        @Bean
        public MessageLogRepository messageLogRepository() {
            return mock(MessageLogRepository.class);
        }

        @Bean
        public Clock connectClock() {
            return Clock.systemUTC();
        }
    }

    @Configuration
    static class ConsumerConfig {
        @Bean
        public ConsumerLoop consumerLoop() {
            return mock(ConsumerLoop.class);
        }
    }
}
