package com.ivamare.connect.kafka;

import com.ivamare.connect.ConnectProperties;
import com.ivamare.connect.exception.ValidationException;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.CooperativeStickyAssignor;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.config.SslConfigs;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.util.Properties;

/**
 * Builds Kafka client configurations from {@link ConnectProperties}.
 */
public final class KafkaClientConfigs {

    private KafkaClientConfigs() {
        // Utility class - no instantiation
    }

    public static Properties producerConfig(ConnectProperties properties) {
        ConnectProperties.ProducerProperties producer = properties.getProducer();

        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, producer.getBootstrapServers());
        props.put(ProducerConfig.CLIENT_ID_CONFIG, properties.getSourceName() + "-producer");
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, producer.getAcks());
        props.put(ProducerConfig.RETRIES_CONFIG, producer.getRetries());
        props.put(ProducerConfig.LINGER_MS_CONFIG, producer.getLingerMs());
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, producer.isEnableIdempotence());
        applySecurity(props, properties.getSecurity());
        return props;
    }

    public static Properties consumerConfig(ConnectProperties properties) {
        ConnectProperties.ConsumerProperties consumer = properties.getConsumer();

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, consumer.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, consumer.getGroupId());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, consumer.getAutoOffsetReset());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, consumer.getSessionTimeoutMs());
        props.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, consumer.getMaxPollIntervalMs());
        props.put(ConsumerConfig.PARTITION_ASSIGNMENT_STRATEGY_CONFIG, CooperativeStickyAssignor.class.getName());
        applySecurity(props, properties.getSecurity());
        return props;
    }

    public static Properties adminConfig(ConnectProperties properties) {
        Properties props = new Properties();
        props.put(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, properties.getProducer().getBootstrapServers());
        props.put(CommonClientConfigs.CLIENT_ID_CONFIG, properties.getSourceName() + "-probe");
        applySecurity(props, properties.getSecurity());
        return props;
    }

    /**
     * Apply protocol, SASL and SSL settings.
     *
     * @throws ValidationException if a SASL protocol lacks its mechanism or credentials
     */
    static void applySecurity(Properties props, ConnectProperties.SecurityProperties security) {
        props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, security.getProtocol());

        if (security.isSasl()) {
            if (isBlank(security.getSaslMechanism())) {
                throw new ValidationException("security.sasl-mechanism",
                    "is required for protocol " + security.getProtocol());
            }
            if (isBlank(security.getSaslUsername()) || isBlank(security.getSaslPassword())) {
                throw new ValidationException("security.sasl-username",
                    "SASL credentials are required for protocol " + security.getProtocol());
            }
            props.put(SaslConfigs.SASL_MECHANISM, security.getSaslMechanism());
            props.put(SaslConfigs.SASL_JAAS_CONFIG, jaasConfig(security));
        }

        if (security.isSsl()) {
            if (!isBlank(security.getSslTruststoreLocation())) {
                props.put(SslConfigs.SSL_TRUSTSTORE_LOCATION_CONFIG, security.getSslTruststoreLocation());
            }
            if (!isBlank(security.getSslTruststorePassword())) {
                props.put(SslConfigs.SSL_TRUSTSTORE_PASSWORD_CONFIG, security.getSslTruststorePassword());
            }
            if (!isBlank(security.getSslKeystoreLocation())) {
                props.put(SslConfigs.SSL_KEYSTORE_LOCATION_CONFIG, security.getSslKeystoreLocation());
            }
            if (!isBlank(security.getSslKeystorePassword())) {
                props.put(SslConfigs.SSL_KEYSTORE_PASSWORD_CONFIG, security.getSslKeystorePassword());
            }
        }
    }

    private static String jaasConfig(ConnectProperties.SecurityProperties security) {
        String loginModule = security.getSaslMechanism().startsWith("SCRAM")
            ? "org.apache.kafka.common.security.scram.ScramLoginModule"
            : "org.apache.kafka.common.security.plain.PlainLoginModule";
        return loginModule + " required username=\"" + security.getSaslUsername()
            + "\" password=\"" + security.getSaslPassword() + "\";";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
