package com.ivamare.connect.kafka;

import com.ivamare.connect.exception.TransportException;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.DescribeClusterOptions;

import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link BrokerProbe} using a short-lived Kafka admin client per check.
 */
public class KafkaBrokerProbe implements BrokerProbe {

    private final Properties adminConfig;

    public KafkaBrokerProbe(Properties adminConfig) {
        this.adminConfig = adminConfig;
    }

    @Override
    public int availableBrokers(Duration timeout) {
        try (Admin admin = Admin.create(adminConfig)) {
            DescribeClusterOptions options = new DescribeClusterOptions().timeoutMs((int) timeout.toMillis());
            return admin.describeCluster(options).nodes().get(timeout.toMillis(), TimeUnit.MILLISECONDS).size();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while probing brokers", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new TransportException("Broker cluster unreachable: " + e.getMessage(), e);
        }
    }
}
