package com.ivamare.connect.kafka;

import java.time.Duration;

/**
 * Reachability check for the broker cluster.
 */
public interface BrokerProbe {

    /**
     * Count reachable brokers.
     *
     * @param timeout upper bound of the check
     * @return number of brokers in the cluster metadata
     * @throws com.ivamare.connect.exception.TransportException if the cluster cannot be reached
     */
    int availableBrokers(Duration timeout);
}
