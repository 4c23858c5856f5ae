package com.amqpharness.consumer;

import com.amqpharness.config.BrokerUri;
import com.amqpharness.pool.BrokerConnector;

import java.time.Duration;

/**
 * Makes {@link ConsumerGroup}s whose loops register with the test's tracker.
 */
public class ConsumerGroupFactory extends ConsumerOwnerFactory<ConsumerGroup> {

    private final BrokerConnector connector;
    private final ConsumerTracker tracker;
    private final Duration drainTimeout;
    private final Duration reconnectDelay;

    public ConsumerGroupFactory(BrokerConnector connector, ConsumerTracker tracker,
                                Duration drainTimeout, Duration reconnectDelay) {
        this.connector = connector;
        this.tracker = tracker;
        this.drainTimeout = drainTimeout;
        this.reconnectDelay = reconnectDelay;
    }

    public ConsumerGroup create(String name, BrokerUri uri) {
        return register(new ConsumerGroup(name, uri, connector, tracker, drainTimeout, reconnectDelay));
    }
}
