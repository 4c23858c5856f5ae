package com.amqpharness.pool;

import com.amqpharness.config.BrokerUri;
import com.amqpharness.config.TransportOptions;
import com.rabbitmq.client.Connection;

import java.io.IOException;

/**
 * Opens live broker connections.
 */
public interface BrokerConnector {

    Connection connect(BrokerUri uri, TransportOptions options) throws IOException;
}
