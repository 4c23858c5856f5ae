package com.amqpharness.pool;

import com.amqpharness.config.BrokerUri;
import com.amqpharness.config.TlsContextBuilder;
import com.amqpharness.config.TlsSettings;
import com.amqpharness.config.TransportOptions;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Connects with the RabbitMQ Java client. Automatic recovery is disabled: a broken
 * connection is discarded by its pool and replaced on the next acquire.
 */
public class RabbitBrokerConnector implements BrokerConnector {
    private static final Logger logger = LoggerFactory.getLogger(RabbitBrokerConnector.class);

    private final TlsSettings tlsSettings;
    private final String connectionName;

    public RabbitBrokerConnector(TlsSettings tlsSettings) {
        this(tlsSettings, "amqp-harness");
    }

    public RabbitBrokerConnector(TlsSettings tlsSettings, String connectionName) {
        this.tlsSettings = tlsSettings == null ? TlsSettings.none() : tlsSettings;
        this.connectionName = connectionName;
    }

    @Override
    public Connection connect(BrokerUri uri, TransportOptions options) throws IOException {
        ConnectionFactory factory = createFactory(uri, options);
        try {
            Connection connection = factory.newConnection(connectionName);
            logger.debug("Opened connection to {}", uri);
            return connection;
        } catch (TimeoutException e) {
            throw new IOException("Timed out connecting to " + uri, e);
        }
    }

    ConnectionFactory createFactory(BrokerUri uri, TransportOptions options) throws IOException {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(uri.getHost());
        factory.setPort(uri.getPort());
        factory.setUsername(uri.getUsername());
        factory.setPassword(uri.getPassword());
        factory.setVirtualHost(uri.getVirtualHost());
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
        factory.setRequestedHeartbeat(options.getHeartbeatSeconds());
        int timeoutMillis = (int) Math.min(options.getConnectionTimeout().toMillis(), Integer.MAX_VALUE);
        factory.setConnectionTimeout(timeoutMillis);
        factory.setHandshakeTimeout(timeoutMillis);

        if (uri.isTls() || tlsSettings.isConfigured()) {
            TlsContextBuilder tls = new TlsContextBuilder(tlsSettings);
            factory.useSslProtocol(tls.buildJdkContext());
            if (tls.verifiesHostname()) {
                factory.enableHostnameVerification();
            }
        }
        return factory;
    }
}
