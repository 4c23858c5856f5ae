package com.amqpharness.pool;

import com.amqpharness.config.BrokerUri;
import com.amqpharness.config.TransportOptions;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Shared broker connections, bounded per (URI, options) key. {@link #acquire} blocks
 * when the key is saturated; it never fails for exhaustion.
 */
public class ConnectionPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);

    private static final int CLOSE_TIMEOUT_MS = 5000;

    private final BrokerConnector connector;
    private final int limit;
    private final ConcurrentMap<PoolKey, KeyedPool<Connection>> pools = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public ConnectionPool(BrokerConnector connector, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Pool limit must be at least 1: " + limit);
        }
        this.connector = connector;
        this.limit = limit;
    }

    public Lease<Connection> acquire(BrokerUri uri) throws IOException {
        return acquire(uri, TransportOptions.defaults());
    }

    public Lease<Connection> acquire(BrokerUri uri, TransportOptions options) throws IOException {
        if (closed) {
            throw new IllegalStateException("Connection pool is closed");
        }
        PoolKey key = new PoolKey(uri, options);
        KeyedPool<Connection> pool = pools.computeIfAbsent(key, k -> {
            logger.info("Created connection pool for {} (limit {})", k, limit);
            return new KeyedPool<>("connection pool " + k, limit,
                                   () -> connector.connect(uri, options),
                                   Connection::isOpen,
                                   ConnectionPool::closeConnection);
        });
        if (closed) {
            pool.close();
            throw new IllegalStateException("Connection pool is closed");
        }
        return pool.acquire();
    }

    public PoolStats getStats(BrokerUri uri, TransportOptions options) {
        KeyedPool<Connection> pool = pools.get(new PoolKey(uri, options));
        return pool == null ? PoolStats.empty() : pool.stats();
    }

    public int getLimit() {
        return limit;
    }

    static void closeConnection(Connection connection) {
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.close(CLOSE_TIMEOUT_MS);
        } catch (IOException | ShutdownSignalException e) {
            logger.warn("Failed to close connection {}", connection, e);
        }
    }

    /**
     * Close idle connections and reject further acquisitions. Leased connections are
     * closed as their leases are returned.
     */
    @Override
    public void close() {
        closed = true;
        pools.values().forEach(KeyedPool::close);
        logger.info("Connection pool closed");
    }
}
