package com.amqpharness.pool;

import com.amqpharness.confirms.Publisher;
import com.amqpharness.config.BrokerUri;
import com.amqpharness.config.TransportOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Bounded publisher checkout. Each checkout leases a connection from the backing
 * {@link ConnectionPool} and opens a channel on it; releasing the publisher closes the
 * channel and returns the connection, so an idle publisher holds no connection.
 * Publishers confirm by default.
 */
public class PublisherPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PublisherPool.class);

    private final ConnectionPool connections;
    private final int limit;
    private final ConcurrentMap<PoolKey, KeyedPool<Publisher>> pools = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public PublisherPool(ConnectionPool connections, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Pool limit must be at least 1: " + limit);
        }
        this.connections = connections;
        this.limit = limit;
    }

    public Lease<Publisher> acquire(BrokerUri uri) throws IOException {
        return acquire(uri, TransportOptions.confirming());
    }

    public Lease<Publisher> acquire(BrokerUri uri, TransportOptions options) throws IOException {
        if (closed) {
            throw new IllegalStateException("Publisher pool is closed");
        }
        PoolKey key = new PoolKey(uri, options);
        KeyedPool<Publisher> pool = pools.computeIfAbsent(key, k -> {
            logger.info("Created publisher pool for {} (limit {})", k, limit);
            return new KeyedPool<>("publisher pool " + k, limit,
                                   () -> Publisher.open(connections.acquire(uri, options), options),
                                   Publisher::isUsable,
                                   Publisher::close,
                                   false);
        });
        if (closed) {
            pool.close();
            throw new IllegalStateException("Publisher pool is closed");
        }
        return pool.acquire();
    }

    public PoolStats getStats(BrokerUri uri, TransportOptions options) {
        KeyedPool<Publisher> pool = pools.get(new PoolKey(uri, options));
        return pool == null ? PoolStats.empty() : pool.stats();
    }

    @Override
    public void close() {
        closed = true;
        pools.values().forEach(KeyedPool::close);
        logger.info("Publisher pool closed");
    }
}
