package com.amqpharness.pool;

import com.amqpharness.config.BrokerUri;
import com.amqpharness.config.TransportOptions;

import java.util.Objects;

/**
 * Identifies one bounded pool: the normalized broker URI plus transport options.
 */
public final class PoolKey {

    private final BrokerUri uri;
    private final String normalizedUri;
    private final TransportOptions options;

    public PoolKey(BrokerUri uri, TransportOptions options) {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.normalizedUri = uri.normalized();
        this.options = Objects.requireNonNull(options, "options");
    }

    public BrokerUri getUri() {
        return uri;
    }

    public TransportOptions getOptions() {
        return options;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PoolKey)) return false;
        PoolKey other = (PoolKey) o;
        return normalizedUri.equals(other.normalizedUri) && options.equals(other.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(normalizedUri, options);
    }

    @Override
    public String toString() {
        return String.format("PoolKey{uri=%s, options=%s}", uri, options);
    }
}
