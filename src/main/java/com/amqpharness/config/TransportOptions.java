package com.amqpharness.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Transport options that, together with the normalized URI, form a pool key.
 */
public final class TransportOptions {

    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_CONFIRM_TIMEOUT = Duration.ofSeconds(10);

    private static final TransportOptions DEFAULTS = builder().build();
    private static final TransportOptions CONFIRMING = builder().confirmPublish(true).build();

    private final boolean confirmPublish;
    private final int heartbeatSeconds;
    private final Duration connectionTimeout;
    private final Duration confirmTimeout;

    private TransportOptions(Builder builder) {
        this.confirmPublish = builder.confirmPublish;
        this.heartbeatSeconds = builder.heartbeatSeconds;
        this.connectionTimeout = builder.connectionTimeout;
        this.confirmTimeout = builder.confirmTimeout;
    }

    public static TransportOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Defaults used for publishers: every publish waits for the broker's confirm.
     */
    public static TransportOptions confirming() {
        return CONFIRMING;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .confirmPublish(confirmPublish)
            .heartbeatSeconds(heartbeatSeconds)
            .connectionTimeout(connectionTimeout)
            .confirmTimeout(confirmTimeout);
    }

    public boolean isConfirmPublish() {
        return confirmPublish;
    }

    public int getHeartbeatSeconds() {
        return heartbeatSeconds;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public Duration getConfirmTimeout() {
        return confirmTimeout;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransportOptions)) return false;
        TransportOptions other = (TransportOptions) o;
        return confirmPublish == other.confirmPublish
            && heartbeatSeconds == other.heartbeatSeconds
            && connectionTimeout.equals(other.connectionTimeout)
            && confirmTimeout.equals(other.confirmTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(confirmPublish, heartbeatSeconds, connectionTimeout, confirmTimeout);
    }

    @Override
    public String toString() {
        return String.format("TransportOptions{confirmPublish=%s, heartbeat=%ds, connectionTimeout=%dms, confirmTimeout=%dms}",
                           confirmPublish, heartbeatSeconds, connectionTimeout.toMillis(), confirmTimeout.toMillis());
    }

    public static class Builder {
        private boolean confirmPublish = false;
        private int heartbeatSeconds = 60;
        private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
        private Duration confirmTimeout = DEFAULT_CONFIRM_TIMEOUT;

        public Builder confirmPublish(boolean confirmPublish) {
            this.confirmPublish = confirmPublish;
            return this;
        }

        public Builder heartbeatSeconds(int heartbeatSeconds) {
            if (heartbeatSeconds < 0) {
                throw new IllegalArgumentException("Heartbeat must not be negative: " + heartbeatSeconds);
            }
            this.heartbeatSeconds = heartbeatSeconds;
            return this;
        }

        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = requirePositive(connectionTimeout, "connectionTimeout");
            return this;
        }

        public Builder confirmTimeout(Duration confirmTimeout) {
            this.confirmTimeout = requirePositive(confirmTimeout, "confirmTimeout");
            return this;
        }

        private static Duration requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }

        public TransportOptions build() {
            return new TransportOptions(this);
        }
    }
}
