package com.amqpharness.diagnosis;

import java.util.Collections;
import java.util.Map;

public final class HandshakeOutcome {

    private final HandshakePhase phase;
    private final HandshakeFailure failure;
    private final Map<String, Object> serverProperties;

    public HandshakeOutcome(HandshakePhase phase, HandshakeFailure failure, Map<String, Object> serverProperties) {
        this.phase = phase;
        this.failure = failure;
        this.serverProperties = serverProperties == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(serverProperties);
    }

    public static HandshakeOutcome failed(HandshakePhase phase, HandshakeFailure failure) {
        return new HandshakeOutcome(phase, failure, null);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public HandshakePhase getPhase() {
        return phase;
    }

    /**
     * @return the failure, or {@code null} when the broker opened the connection
     */
    public HandshakeFailure getFailure() {
        return failure;
    }

    public Map<String, Object> getServerProperties() {
        return serverProperties;
    }

    @Override
    public String toString() {
        return String.format("HandshakeOutcome{phase=%s, failure=%s}", phase, failure);
    }
}
