package com.amqpharness.management;

import com.amqpharness.config.BrokerUri;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-test broker settings scoped to one isolation virtual host.
 */
public final class RabbitConfig {

    private final BrokerUri uri;
    private final String username;
    private final String virtualHost;

    public RabbitConfig(BrokerUri baseUri, String virtualHost) {
        this.uri = baseUri.withVirtualHost(virtualHost);
        this.username = baseUri.getUsername();
        this.virtualHost = virtualHost;
    }

    public BrokerUri getUri() {
        return uri;
    }

    public String getUsername() {
        return username;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    /**
     * Export as a flat map, keyed the way service configuration expects it.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("AMQP_URI", uri.normalized());
        map.put("username", username);
        map.put("vhost", virtualHost);
        return map;
    }

    @Override
    public String toString() {
        return String.format("RabbitConfig{uri=%s, vhost=%s}", uri, virtualHost);
    }
}
