package com.amqpharness.management;

import java.util.List;

/**
 * The slice of the broker's administrative API needed to manage isolation namespaces.
 * Implementations raise {@link ManagementApiException} on failure.
 */
public interface ManagementClient {

    void createVirtualHost(String name);

    void deleteVirtualHost(String name);

    void setPermissions(String virtualHost, String username, String configure, String write, String read);

    List<String> listVirtualHosts();
}
