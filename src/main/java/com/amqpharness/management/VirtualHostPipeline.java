package com.amqpharness.management;

import com.amqpharness.pipeline.ResourcePipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Creates and deletes uniquely named test virtual hosts through the management API.
 * Each new vhost grants the test user full configure, write and read permissions.
 */
public class VirtualHostPipeline {
    private static final Logger logger = LoggerFactory.getLogger(VirtualHostPipeline.class);

    public static final int SUFFIX_LENGTH = 10;
    public static final String ALL = ".*";

    private final ManagementClient management;
    private final String prefix;
    private final String username;

    public VirtualHostPipeline(ManagementClient management, String prefix, String username) {
        this.management = management;
        this.prefix = prefix;
        this.username = username;
    }

    public ResourcePipeline<String> build() {
        return new ResourcePipeline<>("vhosts", this::create, this::destroy);
    }

    String create() {
        String vhost = randomName(prefix, ThreadLocalRandom.current());
        management.createVirtualHost(vhost);
        try {
            management.setPermissions(vhost, username, ALL, ALL, ALL);
        } catch (RuntimeException e) {
            try {
                management.deleteVirtualHost(vhost);
            } catch (RuntimeException deleteFailure) {
                e.addSuppressed(deleteFailure);
            }
            throw e;
        }
        logger.info("Created vhost {} for user {}", vhost, username);
        return vhost;
    }

    void destroy(String vhost) {
        management.deleteVirtualHost(vhost);
        logger.info("Deleted vhost {}", vhost);
    }

    static String randomName(String prefix, Random random) {
        StringBuilder name = new StringBuilder(prefix);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            name.append((char) ('a' + random.nextInt(26)));
        }
        return name.toString();
    }
}
