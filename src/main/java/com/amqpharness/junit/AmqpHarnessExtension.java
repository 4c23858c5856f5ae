package com.amqpharness.junit;

import com.amqpharness.config.BrokerUri;
import com.amqpharness.config.HarnessConfig;
import com.amqpharness.config.TlsSettings;
import com.amqpharness.consumer.ConsumerGroupFactory;
import com.amqpharness.consumer.ConsumerTracker;
import com.amqpharness.diagnosis.ConnectionDiagnoser;
import com.amqpharness.diagnosis.HandshakeProbe;
import com.amqpharness.management.ManagementClient;
import com.amqpharness.management.RabbitConfig;
import com.amqpharness.management.RabbitManagementClient;
import com.amqpharness.management.VirtualHostPipeline;
import com.amqpharness.pipeline.PipelineHandle;
import com.amqpharness.pipeline.ResourceLease;
import com.amqpharness.pool.BrokerConnector;
import com.amqpharness.pool.ConnectionPool;
import com.amqpharness.pool.PublisherPool;
import com.amqpharness.pool.RabbitBrokerConnector;
import com.amqpharness.teardown.TeardownOrchestrator;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ExtensionContext.Namespace;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * JUnit 5 extension giving tests an isolated virtual host, pooled publishers and
 * consumer groups that are torn down in a safe order after each test.
 *
 * <pre><code>
 * {@literal @}ExtendWith(AmqpHarnessExtension.class)
 * class OrderServiceTest {
 *     {@literal @}Test
 *     void handlesOrders(ConsumerGroupFactory consumers, RabbitConfig rabbit, PublisherPool publishers) {
 *         ...
 *     }
 * }
 * </code></pre>
 *
 * <p>Configuration, the management client, the virtual host pipeline and the pools are
 * created once per run and live in the root store. Everything else is scoped to the test:
 * the virtual host lease is discarded as an isolation step, so the broker cancels any
 * consumer bound to it, before the consumer groups are killed.
 */
public class AmqpHarnessExtension implements ParameterResolver, BeforeEachCallback, AfterEachCallback {
    private static final Logger logger = LoggerFactory.getLogger(AmqpHarnessExtension.class);
    private static final Namespace NAMESPACE = Namespace.create(AmqpHarnessExtension.class);

    private static final List<Class<?>> SUPPORTED = Arrays.asList(
        HarnessConfig.class,
        TlsSettings.class,
        ManagementClient.class,
        ConnectionPool.class,
        PublisherPool.class,
        TeardownOrchestrator.class,
        ConsumerGroupFactory.class,
        RabbitConfig.class
    );

    /**
     * Creates the orchestrator and, when the test declares one, the consumer group factory,
     * so consumer owners exist before any virtual host is leased.
     */
    @Override
    public void beforeEach(ExtensionContext context) {
        orchestrator(context);
        boolean declaresConsumers = context.getTestMethod()
            .map(method -> Arrays.asList(method.getParameterTypes()).contains(ConsumerGroupFactory.class))
            .orElse(false);
        if (declaresConsumers) {
            consumerGroups(context, runResources(context));
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        TeardownOrchestrator orchestrator = context.getStore(NAMESPACE).remove(TeardownOrchestrator.class,
                                                                               TeardownOrchestrator.class);
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext)
        throws ParameterResolutionException {
        return SUPPORTED.contains(parameterContext.getParameter().getType());
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext)
        throws ParameterResolutionException {
        Class<?> type = parameterContext.getParameter().getType();
        RunResources run = runResources(extensionContext);

        if (type == HarnessConfig.class) {
            return run.config;
        } else if (type == TlsSettings.class) {
            return run.config.getTlsSettings();
        } else if (type == ManagementClient.class) {
            return run.management();
        } else if (type == ConnectionPool.class) {
            return run.connections;
        } else if (type == PublisherPool.class) {
            return run.publishers;
        } else if (type == TeardownOrchestrator.class) {
            return orchestrator(extensionContext);
        } else if (type == ConsumerGroupFactory.class) {
            return consumerGroups(extensionContext, run);
        } else if (type == RabbitConfig.class) {
            return rabbitConfig(extensionContext, run);
        }
        throw new ParameterResolutionException("Unsupported parameter type " + type.getName());
    }

    private static TeardownOrchestrator orchestrator(ExtensionContext context) {
        return context.getStore(NAMESPACE).getOrComputeIfAbsent(
            TeardownOrchestrator.class,
            key -> new TeardownOrchestrator(new ConsumerTracker()),
            TeardownOrchestrator.class);
    }

    private static ConsumerGroupFactory consumerGroups(ExtensionContext context, RunResources run) {
        return context.getStore(NAMESPACE).getOrComputeIfAbsent(ConsumerGroupFactory.class, key -> {
            TeardownOrchestrator orchestrator = orchestrator(context);
            HarnessConfig config = run.config;
            ConsumerGroupFactory factory = new ConsumerGroupFactory(
                run.connector,
                orchestrator.getTracker(),
                Duration.ofMillis(config.getConsumerDrainTimeoutMs()),
                Duration.ofMillis(config.getConsumerReconnectDelayMs()));
            orchestrator.registerConsumerOwnerTeardown("consumer groups", factory::close);
            return factory;
        }, ConsumerGroupFactory.class);
    }

    private static RabbitConfig rabbitConfig(ExtensionContext context, RunResources run) {
        return context.getStore(NAMESPACE).getOrComputeIfAbsent(RabbitConfig.class, key -> {
            run.verifyBroker();
            ResourceLease<String> lease = run.vhosts().get();
            orchestrator(context).registerIsolationTeardown("vhost " + lease.get(), lease::discard);
            RabbitConfig rabbit = new RabbitConfig(run.config.getBrokerUri(), lease.get());
            logger.debug("Test {} uses {}", context.getDisplayName(), rabbit);
            return rabbit;
        }, RabbitConfig.class);
    }

    private static RunResources runResources(ExtensionContext context) {
        return context.getRoot().getStore(NAMESPACE).getOrComputeIfAbsent(RunResources.class, key -> {
            logger.info("Initializing AMQP test harness");
            return new RunResources(HarnessConfig.load());
        }, RunResources.class);
    }

    /**
     * Objects shared by every test of the run. Closed by JUnit when the root context ends.
     */
    static final class RunResources implements ExtensionContext.Store.CloseableResource {
        final HarnessConfig config;
        final BrokerConnector connector;
        final ConnectionPool connections;
        final PublisherPool publishers;

        private ManagementClient management;
        private PipelineHandle<String> vhosts;
        private boolean verified;

        RunResources(HarnessConfig config) {
            this.config = config;
            this.connector = new RabbitBrokerConnector(config.getTlsSettings());
            this.connections = new ConnectionPool(connector, config.getPoolLimit());
            this.publishers = new PublisherPool(connections, config.getPoolLimit());
        }

        synchronized ManagementClient management() {
            if (management == null) {
                management = RabbitManagementClient.fromUri(config.getManagementUri());
            }
            return management;
        }

        synchronized PipelineHandle<String> vhosts() {
            if (vhosts == null) {
                BrokerUri uri = config.getBrokerUri();
                vhosts = new VirtualHostPipeline(management(), config.getVhostPrefix(), uri.getUsername())
                    .build()
                    .run();
            }
            return vhosts;
        }

        synchronized void verifyBroker() {
            if (verified) {
                return;
            }
            ConnectionDiagnoser diagnoser = new ConnectionDiagnoser(
                new HandshakeProbe(config.getTlsSettings(), Duration.ofMillis(config.getHandshakeTimeoutMs())));
            try {
                diagnoser.verify(config.getBrokerUri());
            } catch (IOException e) {
                throw new ParameterResolutionException("Broker at " + config.getBrokerUri() + " is not usable", e);
            }
            verified = true;
        }

        @Override
        public synchronized void close() {
            logger.info("Shutting down AMQP test harness");
            try {
                if (vhosts != null) {
                    vhosts.close();
                    if (!vhosts.getPipeline().getDestroyFailures().isEmpty()) {
                        logger.warn("{} virtual hosts could not be deleted",
                                    vhosts.getPipeline().getDestroyFailures().size());
                    }
                }
            } finally {
                publishers.close();
                connections.close();
            }
        }
    }
}
