package com.amqpharness.junit;

import com.amqpharness.config.HarnessConfig;
import com.amqpharness.config.TlsSettings;
import com.amqpharness.consumer.ConsumerGroupFactory;
import com.amqpharness.pool.ConnectionPool;
import com.amqpharness.pool.PublisherPool;
import com.amqpharness.teardown.TeardownOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Resolves only what needs no broker.
 */
@ExtendWith(AmqpHarnessExtension.class)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
@DisplayName("Harness Extension Tests")
class AmqpHarnessExtensionTest {

    private static final List<String> tornDown = new ArrayList<>();
    private static TeardownOrchestrator firstOrchestrator;
    private static ConnectionPool firstPool;

    private List<String> ownersBeforeTest;

    @BeforeEach
    void captureOwners(TeardownOrchestrator orchestrator) {
        ownersBeforeTest = orchestrator.getConsumerOwnerSteps();
    }

    @Test
    @Order(1)
    @DisplayName("Should resolve run-scoped configuration and pools")
    void testRunScoped(HarnessConfig config, TlsSettings tls, ConnectionPool connections,
                       PublisherPool publishers, TeardownOrchestrator orchestrator) {
        assertThat(config.getVhostPrefix()).isNotBlank();
        assertThat(tls).isNotNull();
        assertThat(publishers).isNotNull();
        firstPool = connections;
        firstOrchestrator = orchestrator;

        orchestrator.registerIsolationTeardown("marker", () -> tornDown.add("marker"));
        assertThat(tornDown).isEmpty();
    }

    @Test
    @Order(2)
    @DisplayName("Should tear down the previous test and share pools across tests")
    void testTestScoped(ConnectionPool connections, TeardownOrchestrator orchestrator) {
        assertThat(tornDown).containsExactly("marker");
        assertThat(connections).isSameAs(firstPool);
        assertThat(orchestrator).isNotSameAs(firstOrchestrator);
        assertThatThrownBy(() -> firstOrchestrator.registerIsolationTeardown("late", () -> { }))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @Order(3)
    @DisplayName("Should hand out one orchestrator per test")
    void testSameOrchestratorWithinTest(TeardownOrchestrator first, TeardownOrchestrator second) {
        assertThat(first).isSameAs(second);
    }

    @Test
    @Order(4)
    @DisplayName("Should set up consumer owners before the test when it declares them")
    void testConsumerOwnersFirst(ConsumerGroupFactory consumers, TeardownOrchestrator orchestrator) {
        assertThat(ownersBeforeTest).containsExactly("consumer groups");
        assertThat(orchestrator.getConsumerOwnerSteps()).containsExactly("consumer groups");
        assertThat(consumers.getOwners()).isEmpty();
    }

    @Test
    @Order(5)
    @DisplayName("Should not set up consumer owners the test does not declare")
    void testNoConsumerOwnersUndeclared(TeardownOrchestrator orchestrator) {
        assertThat(ownersBeforeTest).isEmpty();
    }
}
