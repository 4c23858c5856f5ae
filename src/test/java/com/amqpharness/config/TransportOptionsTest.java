package com.amqpharness.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Transport Options Tests")
class TransportOptionsTest {

    @Test
    @DisplayName("Should not confirm publishes by default")
    void testDefaults() {
        TransportOptions options = TransportOptions.defaults();

        assertThat(options.isConfirmPublish()).isFalse();
        assertThat(options.getHeartbeatSeconds()).isEqualTo(60);
        assertThat(options.getConnectionTimeout()).isEqualTo(TransportOptions.DEFAULT_CONNECTION_TIMEOUT);
        assertThat(options.getConfirmTimeout()).isEqualTo(TransportOptions.DEFAULT_CONFIRM_TIMEOUT);
    }

    @Test
    @DisplayName("Should enable confirms for the confirming preset")
    void testConfirming() {
        assertThat(TransportOptions.confirming().isConfirmPublish()).isTrue();
        assertThat(TransportOptions.confirming()).isNotEqualTo(TransportOptions.defaults());
    }

    @Test
    @DisplayName("Should compare by value")
    void testEquality() {
        TransportOptions a = TransportOptions.builder().heartbeatSeconds(5).build();
        TransportOptions b = TransportOptions.defaults().toBuilder().heartbeatSeconds(5).build();

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    }

    @Test
    @DisplayName("Should reject invalid values")
    void testValidation() {
        assertThatThrownBy(() -> TransportOptions.builder().heartbeatSeconds(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TransportOptions.builder().confirmTimeout(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TransportOptions.builder().connectionTimeout(null))
            .isInstanceOf(NullPointerException.class);
    }
}
