package com.amqpharness.config;

import io.netty.handler.ssl.SslContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLContext;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TLS Context Builder Tests")
class TlsContextBuilderTest {

    @Test
    @DisplayName("Should build a client context backed by the default trust store")
    void testDefaultTrust() throws Exception {
        SslContext context = new TlsContextBuilder(TlsSettings.none()).buildClientContext();

        assertThat(context.isClient()).isTrue();
    }

    @Test
    @DisplayName("Should expose the JDK view for the RabbitMQ client")
    void testJdkContext() throws Exception {
        SSLContext context = new TlsContextBuilder(TlsSettings.none()).buildJdkContext();

        assertThat(context).isNotNull();
        assertThat(context.getProtocol()).startsWith("TLS");
    }

    @Test
    @DisplayName("Should reject unreadable CA bundles")
    void testMissingCaCerts() {
        TlsSettings settings = new TlsSettings("/nonexistent/ca.pem", null, null);

        assertThatThrownBy(() -> new TlsContextBuilder(settings).buildClientContext())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ssl.ca-certs");
    }

    @Test
    @DisplayName("Should reject unreadable client certificates")
    void testMissingClientCertificate() {
        TlsSettings settings = new TlsSettings(null, "/nonexistent/cert.pem", "/nonexistent/key.pem");

        assertThatThrownBy(() -> new TlsContextBuilder(settings).buildClientContext())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ssl.certfile");
    }

    @Test
    @DisplayName("Should require the key with the certificate")
    void testCertWithoutKey() {
        assertThatThrownBy(() -> new TlsSettings(null, "/etc/cert.pem", null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should verify hostnames only against a configured CA")
    void testVerifiesHostname() {
        assertThat(new TlsContextBuilder(TlsSettings.none()).verifiesHostname()).isFalse();
        assertThat(new TlsContextBuilder(new TlsSettings("/etc/ssl/ca.pem", null, null)).verifiesHostname()).isTrue();
    }
}
