package com.amqpharness.config;

import io.netty.handler.ssl.JdkSslContext;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import java.io.File;

/**
 * Builds client-side TLS contexts from {@link TlsSettings}. The Netty context serves the
 * handshake probe; the JDK {@link SSLContext} view of the same material serves the
 * RabbitMQ client used by the pools.
 */
public class TlsContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(TlsContextBuilder.class);

    private static final String[] PROTOCOLS = {"TLSv1.3", "TLSv1.2"};

    private final TlsSettings settings;

    public TlsContextBuilder(TlsSettings settings) {
        this.settings = settings;
    }

    /**
     * Build an SslContext for client-side TLS.
     */
    /**
     * Broker hostnames are verified only against a configured CA. Both the handshake probe
     * and pooled connections follow this rule.
     */
    public boolean verifiesHostname() {
        return settings.getCaCerts() != null;
    }

    public SslContext buildClientContext() throws SSLException {
        SslContextBuilder builder = SslContextBuilder.forClient()
            .sslProvider(SslProvider.JDK)
            .protocols(PROTOCOLS);

        // Without a CA bundle the JDK default trust store verifies the broker
        if (settings.getCaCerts() != null) {
            builder.trustManager(requireReadable(settings.getCaCerts(), "ssl.ca-certs"));
        }

        if (settings.hasClientCertificate()) {
            builder.keyManager(
                requireReadable(settings.getCertfile(), "ssl.certfile"),
                requireReadable(settings.getKeyfile(), "ssl.keyfile"));
        }

        SslContext context = builder.build();
        log.debug("Built client SSL context with caCerts={}, clientCertificate={}",
                  settings.getCaCerts(), settings.hasClientCertificate());
        return context;
    }

    /**
     * The same client context as a JDK {@link SSLContext}, as expected by the RabbitMQ client.
     */
    public SSLContext buildJdkContext() throws SSLException {
        SslContext context = buildClientContext();
        if (!(context instanceof JdkSslContext)) {
            throw new IllegalStateException("Expected a JDK SSL context but got " + context.getClass().getName());
        }
        return ((JdkSslContext) context).context();
    }

    private static File requireReadable(String path, String option) {
        File file = new File(path);
        if (!file.isFile() || !file.canRead()) {
            throw new IllegalArgumentException(option + " does not point to a readable file: " + path);
        }
        return file;
    }
}
