package com.amqpharness.diagnosis;

import com.amqpharness.amqp.AmqpCodec;
import com.amqpharness.config.BrokerUri;
import com.amqpharness.config.TlsContextBuilder;
import com.amqpharness.config.TlsSettings;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Opens one short-lived connection to the broker and runs the connection handshake on it.
 * The socket and its event loop are released whatever the outcome.
 */
public class HandshakeProbe {
    private static final Logger logger = LoggerFactory.getLogger(HandshakeProbe.class);

    private final TlsSettings tlsSettings;
    private final Duration timeout;

    public HandshakeProbe(TlsSettings tlsSettings, Duration timeout) {
        this.tlsSettings = tlsSettings == null ? TlsSettings.none() : tlsSettings;
        this.timeout = timeout;
    }

    public HandshakeOutcome attempt(BrokerUri uri) {
        boolean useTls = uri.isTls() || tlsSettings.isConfigured();
        TlsContextBuilder tls = new TlsContextBuilder(tlsSettings);
        boolean verifyHostname = tls.verifiesHostname();
        SslContext sslContext;
        try {
            sslContext = useTls ? tls.buildClientContext() : null;
        } catch (SSLException | IllegalArgumentException e) {
            return HandshakeOutcome.failed(HandshakePhase.NOT_CONNECTED,
                                           new HandshakeFailure(HandshakeFailure.Kind.TLS, e));
        }

        long timeoutMillis = timeout.toMillis();
        long deadline = System.nanoTime() + timeout.toNanos();
        HandshakeHandler handler = new HandshakeHandler(uri);
        EventLoopGroup group = new NioEventLoopGroup(1);
        Channel channel = null;

        try {
            Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMillis, Integer.MAX_VALUE))
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        if (sslContext != null) {
                            pipeline.addLast("ssl", newSslHandler(sslContext, ch.alloc(), uri, verifyHostname));
                        }
                        pipeline.addLast("frameDecoder", new AmqpCodec.AmqpFrameDecoder());
                        pipeline.addLast("frameEncoder", new AmqpCodec.AmqpFrameEncoder());
                        pipeline.addLast("handshake", handler);
                    }
                });

            logger.debug("Probing {} (tls={})", uri, useTls);
            ChannelFuture connect = bootstrap.connect(uri.getHost(), uri.getPort());
            channel = connect.channel();

            if (!connect.await(timeoutMillis)) {
                return HandshakeOutcome.failed(HandshakePhase.NOT_CONNECTED, new HandshakeFailure(
                    HandshakeFailure.Kind.TIMEOUT,
                    new SocketTimeoutException("Connect to " + uri.getHost() + ":" + uri.getPort()
                                               + " timed out after " + timeoutMillis + "ms")));
            }
            if (!connect.isSuccess()) {
                return HandshakeOutcome.failed(HandshakePhase.NOT_CONNECTED,
                                               new HandshakeFailure(HandshakeFailure.Kind.CONNECT_FAILED, connect.cause()));
            }

            long remaining = Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
            try {
                return handler.completion().get(remaining, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                handler.timeout(timeoutMillis);
                return handler.completion().join();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HandshakeOutcome.failed(handler.getPhase(), new HandshakeFailure(
                HandshakeFailure.Kind.TIMEOUT, new InterruptedIOException("Interrupted while probing " + uri)));
        } catch (ExecutionException e) {
            // completion is never completed exceptionally
            throw new IllegalStateException("Handshake completion failed", e.getCause());
        } finally {
            if (channel != null) {
                channel.close().awaitUninterruptibly(timeoutMillis);
            }
            group.shutdownGracefully(0, timeoutMillis, TimeUnit.MILLISECONDS).awaitUninterruptibly(timeoutMillis);
        }
    }

    public Duration getTimeout() {
        return timeout;
    }

    public TlsSettings getTlsSettings() {
        return tlsSettings;
    }

    /**
     * Builds the TLS handler with the same hostname check the pooled connections apply.
     */
    static SslHandler newSslHandler(SslContext sslContext, ByteBufAllocator alloc, BrokerUri uri,
                                    boolean verifyHostname) {
        SslHandler handler = sslContext.newHandler(alloc, uri.getHost(), uri.getPort());
        if (verifyHostname) {
            SSLEngine engine = handler.engine();
            SSLParameters parameters = engine.getSSLParameters();
            parameters.setEndpointIdentificationAlgorithm("HTTPS");
            engine.setSSLParameters(parameters);
        }
        return handler;
    }
}
