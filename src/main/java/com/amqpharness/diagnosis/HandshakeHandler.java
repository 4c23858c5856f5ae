package com.amqpharness.diagnosis;

import com.amqpharness.amqp.AmqpCodec;
import com.amqpharness.amqp.AmqpConstants;
import com.amqpharness.amqp.AmqpFrame;
import com.amqpharness.amqp.ProtocolVersionMismatchException;
import com.amqpharness.config.BrokerUri;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.ssl.SslHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Drives the client side of an AMQP 0-9-1 connection handshake and records how far it got.
 * Completes once the broker opens the virtual host or the attempt fails; the first
 * outcome wins.
 */
public class HandshakeHandler extends SimpleChannelInboundHandler<AmqpFrame> {
    private static final Logger logger = LoggerFactory.getLogger(HandshakeHandler.class);

    private static final short CONTROL_CHANNEL = 0;

    private final BrokerUri uri;
    private final CompletableFuture<HandshakeOutcome> completion = new CompletableFuture<>();

    private volatile HandshakePhase phase = HandshakePhase.NOT_CONNECTED;
    private volatile Map<String, Object> serverProperties = Collections.emptyMap();

    public HandshakeHandler(BrokerUri uri) {
        this.uri = uri;
    }

    public HandshakePhase getPhase() {
        return phase;
    }

    public CompletableFuture<HandshakeOutcome> completion() {
        return completion;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        SslHandler sslHandler = ctx.pipeline().get(SslHandler.class);
        if (sslHandler == null) {
            sendProtocolHeader(ctx);
        } else {
            sslHandler.handshakeFuture().addListener(future -> {
                if (future.isSuccess()) {
                    sendProtocolHeader(ctx);
                } else {
                    fail(HandshakeFailure.Kind.TLS, future.cause());
                    ctx.close();
                }
            });
        }
        super.channelActive(ctx);
    }

    private void sendProtocolHeader(ChannelHandlerContext ctx) {
        logger.debug("Sending protocol header to {}:{}", uri.getHost(), uri.getPort());
        phase = HandshakePhase.AWAITING_START;
        ctx.writeAndFlush(AmqpCodec.protocolHeader());
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, AmqpFrame frame) throws Exception {
        if (frame.isHeartbeat()) {
            return;
        }
        if (!frame.isMethod()) {
            protocolError(ctx, "Unexpected frame during handshake: " + frame);
            return;
        }

        ByteBuf payload = frame.getPayload();
        short classId = payload.readShort();
        short methodId = payload.readShort();

        if (classId != AmqpConstants.CLASS_CONNECTION) {
            protocolError(ctx, "Unexpected method " + classId + "." + methodId + " during handshake");
            return;
        }

        logger.debug("Received connection method {} in phase {}", methodId, phase);

        switch (methodId) {
            case AmqpConstants.METHOD_CONNECTION_START:
                handleStart(ctx, payload);
                break;
            case AmqpConstants.METHOD_CONNECTION_TUNE:
                handleTune(ctx, payload);
                break;
            case AmqpConstants.METHOD_CONNECTION_OPEN_OK:
                handleOpenOk(ctx);
                break;
            case AmqpConstants.METHOD_CONNECTION_CLOSE:
                handleClose(ctx, payload);
                break;
            case AmqpConstants.METHOD_CONNECTION_CLOSE_OK:
                phase = HandshakePhase.CLOSED;
                ctx.close();
                break;
            case AmqpConstants.METHOD_CONNECTION_BLOCKED:
            case AmqpConstants.METHOD_CONNECTION_UNBLOCKED:
                break;
            default:
                protocolError(ctx, "Unexpected connection method " + methodId + " in phase " + phase);
        }
    }

    private void handleStart(ChannelHandlerContext ctx, ByteBuf payload) {
        if (phase != HandshakePhase.AWAITING_START) {
            protocolError(ctx, "connection.start received in phase " + phase);
            return;
        }

        byte versionMajor = payload.readByte();
        byte versionMinor = payload.readByte();
        Map<String, Object> properties = AmqpCodec.decodeTable(payload);
        String mechanisms = AmqpCodec.decodeLongString(payload);
        String locales = AmqpCodec.decodeLongString(payload);

        serverProperties = properties;
        logger.debug("connection.start: version={}-{}, mechanisms={}, locales={}",
                     versionMajor, versionMinor, mechanisms, locales);

        if (!Arrays.asList(mechanisms.split(" ")).contains(AmqpConstants.MECHANISM_PLAIN)) {
            protocolError(ctx, "Broker does not offer " + AmqpConstants.MECHANISM_PLAIN
                               + " authentication; offered: " + mechanisms);
            return;
        }

        ByteBuf startOk = Unpooled.buffer();
        AmqpCodec.encodeTable(startOk, clientProperties());
        AmqpCodec.encodeShortString(startOk, AmqpConstants.MECHANISM_PLAIN);
        AmqpCodec.encodeLongBytes(startOk, plainResponse(uri.getUsername(), uri.getPassword()));
        AmqpCodec.encodeShortString(startOk, AmqpConstants.DEFAULT_LOCALE);

        phase = HandshakePhase.AWAITING_TUNE;
        sendMethod(ctx, AmqpConstants.METHOD_CONNECTION_START_OK, startOk);
    }

    private void handleTune(ChannelHandlerContext ctx, ByteBuf payload) {
        if (phase != HandshakePhase.AWAITING_TUNE) {
            protocolError(ctx, "connection.tune received in phase " + phase);
            return;
        }

        int channelMax = payload.readUnsignedShort();
        long frameMax = payload.readUnsignedInt();
        int heartbeat = payload.readUnsignedShort();
        logger.debug("connection.tune: channelMax={}, frameMax={}, heartbeat={}", channelMax, frameMax, heartbeat);

        ByteBuf tuneOk = Unpooled.buffer();
        tuneOk.writeShort((int) negotiate(channelMax, AmqpConstants.DEFAULT_CHANNEL_MAX));
        tuneOk.writeInt((int) negotiate(frameMax, AmqpConstants.DEFAULT_FRAME_MAX));
        // The probe lives for one round trip; heartbeats stay off
        tuneOk.writeShort(0);
        sendMethod(ctx, AmqpConstants.METHOD_CONNECTION_TUNE_OK, tuneOk);

        ByteBuf open = Unpooled.buffer();
        AmqpCodec.encodeShortString(open, uri.getVirtualHost());
        AmqpCodec.encodeShortString(open, ""); // reserved-1
        open.writeByte(0); // reserved-2

        phase = HandshakePhase.AWAITING_OPEN_OK;
        sendMethod(ctx, AmqpConstants.METHOD_CONNECTION_OPEN, open);
    }

    private void handleOpenOk(ChannelHandlerContext ctx) {
        if (phase != HandshakePhase.AWAITING_OPEN_OK) {
            protocolError(ctx, "connection.open-ok received in phase " + phase);
            return;
        }

        phase = HandshakePhase.OPEN;
        logger.debug("Virtual host {} opened", uri.getVirtualHost());
        completion.complete(new HandshakeOutcome(HandshakePhase.OPEN, null, serverProperties));

        ByteBuf close = Unpooled.buffer();
        close.writeShort(AmqpConstants.REPLY_SUCCESS);
        AmqpCodec.encodeShortString(close, "Goodbye");
        close.writeShort(0);
        close.writeShort(0);
        sendMethod(ctx, AmqpConstants.METHOD_CONNECTION_CLOSE, close);
    }

    private void handleClose(ChannelHandlerContext ctx, ByteBuf payload) {
        int replyCode = payload.readUnsignedShort();
        String replyText = AmqpCodec.decodeShortString(payload);
        int failingClass = payload.readUnsignedShort();
        int failingMethod = payload.readUnsignedShort();

        logger.debug("Broker closed connection in phase {}: {} {}", phase, replyCode, replyText);
        fail(HandshakeFailure.Kind.BROKER_CLOSE,
             new BrokerClosedException(replyCode, replyText, failingClass, failingMethod));

        ctx.writeAndFlush(AmqpFrame.method(CONTROL_CHANNEL, AmqpConstants.CLASS_CONNECTION,
                                           AmqpConstants.METHOD_CONNECTION_CLOSE_OK, null))
           .addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (!completion.isDone()) {
            logger.debug("Socket closed by broker in phase {}", phase);
            fail(HandshakeFailure.Kind.SOCKET_CLOSED,
                 new IOException("Socket closed by broker during connection handshake (phase " + phase + ")"));
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        fail(kindOf(cause), unwrap(cause));
        ctx.close();
    }

    /**
     * Fail the attempt because it ran out of time. Has no effect once completed.
     */
    public void timeout(long timeoutMillis) {
        fail(HandshakeFailure.Kind.TIMEOUT,
             new SocketTimeoutException(
                 "Connection handshake did not complete within " + timeoutMillis + "ms (phase " + phase + ")"));
    }

    private void protocolError(ChannelHandlerContext ctx, String message) {
        fail(HandshakeFailure.Kind.PROTOCOL, new IOException(message));
        ctx.close();
    }

    private void fail(HandshakeFailure.Kind kind, Throwable cause) {
        if (completion.complete(HandshakeOutcome.failed(phase, new HandshakeFailure(kind, cause)))) {
            logger.debug("Handshake with {} failed in phase {}: {}", uri, phase, kind);
        }
    }

    static HandshakeFailure.Kind kindOf(Throwable cause) {
        Throwable root = unwrap(cause);
        if (root instanceof SSLException) {
            return HandshakeFailure.Kind.TLS;
        }
        if (cause instanceof ProtocolVersionMismatchException || cause instanceof DecoderException) {
            return HandshakeFailure.Kind.PROTOCOL;
        }
        if (root instanceof IOException) {
            // Connection reset by peer reads as the broker dropping the socket
            return HandshakeFailure.Kind.SOCKET_CLOSED;
        }
        return HandshakeFailure.Kind.PROTOCOL;
    }

    private static Throwable unwrap(Throwable cause) {
        if (cause instanceof DecoderException
            && !(cause instanceof ProtocolVersionMismatchException)
            && cause.getCause() != null) {
            return cause.getCause();
        }
        return cause;
    }

    private void sendMethod(ChannelHandlerContext ctx, short methodId, ByteBuf arguments) {
        ctx.writeAndFlush(AmqpFrame.method(CONTROL_CHANNEL, AmqpConstants.CLASS_CONNECTION, methodId, arguments));
    }

    private static long negotiate(long offered, long preferred) {
        if (offered == 0) {
            return preferred;
        }
        return Math.min(offered, preferred);
    }

    static byte[] plainResponse(String username, String password) {
        byte[] user = username.getBytes(StandardCharsets.UTF_8);
        byte[] pass = password.getBytes(StandardCharsets.UTF_8);
        byte[] response = new byte[user.length + pass.length + 2];
        System.arraycopy(user, 0, response, 1, user.length);
        System.arraycopy(pass, 0, response, user.length + 2, pass.length);
        return response;
    }

    private static Map<String, Object> clientProperties() {
        Map<String, Object> capabilities = new LinkedHashMap<>();
        capabilities.put(AmqpConstants.CAPABILITY_AUTHENTICATION_FAILURE_CLOSE, true);
        capabilities.put(AmqpConstants.CAPABILITY_CONNECTION_BLOCKED, true);

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("product", "amqp-harness");
        properties.put("platform", "Java");
        properties.put("information", "connection diagnosis probe");
        properties.put("capabilities", capabilities);
        return properties;
    }
}
