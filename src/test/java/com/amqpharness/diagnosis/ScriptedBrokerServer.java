package com.amqpharness.diagnosis;

import com.amqpharness.amqp.AmqpCodec;
import com.amqpharness.amqp.AmqpConstants;
import com.amqpharness.amqp.AmqpFrame;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Minimal broker that plays one scripted handshake per connection.
 */
final class ScriptedBrokerServer implements AutoCloseable {

    enum Script {
        /** Completes the handshake. */
        ACCEPT,
        /** Drops the socket after start-ok, as brokers do on a bad login. */
        DROP_AFTER_START_OK,
        /** Sends close 403 after start-ok. */
        REFUSE_LOGIN,
        /** Drops the socket after open, as older brokers do on a bad vhost. */
        DROP_AFTER_OPEN,
        /** Sends close 530 after open. */
        REFUSE_VHOST,
        /** Never answers. */
        SILENT
    }

    private final EventLoopGroup group = new NioEventLoopGroup(1);
    private final Channel serverChannel;

    ScriptedBrokerServer(Script script) throws InterruptedException {
        serverChannel = new ServerBootstrap()
            .group(group)
            .channel(NioServerSocketChannel.class)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ch.pipeline().addLast("frameEncoder", new AmqpCodec.AmqpFrameEncoder());
                    ch.pipeline().addLast("header", new HeaderReader());
                    ch.pipeline().addLast("script", new ScriptHandler(script));
                }
            })
            .bind("127.0.0.1", 0)
            .sync()
            .channel();
    }

    int getPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    @Override
    public void close() {
        serverChannel.close().awaitUninterruptibly();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    /**
     * Swallows the client's protocol header, then hands over to the frame decoder.
     */
    private static final class HeaderReader extends ByteToMessageDecoder {
        @Override
        protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
            if (in.readableBytes() < AmqpConstants.PROTOCOL_HEADER.length) {
                return;
            }
            in.skipBytes(AmqpConstants.PROTOCOL_HEADER.length);
            ctx.pipeline().replace(this, "frameDecoder", new AmqpCodec.AmqpFrameDecoder());
        }
    }

    private static final class ScriptHandler extends SimpleChannelInboundHandler<AmqpFrame> {
        private final Script script;

        ScriptHandler(Script script) {
            this.script = script;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception {
            if (script != Script.SILENT) {
                ctx.writeAndFlush(BrokerFrames.start("AMQPLAIN PLAIN"));
            }
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, AmqpFrame frame) {
            if (!frame.isMethod()) {
                return;
            }
            switch (frame.peekMethodId()) {
                case AmqpConstants.METHOD_CONNECTION_START_OK:
                    if (script == Script.DROP_AFTER_START_OK) {
                        ctx.close();
                    } else if (script == Script.REFUSE_LOGIN) {
                        ctx.writeAndFlush(BrokerFrames.close(AmqpConstants.REPLY_ACCESS_REFUSED,
                                                             "ACCESS_REFUSED - Login was refused"));
                    } else {
                        ctx.writeAndFlush(BrokerFrames.tune(2047, 131072, 60));
                    }
                    break;
                case AmqpConstants.METHOD_CONNECTION_OPEN:
                    if (script == Script.DROP_AFTER_OPEN) {
                        ctx.close();
                    } else if (script == Script.REFUSE_VHOST) {
                        ctx.writeAndFlush(BrokerFrames.close(AmqpConstants.REPLY_NOT_ALLOWED,
                                                             "NOT_ALLOWED - vhost not found"));
                    } else {
                        ctx.writeAndFlush(BrokerFrames.openOk());
                    }
                    break;
                case AmqpConstants.METHOD_CONNECTION_CLOSE:
                    ctx.writeAndFlush(BrokerFrames.closeOk());
                    break;
                case AmqpConstants.METHOD_CONNECTION_CLOSE_OK:
                    ctx.close();
                    break;
                default:
                    break;
            }
        }
    }
}
