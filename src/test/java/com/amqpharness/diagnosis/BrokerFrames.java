package com.amqpharness.diagnosis;

import com.amqpharness.amqp.AmqpCodec;
import com.amqpharness.amqp.AmqpConstants;
import com.amqpharness.amqp.AmqpFrame;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection methods as a broker sends them.
 */
final class BrokerFrames {

    private BrokerFrames() {
    }

    static AmqpFrame start(String mechanisms) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("product", "RabbitMQ");
        properties.put("version", "3.12.0");

        ByteBuf args = Unpooled.buffer();
        args.writeByte(0);
        args.writeByte(9);
        AmqpCodec.encodeTable(args, properties);
        AmqpCodec.encodeLongString(args, mechanisms);
        AmqpCodec.encodeLongString(args, "en_US");
        return method(AmqpConstants.METHOD_CONNECTION_START, args);
    }

    static AmqpFrame tune(int channelMax, int frameMax, int heartbeat) {
        ByteBuf args = Unpooled.buffer();
        args.writeShort(channelMax);
        args.writeInt(frameMax);
        args.writeShort(heartbeat);
        return method(AmqpConstants.METHOD_CONNECTION_TUNE, args);
    }

    static AmqpFrame openOk() {
        ByteBuf args = Unpooled.buffer();
        AmqpCodec.encodeShortString(args, "");
        return method(AmqpConstants.METHOD_CONNECTION_OPEN_OK, args);
    }

    static AmqpFrame close(int replyCode, String replyText) {
        ByteBuf args = Unpooled.buffer();
        args.writeShort(replyCode);
        AmqpCodec.encodeShortString(args, replyText);
        args.writeShort(AmqpConstants.CLASS_CONNECTION);
        args.writeShort(AmqpConstants.METHOD_CONNECTION_OPEN);
        return method(AmqpConstants.METHOD_CONNECTION_CLOSE, args);
    }

    static AmqpFrame closeOk() {
        return method(AmqpConstants.METHOD_CONNECTION_CLOSE_OK, null);
    }

    private static AmqpFrame method(short methodId, ByteBuf args) {
        return AmqpFrame.method((short) 0, AmqpConstants.CLASS_CONNECTION, methodId, args);
    }
}
