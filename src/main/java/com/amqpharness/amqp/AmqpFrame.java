package com.amqpharness.amqp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufHolder;
import io.netty.buffer.Unpooled;

/**
 * A single AMQP 0-9-1 frame. Implements {@link ByteBufHolder} so Netty releases the
 * payload once the frame has been written or consumed.
 */
public class AmqpFrame implements ByteBufHolder {
    public static final int FRAME_HEADER_SIZE = 7;
    public static final int FRAME_END_SIZE = 1;
    public static final byte FRAME_END = (byte) 0xCE;

    private final byte type;
    private final short channel;
    private final int size;
    private final ByteBuf payload;

    public AmqpFrame(byte type, short channel, ByteBuf payload) {
        this.type = type;
        this.channel = channel;
        this.payload = payload;
        this.size = payload.readableBytes();
    }

    /**
     * Builds a method frame: class id and method id followed by the method arguments.
     * The arguments buffer is copied and released.
     */
    public static AmqpFrame method(short channel, short classId, short methodId, ByteBuf arguments) {
        ByteBuf body = Unpooled.buffer();
        try {
            body.writeShort(classId);
            body.writeShort(methodId);
            if (arguments != null) {
                body.writeBytes(arguments);
            }
        } catch (RuntimeException e) {
            body.release();
            throw e;
        } finally {
            if (arguments != null) {
                arguments.release();
            }
        }
        return new AmqpFrame(FrameType.METHOD.getValue(), channel, body);
    }

    public static AmqpFrame heartbeat() {
        return new AmqpFrame(FrameType.HEARTBEAT.getValue(), (short) 0, Unpooled.EMPTY_BUFFER);
    }

    public byte getType() {
        return type;
    }

    public short getChannel() {
        return channel;
    }

    public int getSize() {
        return size;
    }

    public ByteBuf getPayload() {
        return payload;
    }

    public boolean isMethod() {
        return type == FrameType.METHOD.getValue();
    }

    public boolean isHeartbeat() {
        return type == FrameType.HEARTBEAT.getValue();
    }

    /**
     * Class id of a method frame, read without moving the reader index.
     */
    public short peekClassId() {
        requireMethodHeader();
        return payload.getShort(payload.readerIndex());
    }

    /**
     * Method id of a method frame, read without moving the reader index.
     */
    public short peekMethodId() {
        requireMethodHeader();
        return payload.getShort(payload.readerIndex() + 2);
    }

    private void requireMethodHeader() {
        if (!isMethod() || payload.readableBytes() < 4) {
            throw new IllegalStateException("Not a method frame: type=" + type + ", size=" + size);
        }
    }

    @Override
    public ByteBuf content() {
        return payload;
    }

    @Override
    public AmqpFrame copy() {
        return new AmqpFrame(type, channel, payload.copy());
    }

    @Override
    public AmqpFrame duplicate() {
        return new AmqpFrame(type, channel, payload.duplicate());
    }

    @Override
    public AmqpFrame retainedDuplicate() {
        return new AmqpFrame(type, channel, payload.retainedDuplicate());
    }

    @Override
    public AmqpFrame replace(ByteBuf content) {
        return new AmqpFrame(type, channel, content);
    }

    @Override
    public AmqpFrame retain() {
        payload.retain();
        return this;
    }

    @Override
    public AmqpFrame retain(int increment) {
        payload.retain(increment);
        return this;
    }

    @Override
    public AmqpFrame touch() {
        payload.touch();
        return this;
    }

    @Override
    public AmqpFrame touch(Object hint) {
        payload.touch(hint);
        return this;
    }

    @Override
    public int refCnt() {
        return payload.refCnt();
    }

    @Override
    public boolean release() {
        return payload.release();
    }

    @Override
    public boolean release(int decrement) {
        return payload.release(decrement);
    }

    @Override
    public String toString() {
        if (isMethod() && payload.readableBytes() >= 4) {
            return String.format("AmqpFrame{method=%d.%d, channel=%d, size=%d}",
                               peekClassId(), peekMethodId(), channel, size);
        }
        return String.format("AmqpFrame{type=%d, channel=%d, size=%d}", type, channel, size);
    }

    public enum FrameType {
        METHOD(1),
        HEADER(2),
        BODY(3),
        HEARTBEAT(8);

        private final byte value;

        FrameType(int value) {
            this.value = (byte) value;
        }

        public byte getValue() {
            return value;
        }

        public static FrameType fromValue(byte value) {
            for (FrameType type : values()) {
                if (type.value == value) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown frame type: " + value);
        }
    }
}
