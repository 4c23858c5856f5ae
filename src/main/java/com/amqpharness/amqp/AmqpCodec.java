package com.amqpharness.amqp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.MessageToByteEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AmqpCodec {

    // Security constants - a hostile peer must not make us allocate unbounded buffers
    public static final int MAX_FRAME_SIZE = 1024 * 1024; // 1MB max frame
    public static final int MAX_SHORT_STRING_LENGTH = 255;
    public static final int MAX_LONG_STRING_LENGTH = 256 * 1024; // 256KB max string

    /**
     * Client-side frame decoder. A broker that does not speak our protocol version answers
     * the protocol header with its own header and closes; that reply is surfaced as a
     * {@link ProtocolVersionMismatchException} instead of a corrupted frame.
     */
    public static class AmqpFrameDecoder extends ByteToMessageDecoder {
        private static final int MIN_FRAME_SIZE = 8;

        @Override
        protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
            if (in.readableBytes() < MIN_FRAME_SIZE) {
                return;
            }

            int readerIndex = in.readerIndex();

            if (in.getByte(readerIndex) == 'A') {
                byte[] header = new byte[8];
                in.readBytes(header);
                if (header[1] == 'M' && header[2] == 'Q' && header[3] == 'P') {
                    throw new ProtocolVersionMismatchException(header[5], header[6], header[7]);
                }
                throw new CorruptedFrameException("Invalid frame type: " + header[0]);
            }

            byte type = in.readByte();
            short channel = in.readShort();
            int size = in.readInt();

            if (size < 0 || size > MAX_FRAME_SIZE) {
                throw new CorruptedFrameException(
                    "Invalid frame size: " + size + " (max: " + MAX_FRAME_SIZE + ")");
            }

            if (in.readableBytes() < size + 1) {
                in.readerIndex(readerIndex);
                return;
            }

            ByteBuf payload = in.readSlice(size);
            byte frameEnd = in.readByte();

            if (frameEnd != AmqpFrame.FRAME_END) {
                throw new CorruptedFrameException("Invalid frame end marker");
            }

            out.add(new AmqpFrame(type, channel, payload.retain()));
        }
    }

    public static class AmqpFrameEncoder extends MessageToByteEncoder<AmqpFrame> {
        private static final Logger logger = LoggerFactory.getLogger(AmqpFrameEncoder.class);

        @Override
        protected void encode(ChannelHandlerContext ctx, AmqpFrame frame, ByteBuf out) throws Exception {
            logger.trace("Encoding {}", frame);
            out.writeByte(frame.getType());
            out.writeShort(frame.getChannel());
            out.writeInt(frame.getSize());
            out.writeBytes(frame.getPayload());
            out.writeByte(AmqpFrame.FRAME_END);
        }
    }

    public static ByteBuf protocolHeader() {
        return Unpooled.wrappedBuffer(AmqpConstants.PROTOCOL_HEADER);
    }

    public static ByteBuf encodeShortString(ByteBuf buf, String value) {
        if (value == null) value = "";
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_SHORT_STRING_LENGTH) {
            throw new IllegalArgumentException(
                "Short string too long: " + bytes.length + " bytes (max: " + MAX_SHORT_STRING_LENGTH + ")");
        }
        buf.writeByte(bytes.length);
        buf.writeBytes(bytes);
        return buf;
    }

    public static String decodeShortString(ByteBuf buf) {
        int length = buf.readUnsignedByte();
        if (buf.readableBytes() < length) {
            throw new IllegalArgumentException(
                "Buffer underflow: need " + length + " bytes but only " + buf.readableBytes() + " available");
        }
        byte[] bytes = new byte[length];
        buf.readBytes(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public static ByteBuf encodeLongString(ByteBuf buf, String value) {
        if (value == null) value = "";
        return encodeLongBytes(buf, value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Long strings are raw octets on the wire; SASL responses carry NUL separators,
     * so they are written from bytes rather than through a String round trip.
     */
    public static ByteBuf encodeLongBytes(ByteBuf buf, byte[] bytes) {
        buf.writeInt(bytes.length);
        buf.writeBytes(bytes);
        return buf;
    }

    public static String decodeLongString(ByteBuf buf) {
        int length = buf.readInt();
        if (length < 0 || length > MAX_LONG_STRING_LENGTH) {
            throw new IllegalArgumentException(
                "Invalid long string length: " + length + " (max: " + MAX_LONG_STRING_LENGTH + ")");
        }
        if (buf.readableBytes() < length) {
            throw new IllegalArgumentException(
                "Buffer underflow: need " + length + " bytes but only " + buf.readableBytes() + " available");
        }
        byte[] bytes = new byte[length];
        buf.readBytes(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Decode an AMQP field table: 4-byte length followed by name/value pairs.
     */
    public static Map<String, Object> decodeTable(ByteBuf buf) {
        Map<String, Object> table = new LinkedHashMap<>();

        int tableLength = buf.readInt();
        if (tableLength <= 0) {
            return table;
        }

        if (tableLength > buf.readableBytes()) {
            throw new IllegalArgumentException(
                "Table length exceeds available bytes: " + tableLength + " > " + buf.readableBytes());
        }

        int endIndex = buf.readerIndex() + tableLength;

        while (buf.readerIndex() < endIndex) {
            String key = decodeShortString(buf);
            Object value = decodeFieldValue(buf);
            table.put(key, value);
        }

        return table;
    }

    /**
     * Decode a single field value; the first byte is the type indicator.
     */
    public static Object decodeFieldValue(ByteBuf buf) {
        byte type = buf.readByte();

        switch (type) {
            case 't':
                return buf.readByte() != 0;
            case 'b':
                return buf.readByte();
            case 'B':
                return buf.readUnsignedByte();
            case 's':
                return buf.readShort();
            case 'u':
                return buf.readUnsignedShort();
            case 'I':
                return buf.readInt();
            case 'i':
                return buf.readUnsignedInt();
            case 'l':
                return buf.readLong();
            case 'f':
                return buf.readFloat();
            case 'd':
                return buf.readDouble();
            case 'D':
                byte scale = buf.readByte();
                int unscaled = buf.readInt();
                return new BigDecimal(unscaled).scaleByPowerOfTen(-scale);
            case 'S':
                return decodeLongString(buf);
            case 'A':
                return decodeFieldArray(buf);
            case 'T':
                return new Date(buf.readLong() * 1000);
            case 'F':
                return decodeTable(buf);
            case 'V':
                return null;
            case 'x':
                int len = buf.readInt();
                if (len < 0 || len > buf.readableBytes()) {
                    throw new IllegalArgumentException("Invalid byte array length: " + len);
                }
                byte[] bytes = new byte[len];
                buf.readBytes(bytes);
                return bytes;
            default:
                throw new IllegalArgumentException("Unknown field type: " + (char) type);
        }
    }

    public static List<Object> decodeFieldArray(ByteBuf buf) {
        List<Object> array = new ArrayList<>();
        int arrayLength = buf.readInt();

        if (arrayLength <= 0) {
            return array;
        }

        int endIndex = buf.readerIndex() + arrayLength;

        while (buf.readerIndex() < endIndex) {
            array.add(decodeFieldValue(buf));
        }

        return array;
    }

    public static void encodeTable(ByteBuf buf, Map<String, Object> table) {
        if (table == null || table.isEmpty()) {
            buf.writeInt(0);
            return;
        }

        // Write to a temporary buffer to calculate size
        ByteBuf tempBuf = Unpooled.buffer();
        try {
            for (Map.Entry<String, Object> entry : table.entrySet()) {
                encodeShortString(tempBuf, entry.getKey());
                encodeFieldValue(tempBuf, entry.getValue());
            }

            buf.writeInt(tempBuf.readableBytes());
            buf.writeBytes(tempBuf);
        } finally {
            tempBuf.release();
        }
    }

    public static void encodeFieldValue(ByteBuf buf, Object value) {
        if (value == null) {
            buf.writeByte('V');
        } else if (value instanceof Boolean) {
            buf.writeByte('t');
            buf.writeByte((Boolean) value ? 1 : 0);
        } else if (value instanceof Byte) {
            buf.writeByte('b');
            buf.writeByte((Byte) value);
        } else if (value instanceof Short) {
            buf.writeByte('s');
            buf.writeShort((Short) value);
        } else if (value instanceof Integer) {
            buf.writeByte('I');
            buf.writeInt((Integer) value);
        } else if (value instanceof Long) {
            buf.writeByte('l');
            buf.writeLong((Long) value);
        } else if (value instanceof String) {
            buf.writeByte('S');
            encodeLongString(buf, (String) value);
        } else if (value instanceof byte[]) {
            buf.writeByte('x');
            byte[] bytes = (byte[]) value;
            buf.writeInt(bytes.length);
            buf.writeBytes(bytes);
        } else if (value instanceof Map) {
            buf.writeByte('F');
            @SuppressWarnings("unchecked")
            Map<String, Object> nestedTable = (Map<String, Object>) value;
            encodeTable(buf, nestedTable);
        } else if (value instanceof List) {
            buf.writeByte('A');
            @SuppressWarnings("unchecked")
            List<Object> list = (List<Object>) value;
            encodeFieldArray(buf, list);
        } else if (value instanceof Date) {
            buf.writeByte('T');
            buf.writeLong(((Date) value).getTime() / 1000); // AMQP timestamp is in seconds
        } else {
            buf.writeByte('S');
            encodeLongString(buf, value.toString());
        }
    }

    public static void encodeFieldArray(ByteBuf buf, List<Object> array) {
        if (array == null || array.isEmpty()) {
            buf.writeInt(0);
            return;
        }

        ByteBuf tempBuf = Unpooled.buffer();
        try {
            for (Object item : array) {
                encodeFieldValue(tempBuf, item);
            }

            buf.writeInt(tempBuf.readableBytes());
            buf.writeBytes(tempBuf);
        } finally {
            tempBuf.release();
        }
    }
}
