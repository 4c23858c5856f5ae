package com.amqpharness.amqp;

/**
 * AMQP 0-9-1 constants needed to drive the client side of the connection handshake.
 */
public final class AmqpConstants {

    private AmqpConstants() {
        // Utility class
    }

    public static final byte[] PROTOCOL_HEADER = {'A', 'M', 'Q', 'P', 0, 0, 9, 1};

    // ===== Class IDs =====
    public static final short CLASS_CONNECTION = 10;

    // ===== Connection Method IDs =====
    public static final short METHOD_CONNECTION_START = 10;
    public static final short METHOD_CONNECTION_START_OK = 11;
    public static final short METHOD_CONNECTION_SECURE = 20;
    public static final short METHOD_CONNECTION_SECURE_OK = 21;
    public static final short METHOD_CONNECTION_TUNE = 30;
    public static final short METHOD_CONNECTION_TUNE_OK = 31;
    public static final short METHOD_CONNECTION_OPEN = 40;
    public static final short METHOD_CONNECTION_OPEN_OK = 41;
    public static final short METHOD_CONNECTION_CLOSE = 50;
    public static final short METHOD_CONNECTION_CLOSE_OK = 51;
    public static final short METHOD_CONNECTION_BLOCKED = 60;
    public static final short METHOD_CONNECTION_UNBLOCKED = 61;

    // ===== AMQP Reply Codes =====
    public static final int REPLY_SUCCESS = 200;
    public static final int REPLY_CONNECTION_FORCED = 320;
    public static final int REPLY_INVALID_PATH = 402;
    public static final int REPLY_ACCESS_REFUSED = 403;
    public static final int REPLY_NOT_FOUND = 404;
    public static final int REPLY_FRAME_ERROR = 501;
    public static final int REPLY_NOT_ALLOWED = 530;
    public static final int REPLY_INTERNAL_ERROR = 541;

    // ===== SASL =====
    public static final String MECHANISM_PLAIN = "PLAIN";
    public static final String DEFAULT_LOCALE = "en_US";

    // ===== Negotiation =====
    public static final int DEFAULT_CHANNEL_MAX = 2047;
    public static final int DEFAULT_FRAME_MAX = 131072; // 128KB
    public static final int MIN_FRAME_MAX = 4096;

    public static final String CAPABILITY_AUTHENTICATION_FAILURE_CLOSE = "authentication_failure_close";
    public static final String CAPABILITY_CONNECTION_BLOCKED = "connection.blocked";
}
