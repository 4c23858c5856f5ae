package com.amqpharness.amqp;

import io.netty.handler.codec.DecoderException;

/**
 * Raised when the broker rejects our protocol header by echoing the header of the
 * protocol version it does support.
 */
public class ProtocolVersionMismatchException extends DecoderException {

    private final int major;
    private final int minor;
    private final int revision;

    public ProtocolVersionMismatchException(int major, int minor, int revision) {
        super(String.format("Broker does not support AMQP 0-9-1; it offered %d-%d-%d", major, minor, revision));
        this.major = major;
        this.minor = minor;
        this.revision = revision;
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getRevision() {
        return revision;
    }
}
