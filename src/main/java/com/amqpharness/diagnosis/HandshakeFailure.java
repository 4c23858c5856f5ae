package com.amqpharness.diagnosis;

import java.util.Objects;

/**
 * What went wrong during a handshake attempt, reduced to a kind plus the original error.
 */
public final class HandshakeFailure {

    public enum Kind {
        CONNECT_FAILED,
        SOCKET_CLOSED,
        BROKER_CLOSE,
        TIMEOUT,
        TLS,
        PROTOCOL
    }

    private final Kind kind;
    private final Throwable cause;

    public HandshakeFailure(Kind kind, Throwable cause) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.cause = Objects.requireNonNull(cause, "cause");
    }

    public Kind getKind() {
        return kind;
    }

    public Throwable getCause() {
        return cause;
    }

    /**
     * Reply code of a structured broker close, or -1 for every other kind.
     */
    public int getReplyCode() {
        if (cause instanceof BrokerClosedException) {
            return ((BrokerClosedException) cause).getReplyCode();
        }
        return -1;
    }

    @Override
    public String toString() {
        return String.format("HandshakeFailure{kind=%s, cause=%s}", kind, cause);
    }
}
