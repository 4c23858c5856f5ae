package com.amqpharness.diagnosis;

/**
 * How far the client side of the connection handshake progressed.
 */
public enum HandshakePhase {
    /** No protocol header sent yet; the socket may not even be open. */
    NOT_CONNECTED,
    AWAITING_START,
    AWAITING_TUNE,
    AWAITING_OPEN_OK,
    OPEN,
    CLOSED;

    public boolean hasStarted() {
        return this != NOT_CONNECTED;
    }

    /**
     * True once tune-ok has been sent, i.e. the broker accepted our credentials.
     */
    public boolean isTuneCompleted() {
        return compareTo(AWAITING_OPEN_OK) >= 0;
    }
}
