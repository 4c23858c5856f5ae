package com.amqpharness.diagnosis;

import java.io.IOException;
import java.util.Objects;

/**
 * A connection failure relabelled with its probable cause. The low-level failure is
 * always kept as the cause.
 */
public class ConnectionRefusedException extends IOException {

    public enum Reason {
        BAD_CREDENTIALS,
        BAD_VIRTUAL_HOST
    }

    private final Reason reason;

    public ConnectionRefusedException(Reason reason, String message, Throwable cause) {
        super(message, Objects.requireNonNull(cause, "cause"));
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
