package com.amqpharness.teardown;

/**
 * One or more teardown steps failed. Each failure is attached as a suppressed exception.
 */
public class TeardownException extends RuntimeException {

    public TeardownException(String message) {
        super(message);
    }
}
