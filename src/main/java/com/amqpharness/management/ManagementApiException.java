package com.amqpharness.management;

/**
 * A call to the broker's management HTTP API failed.
 */
public class ManagementApiException extends RuntimeException {

    public ManagementApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ManagementApiException(String message) {
        super(message);
    }
}
