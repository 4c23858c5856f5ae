package com.amqpharness.pipeline;

public class ResourceCreateException extends RuntimeException {

    public ResourceCreateException(String message, Throwable cause) {
        super(message, cause);
    }
}
