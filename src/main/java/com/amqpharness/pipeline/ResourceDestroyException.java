package com.amqpharness.pipeline;

public class ResourceDestroyException extends RuntimeException {

    public ResourceDestroyException(String message, Throwable cause) {
        super(message, cause);
    }
}
