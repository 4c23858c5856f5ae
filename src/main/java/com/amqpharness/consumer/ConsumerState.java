package com.amqpharness.consumer;

/**
 * Lifecycle of a consumer loop. A loop always passes through {@link #STOP_REQUESTED}
 * on its way to {@link #STOPPED}.
 */
public enum ConsumerState {
    CREATED,
    STOP_REQUESTED,
    STOPPED
}
