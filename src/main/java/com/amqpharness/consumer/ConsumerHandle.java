package com.amqpharness.consumer;

/**
 * A registered reference to a long-running receive loop.
 */
public interface ConsumerHandle {

    String getName();

    ConsumerState getState();

    /**
     * Set the cooperative stop flag. Once set, the loop never reconnects.
     */
    void requestStop();

    boolean isStopRequested();

    /**
     * Request a stop and wait for the loop to finish.
     */
    void stop();

    /**
     * Number of reconnects attempted after a cancel or connection loss.
     */
    int getReconnectAttempts();
}
