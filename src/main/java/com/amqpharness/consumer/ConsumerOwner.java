package com.amqpharness.consumer;

/**
 * Something that runs consumer loops and can be killed, such as a service container.
 */
public interface ConsumerOwner {

    void kill();
}
