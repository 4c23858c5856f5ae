package com.amqpharness.consumer;

import com.rabbitmq.client.Delivery;

/**
 * Processes one message. Returning normally acks it; throwing rejects it without requeue.
 */
@FunctionalInterface
public interface DeliveryHandler {

    void handle(Delivery delivery) throws Exception;
}
