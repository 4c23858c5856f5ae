package com.amqpharness.confirms;

import java.io.IOException;

/**
 * Raised when publisher confirms are enabled and the broker could not route or persist
 * a message. This is a delivery failure, not a transient fault.
 */
public class UndeliverableMessageException extends IOException {

    private final int replyCode;
    private final String replyText;
    private final String exchange;
    private final String routingKey;

    public UndeliverableMessageException(int replyCode, String replyText, String exchange, String routingKey) {
        super(String.format("Message to exchange '%s' with routing key '%s' was not delivered: %d %s",
                            exchange, routingKey, replyCode, replyText));
        this.replyCode = replyCode;
        this.replyText = replyText;
        this.exchange = exchange;
        this.routingKey = routingKey;
    }

    public int getReplyCode() {
        return replyCode;
    }

    public String getReplyText() {
        return replyText;
    }

    public String getExchange() {
        return exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }
}
