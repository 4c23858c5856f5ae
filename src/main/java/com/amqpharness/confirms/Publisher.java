package com.amqpharness.confirms;

import com.amqpharness.config.TransportOptions;
import com.amqpharness.pool.Lease;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.MessageProperties;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.TimeoutException;

/**
 * A channel bound to a leased connection, used to send messages. With confirms enabled
 * every publish is mandatory and blocks until the broker acks it; a nack or a return
 * raises {@link UndeliverableMessageException}.
 */
public class Publisher {
    private static final Logger logger = LoggerFactory.getLogger(Publisher.class);

    // basic.nack carries no reply code
    private static final int NACK_REPLY_CODE = 0;

    private final Lease<Connection> connectionLease;
    private final Channel channel;
    private final TransportOptions options;
    private final ConfirmTracker tracker;
    private volatile boolean broken;

    Publisher(Lease<Connection> connectionLease, Channel channel, TransportOptions options, ConfirmTracker tracker) {
        this.connectionLease = connectionLease;
        this.channel = channel;
        this.options = options;
        this.tracker = tracker;
    }

    /**
     * Open a publisher on the leased connection. The lease is returned if the channel
     * cannot be set up.
     */
    public static Publisher open(Lease<Connection> connectionLease, TransportOptions options) throws IOException {
        try {
            Channel channel = connectionLease.get().createChannel();
            if (channel == null) {
                throw new IOException("No channel available on " + connectionLease.get());
            }
            ConfirmTracker tracker = null;
            if (options.isConfirmPublish()) {
                channel.confirmSelect();
                tracker = new ConfirmTracker();
                channel.addConfirmListener(tracker);
                channel.addReturnListener(tracker);
            }
            logger.debug("Opened publisher channel {} (confirmPublish={})",
                         channel.getChannelNumber(), options.isConfirmPublish());
            return new Publisher(connectionLease, channel, options, tracker);
        } catch (IOException | RuntimeException e) {
            connectionLease.close();
            throw e;
        }
    }

    public void publish(String exchange, String routingKey, byte[] body) throws IOException {
        publish(exchange, routingKey, MessageProperties.PERSISTENT_BASIC, body);
    }

    public synchronized void publish(String exchange, String routingKey,
                                     AMQP.BasicProperties properties, byte[] body) throws IOException {
        if (broken) {
            throw new IOException("Publisher channel " + channel.getChannelNumber() + " is broken");
        }
        if (!options.isConfirmPublish()) {
            sendUnconfirmed(exchange, routingKey, properties, body);
            return;
        }

        long sequenceNumber = channel.getNextPublishSeqNo();
        // the broker sends basic.return before the ack, so anything queued belongs to an earlier publish
        tracker.clearReturned();
        tracker.addPendingConfirm(sequenceNumber, exchange, routingKey);

        boolean acked;
        try {
            channel.basicPublish(exchange, routingKey, true, properties, body);
            acked = channel.waitForConfirms(options.getConfirmTimeout().toMillis());
        } catch (TimeoutException e) {
            markBroken(sequenceNumber);
            throw new IOException("No publish confirm from broker within "
                                  + options.getConfirmTimeout().toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markBroken(sequenceNumber);
            throw new InterruptedIOException("Interrupted while waiting for publish confirm");
        } catch (ShutdownSignalException e) {
            markBroken(sequenceNumber);
            throw new IOException("Channel closed while waiting for publish confirm", e);
        } catch (IOException e) {
            markBroken(sequenceNumber);
            throw e;
        }

        ConfirmTracker.ReturnedMessage returned = tracker.takeReturned();
        if (returned != null) {
            throw new UndeliverableMessageException(returned.getReplyCode(), returned.getReplyText(),
                                                    returned.getExchange(), returned.getRoutingKey());
        }
        if (!acked || tracker.takeNack(sequenceNumber)) {
            throw new UndeliverableMessageException(NACK_REPLY_CODE, "Message was nacked by the broker",
                                                    exchange, routingKey);
        }
    }

    private void markBroken(long sequenceNumber) {
        broken = true;
        tracker.removePending(sequenceNumber);
    }

    private void sendUnconfirmed(String exchange, String routingKey,
                                 AMQP.BasicProperties properties, byte[] body) throws IOException {
        try {
            channel.basicPublish(exchange, routingKey, false, properties, body);
        } catch (IOException | ShutdownSignalException e) {
            broken = true;
            throw e;
        }
    }

    public boolean isConfirmPublish() {
        return options.isConfirmPublish();
    }

    public Channel getChannel() {
        return channel;
    }

    public boolean isBroken() {
        return broken;
    }

    public boolean isUsable() {
        return !broken && channel.isOpen();
    }

    /**
     * Close the channel and return the connection lease.
     */
    public void close() {
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            logger.warn("Failed to close publisher channel {}", channel.getChannelNumber(), e);
        } finally {
            connectionLease.close();
        }
    }
}
