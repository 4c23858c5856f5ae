package com.amqpharness.confirms;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.ConfirmListener;
import com.rabbitmq.client.ReturnListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Tracks outstanding publish sequence numbers on a confirming channel, together with
 * nacks and returned (unroutable) messages reported by the broker.
 */
public class ConfirmTracker implements ConfirmListener, ReturnListener {
    private static final Logger logger = LoggerFactory.getLogger(ConfirmTracker.class);

    private final NavigableMap<Long, PendingConfirm> pendingConfirms = new ConcurrentSkipListMap<>();
    private final NavigableMap<Long, PendingConfirm> nacked = new ConcurrentSkipListMap<>();
    private final Queue<ReturnedMessage> returned = new ConcurrentLinkedQueue<>();

    public void addPendingConfirm(long sequenceNumber, String exchange, String routingKey) {
        pendingConfirms.put(sequenceNumber, new PendingConfirm(exchange, routingKey));
        logger.debug("Added pending confirm for sequence number: {}", sequenceNumber);
    }

    /**
     * Forget a sequence number whose confirm will no longer be awaited.
     */
    public void removePending(long sequenceNumber) {
        pendingConfirms.remove(sequenceNumber);
        nacked.remove(sequenceNumber);
    }

    @Override
    public void handleAck(long deliveryTag, boolean multiple) {
        settle(deliveryTag, multiple, false);
    }

    @Override
    public void handleNack(long deliveryTag, boolean multiple) {
        settle(deliveryTag, multiple, true);
    }

    private void settle(long deliveryTag, boolean multiple, boolean isNack) {
        Map<Long, PendingConfirm> settled = multiple
            ? pendingConfirms.headMap(deliveryTag, true)
            : pendingConfirms.subMap(deliveryTag, true, deliveryTag, true);

        if (isNack) {
            nacked.putAll(settled);
            logger.debug("Broker nacked up to sequence number: {} (multiple={})", deliveryTag, multiple);
        } else {
            logger.debug("Broker acked up to sequence number: {} (multiple={})", deliveryTag, multiple);
        }
        settled.clear();
    }

    @Override
    public void handleReturn(int replyCode, String replyText, String exchange, String routingKey,
                             AMQP.BasicProperties properties, byte[] body) {
        logger.debug("Message returned from exchange '{}' with routing key '{}': {} {}",
                     exchange, routingKey, replyCode, replyText);
        returned.add(new ReturnedMessage(replyCode, replyText, exchange, routingKey));
    }

    /**
     * @return whether the broker nacked the given sequence number; clears the record
     */
    public boolean takeNack(long sequenceNumber) {
        return nacked.remove(sequenceNumber) != null;
    }

    /**
     * @return the oldest returned message not yet taken, or {@code null}
     */
    public ReturnedMessage takeReturned() {
        return returned.poll();
    }

    public void clearReturned() {
        returned.clear();
    }

    public boolean isPending(long sequenceNumber) {
        return pendingConfirms.containsKey(sequenceNumber);
    }

    public int getPendingConfirmCount() {
        return pendingConfirms.size();
    }

    public void clear() {
        pendingConfirms.clear();
        nacked.clear();
        returned.clear();
    }

    private static final class PendingConfirm {
        final String exchange;
        final String routingKey;
        final long timestamp;

        PendingConfirm(String exchange, String routingKey) {
            this.exchange = exchange;
            this.routingKey = routingKey;
            this.timestamp = System.currentTimeMillis();
        }

        @Override
        public String toString() {
            return String.format("PendingConfirm{exchange=%s, routingKey=%s, age=%dms}",
                               exchange, routingKey, System.currentTimeMillis() - timestamp);
        }
    }

    public static final class ReturnedMessage {
        private final int replyCode;
        private final String replyText;
        private final String exchange;
        private final String routingKey;

        ReturnedMessage(int replyCode, String replyText, String exchange, String routingKey) {
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
}
