package com.amqpharness.consumer;

import com.amqpharness.config.BrokerUri;
import com.amqpharness.config.TransportOptions;
import com.amqpharness.pool.BrokerConnector;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Long-running receive loop on its own broker connection.
 *
 * <p>The loop waits for broker events with a bounded drain timeout. A broker-side
 * {@code basic.cancel} (sent when the queue or its virtual host is deleted) or a
 * connection shutdown wakes the wait at once. After either, the loop reconnects unless
 * its stop flag is set; the flag is checked before and after the reconnect delay.
 */
public class ConsumerLoop implements ConsumerHandle, Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ConsumerLoop.class);

    private static final int CLOSE_TIMEOUT_MS = 2000;
    private static final long STOP_TIMEOUT_MS = 10000;

    private enum EventType {
        DELIVERY,
        CANCELLED,
        SHUTDOWN,
        WAKE
    }

    private static final class LoopEvent {
        final EventType type;
        final Channel source;
        final Delivery delivery;

        LoopEvent(EventType type, Channel source, Delivery delivery) {
            this.type = type;
            this.source = source;
            this.delivery = delivery;
        }
    }

    private final String name;
    private final BrokerUri uri;
    private final String queue;
    private final DeliveryHandler handler;
    private final BrokerConnector connector;
    private final Duration drainTimeout;
    private final Duration reconnectDelay;

    private final BlockingQueue<LoopEvent> events = new LinkedBlockingQueue<>();
    private final AtomicReference<ConsumerState> state = new AtomicReference<>(ConsumerState.CREATED);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicInteger reconnectAttempts = new AtomicInteger();
    private final AtomicInteger handled = new AtomicInteger();

    private volatile boolean stopRequested;
    private volatile boolean started;

    // Owned by the loop thread
    private Connection connection;
    private Channel channel;
    private boolean connectedBefore;

    public ConsumerLoop(String name, BrokerUri uri, String queue, DeliveryHandler handler,
                        BrokerConnector connector, ConsumerTracker tracker,
                        Duration drainTimeout, Duration reconnectDelay) {
        this.name = name;
        this.uri = uri;
        this.queue = queue;
        this.handler = handler;
        this.connector = connector;
        this.drainTimeout = drainTimeout;
        this.reconnectDelay = reconnectDelay;
        tracker.track(this);
    }

    @Override
    public void run() {
        started = true;
        logger.debug("Consumer {} starting on queue {}", name, queue);
        try {
            while (!stopRequested) {
                if (!ensureConnected()) {
                    break;
                }
                LoopEvent event = events.poll(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (event == null || event.type == EventType.WAKE) {
                    continue;
                }
                if (event.source != channel) {
                    // left over from a connection already torn down
                    continue;
                }
                switch (event.type) {
                    case DELIVERY:
                        process(event.delivery);
                        break;
                    case CANCELLED:
                        logger.info("Consumer {} cancelled by broker", name);
                        disconnect();
                        break;
                    case SHUTDOWN:
                        logger.info("Consumer {} lost its connection", name);
                        disconnect();
                        break;
                    default:
                        break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Consumer {} interrupted", name);
        } catch (RuntimeException e) {
            logger.error("Consumer {} failed", name, e);
        } finally {
            disconnect();
            markStopped();
            terminated.countDown();
            logger.debug("Consumer {} stopped after handling {} messages", name, handled.get());
        }
    }

    /**
     * Connect if needed. Returns false when the stop flag prevents (re)connecting.
     */
    private boolean ensureConnected() throws InterruptedException {
        while (channel == null || !channel.isOpen()) {
            if (stopRequested) {
                return false;
            }
            if (connectedBefore) {
                // a stop request during the delay releases the wait early
                if (stopSignal.await(reconnectDelay.toMillis(), TimeUnit.MILLISECONDS) || stopRequested) {
                    logger.debug("Consumer {} not reconnecting: stop requested", name);
                    return false;
                }
                reconnectAttempts.incrementAndGet();
                logger.info("Consumer {} reconnecting (attempt {})", name, reconnectAttempts.get());
            }
            connectedBefore = true;
            try {
                connect();
            } catch (IOException | ShutdownSignalException e) {
                logger.warn("Consumer {} could not connect to {}", name, uri, e);
                disconnect();
            }
            if (stopRequested) {
                logger.debug("Consumer {} stop requested while connecting", name);
                disconnect();
                return false;
            }
        }
        return true;
    }

    private void connect() throws IOException {
        connection = connector.connect(uri, TransportOptions.defaults());
        Channel opened = connection.createChannel();
        if (opened == null) {
            throw new IOException("No channel available on " + connection);
        }
        channel = opened;
        if (stopRequested) {
            return;
        }
        String consumerTag = opened.basicConsume(queue, false, new LoopConsumer(opened));
        logger.debug("Consumer {} consuming from {} as {}", name, queue, consumerTag);
    }

    private void process(Delivery delivery) {
        long deliveryTag = delivery.getEnvelope().getDeliveryTag();
        boolean success;
        try {
            handler.handle(delivery);
            success = true;
        } catch (Exception e) {
            logger.warn("Consumer {} failed to handle message {}", name, deliveryTag, e);
            success = false;
        }
        handled.incrementAndGet();

        try {
            if (success) {
                channel.basicAck(deliveryTag, false);
            } else {
                channel.basicReject(deliveryTag, false);
            }
        } catch (IOException | ShutdownSignalException e) {
            logger.warn("Consumer {} could not settle message {}", name, deliveryTag, e);
            disconnect();
        }
    }

    private void disconnect() {
        Connection current = connection;
        connection = null;
        channel = null;
        if (current == null || !current.isOpen()) {
            return;
        }
        try {
            current.close(CLOSE_TIMEOUT_MS);
        } catch (IOException | ShutdownSignalException e) {
            logger.debug("Consumer {} connection close failed", name, e);
        }
    }

    @Override
    public void requestStop() {
        stopRequested = true;
        if (state.compareAndSet(ConsumerState.CREATED, ConsumerState.STOP_REQUESTED)) {
            logger.debug("Stop requested for consumer {}", name);
        }
        stopSignal.countDown();
        events.offer(new LoopEvent(EventType.WAKE, null, null));
    }

    @Override
    public void stop() {
        requestStop();
        if (started) {
            try {
                if (!terminated.await(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    logger.warn("Consumer {} did not stop within {}ms", name, STOP_TIMEOUT_MS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        markStopped();
    }

    private void markStopped() {
        state.compareAndSet(ConsumerState.CREATED, ConsumerState.STOP_REQUESTED);
        state.set(ConsumerState.STOPPED);
    }

    /**
     * Wait for the loop thread to exit.
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ConsumerState getState() {
        return state.get();
    }

    @Override
    public boolean isStopRequested() {
        return stopRequested;
    }

    @Override
    public int getReconnectAttempts() {
        return reconnectAttempts.get();
    }

    public int getHandledCount() {
        return handled.get();
    }

    public String getQueue() {
        return queue;
    }

    private final class LoopConsumer extends DefaultConsumer {

        LoopConsumer(Channel channel) {
            super(channel);
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope,
                                   AMQP.BasicProperties properties, byte[] body) {
            events.offer(new LoopEvent(EventType.DELIVERY, getChannel(), new Delivery(envelope, properties, body)));
        }

        @Override
        public void handleCancel(String consumerTag) {
            events.offer(new LoopEvent(EventType.CANCELLED, getChannel(), null));
        }

        @Override
        public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
            events.offer(new LoopEvent(EventType.SHUTDOWN, getChannel(), null));
        }
    }
}
