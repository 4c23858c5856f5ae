package com.amqpharness.consumer;

import com.amqpharness.config.BrokerUri;
import com.amqpharness.pool.BrokerConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A minimal consumer owner: runs consumer loops on its own threads and stops them all
 * when killed.
 */
public class ConsumerGroup implements ConsumerOwner {
    private static final Logger logger = LoggerFactory.getLogger(ConsumerGroup.class);

    private final String name;
    private final BrokerUri uri;
    private final BrokerConnector connector;
    private final ConsumerTracker tracker;
    private final Duration drainTimeout;
    private final Duration reconnectDelay;

    private final List<ConsumerLoop> loops = new ArrayList<>();
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService executor;
    private boolean killed;

    public ConsumerGroup(String name, BrokerUri uri, BrokerConnector connector, ConsumerTracker tracker,
                         Duration drainTimeout, Duration reconnectDelay) {
        this.name = name;
        this.uri = uri;
        this.connector = connector;
        this.tracker = tracker;
        this.drainTimeout = drainTimeout;
        this.reconnectDelay = reconnectDelay;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, name + "-consumer-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start a consumer loop on the given queue.
     */
    public synchronized ConsumerLoop consume(String queue, DeliveryHandler handler) {
        if (killed) {
            throw new IllegalStateException("Consumer group " + name + " has been killed");
        }
        ConsumerLoop loop = new ConsumerLoop(name + "/" + queue + "#" + (loops.size() + 1),
                                             uri, queue, handler, connector, tracker,
                                             drainTimeout, reconnectDelay);
        loops.add(loop);
        executor.execute(loop);
        logger.debug("Consumer group {} started {}", name, loop.getName());
        return loop;
    }

    public synchronized List<ConsumerLoop> getLoops() {
        return Collections.unmodifiableList(new ArrayList<>(loops));
    }

    @Override
    public void kill() {
        List<ConsumerLoop> toStop;
        synchronized (this) {
            if (killed) {
                return;
            }
            killed = true;
            toStop = new ArrayList<>(loops);
        }
        for (ConsumerLoop loop : toStop) {
            loop.requestStop();
        }
        for (ConsumerLoop loop : toStop) {
            loop.stop();
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Consumer group {} threads did not terminate", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.debug("Consumer group {} killed ({} loops)", name, toStop.size());
    }

    public String getName() {
        return name;
    }

    public synchronized boolean isKilled() {
        return killed;
    }

    @Override
    public String toString() {
        return "ConsumerGroup{" + name + "}";
    }
}
