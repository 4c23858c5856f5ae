package com.amqpharness.consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records every consumer loop created during one test so they can all be told to stop
 * before their owners are killed. Registrations after {@link #close()} are ignored.
 */
public class ConsumerTracker implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConsumerTracker.class);

    private final List<ConsumerHandle> tracked = new ArrayList<>();
    private boolean closed;

    public synchronized void track(ConsumerHandle handle) {
        if (closed) {
            logger.debug("Tracker closed, not tracking consumer {}", handle.getName());
            return;
        }
        tracked.add(handle);
    }

    /**
     * Set the stop flag on every tracked consumer.
     */
    public void requestStopAll() {
        List<ConsumerHandle> handles = getTracked();
        for (ConsumerHandle handle : handles) {
            handle.requestStop();
        }
        logger.debug("Requested stop on {} consumers", handles.size());
    }

    public synchronized List<ConsumerHandle> getTracked() {
        return Collections.unmodifiableList(new ArrayList<>(tracked));
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        closed = true;
        tracked.clear();
    }
}
