package com.amqpharness.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Bounded pool for a single key. Acquisition blocks while {@code limit} resources are
 * leased; idle resources are reused most-recently-returned first. A pool that does not
 * retain idle resources destroys every returned resource and only bounds concurrency.
 */
final class KeyedPool<T> {
    private static final Logger logger = LoggerFactory.getLogger(KeyedPool.class);

    @FunctionalInterface
    interface Factory<T> {
        T create() throws IOException;
    }

    private final String name;
    private final Semaphore permits;
    private final Deque<T> idle = new ConcurrentLinkedDeque<>();
    private final Factory<T> factory;
    private final Predicate<T> usable;
    private final Consumer<T> destroyer;
    private final AtomicInteger created = new AtomicInteger();
    private final AtomicInteger leased = new AtomicInteger();
    private final boolean retainIdle;
    private volatile boolean closed;

    KeyedPool(String name, int limit, Factory<T> factory, Predicate<T> usable, Consumer<T> destroyer) {
        this(name, limit, factory, usable, destroyer, true);
    }

    KeyedPool(String name, int limit, Factory<T> factory, Predicate<T> usable, Consumer<T> destroyer,
              boolean retainIdle) {
        if (limit < 1) {
            throw new IllegalArgumentException("Pool limit must be at least 1: " + limit);
        }
        this.name = name;
        this.permits = new Semaphore(limit, true);
        this.factory = factory;
        this.usable = usable;
        this.destroyer = destroyer;
        this.retainIdle = retainIdle;
    }

    Lease<T> acquire() throws IOException {
        ensureOpen();
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for " + name);
        }

        boolean handedOut = false;
        try {
            ensureOpen();
            T resource;
            while ((resource = idle.pollFirst()) != null) {
                if (usable.test(resource)) {
                    break;
                }
                logger.warn("Discarding closed idle resource in {}", name);
                destroy(resource);
            }
            if (resource == null) {
                resource = factory.create();
                created.incrementAndGet();
                logger.debug("Created resource #{} in {}", created.get(), name);
            }
            leased.incrementAndGet();
            handedOut = true;
            return new Lease<>(resource, this::release);
        } finally {
            if (!handedOut) {
                permits.release();
            }
        }
    }

    private void release(T resource, boolean broken) {
        leased.decrementAndGet();
        try {
            if (!retainIdle) {
                destroy(resource);
            } else if (broken || closed || !usable.test(resource)) {
                logger.debug("Destroying {} resource returned to {}", broken ? "broken" : "closed", name);
                destroy(resource);
            } else {
                idle.offerFirst(resource);
                // close() may have drained the deque between the check and the offer
                if (closed && idle.remove(resource)) {
                    destroy(resource);
                }
            }
        } finally {
            permits.release();
        }
    }

    private void destroy(T resource) {
        try {
            destroyer.accept(resource);
        } catch (RuntimeException e) {
            logger.warn("Failed to destroy resource in {}", name, e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException(name + " is closed");
        }
    }

    PoolStats stats() {
        return new PoolStats(created.get(), idle.size(), leased.get());
    }

    void close() {
        closed = true;
        T resource;
        while ((resource = idle.pollFirst()) != null) {
            destroy(resource);
        }
    }
}
