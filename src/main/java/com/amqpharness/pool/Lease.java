package com.amqpharness.pool;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive, temporary checkout of a pooled resource. Closing the lease returns the
 * resource to its pool, or destroys it when it was marked broken. Closing twice is a no-op.
 */
public final class Lease<T> implements AutoCloseable {

    /**
     * Receives the resource back when its lease is closed.
     */
    @FunctionalInterface
    public interface Releaser<T> {
        void release(T resource, boolean broken);
    }

    private final T resource;
    private final Releaser<T> releaser;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile boolean broken;

    public Lease(T resource, Releaser<T> releaser) {
        this.resource = resource;
        this.releaser = releaser;
    }

    public T get() {
        if (released.get()) {
            throw new IllegalStateException("Lease already released");
        }
        return resource;
    }

    /**
     * Flag the resource as failed at the transport level so the pool discards it on release.
     */
    public void markBroken() {
        broken = true;
    }

    public boolean isBroken() {
        return broken;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            releaser.release(resource, broken);
        }
    }
}
