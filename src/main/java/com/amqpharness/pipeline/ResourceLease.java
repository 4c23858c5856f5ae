package com.amqpharness.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive checkout of one pipeline resource. {@link #close()} hands it back for reuse;
 * {@link #discard()} destroys it immediately. Only the first of the two has any effect.
 */
public final class ResourceLease<T> implements AutoCloseable {

    private final ResourcePipeline<T> pipeline;
    private final T resource;
    private final AtomicBoolean returned = new AtomicBoolean(false);

    ResourceLease(ResourcePipeline<T> pipeline, T resource) {
        this.pipeline = pipeline;
        this.resource = resource;
    }

    public T get() {
        if (returned.get()) {
            throw new IllegalStateException("Lease on " + resource + " already returned");
        }
        return resource;
    }

    /**
     * Destroy the resource now instead of returning it.
     *
     * @throws ResourceDestroyException if the destroy callback fails
     */
    public void discard() {
        if (returned.compareAndSet(false, true)) {
            pipeline.discard(resource);
        }
    }

    public boolean isReturned() {
        return returned.get();
    }

    @Override
    public void close() {
        if (returned.compareAndSet(false, true)) {
            pipeline.release(resource);
        }
    }

    @Override
    public String toString() {
        return "ResourceLease{" + resource + (returned.get() ? ", returned}" : "}");
    }
}
