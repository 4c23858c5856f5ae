package com.amqpharness.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Creates ephemeral resources on demand, lends them out exclusively and reuses them
 * across leases until the pipeline shuts down, at which point every resource it ever
 * created is destroyed.
 *
 * <p>Resources are created only when a lease is requested and none is idle, so the
 * number created never exceeds the peak number of concurrent leases. Creation and
 * destruction run outside the pipeline lock.
 */
public class ResourcePipeline<T> {
    private static final Logger logger = LoggerFactory.getLogger(ResourcePipeline.class);

    @FunctionalInterface
    public interface Creator<T> {
        T create() throws Exception;
    }

    @FunctionalInterface
    public interface Destroyer<T> {
        void destroy(T resource) throws Exception;
    }

    private enum State {
        NEW,
        RUNNING,
        SHUT_DOWN
    }

    private final String name;
    private final Creator<T> creator;
    private final Destroyer<T> destroyer;

    private final Object lock = new Object();
    private final Deque<T> idle = new ArrayDeque<>();
    private final Set<T> leased = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<T> live = Collections.newSetFromMap(new IdentityHashMap<>());
    private final List<Throwable> destroyFailures = new CopyOnWriteArrayList<>();

    private State state = State.NEW;
    // leases handed out plus creations in flight
    private int outstanding;
    private int created;
    private int peakLeased;

    public ResourcePipeline(String name, Creator<T> creator, Destroyer<T> destroyer) {
        this.name = name;
        this.creator = creator;
        this.destroyer = destroyer;
    }

    /**
     * Activate the pipeline. A pipeline runs once.
     */
    public PipelineHandle<T> run() {
        synchronized (lock) {
            if (state != State.NEW) {
                throw new IllegalStateException("Pipeline " + name + " has already been run");
            }
            state = State.RUNNING;
        }
        logger.debug("Pipeline {} started", name);
        return new PipelineHandle<>(this);
    }

    ResourceLease<T> get() {
        synchronized (lock) {
            ensureRunning();
            outstanding++;
            peakLeased = Math.max(peakLeased, outstanding);
            T resource = idle.pollFirst();
            if (resource != null) {
                leased.add(resource);
                logger.debug("Pipeline {} reused {}", name, resource);
                return new ResourceLease<>(this, resource);
            }
        }

        T resource;
        try {
            resource = creator.create();
            if (resource == null) {
                throw new IllegalStateException("Creator returned null");
            }
        } catch (Exception e) {
            synchronized (lock) {
                outstanding--;
            }
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new ResourceCreateException("Pipeline " + name + " failed to create a resource", e);
        }

        boolean shutDown;
        synchronized (lock) {
            created++;
            shutDown = state == State.SHUT_DOWN;
            if (shutDown) {
                outstanding--;
            } else {
                live.add(resource);
                leased.add(resource);
            }
        }
        if (shutDown) {
            destroyQuietly(resource);
            throw new IllegalStateException("Pipeline " + name + " shut down while creating a resource");
        }
        logger.debug("Pipeline {} created {}", name, resource);
        return new ResourceLease<>(this, resource);
    }

    void release(T resource) {
        boolean destroy;
        synchronized (lock) {
            leased.remove(resource);
            outstanding--;
            destroy = state == State.SHUT_DOWN;
            if (destroy) {
                live.remove(resource);
            } else {
                idle.addFirst(resource);
            }
        }
        if (destroy) {
            destroyQuietly(resource);
        } else {
            logger.debug("Pipeline {} got {} back", name, resource);
        }
    }

    void discard(T resource) {
        synchronized (lock) {
            leased.remove(resource);
            live.remove(resource);
            outstanding--;
        }
        try {
            destroyer.destroy(resource);
            logger.debug("Pipeline {} discarded {}", name, resource);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            ResourceDestroyException failure =
                new ResourceDestroyException("Pipeline " + name + " failed to destroy " + resource, e);
            destroyFailures.add(failure);
            throw failure;
        }
    }

    /**
     * Destroy all idle resources and stop lending. Leases still outstanding are destroyed
     * when returned. Destroy failures are collected, not thrown.
     */
    void shutdown() {
        List<T> toDestroy;
        synchronized (lock) {
            if (state == State.SHUT_DOWN) {
                return;
            }
            state = State.SHUT_DOWN;
            toDestroy = new ArrayList<>(idle);
            idle.clear();
            live.removeAll(toDestroy);
            if (!leased.isEmpty()) {
                logger.warn("Pipeline {} shutting down with {} resources still leased", name, leased.size());
            }
        }
        for (T resource : toDestroy) {
            destroyQuietly(resource);
        }
        logger.debug("Pipeline {} shut down after creating {} resources", name, created);
    }

    private void destroyQuietly(T resource) {
        try {
            destroyer.destroy(resource);
            logger.debug("Pipeline {} destroyed {}", name, resource);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            logger.warn("Pipeline {} failed to destroy {}", name, resource, e);
            destroyFailures.add(new ResourceDestroyException("Pipeline " + name + " failed to destroy " + resource, e));
        }
    }

    private void ensureRunning() {
        if (state != State.RUNNING) {
            throw new IllegalStateException("Pipeline " + name + " is not running (" + state + ")");
        }
    }

    public PipelineStats getStats() {
        synchronized (lock) {
            return new PipelineStats(created, live.size(), idle.size(), leased.size(), peakLeased);
        }
    }

    public List<Throwable> getDestroyFailures() {
        return Collections.unmodifiableList(destroyFailures);
    }

    public String getName() {
        return name;
    }
}
