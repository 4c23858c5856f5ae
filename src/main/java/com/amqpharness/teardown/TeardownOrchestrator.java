package com.amqpharness.teardown;

import com.amqpharness.consumer.ConsumerTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Tears down one test's fixtures in a fixed order:
 * <ol>
 *   <li>isolation resources (deleting a vhost makes the broker cancel its consumers),</li>
 *   <li>the stop flag on every tracked consumer,</li>
 *   <li>consumer owners,</li>
 *   <li>the consumer tracker.</li>
 * </ol>
 * Within a stage, the most recently registered action runs first. Every step runs even
 * if an earlier one failed.
 */
public class TeardownOrchestrator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TeardownOrchestrator.class);

    /**
     * A teardown step.
     */
    @FunctionalInterface
    public interface TeardownAction {
        void run() throws Exception;
    }

    private static final class Step {
        final String name;
        final TeardownAction action;

        Step(String name, TeardownAction action) {
            this.name = name;
            this.action = action;
        }
    }

    private final ConsumerTracker tracker;
    private final Deque<Step> isolationTeardowns = new ArrayDeque<>();
    private final Deque<Step> ownerTeardowns = new ArrayDeque<>();
    private boolean closed;

    public TeardownOrchestrator(ConsumerTracker tracker) {
        this.tracker = tracker;
    }

    public ConsumerTracker getTracker() {
        return tracker;
    }

    public synchronized void registerIsolationTeardown(String name, TeardownAction action) {
        ensureOpen();
        isolationTeardowns.push(new Step(name, action));
    }

    public synchronized void registerConsumerOwnerTeardown(String name, TeardownAction action) {
        ensureOpen();
        ownerTeardowns.push(new Step(name, action));
    }

    /**
     * Names of the registered isolation steps, in the order they will run.
     */
    public synchronized List<String> getIsolationSteps() {
        return names(isolationTeardowns);
    }

    /**
     * Names of the registered consumer-owner steps, in the order they will run.
     */
    public synchronized List<String> getConsumerOwnerSteps() {
        return names(ownerTeardowns);
    }

    private static List<String> names(Deque<Step> steps) {
        List<String> names = new ArrayList<>();
        for (Step step : steps) {
            names.add(step.name);
        }
        return names;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Teardown has already run");
        }
    }

    @Override
    public void close() {
        List<Step> isolation;
        List<Step> owners;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            isolation = new ArrayList<>(isolationTeardowns);
            owners = new ArrayList<>(ownerTeardowns);
            isolationTeardowns.clear();
            ownerTeardowns.clear();
        }

        List<Throwable> failures = new ArrayList<>();
        long start = System.nanoTime();

        runAll(isolation, failures);

        try {
            tracker.requestStopAll();
        } catch (RuntimeException e) {
            logger.warn("Failed to flag consumers to stop", e);
            failures.add(e);
        }

        runAll(owners, failures);

        tracker.close();

        logger.debug("Teardown finished in {}ms ({} isolation, {} owner steps, {} failures)",
                     (System.nanoTime() - start) / 1_000_000, isolation.size(), owners.size(), failures.size());

        if (!failures.isEmpty()) {
            TeardownException exception = new TeardownException(failures.size() + " teardown step(s) failed");
            failures.forEach(exception::addSuppressed);
            throw exception;
        }
    }

    private static void runAll(List<Step> steps, List<Throwable> failures) {
        for (Step step : steps) {
            try {
                step.action.run();
                logger.debug("Tore down {}", step.name);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                logger.warn("Teardown of {} failed", step.name, e);
                failures.add(e);
            }
        }
    }
}
