package com.amqpharness.consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Remembers every consumer owner it makes and kills them all on close. One failing
 * kill does not stop the others from being killed.
 */
public class ConsumerOwnerFactory<T extends ConsumerOwner> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConsumerOwnerFactory.class);

    private final List<T> owners = new CopyOnWriteArrayList<>();
    private final List<RuntimeException> killFailures = new CopyOnWriteArrayList<>();

    public T create(Supplier<? extends T> supplier) {
        return register(supplier.get());
    }

    public T register(T owner) {
        owners.add(owner);
        return owner;
    }

    public List<T> getOwners() {
        return Collections.unmodifiableList(new ArrayList<>(owners));
    }

    public List<RuntimeException> getKillFailures() {
        return Collections.unmodifiableList(killFailures);
    }

    @Override
    public void close() {
        for (T owner : owners) {
            try {
                owner.kill();
            } catch (RuntimeException e) {
                logger.warn("Failed to kill {}", owner, e);
                killFailures.add(e);
            }
        }
        owners.clear();
    }
}
