package com.ledger.anomaly.engine;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of analysis identifiers. Injected so that test runs can be made reproducible.
 */
@FunctionalInterface
public interface IdGenerator {

    String nextId();

    static IdGenerator uuid(String prefix) {
        return () -> prefix + "-" + UUID.randomUUID();
    }

    static IdGenerator sequential(String prefix) {
        AtomicLong counter = new AtomicLong();
        return () -> String.format("%s-%06d", prefix, counter.incrementAndGet());
    }
}
