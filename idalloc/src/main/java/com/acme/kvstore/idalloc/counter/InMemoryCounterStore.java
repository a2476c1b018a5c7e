package com.acme.kvstore.idalloc.counter;

import com.acme.kvstore.idalloc.util.IdAllocStatusCodes;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local counter store. Backs the standalone counter node and tests.
 */
public final class InMemoryCounterStore implements CounterStore {
    private final ConcurrentHashMap<CounterKey, AtomicLong> counters = new ConcurrentHashMap<>();

    @Override
    public long increment(CounterKey key, long delta) {
        Objects.requireNonNull(key, "key");
        if (!key.isValid()) {
            throw new CounterStoreException(IdAllocStatusCodes.BAD_REQUEST, "invalid counter key");
        }
        AtomicLong counter = counters.computeIfAbsent(key, ignored -> new AtomicLong());
        try {
            return counter.updateAndGet(current -> Math.addExact(current, delta));
        } catch (ArithmeticException e) {
            throw new CounterStoreException(IdAllocStatusCodes.BAD_REQUEST,
                "counter " + key + " would overflow adding " + delta, e);
        }
    }

    /** Returns the current value of {@code key}, zero if it was never incremented. */
    public long get(CounterKey key) {
        AtomicLong value = counters.get(key);
        return value == null ? 0L : value.get();
    }

    public int size() {
        return counters.size();
    }
}
