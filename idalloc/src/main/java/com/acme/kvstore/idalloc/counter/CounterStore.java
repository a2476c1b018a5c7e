package com.acme.kvstore.idalloc.counter;

/**
 * Increment-capable counter store backing ID allocation.
 *
 * <p>Implementations must be thread-safe and {@link #increment} must be
 * linearizable relative to every other increment of the same key. A key that
 * was never written behaves as if it held zero; values may be negative.
 */
public interface CounterStore extends AutoCloseable {
    /**
     * Atomically adds {@code delta} to the counter stored under {@code key}.
     *
     * @return the counter value after the addition
     * @throws CounterStoreException if the increment could not be applied
     */
    long increment(CounterKey key, long delta);

    @Override
    default void close() {
    }
}
