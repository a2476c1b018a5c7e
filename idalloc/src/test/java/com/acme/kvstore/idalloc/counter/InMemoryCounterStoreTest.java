package com.acme.kvstore.idalloc.counter;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryCounterStoreTest {

    @Test
    void shouldTreatMissingKeyAsZeroAndAllowNegativeValues() {
        InMemoryCounterStore store = new InMemoryCounterStore();
        CounterKey key = CounterKey.of("range-id-generator");

        assertEquals(0L, store.get(key));
        assertEquals(-1024L, store.increment(key, -1024));
        assertEquals(-1014L, store.increment(key, 10));
        assertEquals(1, store.size());
    }

    @Test
    void shouldRejectInvalidKey() {
        InMemoryCounterStore store = new InMemoryCounterStore();
        CounterStoreException e = assertThrows(CounterStoreException.class,
            () -> store.increment(CounterKey.INVALID, 10));
        assertEquals(400, e.statusCode());
        assertEquals(0, store.size());
    }

    @Test
    void shouldRejectOverflowWithoutChangingValue() {
        InMemoryCounterStore store = new InMemoryCounterStore();
        CounterKey key = CounterKey.of("range-id-generator");
        store.increment(key, Long.MAX_VALUE - 1);

        CounterStoreException up = assertThrows(CounterStoreException.class, () -> store.increment(key, 10));
        assertEquals(400, up.statusCode());
        assertEquals(Long.MAX_VALUE - 1, store.get(key));
        assertEquals(Long.MAX_VALUE, store.increment(key, 1));

        CounterKey negative = CounterKey.of("negative");
        store.increment(negative, Long.MIN_VALUE);
        assertThrows(CounterStoreException.class, () -> store.increment(negative, -1));
        assertEquals(Long.MIN_VALUE, store.get(negative));
    }

    @Test
    void shouldApplyConcurrentIncrementsAtomically() throws Exception {
        InMemoryCounterStore store = new InMemoryCounterStore();
        CounterKey key = CounterKey.of("node-id-generator");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 1_000; i++) {
                        store.increment(key, 3);
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(24_000L, store.get(key));
    }

    @Test
    void shouldExposeInvalidKeySentinel() {
        assertFalse(CounterKey.INVALID.isValid());
        assertTrue(CounterKey.of("x").isValid());
        assertEquals("<invalid>", CounterKey.INVALID.toString());
        assertEquals("x", CounterKey.of("x").toString());
        assertThrows(NullPointerException.class, () -> CounterKey.of(null));
    }
}
