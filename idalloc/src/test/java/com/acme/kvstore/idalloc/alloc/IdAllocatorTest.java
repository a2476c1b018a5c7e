package com.acme.kvstore.idalloc.alloc;

import com.acme.kvstore.idalloc.counter.CounterKey;
import com.acme.kvstore.idalloc.counter.CounterStore;
import com.acme.kvstore.idalloc.counter.CounterStoreException;
import com.acme.kvstore.idalloc.counter.InMemoryCounterStore;
import com.acme.kvstore.idalloc.lifecycle.Stopper;
import com.acme.kvstore.idalloc.retry.RetryOptions;
import com.acme.kvstore.idalloc.telemetry.AtomicAllocatorMetrics;
import com.acme.kvstore.idalloc.telemetry.NoopAllocatorMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdAllocatorTest {
    private static final CounterKey RAFT_ID_KEY = CounterKey.of("raft-id-generator");
    private static final RetryOptions FAST_RETRY = RetryOptions.unbounded(Duration.ofMillis(1), Duration.ofMillis(10));

    private final Stopper stopper = new Stopper(Duration.ofSeconds(5));
    private final InMemoryCounterStore store = new InMemoryCounterStore();

    @AfterEach
    void tearDown() {
        stopper.stop();
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void shouldAllocateEveryIdExactlyOnceAcrossConcurrentCallers() throws Exception {
        IdAllocator idAlloc = allocator(store, 2, 10);
        BlockingQueue<Long> allocated = new LinkedBlockingQueue<>();

        ExecutorService pool = Executors.newFixedThreadPool(10);
        try {
            List<Future<?>> callers = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                callers.add(pool.submit(() -> {
                    for (int j = 0; j < 10; j++) {
                        allocated.add(idAlloc.allocate());
                    }
                    return null;
                }));
            }
            for (Future<?> caller : callers) {
                caller.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<Long> ids = new ArrayList<>(allocated);
        ids.sort(null);
        assertEquals(100, ids.size());
        for (int i = 0; i < 100; i++) {
            assertEquals(i + 2L, ids.get(i), "id #" + i);
        }
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void shouldCompensateForCounterPresetBelowFloor() {
        assertEquals(-1024L, store.increment(RAFT_ID_KEY, -1024));
        AtomicAllocatorMetrics metrics = new AtomicAllocatorMetrics();
        IdAllocator idAlloc = new IdAllocator(RAFT_ID_KEY, store, 2, 10, stopper, FAST_RETRY, metrics);

        assertEquals(2L, idAlloc.allocate());
        // -1024 + 10 * 102 = -4 is the last block wholly below the floor
        assertEquals(102L, metrics.snapshot().compensatingIncrements());
        assertEquals(3L, idAlloc.allocate());
    }

    @ParameterizedTest
    @CsvSource({
        "0, 10",
        "-5, 10",
        "2, 0",
        "2, -1"
    })
    void shouldRejectInvalidArguments(long minId, int blockSize) {
        assertThrows(IllegalArgumentException.class,
            () -> new IdAllocator(null, null, minId, blockSize, null));
    }

    @Test
    void shouldRejectStopperThatIsAlreadyStopping() {
        Stopper stopped = new Stopper();
        stopped.stop();
        assertThrows(IllegalStateException.class,
            () -> new IdAllocator(RAFT_ID_KEY, store, 2, 10, stopped));
    }

    @Test
    @Timeout(value = 15, unit = TimeUnit.SECONDS)
    void shouldServeBufferedIdsDuringOutageAndResumeOnRecovery() throws Exception {
        IdAllocator idAlloc = allocator(store, 2, 10);

        assertEquals(2L, idAlloc.allocate());

        idAlloc.setIdKey(CounterKey.INVALID);

        // The rest of the first block is still served while the worker retries.
        for (int i = 0; i < 8; i++) {
            assertEquals(i + 3L, idAlloc.allocate());
        }

        BlockingQueue<Long> allocated = new LinkedBlockingQueue<>();
        ExecutorService pool = Executors.newFixedThreadPool(10);
        try {
            for (int i = 0; i < 10; i++) {
                pool.submit(() -> allocated.add(idAlloc.allocate()));
            }

            Thread.sleep(50);
            assertTrue(allocated.isEmpty(), "allocate() must block until a block is reserved");

            idAlloc.setIdKey(RAFT_ID_KEY);

            List<Long> ids = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                Long id = allocated.poll(5, TimeUnit.SECONDS);
                assertNotNull(id, "blocked allocation #" + i + " never returned");
                ids.add(id);
            }
            ids.sort(null);
            for (int i = 0; i < 10; i++) {
                assertEquals(i + 11L, ids.get(i));
            }
        } finally {
            pool.shutdownNow();
        }

        for (int i = 0; i < 10; i++) {
            assertEquals(i + 21L, idAlloc.allocate());
        }
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void shouldCancelBlockedCallersWhenStopped() throws Exception {
        CountingStore failing = new CountingStore(store, Integer.MAX_VALUE);
        IdAllocator idAlloc = allocator(failing, 2, 10);

        int callers = 10;
        CountDownLatch started = new CountDownLatch(callers);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        List<Future<Throwable>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                outcomes.add(pool.submit(() -> {
                    started.countDown();
                    try {
                        idAlloc.allocate();
                        return null;
                    } catch (Throwable t) {
                        return t;
                    }
                }));
            }
            assertTrue(started.await(5, TimeUnit.SECONDS));
            Thread.sleep(20);

            stopper.stop();

            for (Future<Throwable> outcome : outcomes) {
                assertInstanceOf(AllocationCancelledException.class, outcome.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertTrue(stopper.awaitStopped(1, TimeUnit.SECONDS));
        assertEquals(0, idAlloc.stats().buffered());
    }

    @Test
    void shouldFailImmediatelyAfterStopWithoutTouchingStore() {
        CountingStore counting = new CountingStore(store, 0);
        IdAllocator idAlloc = allocator(counting, 2, 10);

        stopper.stop();

        AllocationCancelledException e = assertThrows(AllocationCancelledException.class, idAlloc::allocate);
        assertEquals(503, e.reasonCode());
        assertEquals(0, counting.calls.get());
        assertEquals(0L, store.get(RAFT_ID_KEY));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void shouldServeWarmBufferWithoutTouchingStore() {
        CountingStore counting = new CountingStore(store, 0);
        IdAllocator idAlloc = allocator(counting, 1, 100);

        long previous = idAlloc.allocate();
        assertEquals(1L, previous);
        for (int i = 0; i < 40; i++) {
            long id = idAlloc.allocate();
            assertEquals(previous + 1, id);
            previous = id;
        }
        assertEquals(1, counting.calls.get());
        assertEquals(100L, store.get(RAFT_ID_KEY));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void shouldAbsorbTransientStoreFailures() {
        CountingStore flaky = new CountingStore(store, 3);
        AtomicAllocatorMetrics metrics = new AtomicAllocatorMetrics();
        IdAllocator idAlloc = new IdAllocator(RAFT_ID_KEY, flaky, 2, 10, stopper, FAST_RETRY, metrics);

        assertEquals(2L, idAlloc.allocate());
        assertEquals(4, flaky.calls.get());
        AtomicAllocatorMetrics.Snapshot snapshot = metrics.snapshot();
        assertEquals(3L, snapshot.failedIncrements());
        assertEquals(3L, snapshot.failedIncrementsByReason().get(503));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void shouldHandOutSequentialIdsForSingleCallerAcrossBlocks() {
        IdAllocator idAlloc = allocator(store, 1, 3);
        for (long expected = 1; expected <= 20; expected++) {
            assertEquals(expected, idAlloc.allocate());
        }
        assertTrue(idAlloc.stats().blocksReserved() >= 7);
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void shouldAllocateWithBlockSizeOne() {
        IdAllocator idAlloc = allocator(store, 5, 1);
        assertEquals(5L, idAlloc.allocate());
        assertEquals(6L, idAlloc.allocate());
        assertEquals(7L, idAlloc.allocate());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void shouldKeepReservingAfterBoundedRetryBudgetIsSpent() throws Exception {
        RetryOptions bounded = new RetryOptions(Duration.ofMillis(1), Duration.ofMillis(1), 1.0d, 3);
        IdAllocator idAlloc = new IdAllocator(CounterKey.INVALID, store, 2, 10, stopper, bounded,
            NoopAllocatorMetrics.INSTANCE);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Long> pending = pool.submit(idAlloc::allocate);
            Thread.sleep(200);
            assertFalse(pending.isDone());

            idAlloc.setIdKey(RAFT_ID_KEY);

            assertEquals(2L, pending.get(3, TimeUnit.SECONDS));
            assertEquals(3L, idAlloc.allocate());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void shouldRestartWorkerThatDiesBeforeStop() {
        AtomicInteger calls = new AtomicInteger();
        CounterStore crashingOnce = (key, delta) -> {
            if (calls.incrementAndGet() == 1) {
                throw new Error("injected worker crash");
            }
            return store.increment(key, delta);
        };
        IdAllocator idAlloc = allocator(crashingOnce, 2, 10);

        assertEquals(2L, idAlloc.allocate());
        assertEquals(2, calls.get());
        assertEquals(0, stopper.activeTasks());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void shouldNotWrapPastLongMaxValue() {
        store.increment(RAFT_ID_KEY, Long.MAX_VALUE - 10);
        AtomicAllocatorMetrics metrics = new AtomicAllocatorMetrics();
        IdAllocator idAlloc = new IdAllocator(RAFT_ID_KEY, store, 1, 5, stopper, FAST_RETRY, metrics);

        for (long expected = Long.MAX_VALUE - 9; ; expected++) {
            assertEquals(expected, idAlloc.allocate());
            if (expected == Long.MAX_VALUE) {
                break;
            }
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
        while (metrics.snapshot().failedIncrements() == 0 && System.nanoTime() < deadline) {
            Thread.onSpinWait();
        }
        assertTrue(metrics.snapshot().failedIncrements() > 0, "overflowing increment must be rejected");
        assertEquals(0, idAlloc.stats().buffered());
        assertEquals(Long.MAX_VALUE, store.get(RAFT_ID_KEY));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void shouldLogStackTraceOnlyForFirstFailedAttempt() {
        Logger logger = Logger.getLogger(IdAllocator.class.getName());
        AtomicInteger warnings = new AtomicInteger();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                if (record.getLevel().intValue() >= Level.WARNING.intValue()) {
                    warnings.incrementAndGet();
                }
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(handler);
        try {
            CountingStore flaky = new CountingStore(store, 5);
            IdAllocator idAlloc = allocator(flaky, 2, 10);

            assertEquals(2L, idAlloc.allocate());
            assertEquals(6, flaky.calls.get());
            assertEquals(1, warnings.get());
        } finally {
            logger.removeHandler(handler);
        }
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void shouldReportStats() {
        IdAllocator idAlloc = allocator(store, 2, 10);
        IdAllocatorStats before = idAlloc.stats();
        assertEquals(0L, before.allocated());
        assertFalse(before.started());

        idAlloc.allocate();
        idAlloc.allocate();

        IdAllocatorStats after = idAlloc.stats();
        assertTrue(after.started());
        assertEquals(2L, after.allocated());
        assertEquals(1L, after.blocksReserved());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void shouldCreateFromConfig() {
        IdAllocatorConfig config = new IdAllocatorConfig(7, 4, FAST_RETRY);
        IdAllocator idAlloc = IdAllocator.create(config, RAFT_ID_KEY, store, stopper, null);

        assertEquals(7L, idAlloc.minId());
        assertEquals(4, idAlloc.blockSize());
        assertEquals(7L, idAlloc.allocate());
    }

    private IdAllocator allocator(CounterStore counterStore, long minId, int blockSize) {
        return new IdAllocator(RAFT_ID_KEY, counterStore, minId, blockSize, stopper, FAST_RETRY,
            NoopAllocatorMetrics.INSTANCE);
    }

    /** Counts increments and fails the first {@code failures} of them. */
    private static final class CountingStore implements CounterStore {
        private final CounterStore delegate;
        private final int failures;
        private final AtomicInteger calls = new AtomicInteger();

        private CountingStore(CounterStore delegate, int failures) {
            this.delegate = delegate;
            this.failures = failures;
        }

        @Override
        public long increment(CounterKey key, long delta) {
            if (calls.incrementAndGet() <= failures) {
                throw new CounterStoreException(503, "injected failure");
            }
            return delegate.increment(key, delta);
        }
    }
}
