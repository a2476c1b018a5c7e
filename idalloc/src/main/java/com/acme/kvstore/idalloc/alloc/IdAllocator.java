package com.acme.kvstore.idalloc.alloc;

import com.acme.kvstore.idalloc.counter.CounterKey;
import com.acme.kvstore.idalloc.counter.CounterStore;
import com.acme.kvstore.idalloc.counter.CounterStoreException;
import com.acme.kvstore.idalloc.lifecycle.Stopper;
import com.acme.kvstore.idalloc.retry.Retry;
import com.acme.kvstore.idalloc.retry.RetryOptions;
import com.acme.kvstore.idalloc.telemetry.AllocatorMetrics;
import com.acme.kvstore.idalloc.telemetry.NoopAllocatorMetrics;
import com.acme.kvstore.idalloc.util.IdAllocStatusCodes;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hands out unique, monotonically increasing IDs reserved in blocks from a
 * {@link CounterStore}.
 *
 * <p>A single background worker (registered with the {@link Stopper}) reserves
 * blocks of {@code blockSize} IDs with one atomic increment each and feeds
 * them, in ascending order, into a bounded buffer of {@code blockSize / 2 + 1}
 * slots. Callers of {@link #allocate()} pop from that buffer and block only
 * while it is empty. Because the worker moves on to the next reservation as
 * soon as the last ID of a block fits into the buffer, steady-state callers
 * are served from memory.
 *
 * <h3>Reservation round</h3>
 * <ol>
 *   <li>Read the current key; an {@link CounterKey#INVALID invalid} key is a
 *       transient outage and is retried with backoff.</li>
 *   <li>{@code increment(key, blockSize)} inside a stopper task; store
 *       failures are retried with backoff, never surfaced to callers.</li>
 *   <li>While the new value is below {@code minId} the whole block is below
 *       the floor; increment again immediately.</li>
 *   <li>The block is {@code [max(minId, value - blockSize + 1), value]}.</li>
 * </ol>
 *
 * <p>Once the stopper begins stopping, {@link #allocate()} fails with
 * {@link AllocationCancelledException}, blocked callers are released, and
 * the worker exits without delivering further IDs.
 */
public final class IdAllocator {
    private static final Logger LOG = Logger.getLogger(IdAllocator.class.getName());

    private final AtomicReference<CounterKey> idKey;
    private final CounterStore store;
    private final long minId;
    private final int blockSize;
    private final Stopper stopper;
    private final RetryOptions retryOptions;
    private final AllocatorMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    // ring buffer of reserved IDs, guarded by lock
    private final long[] ids;
    private int head;
    private int count;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean reservationInFlight;
    private final AtomicLong allocated = new AtomicLong();
    private final AtomicLong blocksReserved = new AtomicLong();

    public IdAllocator(CounterKey idKey, CounterStore store, long minId, int blockSize, Stopper stopper) {
        this(idKey, store, minId, blockSize, stopper, RetryOptions.DEFAULT, NoopAllocatorMetrics.INSTANCE);
    }

    /**
     * @param idKey        key of the counter backing this ID class
     * @param store        store providing the atomic increment
     * @param minId        smallest ID ever returned, must be positive
     * @param blockSize    IDs reserved per increment, must be at least 1
     * @param stopper      shutdown authority; must not already be stopping
     * @param retryOptions backoff for failed reservations
     * @param metrics      metrics sink, {@code null} for none
     */
    public IdAllocator(CounterKey idKey,
                       CounterStore store,
                       long minId,
                       int blockSize,
                       Stopper stopper,
                       RetryOptions retryOptions,
                       AllocatorMetrics metrics) {
        if (minId <= 0) {
            throw new IllegalArgumentException("minId must be > 0, got " + minId);
        }
        if (blockSize < 1) {
            throw new IllegalArgumentException("blockSize must be >= 1, got " + blockSize);
        }
        this.idKey = new AtomicReference<>(Objects.requireNonNull(idKey, "idKey"));
        this.store = Objects.requireNonNull(store, "store");
        this.stopper = Objects.requireNonNull(stopper, "stopper");
        this.retryOptions = Objects.requireNonNull(retryOptions, "retryOptions");
        this.metrics = metrics == null ? NoopAllocatorMetrics.INSTANCE : metrics;
        if (stopper.isStopping()) {
            throw new IllegalStateException("stopper is already stopping");
        }
        this.minId = minId;
        this.blockSize = blockSize;
        this.ids = new long[blockSize / 2 + 1];
        stopper.addStopListener(this::wakeAll);
    }

    public static IdAllocator create(IdAllocatorConfig config,
                                     CounterKey idKey,
                                     CounterStore store,
                                     Stopper stopper,
                                     AllocatorMetrics metrics) {
        Objects.requireNonNull(config, "config");
        return new IdAllocator(idKey, store, config.minId(), config.blockSize(), stopper,
            config.retryOptions(), metrics);
    }

    /**
     * Returns the next ID, blocking while no reserved ID is buffered.
     *
     * @throws AllocationCancelledException if the stopper is stopping, either
     *         before the call or while it waits
     */
    public long allocate() {
        if (stopper.isStopping()) {
            throw cancelled();
        }
        if (started.compareAndSet(false, true)) {
            startWorker();
        }
        lock.lock();
        try {
            while (count == 0) {
                if (stopper.isStopping()) {
                    throw cancelled();
                }
                if (started.compareAndSet(false, true)) {
                    startWorker();
                }
                notEmpty.awaitUninterruptibly();
            }
            if (stopper.isStopping()) {
                throw cancelled();
            }
            long id = ids[head];
            head = (head + 1) % ids.length;
            count--;
            notFull.signal();
            metrics.setBufferDepth(count);
            allocated.incrementAndGet();
            metrics.incAllocated(1L);
            return id;
        } finally {
            lock.unlock();
        }
    }

    /** Current counter key. */
    public CounterKey idKey() {
        return idKey.get();
    }

    /**
     * Swaps the counter key. Setting {@link CounterKey#INVALID} pauses new
     * reservations until a valid key is set again; buffered IDs keep being
     * served.
     */
    public void setIdKey(CounterKey key) {
        CounterKey previous = idKey.getAndSet(Objects.requireNonNull(key, "key"));
        LOG.fine(() -> "id key changed from " + previous + " to " + key);
    }

    public long minId() {
        return minId;
    }

    public int blockSize() {
        return blockSize;
    }

    public IdAllocatorStats stats() {
        int buffered;
        lock.lock();
        try {
            buffered = count;
        } finally {
            lock.unlock();
        }
        return new IdAllocatorStats(allocated.get(), blocksReserved.get(), buffered,
            reservationInFlight, started.get());
    }

    private void startWorker() {
        String name = "id-allocator-" + idKey.get();
        if (!stopper.runWorker(name, this::reserveLoop)) {
            LOG.fine(() -> "id allocator worker not started, stopper is stopping");
        }
    }

    private void reserveLoop() {
        try {
            reserveBlocks();
        } finally {
            if (!stopper.isStopping()) {
                // the next waiting or arriving caller starts a fresh worker
                LOG.warning("id allocator worker for " + idKey.get() + " exited before stop");
                started.set(false);
                wakeAll();
            }
        }
    }

    private void reserveBlocks() {
        while (!stopper.isStopping()) {
            reservationInFlight = true;
            OptionalLong last;
            try {
                last = reserveBlock();
            } finally {
                reservationInFlight = false;
            }
            if (last.isEmpty()) {
                return;
            }
            long end = last.getAsLong();
            long first = Math.max(minId, end - blockSize + 1);
            blocksReserved.incrementAndGet();
            metrics.incBlocksReserved(1L);
            LOG.fine(() -> "reserved ids [" + first + ", " + end + "] from " + idKey.get());
            // end may be Long.MAX_VALUE, so stop on equality instead of id <= end
            for (long id = first; ; id++) {
                if (!push(id)) {
                    return;
                }
                if (id == end) {
                    break;
                }
            }
        }
    }

    /**
     * Increments until the counter lands at or above {@code minId}.
     *
     * @return the last ID of the reserved block, or empty if stopped or
     *         interrupted first
     */
    private OptionalLong reserveBlock() {
        while (true) {
            OptionalLong newValue = incrementWithRetry();
            if (newValue.isEmpty() || newValue.getAsLong() >= minId) {
                return newValue;
            }
            long below = newValue.getAsLong();
            metrics.incCompensatingIncrements(1L);
            LOG.fine(() -> "counter " + idKey.get() + " at " + below + " is below minId=" + minId
                + ", reserving another block");
        }
    }

    private OptionalLong incrementWithRetry() {
        Retry retry = Retry.start(retryOptions, stopper);
        int failures = 0;
        while (true) {
            if (!retry.next()) {
                if (stopper.isStopping() || Thread.currentThread().isInterrupted()) {
                    return OptionalLong.empty();
                }
                // attempt budget spent; reservations never give up while running
                retry.reset();
                continue;
            }
            CounterKey key = idKey.get();
            if (!key.isValid()) {
                metrics.incFailedIncrements(1L, IdAllocStatusCodes.BAD_REQUEST);
                if (++failures == 1) {
                    LOG.warning("unable to allocate " + blockSize + " ids: counter key is invalid");
                }
                continue;
            }
            if (!stopper.startTask()) {
                return OptionalLong.empty();
            }
            try {
                return OptionalLong.of(store.increment(key, blockSize));
            } catch (CounterStoreException e) {
                metrics.incFailedIncrements(1L, e.statusCode());
                logFailedIncrement(key, ++failures, e);
            } catch (RuntimeException e) {
                metrics.incFailedIncrements(1L, IdAllocStatusCodes.INTERNAL_ERROR);
                logFailedIncrement(key, ++failures, e);
            } finally {
                stopper.finishTask();
            }
        }
    }

    private void logFailedIncrement(CounterKey key, int failures, RuntimeException e) {
        String message = "unable to allocate " + blockSize + " ids from " + key + " failures=" + failures;
        if (failures == 1) {
            LOG.log(Level.WARNING, message, e);
        } else {
            LOG.fine(() -> message + ": " + e);
        }
    }

    private boolean push(long id) {
        lock.lock();
        try {
            while (count == ids.length) {
                if (stopper.isStopping()) {
                    return false;
                }
                notFull.awaitUninterruptibly();
            }
            if (stopper.isStopping()) {
                return false;
            }
            ids[(head + count) % ids.length] = id;
            count++;
            notEmpty.signal();
            metrics.setBufferDepth(count);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void wakeAll() {
        lock.lock();
        try {
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private AllocationCancelledException cancelled() {
        metrics.incCancelled(1L);
        return new AllocationCancelledException("could not allocate id from " + idKey.get()
            + "; system is stopping");
    }
}
