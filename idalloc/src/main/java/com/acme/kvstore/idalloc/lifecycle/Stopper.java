package com.acme.kvstore.idalloc.lifecycle;

import com.acme.kvstore.idalloc.util.IdAllocDefaults;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cooperative shutdown authority shared by long-lived components.
 *
 * <p>Components register background workers with {@link #runWorker} and wrap
 * short operations in {@link #startTask()}/{@link #finishTask()}. Blocking
 * waits observe shutdown either through {@link #awaitStop} or through a
 * {@link #addStopListener stop listener} that wakes their own conditions.
 *
 * <h3>Stop sequence</h3>
 * <ol>
 *   <li>Draining: {@link #isStopping()} becomes true, new tasks and workers
 *       are refused, and in-flight tasks are awaited.</li>
 *   <li>Signal: the stop latch is released and stop listeners run. The
 *       signal is permanent.</li>
 *   <li>Workers are joined, bounded by the worker join timeout.</li>
 *   <li>Closers run in registration order, then {@link #awaitStopped}
 *       returns.</li>
 * </ol>
 */
public final class Stopper {
    private static final Logger LOG = Logger.getLogger(Stopper.class.getName());

    private final long workerJoinTimeoutNanos;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition tasksDone = lock.newCondition();

    // guarded by lock
    private int activeTasks;
    private boolean signalled;
    private boolean closing;
    private final List<Thread> workers = new ArrayList<>();
    private final List<Runnable> stopListeners = new ArrayList<>();
    private final List<AutoCloseable> closers = new ArrayList<>();

    private volatile boolean stopping;

    public Stopper() {
        this(Duration.ofMillis(IdAllocDefaults.DEFAULT_WORKER_JOIN_TIMEOUT_MS));
    }

    public Stopper(Duration workerJoinTimeout) {
        Objects.requireNonNull(workerJoinTimeout, "workerJoinTimeout");
        this.workerJoinTimeoutNanos = Math.max(1L, workerJoinTimeout.toNanos());
    }

    /**
     * Starts {@code body} on a tracked daemon thread that {@link #stop()} joins.
     *
     * @return false if the stopper is already stopping and the worker was not started
     */
    public boolean runWorker(String name, Runnable body) {
        Objects.requireNonNull(body, "body");
        lock.lock();
        try {
            if (stopping) {
                return false;
            }
            Thread t = new Thread(() -> {
                try {
                    body.run();
                } catch (Throwable e) {
                    LOG.log(Level.SEVERE, "worker " + Thread.currentThread().getName() + " failed", e);
                }
            }, name);
            t.setDaemon(true);
            workers.add(t);
            t.start();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers an in-flight task. Every successful call must be paired with
     * {@link #finishTask()}.
     *
     * @return false once the stopper is stopping; the task must not run
     */
    public boolean startTask() {
        lock.lock();
        try {
            if (stopping) {
                return false;
            }
            activeTasks++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void finishTask() {
        lock.lock();
        try {
            if (activeTasks <= 0) {
                throw new IllegalStateException("finishTask without matching startTask");
            }
            activeTasks--;
            if (activeTasks == 0) {
                tasksDone.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /** Runs {@code task} inline as a tracked task; returns false if it was refused. */
    public boolean runTask(Runnable task) {
        Objects.requireNonNull(task, "task");
        if (!startTask()) {
            return false;
        }
        try {
            task.run();
            return true;
        } finally {
            finishTask();
        }
    }

    public int activeTasks() {
        lock.lock();
        try {
            return activeTasks;
        } finally {
            lock.unlock();
        }
    }

    /** True from the moment {@link #stop()} is called; never reverts. */
    public boolean isStopping() {
        return stopping;
    }

    public boolean isStopped() {
        return stopped.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout} for the stop signal.
     *
     * @return true if the stop signal was raised before the timeout elapsed
     */
    public boolean awaitStop(long timeout, TimeUnit unit) throws InterruptedException {
        return stopSignal.await(timeout, unit);
    }

    /** Waits up to {@code timeout} for {@link #stop()} to finish closing everything. */
    public boolean awaitStopped(long timeout, TimeUnit unit) throws InterruptedException {
        return stopped.await(timeout, unit);
    }

    /**
     * Registers a callback fired once, right after the stop signal is raised.
     * Runs immediately on the calling thread if the signal was already raised.
     */
    public void addStopListener(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        lock.lock();
        try {
            if (!signalled) {
                stopListeners.add(listener);
                return;
            }
        } finally {
            lock.unlock();
        }
        runListener(listener);
    }

    /** Registers a resource closed after all workers have been joined. */
    public void addCloser(AutoCloseable closer) {
        Objects.requireNonNull(closer, "closer");
        lock.lock();
        try {
            if (!closing) {
                closers.add(closer);
                return;
            }
        } finally {
            lock.unlock();
        }
        close(closer);
    }

    /**
     * Drains tasks, signals stop, joins workers and closes registered
     * resources. Concurrent and repeated calls return once the first call
     * has finished.
     */
    public void stop() {
        if (!stopRequested.compareAndSet(false, true)) {
            awaitStoppedUninterruptibly();
            return;
        }
        quiesce();
        signal();
        joinWorkers();
        List<AutoCloseable> toClose;
        lock.lock();
        try {
            closing = true;
            toClose = List.copyOf(closers);
            closers.clear();
        } finally {
            lock.unlock();
        }
        for (AutoCloseable closer : toClose) {
            close(closer);
        }
        stopped.countDown();
        LOG.fine("stopper stopped");
    }

    private void quiesce() {
        lock.lock();
        try {
            stopping = true;
            while (activeTasks > 0) {
                tasksDone.awaitUninterruptibly();
            }
        } finally {
            lock.unlock();
        }
    }

    private void signal() {
        List<Runnable> listeners;
        lock.lock();
        try {
            signalled = true;
            listeners = List.copyOf(stopListeners);
            stopListeners.clear();
        } finally {
            lock.unlock();
        }
        stopSignal.countDown();
        for (Runnable listener : listeners) {
            runListener(listener);
        }
    }

    private void joinWorkers() {
        List<Thread> threads;
        lock.lock();
        try {
            threads = List.copyOf(workers);
        } finally {
            lock.unlock();
        }
        long deadlineNanos = System.nanoTime() + workerJoinTimeoutNanos;
        for (Thread t : threads) {
            if (t == Thread.currentThread()) {
                continue;
            }
            long remaining = deadlineNanos - System.nanoTime();
            try {
                if (remaining > 0L) {
                    TimeUnit.NANOSECONDS.timedJoin(t, remaining);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (t.isAlive()) {
                LOG.warning("worker " + t.getName() + " still running after stop");
            }
        }
    }

    private void awaitStoppedUninterruptibly() {
        boolean interrupted = false;
        while (true) {
            try {
                stopped.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (Throwable t) {
            LOG.log(Level.WARNING, "stop listener failed", t);
        }
    }

    private static void close(AutoCloseable closer) {
        try {
            closer.close();
        } catch (Exception e) {
            LOG.log(Level.WARNING, "closer " + closer.getClass().getSimpleName() + " failed", e);
        }
    }
}
