package com.acme.kvstore.idalloc.retry;

import com.acme.kvstore.idalloc.lifecycle.Stopper;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Backoff loop that gives up as soon as its {@link Stopper} signals.
 *
 * <pre>{@code
 * for (Retry r = Retry.start(options, stopper); r.next(); ) {
 *     if (tryOnce()) {
 *         break;
 *     }
 * }
 * }</pre>
 *
 * <p>Not thread-safe; each retrying loop owns its own instance.
 */
public final class Retry {
    private final RetryOptions options;
    private final Stopper stopper;
    private final long maxBackoffNanos;
    private long backoffNanos;
    private int attempt;

    private Retry(RetryOptions options, Stopper stopper) {
        this.options = Objects.requireNonNull(options, "options");
        this.stopper = Objects.requireNonNull(stopper, "stopper");
        this.maxBackoffNanos = options.maxBackoff().toNanos();
        this.backoffNanos = options.initialBackoff().toNanos();
    }

    public static Retry start(RetryOptions options, Stopper stopper) {
        return new Retry(options, stopper);
    }

    /**
     * Waits out the current backoff (skipped for the first attempt) and
     * reports whether another attempt may run.
     *
     * @return false once the stopper signals, the thread is interrupted or
     *         the attempt budget is spent
     */
    public boolean next() {
        if (stopper.isStopping()) {
            return false;
        }
        if (!options.isUnbounded() && attempt >= options.maxAttempts()) {
            return false;
        }
        if (attempt > 0) {
            try {
                if (stopper.awaitStop(backoffNanos, TimeUnit.NANOSECONDS)) {
                    return false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            backoffNanos = Math.min(maxBackoffNanos, (long) (backoffNanos * options.multiplier()));
            if (stopper.isStopping()) {
                return false;
            }
        }
        attempt++;
        return true;
    }

    /** Restarts the backoff schedule and the attempt count. */
    public void reset() {
        attempt = 0;
        backoffNanos = options.initialBackoff().toNanos();
    }

    /** One-based number of the attempt most recently granted by {@link #next()}. */
    public int attempt() {
        return attempt;
    }

    long currentBackoffNanos() {
        return backoffNanos;
    }
}
