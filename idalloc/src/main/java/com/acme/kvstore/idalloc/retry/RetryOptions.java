package com.acme.kvstore.idalloc.retry;

import com.acme.kvstore.idalloc.util.IdAllocDefaults;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff settings for {@link Retry}.
 *
 * @param initialBackoff wait before the second attempt
 * @param maxBackoff     upper bound for any single wait
 * @param multiplier     growth factor applied after each wait
 * @param maxAttempts    attempts before giving up, 0 for unbounded
 */
public record RetryOptions(Duration initialBackoff,
                           Duration maxBackoff,
                           double multiplier,
                           int maxAttempts) {

    public static final RetryOptions DEFAULT = new RetryOptions(
        Duration.ofMillis(IdAllocDefaults.DEFAULT_RETRY_INITIAL_BACKOFF_MS),
        Duration.ofMillis(IdAllocDefaults.DEFAULT_RETRY_MAX_BACKOFF_MS),
        IdAllocDefaults.DEFAULT_RETRY_MULTIPLIER,
        0
    );

    public RetryOptions {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("initialBackoff must be positive, got " + initialBackoff);
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException(
                "maxBackoff (" + maxBackoff + ") must be >= initialBackoff (" + initialBackoff + ")");
        }
        if (!(multiplier >= 1.0d)) {
            throw new IllegalArgumentException("multiplier must be >= 1, got " + multiplier);
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0, got " + maxAttempts);
        }
    }

    public static RetryOptions unbounded(Duration initialBackoff, Duration maxBackoff) {
        return new RetryOptions(initialBackoff, maxBackoff, IdAllocDefaults.DEFAULT_RETRY_MULTIPLIER, 0);
    }

    public boolean isUnbounded() {
        return maxAttempts == 0;
    }
}
