package com.acme.kvstore.idalloc.alloc;

import com.acme.kvstore.idalloc.retry.RetryOptions;
import com.acme.kvstore.idalloc.util.EnvVars;
import com.acme.kvstore.idalloc.util.IdAllocDefaults;
import com.acme.kvstore.idalloc.util.IdAllocEnvKeys;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Tuning for one {@link IdAllocator}. Range checks happen in the allocator's
 * constructor so a hand-built config fails the same way as direct arguments.
 */
public record IdAllocatorConfig(long minId, int blockSize, RetryOptions retryOptions) {

    public IdAllocatorConfig {
        Objects.requireNonNull(retryOptions, "retryOptions");
    }

    public static IdAllocatorConfig defaults() {
        return new IdAllocatorConfig(IdAllocDefaults.DEFAULT_MIN_ID, IdAllocDefaults.DEFAULT_BLOCK_SIZE, RetryOptions.DEFAULT);
    }

    public static IdAllocatorConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static IdAllocatorConfig fromEnv(Map<String, String> env) {
        long minId = EnvVars.getLongClamped(env, IdAllocEnvKeys.IDALLOC_MIN_ID,
            IdAllocDefaults.DEFAULT_MIN_ID, 1L, Long.MAX_VALUE);
        int blockSize = EnvVars.getIntClamped(env, IdAllocEnvKeys.IDALLOC_BLOCK_SIZE,
            IdAllocDefaults.DEFAULT_BLOCK_SIZE, 1, 1_000_000);
        long initialBackoffMs = EnvVars.getLongClamped(env, IdAllocEnvKeys.IDALLOC_RETRY_INITIAL_BACKOFF_MS,
            IdAllocDefaults.DEFAULT_RETRY_INITIAL_BACKOFF_MS, 1L, 60_000L);
        long maxBackoffMs = EnvVars.getLongClamped(env, IdAllocEnvKeys.IDALLOC_RETRY_MAX_BACKOFF_MS,
            IdAllocDefaults.DEFAULT_RETRY_MAX_BACKOFF_MS, initialBackoffMs, 600_000L);
        double multiplier = EnvVars.getDoubleClamped(env, IdAllocEnvKeys.IDALLOC_RETRY_MULTIPLIER,
            IdAllocDefaults.DEFAULT_RETRY_MULTIPLIER, 1.0d, 10.0d);
        RetryOptions retry = new RetryOptions(
            Duration.ofMillis(initialBackoffMs),
            Duration.ofMillis(maxBackoffMs),
            multiplier,
            0
        );
        return new IdAllocatorConfig(minId, blockSize, retry);
    }
}
