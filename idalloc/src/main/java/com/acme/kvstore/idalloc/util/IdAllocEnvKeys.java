package com.acme.kvstore.idalloc.util;

/**
 * Canonical environment variable names used by the allocator runtime.
 */
public final class IdAllocEnvKeys {
    public static final String IDALLOC_MIN_ID = "IDALLOC_MIN_ID";
    public static final String IDALLOC_BLOCK_SIZE = "IDALLOC_BLOCK_SIZE";

    public static final String IDALLOC_RETRY_INITIAL_BACKOFF_MS = "IDALLOC_RETRY_INITIAL_BACKOFF_MS";
    public static final String IDALLOC_RETRY_MAX_BACKOFF_MS = "IDALLOC_RETRY_MAX_BACKOFF_MS";
    public static final String IDALLOC_RETRY_MULTIPLIER = "IDALLOC_RETRY_MULTIPLIER";

    public static final String IDALLOC_COUNTER_HTTP_PORT = "IDALLOC_COUNTER_HTTP_PORT";

    private IdAllocEnvKeys() {
    }
}
