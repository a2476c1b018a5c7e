package com.acme.kvstore.idalloc.util;

/**
 * Default capacity, timeout, and tuning constants for the allocator runtime.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class IdAllocDefaults {

    // ---- Allocator ----
    public static final long DEFAULT_MIN_ID = 1L;
    public static final int DEFAULT_BLOCK_SIZE = 10;

    // ---- Reservation retry ----
    public static final long DEFAULT_RETRY_INITIAL_BACKOFF_MS = 50L;
    public static final long DEFAULT_RETRY_MAX_BACKOFF_MS = 1_000L;
    public static final double DEFAULT_RETRY_MULTIPLIER = 2.0d;

    // ---- Stopper ----
    public static final long DEFAULT_WORKER_JOIN_TIMEOUT_MS = 10_000L;

    // ---- Counter HTTP transport ----
    public static final int DEFAULT_COUNTER_HTTP_PORT = 26_257;
    public static final int DEFAULT_MAX_INFLIGHT = 256;
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_RESPONSE_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_CLIENT_IO_THREADS = 2;
    public static final int HTTPS_DEFAULT_PORT = 443;
    public static final int HTTP_DEFAULT_PORT = 80;
    public static final int DEFAULT_SO_BACKLOG = 1024;
    public static final int MAX_CONTENT_LENGTH = 64 * 1024;

    private IdAllocDefaults() {
    }
}
