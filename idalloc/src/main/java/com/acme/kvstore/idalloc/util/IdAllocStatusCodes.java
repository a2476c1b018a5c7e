package com.acme.kvstore.idalloc.util;

/**
 * Canonical HTTP and allocator-internal status codes shared by the counter
 * transport and the allocator's failure reasons.
 */
public final class IdAllocStatusCodes {

    // ---- Success ----
    public static final int OK = 200;

    // ---- Client errors ----
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int METHOD_NOT_ALLOWED = 405;
    public static final int TOO_MANY_REQUESTS = 429;

    // ---- Server errors ----
    public static final int INTERNAL_ERROR = 500;
    public static final int BAD_GATEWAY = 502;
    public static final int SERVICE_UNAVAILABLE = 503;
    public static final int GATEWAY_TIMEOUT = 504;

    private IdAllocStatusCodes() {
    }
}
