package com.acme.kvstore.idalloc.counter;

/**
 * Thrown when a counter increment fails. Carries an HTTP-like status code so
 * remote and local stores report failures the same way.
 */
public final class CounterStoreException extends RuntimeException {
    private final int statusCode;

    public CounterStoreException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public CounterStoreException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
