package com.acme.kvstore.idalloc.alloc;

import com.acme.kvstore.idalloc.util.IdAllocStatusCodes;

/**
 * Thrown by {@link IdAllocator#allocate()} when the owning stopper is shutting
 * down and no ID can be handed out. Carries a reason code so transports can
 * map it to a status (HTTP 503).
 */
public final class AllocationCancelledException extends RuntimeException {
    private final int reasonCode;

    public AllocationCancelledException(String message) {
        this(IdAllocStatusCodes.SERVICE_UNAVAILABLE, message);
    }

    public AllocationCancelledException(int reasonCode, String message) {
        super(message + ", reasonCode=" + reasonCode);
        this.reasonCode = reasonCode;
    }

    public int reasonCode() {
        return reasonCode;
    }
}
