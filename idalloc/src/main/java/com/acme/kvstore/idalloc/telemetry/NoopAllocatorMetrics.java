package com.acme.kvstore.idalloc.telemetry;

public final class NoopAllocatorMetrics implements AllocatorMetrics {
    public static final NoopAllocatorMetrics INSTANCE = new NoopAllocatorMetrics();

    private NoopAllocatorMetrics() {
    }

    @Override
    public void incAllocated(long n) {
    }

    @Override
    public void incBlocksReserved(long n) {
    }

    @Override
    public void incCompensatingIncrements(long n) {
    }

    @Override
    public void incFailedIncrements(long n, int reasonCode) {
    }

    @Override
    public void incCancelled(long n) {
    }

    @Override
    public void setBufferDepth(int depth) {
    }
}
