package com.acme.kvstore.idalloc.telemetry;

public interface AllocatorMetrics {
    void incAllocated(long n);
    void incBlocksReserved(long n);
    void incCompensatingIncrements(long n);
    void incFailedIncrements(long n, int reasonCode);
    void incCancelled(long n);
    void setBufferDepth(int depth);
}
