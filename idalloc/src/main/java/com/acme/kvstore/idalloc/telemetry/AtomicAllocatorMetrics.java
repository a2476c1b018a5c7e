package com.acme.kvstore.idalloc.telemetry;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicAllocatorMetrics implements AllocatorMetrics {
    private final LongAdder allocated = new LongAdder();
    private final LongAdder blocksReserved = new LongAdder();
    private final LongAdder compensatingIncrements = new LongAdder();
    private final LongAdder cancelled = new LongAdder();
    private final AtomicInteger bufferDepth = new AtomicInteger();
    private final ConcurrentHashMap<Integer, LongAdder> failedByReason = new ConcurrentHashMap<>();

    @Override
    public void incAllocated(long n) {
        allocated.add(Math.max(0L, n));
    }

    @Override
    public void incBlocksReserved(long n) {
        blocksReserved.add(Math.max(0L, n));
    }

    @Override
    public void incCompensatingIncrements(long n) {
        compensatingIncrements.add(Math.max(0L, n));
    }

    @Override
    public void incFailedIncrements(long n, int reasonCode) {
        if (n <= 0) return;
        failedByReason.computeIfAbsent(reasonCode, ignored -> new LongAdder()).add(n);
    }

    @Override
    public void incCancelled(long n) {
        cancelled.add(Math.max(0L, n));
    }

    @Override
    public void setBufferDepth(int depth) {
        bufferDepth.set(Math.max(0, depth));
    }

    public Snapshot snapshot() {
        return new Snapshot(
            allocated.sum(),
            blocksReserved.sum(),
            compensatingIncrements.sum(),
            cancelled.sum(),
            bufferDepth.get(),
            mapToLongs(failedByReason)
        );
    }

    private static Map<Integer, Long> mapToLongs(ConcurrentHashMap<Integer, LongAdder> src) {
        Map<Integer, Long> out = new HashMap<>();
        src.forEach((k, v) -> out.put(k, v.sum()));
        return Collections.unmodifiableMap(out);
    }

    public record Snapshot(long allocated,
                           long blocksReserved,
                           long compensatingIncrements,
                           long cancelled,
                           int bufferDepth,
                           Map<Integer, Long> failedIncrementsByReason) {

        public long failedIncrements() {
            long total = 0L;
            for (long v : failedIncrementsByReason.values()) {
                total += v;
            }
            return total;
        }
    }
}
