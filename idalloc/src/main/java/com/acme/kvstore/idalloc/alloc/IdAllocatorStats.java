package com.acme.kvstore.idalloc.alloc;

public record IdAllocatorStats(long allocated,
                               long blocksReserved,
                               int buffered,
                               boolean reservationInFlight,
                               boolean started) {}
