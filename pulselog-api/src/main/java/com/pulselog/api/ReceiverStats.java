package com.pulselog.api;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Cumulative write counters of a receiver.
 * <p>
 * Counters only move forward: they survive file rotation and are updated once
 * per successful write. Readers never block writers.
 * </p>
 */
public class ReceiverStats {

    private final AtomicLong linesWritten = new AtomicLong();
    private final AtomicLong bytesWritten = new AtomicLong();

    public void record(long bytes) {
        linesWritten.incrementAndGet();
        bytesWritten.addAndGet(bytes);
    }

    public long linesWritten() {
        return linesWritten.get();
    }

    public long bytesWritten() {
        return bytesWritten.get();
    }

    @Override
    public String toString() {
        return "ReceiverStats{" +
                "linesWritten=" + linesWritten.get() +
                ", bytesWritten=" + bytesWritten.get() +
                '}';
    }
}
