package com.storylens.highlight;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-document counters, mainly for diagnostics and the host status route.
 */
public class HighlightStats {
    private final AtomicLong scans = new AtomicLong();
    private final AtomicLong applied = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();
    private final AtomicLong aborted = new AtomicLong();
    private final AtomicLong degraded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    void recordScan() {
        scans.incrementAndGet();
    }

    void recordApplied() {
        applied.incrementAndGet();
    }

    void recordDiscarded() {
        discarded.incrementAndGet();
    }

    void recordAborted() {
        aborted.incrementAndGet();
    }

    void recordDegraded() {
        degraded.incrementAndGet();
    }

    void recordFailed() {
        failed.incrementAndGet();
    }

    public long getScans() {
        return scans.get();
    }

    public long getApplied() {
        return applied.get();
    }

    /**
     * Results dropped because a newer revision existed when they completed.
     */
    public long getDiscarded() {
        return discarded.get();
    }

    /**
     * Apply batches abandoned because the document changed under them.
     */
    public long getAborted() {
        return aborted.get();
    }

    public long getDegraded() {
        return degraded.get();
    }

    public long getFailed() {
        return failed.get();
    }
}
