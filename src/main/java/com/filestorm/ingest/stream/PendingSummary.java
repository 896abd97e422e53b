package com.filestorm.ingest.stream;

/**
 * Summary of the consumer group's pending ledger.
 */
public class PendingSummary {

    private static final PendingSummary EMPTY = new PendingSummary(0, 0);

    private final long totalPending;
    private final long oldestIdleMs;

    public PendingSummary(long totalPending, long oldestIdleMs) {
        this.totalPending = totalPending;
        this.oldestIdleMs = oldestIdleMs;
    }

    public static PendingSummary empty() {
        return EMPTY;
    }

    public long getTotalPending() {
        return totalPending;
    }

    public long getOldestIdleMs() {
        return oldestIdleMs;
    }
}
