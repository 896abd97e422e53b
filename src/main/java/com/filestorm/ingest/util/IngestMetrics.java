package com.filestorm.ingest.util;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lightweight in-process counters for consumer observability.
 * <p>
 * Exposed via {@code /v1/consumer/metrics}.
 */
@ApplicationScoped
public class IngestMetrics {

    private final AtomicLong cyclesTotal = new AtomicLong();
    private final AtomicLong cycleErrorsTotal = new AtomicLong();
    private final AtomicLong reinitializationsTotal = new AtomicLong();
    private final AtomicLong groupRecreationsTotal = new AtomicLong();

    private final AtomicLong persistedTotal = new AtomicLong();
    private final AtomicLong duplicatesSkippedTotal = new AtomicLong();
    private final AtomicLong persistFailuresTotal = new AtomicLong();
    private final AtomicLong schemaFallbacksTotal = new AtomicLong();
    private final AtomicLong storeReconnectsTotal = new AtomicLong();

    private final AtomicLong entriesSkippedTotal = new AtomicLong();
    private final AtomicLong entriesErroredTotal = new AtomicLong();
    private final AtomicLong entriesAckedTotal = new AtomicLong();
    private final AtomicLong pendingReclaimedTotal = new AtomicLong();
    private final AtomicLong pendingLast = new AtomicLong();
    private final AtomicLong pendingOldestIdleMs = new AtomicLong();

    public void incrementCycles() {
        cyclesTotal.incrementAndGet();
    }

    public void incrementCycleErrors() {
        cycleErrorsTotal.incrementAndGet();
    }

    public void incrementReinitializations() {
        reinitializationsTotal.incrementAndGet();
    }

    public void incrementGroupRecreations() {
        groupRecreationsTotal.incrementAndGet();
    }

    public void incrementPersisted(long count) {
        persistedTotal.addAndGet(count);
    }

    public void incrementDuplicatesSkipped(long count) {
        duplicatesSkippedTotal.addAndGet(count);
    }

    public void incrementPersistFailures() {
        persistFailuresTotal.incrementAndGet();
    }

    public void incrementSchemaFallbacks() {
        schemaFallbacksTotal.incrementAndGet();
    }

    public void incrementStoreReconnects() {
        storeReconnectsTotal.incrementAndGet();
    }

    public void incrementEntriesSkipped(long count) {
        entriesSkippedTotal.addAndGet(count);
    }

    public void incrementEntriesErrored(long count) {
        entriesErroredTotal.addAndGet(count);
    }

    public void incrementEntriesAcked(long count) {
        entriesAckedTotal.addAndGet(count);
    }

    public void incrementPendingReclaimed(long count) {
        pendingReclaimedTotal.addAndGet(count);
    }

    public void setPendingSummary(long totalPending, long oldestIdleMs) {
        pendingLast.set(totalPending);
        pendingOldestIdleMs.set(oldestIdleMs);
    }

    public long persistedTotal() {
        return persistedTotal.get();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> m = new LinkedHashMap<>();
        m.put("cycles_total", cyclesTotal.get());
        m.put("cycle_errors_total", cycleErrorsTotal.get());
        m.put("reinitializations_total", reinitializationsTotal.get());
        m.put("group_recreations_total", groupRecreationsTotal.get());
        m.put("persisted_total", persistedTotal.get());
        m.put("duplicates_skipped_total", duplicatesSkippedTotal.get());
        m.put("persist_failures_total", persistFailuresTotal.get());
        m.put("schema_fallbacks_total", schemaFallbacksTotal.get());
        m.put("store_reconnects_total", storeReconnectsTotal.get());
        m.put("entries_skipped_total", entriesSkippedTotal.get());
        m.put("entries_errored_total", entriesErroredTotal.get());
        m.put("entries_acked_total", entriesAckedTotal.get());
        m.put("pending_reclaimed_total", pendingReclaimedTotal.get());
        m.put("pending_last", pendingLast.get());
        m.put("pending_oldest_idle_ms", pendingOldestIdleMs.get());
        return m;
    }
}
