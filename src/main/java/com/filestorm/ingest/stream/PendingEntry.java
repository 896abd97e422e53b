package com.filestorm.ingest.stream;

/**
 * Pending-ledger detail for one delivered-but-unacknowledged entry.
 */
public class PendingEntry {
    private final String id;
    private final String owner;
    private final long idleMs;
    private final long deliveryCount;

    public PendingEntry(String id, String owner, long idleMs, long deliveryCount) {
        this.id = id;
        this.owner = owner;
        this.idleMs = idleMs;
        this.deliveryCount = deliveryCount;
    }

    public String getId() {
        return id;
    }

    public String getOwner() {
        return owner;
    }

    public long getIdleMs() {
        return idleMs;
    }

    public long getDeliveryCount() {
        return deliveryCount;
    }
}
