package com.filestorm.ingest.consumer;

/**
 * Which pending entries the claim step may take over.
 */
public enum ClaimMode {
    /**
     * Claim any pending entry regardless of idle time. Suitable when one consumer owns the backlog.
     */
    IMMEDIATE,
    /**
     * Claim only entries idle beyond {@code app.consumer.claim.min-idle-ms}, so a slow but live
     * peer keeps its work.
     */
    IDLE_THRESHOLD
}
