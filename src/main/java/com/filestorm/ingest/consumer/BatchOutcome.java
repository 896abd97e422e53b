package com.filestorm.ingest.consumer;

/**
 * Tally of one processed batch of stream entries.
 */
public final class BatchOutcome {

    public static final BatchOutcome EMPTY = new BatchOutcome(0, 0, 0, 0, 0, 0);

    private final int entries;
    private final int persisted;
    private final int skipped;
    private final int errored;
    private final int unpersisted;
    private final int acked;

    public BatchOutcome(int entries, int persisted, int skipped, int errored, int unpersisted, int acked) {
        this.entries = entries;
        this.persisted = persisted;
        this.skipped = skipped;
        this.errored = errored;
        this.unpersisted = unpersisted;
        this.acked = acked;
    }

    public int getEntries() {
        return entries;
    }

    /**
     * @return records confirmed durable (fresh inserts and already-present rows)
     */
    public int getPersisted() {
        return persisted;
    }

    public int getSkipped() {
        return skipped;
    }

    public int getErrored() {
        return errored;
    }

    /**
     * @return successfully normalized entries left pending because their batch failed to persist
     */
    public int getUnpersisted() {
        return unpersisted;
    }

    public int getAcked() {
        return acked;
    }

    public BatchOutcome plus(BatchOutcome other) {
        return new BatchOutcome(entries + other.entries, persisted + other.persisted, skipped + other.skipped,
                errored + other.errored, unpersisted + other.unpersisted, acked + other.acked);
    }

    @Override
    public String toString() {
        return "BatchOutcome{entries=" + entries + ", persisted=" + persisted + ", skipped=" + skipped
                + ", errored=" + errored + ", unpersisted=" + unpersisted + ", acked=" + acked + '}';
    }
}
