package com.filestorm.ingest.stream;

import java.util.List;
import java.util.Map;

public interface EventLogClient {

    /**
     * Creates the stream and consumer group if needed. An existing group is not an error.
     */
    void ensureGroup();

    /**
     * Appends a new upload event (producer side).
     * @return stream entry id
     */
    String append(Map<String, String> fields);

    /**
     * Reads entries never delivered to the group before. Pending entries are never returned here.
     * Blocks for at most {@code blockMs} when nothing is available.
     */
    List<StreamEntry> readNew(int count, long blockMs);

    /**
     * Returns a summary of pending entries (count + oldest idle age).
     */
    PendingSummary pendingSummary();

    /**
     * Lists pending entries, oldest first.
     * @param minIdleMs only entries idle for at least this long; 0 for all
     * @param consumer  owner filter, or null for entries of any consumer
     */
    List<PendingEntry> pendingEntries(int count, long minIdleMs, String consumer);

    /**
     * Takes ownership of pending entries idle for at least {@code minIdleMs}.
     */
    List<StreamEntry> claim(List<String> entryIds, long minIdleMs);

    /**
     * Acknowledges an entry and removes it from the stream.
     */
    void ackAndDelete(String entryId);

    /**
     * Number of entries currently in the stream.
     */
    long streamLength();

    /**
     * @return true if the log answers
     */
    boolean ping();

    /**
     * Stable name of this consumer within the group.
     */
    String consumerName();
}
