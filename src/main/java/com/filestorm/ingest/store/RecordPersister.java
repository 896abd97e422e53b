package com.filestorm.ingest.store;

import com.filestorm.ingest.domain.FileEventRecord;

import java.util.List;

public interface RecordPersister {

    /**
     * Durably writes a batch of records, at most once per dedup key.
     *
     * @param records records in stream read order
     * @return number of input records now durably present (fresh or from an earlier attempt),
     *         0 if the batch could not be committed
     */
    int persist(List<FileEventRecord> records);
}
