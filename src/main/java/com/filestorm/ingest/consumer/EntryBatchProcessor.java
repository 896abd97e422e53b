package com.filestorm.ingest.consumer;

import com.filestorm.ingest.domain.FileEventRecord;
import com.filestorm.ingest.normalize.MessageNormalizer;
import com.filestorm.ingest.normalize.NormalizationResult;
import com.filestorm.ingest.store.RecordPersister;
import com.filestorm.ingest.stream.EventLogFacade;
import com.filestorm.ingest.stream.StreamEntry;
import com.filestorm.ingest.util.IngestMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Classifies, persists and acknowledges a batch of entries, whether freshly read or claimed.
 * <p>
 * An entry is acknowledged and deleted once its record is confirmed durable, or when it was
 * skipped. Errored entries and every entry of a batch that failed to persist stay pending.
 * Temp files uploaded for the batch are removed only after the batch commits.
 */
@ApplicationScoped
public class EntryBatchProcessor {

    private static final Logger LOG = Logger.getLogger(EntryBatchProcessor.class);

    @Inject
    MessageNormalizer normalizer;

    @Inject
    RecordPersister persister;

    @Inject
    EventLogFacade eventLog;

    @Inject
    IngestMetrics metrics;

    public BatchOutcome process(List<StreamEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return BatchOutcome.EMPTY;
        }

        List<FileEventRecord> records = new ArrayList<>(entries.size());
        List<String> successIds = new ArrayList<>(entries.size());
        List<String> skipIds = new ArrayList<>();
        List<Path> uploadedTempFiles = new ArrayList<>();
        int errored = 0;

        for (StreamEntry entry : entries) {
            if (entry.isDeleted()) {
                LOG.warnf("Entry %s no longer in stream, acking", entry.getId());
                skipIds.add(entry.getId());
                continue;
            }
            NormalizationResult result = normalizer.normalize(entry.getId(), entry.getFields());
            switch (result.getStatus()) {
                case SUCCESS:
                    records.add(result.getRecord());
                    successIds.add(entry.getId());
                    if (result.getTempFile() != null) {
                        uploadedTempFiles.add(result.getTempFile());
                    }
                    break;
                case SKIP:
                    skipIds.add(entry.getId());
                    break;
                default:
                    errored++;
                    LOG.warnf("Entry %s failed to normalize, leaving pending: %s", entry.getId(), result.getReason());
                    break;
            }
        }

        int persisted = records.isEmpty() ? 0 : persister.persist(records);
        int acked = 0;
        int unpersisted = 0;
        if (persisted == records.size()) {
            uploadedTempFiles.forEach(EntryBatchProcessor::deleteTempFile);
            for (String id : successIds) {
                eventLog.ackAndDelete(id);
                acked++;
            }
        } else {
            unpersisted = records.size();
            persisted = 0;
            LOG.warnf("Batch of %d records not confirmed durable, leaving entries pending", records.size());
        }
        for (String id : skipIds) {
            eventLog.ackAndDelete(id);
            acked++;
        }

        metrics.incrementEntriesSkipped(skipIds.size());
        metrics.incrementEntriesErrored(errored);
        metrics.incrementEntriesAcked(acked);

        BatchOutcome outcome = new BatchOutcome(entries.size(), persisted, skipIds.size(), errored, unpersisted, acked);
        LOG.debugf("Processed batch: %s", outcome);
        return outcome;
    }

    private static void deleteTempFile(Path tempFile) {
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            LOG.warnf("Failed to delete temp file %s: %s", tempFile, e.getMessage());
        }
    }
}
