package com.filestorm.ingest.consumer;

import com.filestorm.ingest.stream.ConsumerGroupMissingException;
import com.filestorm.ingest.stream.EventLogException;
import com.filestorm.ingest.stream.EventLogFacade;
import com.filestorm.ingest.stream.PendingEntry;
import com.filestorm.ingest.stream.PendingSummary;
import com.filestorm.ingest.stream.StreamEntry;
import com.filestorm.ingest.util.IngestMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Recovers delivered-but-unacknowledged entries before new ones are read.
 * <p>
 * Entries owned by this consumer are preferred; when none qualify, entries of any consumer
 * (including crashed ones) are taken. With {@link ClaimMode#IDLE_THRESHOLD} only entries idle
 * for at least {@code app.consumer.claim.min-idle-ms} are eligible.
 */
@ApplicationScoped
public class ClaimRetryManager {

    private static final Logger LOG = Logger.getLogger(ClaimRetryManager.class);

    @ConfigProperty(name = "app.consumer.claim.mode", defaultValue = "IDLE_THRESHOLD")
    ClaimMode claimMode;

    @ConfigProperty(name = "app.consumer.claim.min-idle-ms", defaultValue = "60000")
    long minIdleMs;

    @ConfigProperty(name = "app.consumer.batch-size", defaultValue = "50")
    int batchSize;

    @Inject
    EventLogFacade eventLog;

    @Inject
    EntryBatchProcessor processor;

    @Inject
    IngestMetrics metrics;

    public ClaimOutcome claimAndProcess() {
        try {
            return claimPending();
        } catch (ConsumerGroupMissingException e) {
            throw e;
        } catch (EventLogException e) {
            LOG.warnf("Error claiming pending entries: %s", e.getMessage());
            return ClaimOutcome.none();
        }
    }

    private ClaimOutcome claimPending() {
        PendingSummary summary = eventLog.pendingSummary();
        metrics.setPendingSummary(summary.getTotalPending(), summary.getOldestIdleMs());
        if (summary.getTotalPending() == 0) {
            return ClaimOutcome.none();
        }

        long threshold = effectiveMinIdleMs();
        int count = (int) Math.min(summary.getTotalPending(), batchSize);

        // the idle filter runs in the log, so fresh entries never crowd idle ones out of the page
        List<String> ids = eligibleIds(eventLog.pendingEntries(count, threshold, eventLog.consumerName()), threshold);
        if (ids.isEmpty()) {
            ids = eligibleIds(eventLog.pendingEntries(count, threshold, null), threshold);
        }
        if (ids.isEmpty()) {
            LOG.debugf("%d entries pending, none idle for %dms", summary.getTotalPending(), threshold);
            return ClaimOutcome.none();
        }

        List<StreamEntry> claimed = eventLog.claim(ids, threshold);
        if (claimed.isEmpty()) {
            return ClaimOutcome.none();
        }
        LOG.infof("Claimed %d pending entries", claimed.size());
        metrics.incrementPendingReclaimed(claimed.size());

        BatchOutcome outcome = processor.process(claimed);
        boolean drained = eventLog.pendingSummary().getTotalPending() == 0;
        return new ClaimOutcome(claimed.size(), outcome, drained);
    }

    long effectiveMinIdleMs() {
        return claimMode == ClaimMode.IMMEDIATE ? 0 : minIdleMs;
    }

    private static List<String> eligibleIds(List<PendingEntry> pending, long threshold) {
        List<String> ids = new ArrayList<>(pending.size());
        for (PendingEntry entry : pending) {
            if (entry.getIdleMs() >= threshold) {
                ids.add(entry.getId());
            }
        }
        return ids;
    }
}
