package com.filestorm.ingest.consumer;

import com.filestorm.ingest.store.RecordStorePool;
import com.filestorm.ingest.store.SchemaInitializer;
import com.filestorm.ingest.stream.ConsumerGroupMissingException;
import com.filestorm.ingest.stream.EventLogFacade;
import com.filestorm.ingest.stream.PendingSummary;
import com.filestorm.ingest.stream.StreamEntry;
import com.filestorm.ingest.util.AlertLogger;
import com.filestorm.ingest.util.IngestMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Long-running consumer of the upload stream.
 * <p>
 * Runs on a single background thread. Startup waits for the record store (bounded by
 * {@code app.consumer.startup-timeout-seconds}, after which the loop stops), recreates the
 * consumer group and drains any backlog. Each steady-state cycle then
 * <ol>
 *   <li>claims and retries pending entries;</li>
 *   <li>reads new entries only, blocking for at most {@code app.consumer.block-ms};</li>
 *   <li>normalizes, persists and acknowledges them through {@link EntryBatchProcessor}.</li>
 * </ol>
 * A failed cycle never ends the loop: it backs off, and after
 * {@code app.consumer.reinit-after-errors} consecutive failures the consumer group and the
 * store pool are reinitialized.
 * <p>
 * Cancellation is cooperative: the running flag is checked before every cycle and
 * {@link #stop()} joins the thread for at most {@code app.consumer.shutdown-timeout-seconds}.
 */
@ApplicationScoped
public class IngestionConsumerLoop {

    private static final Logger LOG = Logger.getLogger(IngestionConsumerLoop.class);

    private static final long STORE_POLL_INTERVAL_MS = 1000;

    @ConfigProperty(name = "app.consumer.enabled", defaultValue = "true")
    boolean consumerEnabled;

    @ConfigProperty(name = "app.consumer.batch-size", defaultValue = "50")
    int batchSize;

    @ConfigProperty(name = "app.consumer.block-ms", defaultValue = "500")
    long blockMs;

    @ConfigProperty(name = "app.consumer.idle-check-every", defaultValue = "5")
    int idleCheckEvery;

    @ConfigProperty(name = "app.consumer.heartbeat-every", defaultValue = "60")
    int heartbeatEvery;

    @ConfigProperty(name = "app.consumer.reinit-after-errors", defaultValue = "5")
    int reinitAfterErrors;

    @ConfigProperty(name = "app.consumer.backoff.strategy", defaultValue = "LINEAR")
    String backoffStrategy;

    @ConfigProperty(name = "app.consumer.backoff.base-ms", defaultValue = "2000")
    long backoffBaseMs;

    @ConfigProperty(name = "app.consumer.backoff.cap-ms", defaultValue = "10000")
    long backoffCapMs;

    @ConfigProperty(name = "app.consumer.startup-timeout-seconds", defaultValue = "20")
    int startupTimeoutSeconds;

    @ConfigProperty(name = "app.consumer.shutdown-timeout-seconds", defaultValue = "10")
    int shutdownTimeoutSeconds;

    @ConfigProperty(name = "app.consumer.post-batch-pause-ms", defaultValue = "50")
    long postBatchPauseMs;

    @ConfigProperty(name = "app.consumer.drain-max-cycles", defaultValue = "50")
    int drainMaxCycles;

    @Inject
    EventLogFacade eventLog;

    @Inject
    ClaimRetryManager claimManager;

    @Inject
    EntryBatchProcessor processor;

    @Inject
    RecordStorePool pool;

    @Inject
    SchemaInitializer schemaInitializer;

    @Inject
    IngestMetrics metrics;

    Sleeper sleeper = Sleeper.SYSTEM;

    BackoffPolicy backoff;

    final AtomicBoolean running = new AtomicBoolean(false);

    private final ReentrantLock cycleLock = new ReentrantLock();

    private volatile ConsumerState state = ConsumerState.STOPPED;
    private ExecutorService executor;

    private int errorCount;
    private int emptyCycles;
    private long processedTotal;
    private long processingStartedAtMs;

    @PostConstruct
    void init() {
        backoff = BackoffPolicy.of(backoffStrategy, backoffBaseMs, backoffCapMs);
    }

    public synchronized void start() {
        if (running.get()) {
            LOG.debug("Consumer loop already running");
            return;
        }
        LOG.infof("Starting consumer loop (batch size: %d, block: %dms, backoff: %s %d-%dms)",
                batchSize, blockMs, backoff.getStrategy(), backoff.getBaseMs(), backoff.getCapMs());
        running.set(true);
        state = ConsumerState.STARTING;
        executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "filestorm-consumer"));
        executor.submit(this::run);
    }

    public synchronized void stop() {
        LOG.info("Stopping consumer loop...");
        running.set(false);

        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                    LOG.warnf("Consumer loop did not finish within %ds, interrupting", shutdownTimeoutSeconds);
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            executor = null;
        }

        state = ConsumerState.STOPPED;
        pool.close();
        LOG.info("Consumer loop stopped");
    }

    /**
     * Asks the loop to finish after the current cycle without waiting for it.
     */
    public void requestStop() {
        running.set(false);
    }

    void run() {
        try {
            state = ConsumerState.STARTING;
            if (!awaitStore()) {
                return;
            }
            initialize();
            state = ConsumerState.RUNNING;
            processingStartedAtMs = System.currentTimeMillis();
            LOG.infof("Consumer %s listening for entries", eventLog.consumerName());

            while (running.get()) {
                iterate();
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Consumer loop terminated unexpectedly");
        } finally {
            running.set(false);
            state = ConsumerState.STOPPED;
        }
    }

    private boolean awaitStore() {
        int attempts = Math.max(1, startupTimeoutSeconds);
        for (int attempt = 1; attempt <= attempts && running.get(); attempt++) {
            if (pool.isReady()) {
                LOG.info("Record store connection ready");
                return true;
            }
            LOG.infof("Waiting for record store... (%d/%d)", attempt, attempts);
            pause(STORE_POLL_INTERVAL_MS);
        }
        if (running.get()) {
            LOG.fatalf("Record store not ready after %ds, consumer stopping", startupTimeoutSeconds);
            AlertLogger.storeUnavailableAtStartup(eventLog.consumerName(), startupTimeoutSeconds);
        }
        return false;
    }

    private void initialize() {
        try {
            schemaInitializer.initialize();
            eventLog.ensureGroup();
            drainBacklog();
        } catch (RuntimeException e) {
            // steady-state cycles recover the group and the pool
            LOG.errorf(e, "Startup initialization failed, continuing with regular cycles");
        }
    }

    /**
     * Processes the pending ledger and queued entries before the steady loop, for a bounded
     * number of cycles each.
     */
    void drainBacklog() {
        PendingSummary pending = eventLog.pendingSummary();
        long queued = eventLog.streamLength();
        LOG.infof("Startup backlog: %d pending, %d in stream", pending.getTotalPending(), queued);

        long drained = 0;
        int pendingCycles = (int) Math.min(pending.getTotalPending() + 10, drainMaxCycles);
        for (int i = 0; i < pendingCycles && running.get(); i++) {
            if (eventLog.pendingSummary().getTotalPending() == 0) {
                break;
            }
            CycleResult result = runCycle();
            if (result.isEmpty()) {
                break;
            }
            drained += result.getEntries();
        }

        int queueCycles = (int) Math.min(eventLog.streamLength(), drainMaxCycles);
        for (int i = 0; i < queueCycles && running.get(); i++) {
            CycleResult result = runCycle();
            if (result.isEmpty()) {
                break;
            }
            drained += result.getEntries();
        }

        if (drained > 0) {
            LOG.infof("Startup drain processed %d entries", drained);
        }
    }

    private void iterate() {
        try {
            CycleResult result = runCycle();
            errorCount = 0;
            if (result.isEmpty()) {
                onEmptyCycle();
            } else {
                onProductiveCycle(result);
            }
        } catch (RuntimeException e) {
            onCycleError(e);
        }
    }

    /**
     * Runs one cycle now, serialised with the background loop. Used by the manual trigger.
     */
    public CycleResult runOnce() {
        return runCycle();
    }

    CycleResult runCycle() {
        cycleLock.lock();
        try {
            try {
                return doCycle();
            } catch (ConsumerGroupMissingException e) {
                LOG.warnf("Consumer group missing (%s), recreating", e.getMessage());
                eventLog.ensureGroup();
                metrics.incrementGroupRecreations();
                return doCycle();
            }
        } finally {
            cycleLock.unlock();
        }
    }

    private CycleResult doCycle() {
        metrics.incrementCycles();

        ClaimOutcome claim = claimManager.claimAndProcess();
        if (claim.getClaimed() > 0 && claim.isLedgerDrained()) {
            return new CycleResult(claim.getClaimed(), 0, claim.getOutcome());
        }

        List<StreamEntry> entries = eventLog.readNew(batchSize, blockMs);
        BatchOutcome fresh = entries.isEmpty() ? BatchOutcome.EMPTY : processor.process(entries);
        return new CycleResult(claim.getClaimed(), entries.size(), claim.getOutcome().plus(fresh));
    }

    private void onEmptyCycle() {
        emptyCycles++;
        if (heartbeatEvery > 0 && emptyCycles % heartbeatEvery == 0) {
            LOG.infof("Listening... (~%ds idle)", emptyCycles * blockMs / 1000);
        }
        if (idleCheckEvery > 0 && emptyCycles % idleCheckEvery == 0) {
            checkBacklog();
        }
    }

    /**
     * Entries may land just after a blocking read returned empty; look at the stream directly
     * and run an extra cycle if anything is waiting.
     */
    private void checkBacklog() {
        long queued = eventLog.streamLength();
        PendingSummary pending = eventLog.pendingSummary();
        metrics.setPendingSummary(pending.getTotalPending(), pending.getOldestIdleMs());
        if (queued == 0 && pending.getTotalPending() == 0) {
            return;
        }
        LOG.debugf("Idle check found %d queued, %d pending, running extra cycle", queued, pending.getTotalPending());
        CycleResult extra = runCycle();
        if (!extra.isEmpty()) {
            onProductiveCycle(extra);
        }
    }

    private void onProductiveCycle(CycleResult result) {
        emptyCycles = 0;
        processedTotal += result.getEntries();
        double elapsedSeconds = Math.max(1, System.currentTimeMillis() - processingStartedAtMs) / 1000.0;
        LOG.infof("Processed %d entries (%d persisted). Total: %d, rate: %.1f/sec",
                result.getEntries(), result.getPersisted(), processedTotal, processedTotal / elapsedSeconds);
        pause(postBatchPauseMs);
    }

    private void onCycleError(RuntimeException e) {
        errorCount++;
        metrics.incrementCycleErrors();
        state = ConsumerState.BACKING_OFF;
        long delay = backoff.delayFor(errorCount);
        LOG.errorf(e, "Consumer cycle failed (%d consecutive), retrying in %dms", errorCount, delay);
        pause(delay);

        if (errorCount > reinitAfterErrors) {
            reinitialize();
        }
        if (running.get()) {
            state = ConsumerState.RUNNING;
        }
    }

    private void reinitialize() {
        LOG.warnf("Reinitializing consumer after %d consecutive errors", errorCount);
        AlertLogger.consumerReinitialized(eventLog.consumerName(), errorCount);
        try {
            eventLog.ensureGroup();
        } catch (RuntimeException e) {
            LOG.errorf("Failed to recreate consumer group: %s", e.getMessage());
        }
        pool.reconnect();
        metrics.incrementReinitializations();
        errorCount = 0;
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.set(false);
        }
    }

    public ConsumerState getState() {
        return state;
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isConsumerEnabled() {
        return consumerEnabled;
    }

    public String consumerName() {
        return eventLog.consumerName();
    }

    /**
     * What one cycle did.
     */
    public static final class CycleResult {
        private final int claimed;
        private final int read;
        private final BatchOutcome outcome;

        public CycleResult(int claimed, int read, BatchOutcome outcome) {
            this.claimed = claimed;
            this.read = read;
            this.outcome = outcome;
        }

        public int getClaimed() {
            return claimed;
        }

        public int getRead() {
            return read;
        }

        public int getEntries() {
            return claimed + read;
        }

        public int getPersisted() {
            return outcome.getPersisted();
        }

        public BatchOutcome getOutcome() {
            return outcome;
        }

        public boolean isEmpty() {
            return claimed == 0 && read == 0;
        }
    }
}
