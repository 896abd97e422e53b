package com.filestorm.ingest.consumer;

import com.filestorm.ingest.domain.FileEventRecord;
import com.filestorm.ingest.stream.ConsumerGroupMissingException;
import com.filestorm.ingest.stream.EventLogException;
import com.filestorm.ingest.stream.EventLogFacade;
import com.filestorm.ingest.stream.InMemoryEventLogClient;
import com.filestorm.ingest.stream.PendingEntry;
import com.filestorm.ingest.stream.StreamEntry;
import com.filestorm.ingest.util.IngestMetrics;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static com.filestorm.ingest.consumer.ConsumerTestSupport.DEAD_CONSUMER;
import static com.filestorm.ingest.consumer.ConsumerTestSupport.LIVE_CONSUMER;
import static com.filestorm.ingest.consumer.ConsumerTestSupport.storedEvent;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ClaimRetryManagerTest {

    @Test
    void nothingPendingClaimsNothing() {
        ConsumerTestSupport support = new ConsumerTestSupport(ClaimMode.IMMEDIATE);

        ClaimOutcome outcome = support.claimManager.claimAndProcess();

        assertThat(outcome.getClaimed()).isZero();
        assertThat(outcome.isLedgerDrained()).isFalse();
    }

    @Test
    void idleThresholdLeavesFreshWorkOfLivePeer() {
        ConsumerTestSupport support = new ConsumerTestSupport(ClaimMode.IDLE_THRESHOLD);
        InMemoryEventLogClient peer = support.log.withConsumer("consumer_peer");
        String id = support.log.append(storedEvent("a.txt"));
        peer.readNew(10, 0);
        support.clock.advance(Duration.ofSeconds(10));

        ClaimOutcome outcome = support.claimManager.claimAndProcess();

        assertThat(outcome.getClaimed()).isZero();
        assertThat(support.persister.rowCount()).isZero();
        assertThat(support.log.pendingEntries(10, 0, "consumer_peer"))
                .extracting(PendingEntry::getId)
                .containsExactly(id);
    }

    @Test
    void idleThresholdReclaimsFromDeadConsumerWithoutDuplicateRows() {
        ConsumerTestSupport support = new ConsumerTestSupport(ClaimMode.IDLE_THRESHOLD);
        InMemoryEventLogClient dead = support.log.withConsumer(DEAD_CONSUMER);
        for (int i = 0; i < 5; i++) {
            support.log.append(storedEvent("file-" + i + ".txt"));
        }
        // the dead consumer committed its rows but crashed before acknowledging
        EntryBatchProcessor deadProcessor = new EntryBatchProcessor();
        deadProcessor.normalizer = support.normalizer;
        deadProcessor.metrics = new IngestMetrics();
        deadProcessor.eventLog = support.eventLog;
        deadProcessor.persister = records -> {
            support.persister.persist(records);
            throw new IllegalStateException("process killed");
        };
        try {
            deadProcessor.process(dead.readNew(10, 0));
        } catch (IllegalStateException expected) {
            // simulated crash
        }
        assertThat(support.persister.rowCount()).isEqualTo(5);
        support.clock.advance(Duration.ofSeconds(61));

        ClaimOutcome outcome = support.claimManager.claimAndProcess();

        assertThat(outcome.getClaimed()).isEqualTo(5);
        assertThat(outcome.isLedgerDrained()).isTrue();
        assertThat(outcome.getOutcome().getAcked()).isEqualTo(5);
        assertThat(support.persister.rowCount()).isEqualTo(5);
        assertThat(support.log.pendingSummary().getTotalPending()).isZero();
        assertThat(support.log.streamLength()).isZero();
    }

    @Test
    void immediateModeRetriesOwnPendingEntryRightAway() {
        ConsumerTestSupport support = new ConsumerTestSupport(ClaimMode.IMMEDIATE);
        support.log.append(storedEvent("a.txt"));
        support.persister.failNext(1);
        support.processor.process(support.log.readNew(10, 0));
        assertThat(support.log.pendingSummary().getTotalPending()).isEqualTo(1);

        ClaimOutcome outcome = support.claimManager.claimAndProcess();

        assertThat(outcome.getClaimed()).isEqualTo(1);
        assertThat(outcome.isLedgerDrained()).isTrue();
        assertThat(support.persister.rowCount()).isEqualTo(1);
    }

    @Test
    void idleEntryOfDeadPeerIsReachedBehindMoreThanABatchOfFreshOwnEntries() {
        ConsumerTestSupport support = new ConsumerTestSupport(ClaimMode.IDLE_THRESHOLD);
        support.claimManager.batchSize = 2;
        InMemoryEventLogClient dead = support.log.withConsumer(DEAD_CONSUMER);
        for (int i = 0; i < 3; i++) {
            support.log.append(storedEvent("own-" + i + ".txt"));
        }
        String stranded = support.log.append(storedEvent("stranded.txt"));
        List<String> own = support.log.readNew(3, 0).stream().map(StreamEntry::getId).collect(Collectors.toList());
        dead.readNew(10, 0);
        support.clock.advance(Duration.ofSeconds(61));
        // own entries were just redelivered, so only the dead peer's entry is idle
        support.log.claim(own, 0);

        ClaimOutcome outcome = support.claimManager.claimAndProcess();

        assertThat(outcome.getClaimed()).isEqualTo(1);
        assertThat(outcome.isLedgerDrained()).isFalse();
        assertThat(support.log.isPending(stranded)).isFalse();
        assertThat(support.persister.rows()).extracting(FileEventRecord::getFilename).containsExactly("stranded.txt");
        assertThat(support.log.pendingEntries(10, 0, LIVE_CONSUMER)).hasSize(3);
    }

    @Test
    void prefersEntriesAlreadyOwnedByThisConsumer() {
        ConsumerTestSupport support = new ConsumerTestSupport(ClaimMode.IMMEDIATE);
        InMemoryEventLogClient peer = support.log.withConsumer("consumer_peer");
        String peerId = support.log.append(storedEvent("peer.txt"));
        peer.readNew(1, 0);
        String ownId = support.log.append(storedEvent("own.txt"));
        support.log.readNew(1, 0);

        ClaimOutcome outcome = support.claimManager.claimAndProcess();

        assertThat(outcome.getClaimed()).isEqualTo(1);
        assertThat(outcome.isLedgerDrained()).isFalse();
        assertThat(support.log.isPending(ownId)).isFalse();
        assertThat(support.log.pendingEntries(10, 0, "consumer_peer"))
                .extracting(PendingEntry::getId)
                .containsExactly(peerId);
        assertThat(support.log.pendingEntries(10, 0, LIVE_CONSUMER)).isEmpty();
    }

    @Test
    void claimTransportFailureIsNotPropagated() {
        ClaimRetryManager manager = managerOver(mock(EventLogFacade.class));
        when(manager.eventLog.pendingSummary()).thenThrow(new EventLogException("connection reset"));

        ClaimOutcome outcome = manager.claimAndProcess();

        assertThat(outcome.getClaimed()).isZero();
        verify(manager.eventLog, never()).claim(anyList(), anyLong());
        verifyNoInteractions(manager.processor);
    }

    @Test
    void missingGroupPropagates() {
        ClaimRetryManager manager = managerOver(mock(EventLogFacade.class));
        when(manager.eventLog.pendingSummary()).thenThrow(new ConsumerGroupMissingException("NOGROUP", null));

        assertThatThrownBy(manager::claimAndProcess).isInstanceOf(ConsumerGroupMissingException.class);
    }

    @Test
    void immediateModeUsesZeroIdleThreshold() {
        ClaimRetryManager manager = managerOver(mock(EventLogFacade.class));
        manager.claimMode = ClaimMode.IMMEDIATE;
        assertThat(manager.effectiveMinIdleMs()).isZero();

        manager.claimMode = ClaimMode.IDLE_THRESHOLD;
        assertThat(manager.effectiveMinIdleMs()).isEqualTo(60_000);
    }

    private static ClaimRetryManager managerOver(EventLogFacade eventLog) {
        ClaimRetryManager manager = new ClaimRetryManager();
        manager.claimMode = ClaimMode.IDLE_THRESHOLD;
        manager.minIdleMs = 60_000;
        manager.batchSize = 50;
        manager.eventLog = eventLog;
        manager.processor = mock(EntryBatchProcessor.class);
        manager.metrics = new IngestMetrics();
        return manager;
    }
}
