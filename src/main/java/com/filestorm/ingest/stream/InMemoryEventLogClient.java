package com.filestorm.ingest.stream;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Test-friendly, in-memory upload log with consumer-group semantics:
 * delivery ownership, a pending ledger with idle tracking, claim and ack.
 * <p>
 * Several clients created through {@link #withConsumer(String)} share one ledger,
 * which lets tests model competing or crashed consumers.
 */
@ApplicationScoped
@Named("in-memory-stream")
public class InMemoryEventLogClient implements EventLogClient {

    private final Ledger ledger;
    private final String consumerName;

    public InMemoryEventLogClient() {
        this(new Ledger(Clock.systemUTC()), "in-memory-consumer");
    }

    public InMemoryEventLogClient(Clock clock, String consumerName) {
        this(new Ledger(clock), consumerName);
    }

    private InMemoryEventLogClient(Ledger ledger, String consumerName) {
        this.ledger = ledger;
        this.consumerName = consumerName;
    }

    /**
     * Returns a client for another consumer of the same group and stream.
     */
    public InMemoryEventLogClient withConsumer(String name) {
        return new InMemoryEventLogClient(ledger, name);
    }

    @Override
    public String consumerName() {
        return consumerName;
    }

    @Override
    public void ensureGroup() {
        synchronized (ledger) {
            if (!ledger.groupExists) {
                // a new group starts at id 0 and sees every entry still in the stream
                ledger.groupExists = true;
                ledger.undelivered.clear();
                ledger.undelivered.addAll(ledger.entries.keySet());
            }
        }
    }

    /**
     * Drops the consumer group and its pending ledger, as a reset would.
     */
    public void destroyGroup() {
        synchronized (ledger) {
            ledger.groupExists = false;
            ledger.pending.clear();
        }
    }

    @Override
    public String append(Map<String, String> fields) {
        synchronized (ledger) {
            String id = (++ledger.sequence) + "-0";
            ledger.entries.put(id, new LinkedHashMap<>(fields));
            ledger.undelivered.addLast(id);
            return id;
        }
    }

    @Override
    public List<StreamEntry> readNew(int count, long blockMs) {
        synchronized (ledger) {
            requireGroup();
            List<StreamEntry> batch = new ArrayList<>();
            while (batch.size() < count && !ledger.undelivered.isEmpty()) {
                String id = ledger.undelivered.pollFirst();
                Map<String, String> fields = ledger.entries.get(id);
                if (fields == null) {
                    continue;
                }
                ledger.pending.put(id, new PendingState(consumerName, ledger.clock.millis()));
                batch.add(new StreamEntry(id, fields));
            }
            return batch;
        }
    }

    @Override
    public PendingSummary pendingSummary() {
        synchronized (ledger) {
            requireGroup();
            if (ledger.pending.isEmpty()) {
                return PendingSummary.empty();
            }
            long oldestDelivery = Long.MAX_VALUE;
            for (PendingState state : ledger.pending.values()) {
                oldestDelivery = Math.min(oldestDelivery, state.deliveredAtMs);
            }
            return new PendingSummary(ledger.pending.size(), ledger.clock.millis() - oldestDelivery);
        }
    }

    @Override
    public List<PendingEntry> pendingEntries(int count, long minIdleMs, String consumer) {
        synchronized (ledger) {
            requireGroup();
            long now = ledger.clock.millis();
            List<PendingEntry> result = new ArrayList<>();
            for (Map.Entry<String, PendingState> e : ledger.pending.entrySet()) {
                if (result.size() >= count) {
                    break;
                }
                PendingState state = e.getValue();
                long idleMs = now - state.deliveredAtMs;
                if (idleMs >= minIdleMs && (consumer == null || consumer.equals(state.owner))) {
                    result.add(new PendingEntry(e.getKey(), state.owner, idleMs, state.deliveries));
                }
            }
            return result;
        }
    }

    @Override
    public List<StreamEntry> claim(List<String> entryIds, long minIdleMs) {
        synchronized (ledger) {
            requireGroup();
            long now = ledger.clock.millis();
            List<StreamEntry> claimed = new ArrayList<>();
            for (String id : entryIds) {
                PendingState state = ledger.pending.get(id);
                if (state == null || now - state.deliveredAtMs < minIdleMs) {
                    continue;
                }
                state.owner = consumerName;
                state.deliveredAtMs = now;
                state.deliveries++;
                claimed.add(new StreamEntry(id, ledger.entries.get(id)));
            }
            return claimed;
        }
    }

    @Override
    public void ackAndDelete(String entryId) {
        synchronized (ledger) {
            requireGroup();
            ledger.pending.remove(entryId);
            ledger.entries.remove(entryId);
        }
    }

    @Override
    public long streamLength() {
        synchronized (ledger) {
            return ledger.entries.size();
        }
    }

    @Override
    public boolean ping() {
        return true;
    }

    /**
     * @return true if the entry is still in the pending ledger
     */
    public boolean isPending(String entryId) {
        synchronized (ledger) {
            return ledger.pending.containsKey(entryId);
        }
    }

    private void requireGroup() {
        if (!ledger.groupExists) {
            throw new ConsumerGroupMissingException("NOGROUP in-memory consumer group does not exist", null);
        }
    }

    private static final class Ledger {
        private final Clock clock;
        private final Map<String, Map<String, String>> entries = new LinkedHashMap<>();
        private final Deque<String> undelivered = new ArrayDeque<>();
        private final Map<String, PendingState> pending = new LinkedHashMap<>();
        private long sequence;
        private boolean groupExists;

        private Ledger(Clock clock) {
            this.clock = clock;
        }
    }

    private static final class PendingState {
        private String owner;
        private long deliveredAtMs;
        private long deliveries = 1;

        private PendingState(String owner, long deliveredAtMs) {
            this.owner = owner;
            this.deliveredAtMs = deliveredAtMs;
        }
    }
}
