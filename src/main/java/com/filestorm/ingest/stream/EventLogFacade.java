package com.filestorm.ingest.stream;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.List;
import java.util.Map;

/**
 * Facade that selects the active EventLogClient implementation based on configuration.
 */
@ApplicationScoped
public class EventLogFacade implements EventLogClient {

    @ConfigProperty(name = "app.stream.mode", defaultValue = "redis")
    String mode;

    @Inject
    @Named("redis-stream")
    RedisStreamsEventLogClient redisLog;

    @Inject
    @Named("in-memory-stream")
    InMemoryEventLogClient inMemoryLog;

    private EventLogClient delegate() {
        if ("in-memory".equalsIgnoreCase(mode)) {
            return inMemoryLog;
        }
        return redisLog;
    }

    @Override
    public void ensureGroup() {
        delegate().ensureGroup();
    }

    @Override
    public String append(Map<String, String> fields) {
        return delegate().append(fields);
    }

    @Override
    public List<StreamEntry> readNew(int count, long blockMs) {
        return delegate().readNew(count, blockMs);
    }

    @Override
    public PendingSummary pendingSummary() {
        return delegate().pendingSummary();
    }

    @Override
    public List<PendingEntry> pendingEntries(int count, long minIdleMs, String consumer) {
        return delegate().pendingEntries(count, minIdleMs, consumer);
    }

    @Override
    public List<StreamEntry> claim(List<String> entryIds, long minIdleMs) {
        return delegate().claim(entryIds, minIdleMs);
    }

    @Override
    public void ackAndDelete(String entryId) {
        delegate().ackAndDelete(entryId);
    }

    @Override
    public long streamLength() {
        return delegate().streamLength();
    }

    @Override
    public boolean ping() {
        return delegate().ping();
    }

    @Override
    public String consumerName() {
        return delegate().consumerName();
    }
}
