package com.filestorm.ingest.stream;

import io.vertx.mutiny.redis.client.RedisAPI;
import io.vertx.mutiny.redis.client.Response;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis Streams based upload log, read through a consumer group.
 */
@ApplicationScoped
@Named("redis-stream")
public class RedisStreamsEventLogClient implements EventLogClient {

    private static final Logger LOG = Logger.getLogger(RedisStreamsEventLogClient.class);

    @ConfigProperty(name = "app.stream.key", defaultValue = "connectstorm:uploads")
    String streamKey;

    @ConfigProperty(name = "app.stream.group", defaultValue = "connectstorm_group")
    String consumerGroup;

    @ConfigProperty(name = "app.stream.group-start-id", defaultValue = "0")
    String groupStartId;

    @ConfigProperty(name = "app.consumer.name", defaultValue = "auto")
    String consumerName;

    @ConfigProperty(name = "app.stream.redis-timeout-seconds", defaultValue = "5")
    int redisTimeoutSeconds;

    @Inject
    RedisAPI redisAPI;

    @PostConstruct
    void init() {
        consumerName = resolveConsumerName(consumerName);
    }

    static String resolveConsumerName(String configured) {
        String normalized = configured == null ? "" : configured.trim();
        if (normalized.isEmpty() || "auto".equalsIgnoreCase(normalized)) {
            return "consumer_" + ProcessHandle.current().pid();
        }
        return normalized;
    }

    @Override
    public String consumerName() {
        return consumerName;
    }

    @Override
    public void ensureGroup() {
        try {
            redisAPI.xgroup(List.of("CREATE", streamKey, consumerGroup, groupStartId, "MKSTREAM"))
                    .await().atMost(timeout());
            LOG.infof("Created consumer group '%s' for stream '%s'", consumerGroup, streamKey);
        } catch (Exception e) {
            if (messageContains(e, "BUSYGROUP")) {
                LOG.debugf("Consumer group '%s' already exists", consumerGroup);
            } else {
                throw translate("create consumer group", e);
            }
        }
    }

    @Override
    public String append(Map<String, String> fields) {
        List<String> args = new ArrayList<>(2 + fields.size() * 2);
        args.add(streamKey);
        args.add("*");
        fields.forEach((name, value) -> {
            args.add(name);
            args.add(value);
        });
        try {
            Response response = redisAPI.xadd(args).await().atMost(timeout());
            return response != null ? response.toString() : null;
        } catch (Exception e) {
            throw translate("append to stream", e);
        }
    }

    @Override
    public List<StreamEntry> readNew(int count, long blockMs) {
        List<String> args = new ArrayList<>();
        args.add("GROUP");
        args.add(consumerGroup);
        args.add(consumerName);
        args.add("COUNT");
        args.add(String.valueOf(count));
        args.add("BLOCK");
        args.add(String.valueOf(blockMs));
        args.add("STREAMS");
        args.add(streamKey);
        args.add(">");

        // Add extra buffer for BLOCK timeout + network round-trip
        Duration readTimeout = Duration.ofMillis(blockMs).plus(timeout());
        try {
            Response resp = redisAPI.xreadgroup(args).await().atMost(readTimeout);
            if (resp == null) {
                return Collections.emptyList();
            }
            return parseXReadResponse(resp);
        } catch (Exception e) {
            throw translate("read from stream", e);
        }
    }

    @Override
    public PendingSummary pendingSummary() {
        try {
            Response resp = redisAPI.xpending(List.of(streamKey, consumerGroup))
                    .await().atMost(timeout());
            if (resp == null || resp.size() == 0) {
                return PendingSummary.empty();
            }
            long totalPending = parseLong(resp.get(0), 0);
            long oldestIdleMs = 0;
            if (totalPending > 0) {
                List<PendingEntry> oldest = pendingEntries(1, 0, null);
                if (!oldest.isEmpty()) {
                    oldestIdleMs = oldest.get(0).getIdleMs();
                }
            }
            return new PendingSummary(totalPending, oldestIdleMs);
        } catch (EventLogException e) {
            throw e;
        } catch (Exception e) {
            throw translate("read pending summary", e);
        }
    }

    @Override
    public List<PendingEntry> pendingEntries(int count, long minIdleMs, String consumer) {
        List<String> args = new ArrayList<>(8);
        args.add(streamKey);
        args.add(consumerGroup);
        if (minIdleMs > 0) {
            // XPENDING ... IDLE needs Redis 6.2+
            args.add("IDLE");
            args.add(String.valueOf(minIdleMs));
        }
        args.add("-");
        args.add("+");
        args.add(String.valueOf(count));
        if (consumer != null) {
            args.add(consumer);
        }
        try {
            Response resp = redisAPI.xpending(args).await().atMost(timeout());
            if (resp == null) {
                return Collections.emptyList();
            }
            // Response structure: [[id, consumer, idle-ms, delivery-count], ...]
            List<PendingEntry> entries = new ArrayList<>(resp.size());
            for (int i = 0; i < resp.size(); i++) {
                Response item = resp.get(i);
                if (item == null || item.size() < 4) {
                    continue;
                }
                entries.add(new PendingEntry(
                        item.get(0).toString(),
                        item.get(1).toString(),
                        parseLong(item.get(2), 0),
                        parseLong(item.get(3), 0)));
            }
            return entries;
        } catch (Exception e) {
            throw translate("list pending entries", e);
        }
    }

    @Override
    public List<StreamEntry> claim(List<String> entryIds, long minIdleMs) {
        if (entryIds.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> args = new ArrayList<>(4 + entryIds.size());
        args.add(streamKey);
        args.add(consumerGroup);
        args.add(consumerName);
        args.add(String.valueOf(minIdleMs));
        args.addAll(entryIds);
        try {
            Response resp = redisAPI.xclaim(args).await().atMost(timeout());
            if (resp == null) {
                return Collections.emptyList();
            }
            return parseEntries(resp);
        } catch (Exception e) {
            throw translate("claim pending entries", e);
        }
    }

    @Override
    public void ackAndDelete(String entryId) {
        try {
            redisAPI.xack(List.of(streamKey, consumerGroup, entryId)).await().atMost(timeout());
            redisAPI.xdel(List.of(streamKey, entryId)).await().atMost(timeout());
        } catch (Exception e) {
            throw translate("ack entry " + entryId, e);
        }
    }

    @Override
    public long streamLength() {
        try {
            return parseLong(redisAPI.xlen(streamKey).await().atMost(timeout()), 0);
        } catch (Exception e) {
            throw translate("read stream length", e);
        }
    }

    @Override
    public boolean ping() {
        try {
            Response resp = redisAPI.ping(List.of()).await().atMost(timeout());
            return resp != null && "PONG".equalsIgnoreCase(resp.toString());
        } catch (Exception e) {
            LOG.debugf(e, "Redis ping failed");
            return false;
        }
    }

    private List<StreamEntry> parseXReadResponse(Response resp) {
        List<StreamEntry> entries = new ArrayList<>();
        // Response structure: [[stream, [[id, [field, value]...], ...]]]
        for (int i = 0; i < resp.size(); i++) {
            Response streamResp = resp.get(i);
            if (streamResp == null || streamResp.size() < 2) {
                continue;
            }
            entries.addAll(parseEntries(streamResp.get(1)));
        }
        return entries;
    }

    private List<StreamEntry> parseEntries(Response messages) {
        List<StreamEntry> entries = new ArrayList<>();
        if (messages == null) {
            return entries;
        }
        for (int j = 0; j < messages.size(); j++) {
            Response message = messages.get(j);
            if (message == null || message.size() < 1) {
                continue;
            }
            String id = message.get(0).toString();
            Response fields = message.size() > 1 ? message.get(1) : null;
            entries.add(new StreamEntry(id, parseFields(fields)));
        }
        return entries;
    }

    private Map<String, String> parseFields(Response fields) {
        if (fields == null) {
            return null;
        }
        Map<String, String> parsed = new LinkedHashMap<>();
        for (int k = 0; k + 1 < fields.size(); k += 2) {
            Response name = fields.get(k);
            Response value = fields.get(k + 1);
            if (name != null) {
                parsed.put(name.toString(), value != null ? value.toString(StandardCharsets.UTF_8) : null);
            }
        }
        return parsed;
    }

    private EventLogException translate(String operation, Exception e) {
        if (messageContains(e, "NOGROUP")) {
            return new ConsumerGroupMissingException(
                    "Consumer group '" + consumerGroup + "' not found while trying to " + operation, e);
        }
        return new EventLogException("Failed to " + operation + " on '" + streamKey + "'", e);
    }

    private static boolean messageContains(Throwable e, String token) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains(token)) {
                return true;
            }
        }
        return false;
    }

    private long parseLong(Response response, long fallback) {
        if (response == null) {
            return fallback;
        }
        try {
            return Long.parseLong(response.toString());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private Duration timeout() {
        return Duration.ofSeconds(redisTimeoutSeconds);
    }
}
