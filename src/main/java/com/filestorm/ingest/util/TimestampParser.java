package com.filestorm.ingest.util;

import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parses event timestamps written by the intake component.
 * <p>
 * Accepted forms:
 * <ul>
 *   <li>ISO-8601 with offset: {@code 2023-12-07T10:30:00.123456+00:00} or {@code ...Z}</li>
 *   <li>ISO-8601 local date-time, assumed UTC</li>
 *   <li>{@code yyyy-MM-dd HH:mm:ss}, assumed UTC</li>
 * </ul>
 * Anything else falls back to a caller-supplied instant, normally {@link #entryIdTime}.
 */
public final class TimestampParser {

    private static final Logger LOG = Logger.getLogger(TimestampParser.class);

    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private TimestampParser() {}

    public static Instant parseOr(String raw, Instant fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim();
        try {
            if (value.indexOf('T') >= 0) {
                try {
                    return OffsetDateTime.parse(value).toInstant();
                } catch (DateTimeParseException e) {
                    return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
                }
            }
            return LocalDateTime.parse(value, SPACE_SEPARATED).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            LOG.warnf("Failed to parse timestamp '%s': %s, using %s", value, e.getMessage(), fallback);
            return fallback;
        }
    }

    /**
     * Time encoded in a stream entry id of the form {@code <epoch-ms>-<seq>}. Every delivery of
     * an entry yields the same instant, so the {@code (dedup_key, event_time)} conflict key stays
     * stable. Ids without a numeric millisecond part fall back to the clock.
     */
    public static Instant entryIdTime(String entryId, Clock clock) {
        if (entryId != null) {
            int dash = entryId.indexOf('-');
            String millis = dash > 0 ? entryId.substring(0, dash) : entryId;
            try {
                return Instant.ofEpochMilli(Long.parseLong(millis));
            } catch (NumberFormatException e) {
                LOG.debugf("Entry id '%s' carries no timestamp", entryId);
            }
        }
        return clock.instant();
    }
}
