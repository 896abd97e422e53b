package com.filestorm.ingest.domain;

import com.filestorm.ingest.util.TimestampParser;

import java.time.Instant;
import java.util.Map;

/**
 * Upload event as carried on the stream, validated against a strict schema.
 * <p>
 * Required: {@code filename}. Optional fields fall back to defaults:
 * {@code operation=UPLOAD}, {@code size=0}, {@code mime_type=application/octet-stream},
 * {@code uploader_id=anonymous}, {@code ts=<fallback time>}, {@code already_stored=false}.
 * The storage locator and the legacy temp path are only checked by the normalizer,
 * since which one is required depends on {@code already_stored}.
 */
public class UploadEvent {

    public static final String FIELD_OPERATION = "operation";
    public static final String FIELD_FILENAME = "filename";
    public static final String FIELD_SIZE = "size";
    public static final String FIELD_MIME_TYPE = "mime_type";
    public static final String FIELD_STORAGE_URL = "storage_url";
    public static final String FIELD_STORAGE_LOCATOR = "storage_locator";
    public static final String FIELD_UPLOADER_ID = "uploader_id";
    public static final String FIELD_TS = "ts";
    public static final String FIELD_EVENT_TIMESTAMP = "event_timestamp";
    public static final String FIELD_ALREADY_STORED = "already_stored";
    public static final String FIELD_TMP_PATH = "tmp_path";
    public static final String FIELD_TEMP_PATH = "temp_path";

    public static final String DEFAULT_MIME_TYPE = "application/octet-stream";
    public static final String ANONYMOUS_UPLOADER = "anonymous";

    private final Operation operation;
    private final String filename;
    private final long size;
    private final String mimeType;
    private final String storageLocator;
    private final String uploaderId;
    private final Instant eventTime;
    private final boolean alreadyStored;
    private final String tempPath;

    public UploadEvent(Operation operation, String filename, long size, String mimeType,
                       String storageLocator, String uploaderId, Instant eventTime,
                       boolean alreadyStored, String tempPath) {
        this.operation = operation;
        this.filename = filename;
        this.size = size;
        this.mimeType = mimeType;
        this.storageLocator = storageLocator;
        this.uploaderId = uploaderId;
        this.eventTime = eventTime;
        this.alreadyStored = alreadyStored;
        this.tempPath = tempPath;
    }

    /**
     * Builds an event from raw stream fields.
     *
     * @param fields       field map of one stream entry
     * @param fallbackTime event time used when the event carries no usable timestamp
     * @throws MalformedEventException if a required field is missing or invalid
     */
    public static UploadEvent fromFields(Map<String, String> fields, Instant fallbackTime) {
        if (fields == null || fields.isEmpty()) {
            throw new MalformedEventException("Entry has no fields");
        }
        String filename = trimToNull(fields.get(FIELD_FILENAME));
        if (filename == null) {
            throw new MalformedEventException("Missing required field: " + FIELD_FILENAME);
        }
        Operation operation = Operation.fromWire(fields.get(FIELD_OPERATION));
        long size = parseSize(fields.get(FIELD_SIZE));
        String mimeType = defaultIfBlank(fields.get(FIELD_MIME_TYPE), DEFAULT_MIME_TYPE);
        String uploaderId = defaultIfBlank(fields.get(FIELD_UPLOADER_ID), ANONYMOUS_UPLOADER);
        String locator = trimToNull(firstPresent(fields, FIELD_STORAGE_URL, FIELD_STORAGE_LOCATOR));
        String tempPath = trimToNull(firstPresent(fields, FIELD_TMP_PATH, FIELD_TEMP_PATH));
        Instant eventTime = TimestampParser.parseOr(firstPresent(fields, FIELD_TS, FIELD_EVENT_TIMESTAMP), fallbackTime);
        boolean alreadyStored = "true".equalsIgnoreCase(trimToNull(fields.get(FIELD_ALREADY_STORED)));

        return new UploadEvent(operation, filename, size, mimeType, locator, uploaderId,
                eventTime, alreadyStored, tempPath);
    }

    private static long parseSize(String raw) {
        String value = trimToNull(raw);
        if (value == null) {
            return 0L;
        }
        long size;
        try {
            size = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new MalformedEventException("Invalid size: " + raw);
        }
        if (size < 0) {
            throw new MalformedEventException("Negative size: " + raw);
        }
        return size;
    }

    private static String firstPresent(Map<String, String> fields, String primary, String alias) {
        String value = fields.get(primary);
        return value != null ? value : fields.get(alias);
    }

    private static String defaultIfBlank(String value, String fallback) {
        String trimmed = trimToNull(value);
        return trimmed != null ? trimmed : fallback;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public Operation getOperation() {
        return operation;
    }

    public String getFilename() {
        return filename;
    }

    public long getSize() {
        return size;
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getStorageLocator() {
        return storageLocator;
    }

    public String getUploaderId() {
        return uploaderId;
    }

    public Instant getEventTime() {
        return eventTime;
    }

    public boolean isAlreadyStored() {
        return alreadyStored;
    }

    public String getTempPath() {
        return tempPath;
    }
}
