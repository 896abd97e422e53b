package com.filestorm.ingest.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Normalized upload record, one row of {@code file_events}.
 * <p>
 * Only built from an event with a usable storage URL. {@code dedupKey} is the
 * originating stream entry id and may be null for inputs that predate deduplication.
 */
public final class FileEventRecord {

    private final Instant eventTime;
    private final Operation operation;
    private final String filename;
    private final long fileSize;
    private final String mimeType;
    private final String storageUrl;
    private final String uploaderId;
    private final String dedupKey;

    public FileEventRecord(Instant eventTime, Operation operation, String filename, long fileSize,
                           String mimeType, String storageUrl, String uploaderId, String dedupKey) {
        this.eventTime = Objects.requireNonNull(eventTime, "eventTime");
        this.operation = Objects.requireNonNull(operation, "operation");
        this.filename = Objects.requireNonNull(filename, "filename");
        this.fileSize = fileSize;
        this.mimeType = mimeType;
        this.storageUrl = Objects.requireNonNull(storageUrl, "storageUrl");
        this.uploaderId = uploaderId;
        this.dedupKey = dedupKey;
    }

    public static FileEventRecord of(UploadEvent event, String storageUrl, String dedupKey) {
        return new FileEventRecord(
                event.getEventTime(),
                event.getOperation(),
                event.getFilename(),
                event.getSize(),
                event.getMimeType(),
                storageUrl,
                event.getUploaderId(),
                dedupKey);
    }

    public Instant getEventTime() {
        return eventTime;
    }

    public Operation getOperation() {
        return operation;
    }

    public String getFilename() {
        return filename;
    }

    public long getFileSize() {
        return fileSize;
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getStorageUrl() {
        return storageUrl;
    }

    public String getUploaderId() {
        return uploaderId;
    }

    public String getDedupKey() {
        return dedupKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FileEventRecord)) {
            return false;
        }
        FileEventRecord that = (FileEventRecord) o;
        return fileSize == that.fileSize
                && eventTime.equals(that.eventTime)
                && operation == that.operation
                && filename.equals(that.filename)
                && Objects.equals(mimeType, that.mimeType)
                && storageUrl.equals(that.storageUrl)
                && Objects.equals(uploaderId, that.uploaderId)
                && Objects.equals(dedupKey, that.dedupKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventTime, operation, filename, fileSize, mimeType, storageUrl, uploaderId, dedupKey);
    }

    @Override
    public String toString() {
        return "FileEventRecord{filename=" + filename + ", dedupKey=" + dedupKey + ", storageUrl=" + storageUrl + "}";
    }
}
