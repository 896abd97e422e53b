package com.filestorm.ingest.normalize;

import com.filestorm.ingest.domain.FileEventRecord;

import java.nio.file.Path;

/**
 * Outcome of normalizing one stream entry.
 */
public final class NormalizationResult {

    private final NormalizationStatus status;
    private final FileEventRecord record;
    private final String reason;
    private final Throwable cause;
    private final Path tempFile;

    private NormalizationResult(NormalizationStatus status, FileEventRecord record, String reason, Throwable cause,
                                Path tempFile) {
        this.status = status;
        this.record = record;
        this.reason = reason;
        this.cause = cause;
        this.tempFile = tempFile;
    }

    public static NormalizationResult success(FileEventRecord record) {
        return success(record, null);
    }

    /**
     * A record whose bytes were uploaded from {@code tempFile}. The file must outlive the upload
     * until the record is durable, so a failed batch can upload it again on retry.
     */
    public static NormalizationResult success(FileEventRecord record, Path tempFile) {
        return new NormalizationResult(NormalizationStatus.SUCCESS, record, null, null, tempFile);
    }

    public static NormalizationResult skip(String reason) {
        return new NormalizationResult(NormalizationStatus.SKIP, null, reason, null, null);
    }

    public static NormalizationResult error(Throwable cause) {
        return new NormalizationResult(NormalizationStatus.ERROR, null,
                cause != null ? cause.getMessage() : null, cause, null);
    }

    public NormalizationStatus getStatus() {
        return status;
    }

    /**
     * @return the record, only present when the status is {@link NormalizationStatus#SUCCESS}
     */
    public FileEventRecord getRecord() {
        return record;
    }

    public String getReason() {
        return reason;
    }

    public Throwable getCause() {
        return cause;
    }

    /**
     * @return the uploaded temp file still to be removed, or {@code null} when none was used
     */
    public Path getTempFile() {
        return tempFile;
    }

    public boolean isSuccess() {
        return status == NormalizationStatus.SUCCESS;
    }
}
