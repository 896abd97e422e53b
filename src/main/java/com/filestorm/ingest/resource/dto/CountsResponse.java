package com.filestorm.ingest.resource.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;

/**
 * Queue depth and stored row count, for comparing what was sent with what landed.
 */
@Schema(description = "Stream and store counts")
public class CountsResponse {

    @Schema(description = "Entries currently in the upload stream", example = "12")
    public long streamLength;

    @Schema(description = "Rows in file_events", example = "1048")
    public long databaseRows;

    @Schema(example = "2024-01-15T10:30:00Z")
    public Instant timestamp;

    public CountsResponse(long streamLength, long databaseRows, Instant timestamp) {
        this.streamLength = streamLength;
        this.databaseRows = databaseRows;
        this.timestamp = timestamp;
    }

    public long getStreamLength() {
        return streamLength;
    }

    public long getDatabaseRows() {
        return databaseRows;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
