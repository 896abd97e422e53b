package com.filestorm.ingest.resource.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Result of a manually triggered consumer cycle")
public class TriggerResponse {

    @Schema(example = "processed")
    public String status;

    @Schema(description = "Pending entries claimed", example = "0")
    public int claimed;

    @Schema(description = "New entries read", example = "3")
    public int read;

    @Schema(example = "3")
    public int persisted;

    @Schema(example = "0")
    public int skipped;

    @Schema(example = "0")
    public int errored;

    public String getStatus() {
        return status;
    }

    public int getClaimed() {
        return claimed;
    }

    public int getRead() {
        return read;
    }

    public int getPersisted() {
        return persisted;
    }

    public int getSkipped() {
        return skipped;
    }

    public int getErrored() {
        return errored;
    }
}
