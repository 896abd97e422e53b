package com.filestorm.ingest.normalize;

public enum NormalizationStatus {
    /** Record built, ready to persist. */
    SUCCESS,
    /** Nothing to persist and nothing to retry: acknowledge and discard. */
    SKIP,
    /** Processing failed: leave unacknowledged for redelivery. */
    ERROR
}
