package com.filestorm.ingest.domain;

/**
 * Raised when a stream entry does not satisfy the upload event schema.
 * Malformed entries are acknowledged and discarded, never retried.
 */
public class MalformedEventException extends RuntimeException {

    public MalformedEventException(String message) {
        super(message);
    }
}
