package com.filestorm.ingest.stream;

/**
 * The consumer group (or the stream itself) no longer exists, e.g. after a reset.
 * Recovered by re-creating the group.
 */
public class ConsumerGroupMissingException extends EventLogException {
    public ConsumerGroupMissingException(String message, Throwable cause) {
        super(message, cause);
    }
}
