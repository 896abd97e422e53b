package com.filestorm.ingest.consumer;

public enum ConsumerState {
    /** Waiting for the record store, then recreating the group and draining the backlog. */
    STARTING,
    RUNNING,
    /** Sleeping after a failed cycle. */
    BACKING_OFF,
    STOPPED
}
