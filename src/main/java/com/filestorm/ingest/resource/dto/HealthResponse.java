package com.filestorm.ingest.resource.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Consumer health: connectivity to the stream and the record store, plus queue depth.
 */
@Schema(description = "Consumer health response")
public class HealthResponse {

    @Schema(example = "healthy")
    public String status;

    @Schema(example = "true")
    public boolean redisConnected;

    @Schema(example = "true")
    public boolean databaseConnected;

    @Schema(description = "Entries currently in the upload stream", example = "0")
    public long queueLength;

    @Schema(example = "consumer_4242")
    public String consumer;

    @Schema(example = "true")
    public boolean consumerEnabled;

    @Schema(example = "true")
    public boolean consumerRunning;

    @Schema(example = "RUNNING")
    public String consumerState;

    @Schema(description = "Failure detail when unhealthy")
    public String error;

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public boolean isRedisConnected() {
        return redisConnected;
    }

    public void setRedisConnected(boolean redisConnected) {
        this.redisConnected = redisConnected;
    }

    public boolean isDatabaseConnected() {
        return databaseConnected;
    }

    public void setDatabaseConnected(boolean databaseConnected) {
        this.databaseConnected = databaseConnected;
    }

    public long getQueueLength() {
        return queueLength;
    }

    public void setQueueLength(long queueLength) {
        this.queueLength = queueLength;
    }

    public String getConsumer() {
        return consumer;
    }

    public void setConsumer(String consumer) {
        this.consumer = consumer;
    }

    public boolean isConsumerEnabled() {
        return consumerEnabled;
    }

    public void setConsumerEnabled(boolean consumerEnabled) {
        this.consumerEnabled = consumerEnabled;
    }

    public boolean isConsumerRunning() {
        return consumerRunning;
    }

    public void setConsumerRunning(boolean consumerRunning) {
        this.consumerRunning = consumerRunning;
    }

    public String getConsumerState() {
        return consumerState;
    }

    public void setConsumerState(String consumerState) {
        this.consumerState = consumerState;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
