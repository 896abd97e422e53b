package com.filestorm.ingest.resource.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * Metrics response.
 */
@Schema(description = "Metrics response")
public class MetricsResponse {

    @Schema(description = "Consumer state")
    public String consumerState;

    @Schema(description = "JVM uptime in ms")
    public long jvmUptime;

    @Schema(description = "JVM used memory in bytes")
    public long jvmMemory;

    @Schema(description = "Consumer observability counters")
    public Map<String, Long> counters;

    public String getConsumerState() {
        return consumerState;
    }

    public long getJvmUptime() {
        return jvmUptime;
    }

    public long getJvmMemory() {
        return jvmMemory;
    }

    public Map<String, Long> getCounters() {
        return counters;
    }

    public void setCounters(Map<String, Long> counters) {
        this.counters = counters;
    }
}
