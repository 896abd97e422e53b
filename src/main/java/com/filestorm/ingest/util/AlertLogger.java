package com.filestorm.ingest.util;

import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;

/**
 * Utility for sending structured alerts to monitoring systems.
 * <p>
 * Provides consistent alert logging with structured metadata that can be
 * detected by log aggregators.
 */
public final class AlertLogger {

    private AlertLogger() {}

    private static final Logger LOG = Logger.getLogger(AlertLogger.class);

    public static void persistenceFailed(int batchSize, String sqlState, String error) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "PERSISTENCE_FAILURE");
        alertData.put("severity", "WARNING");
        alertData.put("batch_size", batchSize);
        alertData.put("sql_state", sqlState);
        alertData.put("error", error);

        LOG.warnf("ALERT: Batch of %d records not persisted (SQLSTATE %s). Error: %s",
                batchSize, sqlState, error);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void consumerReinitialized(String consumer, int consecutiveErrors) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "CONSUMER_REINITIALIZED");
        alertData.put("severity", "WARNING");
        alertData.put("consumer", consumer);
        alertData.put("consecutive_errors", consecutiveErrors);

        LOG.warnf("ALERT: Consumer %s reinitialized stream group and store pool after %d consecutive errors",
                consumer, consecutiveErrors);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void storeUnavailableAtStartup(String consumer, int timeoutSeconds) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "STORE_UNAVAILABLE_AT_STARTUP");
        alertData.put("severity", "CRITICAL");
        alertData.put("consumer", consumer);
        alertData.put("timeout_seconds", timeoutSeconds);

        LOG.errorf("ALERT: Record store not ready after %ds. Consumer %s cannot continue without database connection.",
                timeoutSeconds, consumer);
        LOG.debugf("Alert details: %s", alertData);
    }
}
